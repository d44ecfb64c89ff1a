// Copyright 2020-2025 The Defold Foundation
// Licensed under the Defold License version 1.0 (the "License"); you may not use
// this file except in compliance with the License.
//
// You may obtain a copy of the License, together with FAQs at
// https://www.defold.com/license
//
// Unless required by applicable law or agreed to in writing, software distributed
// under the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR
// CONDITIONS OF ANY KIND, either express or implied. See the License for the
// specific language governing permissions and limitations under the License.

package com.dynamo.kiln;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.dynamo.kiln.fs.ProjectPath;

/**
 * Packaging found objects in the dependency graph that have no cooked output.
 */
public class MissingDependencyException extends KilnException {
    private static final long serialVersionUID = 2207318265710926435L;

    private final List<ProjectPath> missing;

    public MissingDependencyException(List<ProjectPath> missing) {
        super(createMessage(missing));
        this.missing = new ArrayList<ProjectPath>(missing);
    }

    private static String createMessage(List<ProjectPath> missing) {
        StringBuilder sb = new StringBuilder("Missing cooked dependencies:");
        for (ProjectPath path : missing) {
            sb.append("\n  ").append(path);
        }
        return sb.toString();
    }

    /**
     * Get the working paths that have no cooked output
     * @return list of paths in depsgraph order
     */
    public List<ProjectPath> getMissing() {
        return Collections.unmodifiableList(missing);
    }
}
