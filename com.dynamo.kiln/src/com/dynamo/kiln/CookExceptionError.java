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

import com.dynamo.kiln.fs.ProjectPath;


/**
 * Cook exception. Raised by a backend when a single object fails to cook.
 */
public class CookExceptionError extends Exception {
    private static final long serialVersionUID = -3189379067765141096L;

    private ProjectPath path;

    public CookExceptionError(String message) {
        super(message);
    }

    public CookExceptionError(ProjectPath path, String message) {
        super(message);
        this.path = path;
    }

    public CookExceptionError(ProjectPath path, String message, Throwable e) {
        super(message, e);
        this.path = path;
    }

    public ProjectPath getPath() {
        return path;
    }
}
