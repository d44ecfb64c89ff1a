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

import java.io.File;
import java.util.Set;

/**
 * Lists classes available to a class loader
 */
public interface IClassScanner {

    /**
     * Add a directory or jar to search for classes
     * @param file directory or jar file
     */
    public void addUrl(File file);

    public ClassLoader getClassLoader();

    /**
     * Scan after classes in package
     * @param pkg package to list classes
     * @return {@link Set} of classes
     */
    public Set<String> scan(String pkg);
}
