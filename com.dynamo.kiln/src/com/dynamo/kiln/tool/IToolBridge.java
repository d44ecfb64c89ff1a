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

package com.dynamo.kiln.tool;

import java.io.File;
import java.io.IOException;

/**
 * Connection to an external authoring tool that can open source documents
 * and convert them. Implementations are not thread safe; access goes
 * through {@link ToolConnection}.
 */
public interface IToolBridge {

    /**
     * Convert a source document to cooked bytes
     * @param sourcePath source document
     * @param expectedType expected document type
     * @param platform target platform name
     * @param bigEndian target byte order
     * @return cooked bytes
     * @throws IOException if the tool fails or the document type doesn't match
     */
    byte[] cookToBuffer(File sourcePath, String expectedType, String platform, boolean bigEndian) throws IOException;

    /**
     * Run a script in the tool
     * @param script script source
     * @return true if the script succeeded
     * @throws IOException if the tool can't be reached
     */
    boolean runScript(String script) throws IOException;

    boolean open(File path) throws IOException;

    boolean create(File path) throws IOException;

    void shutdown();
}
