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
import java.util.List;

/**
 * Exclusive access to a {@link IToolBridge}, released by {@link #close()}
 */
public class ToolSession implements AutoCloseable {

    private final ToolConnection connection;
    private final IToolBridge bridge;
    private boolean closed;

    ToolSession(ToolConnection connection, IToolBridge bridge) {
        this.connection = connection;
        this.bridge = bridge;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Tool session is closed");
        }
    }

    public byte[] cookToBuffer(File sourcePath, String expectedType, String platform, boolean bigEndian) throws IOException {
        checkOpen();
        return bridge.cookToBuffer(sourcePath, expectedType, platform, bigEndian);
    }

    public boolean runScript(String script) throws IOException {
        checkOpen();
        return bridge.runScript(script);
    }

    public boolean runScript(List<String> lines) throws IOException {
        return runScript(String.join("\n", lines));
    }

    public boolean open(File path) throws IOException {
        checkOpen();
        return bridge.open(path);
    }

    public boolean create(File path) throws IOException {
        checkOpen();
        return bridge.create(path);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            connection.release();
        }
    }
}
