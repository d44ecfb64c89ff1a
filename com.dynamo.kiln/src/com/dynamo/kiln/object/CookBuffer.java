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

package com.dynamo.kiln.object;

import java.io.ByteArrayOutputStream;

/**
 * In-memory {@link ObjectBase.IDataAppender} that holds cooked bytes until
 * they are written out in one go
 */
public class CookBuffer implements ObjectBase.IDataAppender {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(16 * 1024);

    @Override
    public void append(byte[] data, int offset, int length) {
        buffer.write(data, offset, length);
    }

    public int size() {
        return buffer.size();
    }

    public byte[] toByteArray() {
        return buffer.toByteArray();
    }
}
