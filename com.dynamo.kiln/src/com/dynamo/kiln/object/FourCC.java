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

import java.nio.charset.StandardCharsets;

/**
 * Four character type code, stored big endian so the first character is the
 * most significant byte
 */
public final class FourCC {

    public static final FourCC NULL = new FourCC("NULL");

    private final int value;

    public FourCC(String code) {
        if (code == null || code.length() != 4) {
            throw new IllegalArgumentException(String.format("'%s' is not a four character code", code));
        }
        byte[] bytes = code.getBytes(StandardCharsets.US_ASCII);
        if (bytes.length != 4 || !code.chars().allMatch(c -> c >= 0x20 && c < 0x7f)) {
            throw new IllegalArgumentException(String.format("'%s' is not a printable ASCII code", code));
        }
        this.value = ((bytes[0] & 0xff) << 24) | ((bytes[1] & 0xff) << 16) | ((bytes[2] & 0xff) << 8) | (bytes[3] & 0xff);
    }

    public int toInt() {
        return value;
    }

    public byte[] toBytes() {
        return new byte[] { (byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value };
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FourCC && ((FourCC) obj).value == value;
    }

    @Override
    public String toString() {
        return new String(toBytes(), StandardCharsets.US_ASCII);
    }
}
