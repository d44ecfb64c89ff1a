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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.apache.commons.codec.digest.DigestUtils;

import com.dynamo.kiln.fs.ProjectPath;

/**
 * Base object to represent a data resource within a project. Objects are
 * created by the project through the {@link IObjectFactory} registered for
 * the path extension; working files without a registered type get a plain
 * ObjectBase.
 */
public class ObjectBase {

    public enum DataEndianness {
        NONE,
        BIG,
        LITTLE
    }

    public enum DataPlatform {
        NONE,
        GENERIC,
        REVOLUTION,
        CAFE
    }

    /**
     * Receives cooked data
     */
    @FunctionalInterface
    public interface IDataAppender {
        void append(byte[] data, int offset, int length) throws IOException;

        default void append(byte[] data) throws IOException {
            append(data, 0, data.length);
        }
    }

    /**
     * Receives the direct dependencies of an object
     */
    @FunctionalInterface
    public interface IDependencyCollector {
        void addDependency(ObjectBase dependency);
    }

    private final ProjectPath path;

    public ObjectBase(ProjectPath path) {
        this.path = path;
    }

    public ProjectPath getPath() {
        return path;
    }

    public FourCC getType() {
        return FourCC.NULL;
    }

    /**
     * Cook the object for a platform. The default object has no payload.
     * @param appender sink for the cooked bytes
     * @param endianness byte order of the target
     * @param platform target platform
     * @return true if the object was cooked
     * @throws IOException if the working file can't be read
     */
    public boolean cookObject(IDataAppender appender, DataEndianness endianness, DataPlatform platform) throws IOException {
        return true;
    }

    /**
     * Report direct dependencies in a stable order
     * @param collector dependency sink
     * @throws IOException if the working file can't be read
     */
    public void gatherDeps(IDependencyCollector collector) throws IOException {
    }

    /**
     * Get a 64-bit id that identifies the object at runtime. Defaults to the
     * first eight bytes of the sha1 of type and path.
     * @return object id
     */
    public long getId() {
        byte[] digest = DigestUtils.sha1(getType() + ":" + path.getRelativePath());
        return ByteBuffer.wrap(digest, 0, 8).getLong();
    }

    @Override
    public String toString() {
        return String.format("%s [%s]", path, getType());
    }
}
