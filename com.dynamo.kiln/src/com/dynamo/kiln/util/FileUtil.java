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

package com.dynamo.kiln.util;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;

public class FileUtil {

    @FunctionalInterface
    public interface IContentWriter {
        void write(OutputStream os) throws IOException;
    }

    /**
     * Write a file through a temporary sibling that is renamed into place, so
     * readers see either the previous content or the complete new content.
     * The temporary file is removed if writing fails.
     * @param file destination
     * @param writer content producer
     * @throws IOException
     */
    public static void writeAtomic(File file, IContentWriter writer) throws IOException {
        FileUtils.forceMkdirParent(file);
        File tmp = new File(file.getParentFile(), file.getName() + ".tmp");
        boolean done = false;
        try {
            try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(tmp.toPath()))) {
                writer.write(os);
            }
            try {
                Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
            }
            done = true;
        } finally {
            if (!done) {
                Files.deleteIfExists(tmp.toPath());
            }
        }
    }

    public static void writeAtomic(File file, byte[] content) throws IOException {
        writeAtomic(file, (OutputStream os) -> os.write(content));
    }

    /**
     * Delete a file if it exists
     * @param file file to delete
     * @return true if a file was deleted
     * @throws IOException if the file exists and can't be deleted
     */
    public static boolean deleteIfExists(File file) throws IOException {
        return Files.deleteIfExists(file.toPath());
    }

    /**
     * Compute the content fingerprint of a file
     * @param file file to fingerprint
     * @return lowercase hex sha1 of the content
     * @throws IOException
     */
    public static String fingerprint(File file) throws IOException {
        try (InputStream is = Files.newInputStream(file.toPath())) {
            return DigestUtils.sha1Hex(is);
        }
    }
}
