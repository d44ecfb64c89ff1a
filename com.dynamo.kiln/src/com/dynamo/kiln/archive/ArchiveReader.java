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

package com.dynamo.kiln.archive;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads archives written by {@link ArchiveBuilder}
 */
public class ArchiveReader implements AutoCloseable {

    private final RandomAccessFile file;
    private final List<ArchiveEntry> entries = new ArrayList<ArchiveEntry>();
    private int alignment;

    public ArchiveReader(File archive) throws IOException {
        file = new RandomAccessFile(archive, "r");
        try {
            read();
        } catch (IOException e) {
            file.close();
            throw e;
        }
    }

    private void read() throws IOException {
        int magic = file.readInt();
        if (magic != ArchiveBuilder.MAGIC) {
            throw new IOException(String.format("Not an archive, magic %08x", magic));
        }
        int version = file.readInt();
        if (version != ArchiveBuilder.VERSION) {
            throw new IOException("Unsupported archive version: " + version);
        }
        alignment = file.readInt();
        int count = file.readInt();
        for (int i = 0; i < count; ++i) {
            int type = file.readInt();
            long id = file.readLong();
            long offset = file.readLong();
            long size = file.readLong();
            String path = file.readUTF();
            String group = file.readUTF();
            entries.add(new ArchiveEntry(path, group, type, id, offset, size));
        }
    }

    public int getAlignment() {
        return alignment;
    }

    public List<ArchiveEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public byte[] getEntryContent(ArchiveEntry entry) throws IOException {
        byte[] content = new byte[(int) entry.getSize()];
        file.seek(entry.getOffset());
        file.readFully(content);
        return content;
    }

    @Override
    public void close() throws IOException {
        file.close();
    }
}
