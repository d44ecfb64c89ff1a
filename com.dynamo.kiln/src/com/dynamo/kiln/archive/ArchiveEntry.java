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

public class ArchiveEntry {
    private final String path;
    private final String group;
    private final int type;
    private final long id;
    private final File cookedFile;
    long offset;
    long size;

    public ArchiveEntry(String path, String group, int type, long id, File cookedFile) {
        this.path = path;
        this.group = group;
        this.type = type;
        this.id = id;
        this.cookedFile = cookedFile;
    }

    ArchiveEntry(String path, String group, int type, long id, long offset, long size) {
        this(path, group, type, id, null);
        this.offset = offset;
        this.size = size;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return group directory, empty for top-level entries
     */
    public String getGroup() {
        return group;
    }

    public int getType() {
        return type;
    }

    public long getId() {
        return id;
    }

    public File getCookedFile() {
        return cookedFile;
    }

    public long getOffset() {
        return offset;
    }

    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return String.format("%s [%s] @%d+%d", path, group, offset, size);
    }
}
