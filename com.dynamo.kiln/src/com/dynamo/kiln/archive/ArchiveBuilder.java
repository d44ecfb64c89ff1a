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
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;

import org.apache.commons.io.FileUtils;

import com.dynamo.kiln.CookExceptionError;
import com.dynamo.kiln.depsgraph.PackageDepsgraph;
import com.dynamo.kiln.depsgraph.PackageDepsgraph.Node;
import com.dynamo.kiln.depsgraph.PackageDepsgraph.NodeType;
import com.dynamo.kiln.logging.Logger;

/**
 * Writes cooked objects into a single package file. Entries are stored in
 * the order they are added; use {@link #fromDepsgraph} to get the depsgraph
 * layout with contiguous groups.
 *
 * Layout, big endian: magic, version, alignment, entry count, one index
 * record per entry (type, id, offset, size, path, group), then the entry
 * payloads, each starting at a multiple of the alignment.
 */
public class ArchiveBuilder {

    private static Logger logger = Logger.getLogger(ArchiveBuilder.class.getName());

    public static final int MAGIC = 0x4b50414b; // KPAK
    public static final int VERSION = 1;

    private final int alignment;
    private final List<ArchiveEntry> entries = new ArrayList<ArchiveEntry>();

    public ArchiveBuilder(int alignment) {
        if (alignment <= 0 || (alignment & (alignment - 1)) != 0) {
            throw new IllegalArgumentException(String.format("Alignment %d is not a power of two", alignment));
        }
        this.alignment = alignment;
    }

    /**
     * Create a builder holding the data nodes of a depsgraph in traversal order
     * @param depsgraph depsgraph built with a cooked tree
     * @param alignment payload alignment
     * @return builder
     */
    public static ArchiveBuilder fromDepsgraph(PackageDepsgraph depsgraph, int alignment) {
        ArchiveBuilder builder = new ArchiveBuilder(alignment);
        addChildren(builder, depsgraph, depsgraph.getRootNode(), "");
        return builder;
    }

    private static void addChildren(ArchiveBuilder builder, PackageDepsgraph depsgraph, Node parent, String group) {
        for (Node node : depsgraph.getChildren(parent)) {
            if (node.getType() == NodeType.GROUP) {
                addChildren(builder, depsgraph, node, node.getPath().getRelativePath());
            } else {
                builder.add(new ArchiveEntry(node.getPath().getRelativePath(), group,
                        node.getObject().getType().toInt(), node.getObject().getId(), node.getCookedPath().toFile()));
            }
        }
    }

    public void add(ArchiveEntry entry) {
        entries.add(entry);
    }

    public List<ArchiveEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int getAlignment() {
        return alignment;
    }

    /**
     * Write the archive. The file appears only once it is complete.
     * @param output archive file
     * @param interrupted polled between entries
     * @throws IOException
     * @throws CookExceptionError if interrupted
     */
    public void write(File output, BooleanSupplier interrupted) throws IOException, CookExceptionError {
        FileUtils.forceMkdirParent(output);
        File tmp = new File(output.getParentFile(), output.getName() + ".tmp");
        boolean done = false;
        try {
            try (RandomAccessFile file = new RandomAccessFile(tmp, "rw")) {
                file.setLength(0);
                writeIndex(file);
                alignBuffer(file, alignment);
                byte[] buffer = new byte[64 * 1024];
                for (ArchiveEntry entry : entries) {
                    if (interrupted.getAsBoolean()) {
                        throw new CookExceptionError("Packaging interrupted");
                    }
                    alignBuffer(file, alignment);
                    entry.offset = file.getFilePointer();
                    long size = 0;
                    try (InputStream is = Files.newInputStream(entry.getCookedFile().toPath())) {
                        int n;
                        while ((n = is.read(buffer)) != -1) {
                            file.write(buffer, 0, n);
                            size += n;
                        }
                    }
                    entry.size = size;
                }
                file.seek(0);
                writeIndex(file);
            }
            try {
                Files.move(tmp.toPath(), output.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp.toPath(), output.toPath(), StandardCopyOption.REPLACE_EXISTING);
            }
            done = true;
            logger.fine("Wrote %d entries to %s", entries.size(), output);
        } finally {
            if (!done) {
                Files.deleteIfExists(tmp.toPath());
            }
        }
    }

    private void writeIndex(RandomAccessFile file) throws IOException {
        file.writeInt(MAGIC);
        file.writeInt(VERSION);
        file.writeInt(alignment);
        file.writeInt(entries.size());
        for (ArchiveEntry entry : entries) {
            file.writeInt(entry.getType());
            file.writeLong(entry.getId());
            file.writeLong(entry.offset);
            file.writeLong(entry.size);
            file.writeUTF(entry.getPath());
            file.writeUTF(entry.getGroup());
        }
    }

    private static void alignBuffer(RandomAccessFile outFile, int align) throws IOException {
        long pos = outFile.getFilePointer();
        long newPos = (pos + (align - 1)) & ~((long) align - 1);
        for (long i = pos; i < newPos; ++i) {
            outFile.writeByte(0);
        }
    }
}
