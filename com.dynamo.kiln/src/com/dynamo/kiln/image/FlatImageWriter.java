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

package com.dynamo.kiln.image;

import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.filefilter.HiddenFileFilter;

import com.dynamo.kiln.IProgress;
import com.dynamo.kiln.logging.Logger;
import com.dynamo.kiln.util.FileUtil;

/**
 * Generic image: a sector aligned table of contents followed by the files of
 * the directory in path order, each starting on a sector boundary.
 *
 * TOC layout, big endian: magic "KIMG", sector size, file count, then per
 * file its first sector, byte size and path in the modified UTF-8 of
 * {@link DataOutputStream#writeUTF(String)}.
 */
public class FlatImageWriter implements IImageWriter {

    private static Logger logger = Logger.getLogger(FlatImageWriter.class.getName());

    public static final int MAGIC = 0x4b494d47; // KIMG
    public static final int DEFAULT_SECTOR_SIZE = 2048;

    private final File output;
    private final int sectorSize;
    private final long capacity;

    /**
     * @param output image file
     * @param sectorSize sector size in bytes
     * @param capacity maximum image size, 0 for no limit
     */
    public FlatImageWriter(File output, int sectorSize, long capacity) {
        this.output = output;
        this.sectorSize = sectorSize;
        this.capacity = capacity;
    }

    public FlatImageWriter(File output) {
        this(output, DEFAULT_SECTOR_SIZE, 0);
    }

    private List<File> listFiles(File directory) throws IOException {
        if (!directory.isDirectory()) {
            throw new IOException(String.format("'%s' is not a directory", directory));
        }
        Collection<File> files = FileUtils.listFiles(directory, HiddenFileFilter.VISIBLE, HiddenFileFilter.VISIBLE);
        List<File> sorted = new ArrayList<File>(files);
        sorted.removeIf(f -> f.getAbsoluteFile().equals(output.getAbsoluteFile()));
        sorted.sort((a, b) -> relative(directory, a).compareTo(relative(directory, b)));
        return sorted;
    }

    private static String relative(File directory, File file) {
        String base = directory.getAbsoluteFile().toPath().normalize().toString();
        String path = file.getAbsoluteFile().toPath().normalize().toString();
        return FilenameUtils.separatorsToUnix(path.substring(base.length() + 1));
    }

    private long sectors(long size) {
        return (size + sectorSize - 1) / sectorSize;
    }

    private long tocSize(File directory, List<File> files) {
        long size = 12;
        for (File f : files) {
            size += 8 + 8 + 2 + utfLength(relative(directory, f));
        }
        return size;
    }

    // Encoded length as written by writeUTF: NUL takes two bytes and each
    // surrogate of a supplementary character three
    static int utfLength(String s) {
        int length = 0;
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            if (c >= 0x0001 && c <= 0x007f) {
                length += 1;
            } else if (c <= 0x07ff) {
                length += 2;
            } else {
                length += 3;
            }
        }
        return length;
    }

    @Override
    public long estimateSize(File directory) throws IOException {
        List<File> files = listFiles(directory);
        long total = sectors(tocSize(directory, files));
        for (File f : files) {
            total += sectors(f.length());
        }
        long size = total * sectorSize;
        if (capacity > 0 && size > capacity) {
            throw new IOException(String.format("Image of %d bytes exceeds the capacity of %d bytes", size, capacity));
        }
        return size;
    }

    @Override
    public void build(File directory, IProgress progress) throws IOException {
        List<File> files = listFiles(directory);
        estimateSize(directory);
        long sector = sectors(tocSize(directory, files));
        List<Long> firstSectors = new ArrayList<Long>();
        for (File f : files) {
            firstSectors.add(sector);
            sector += sectors(f.length());
        }

        progress.beginTask(IProgress.Task.IMAGING, files.size());
        FileUtil.writeAtomic(output, (OutputStream os) -> {
            DataOutputStream out = new DataOutputStream(os);
            out.writeInt(MAGIC);
            out.writeInt(sectorSize);
            out.writeInt(files.size());
            for (int i = 0; i < files.size(); ++i) {
                File f = files.get(i);
                out.writeLong(firstSectors.get(i));
                out.writeLong(f.length());
                out.writeUTF(relative(directory, f));
            }
            pad(out, out.size());
            long written = sectors(out.size()) * sectorSize;
            for (File f : files) {
                long size;
                try (InputStream is = Files.newInputStream(f.toPath())) {
                    size = IOUtils.copyLarge(is, out);
                }
                pad(out, size);
                written += sectors(size) * sectorSize;
                progress.worked(relative(directory, f), 1);
            }
            out.flush();
            logger.fine("Wrote image %s, %d bytes", output, written);
        });
        progress.done();
    }

    private void pad(OutputStream out, long size) throws IOException {
        long rem = size % sectorSize;
        if (rem != 0) {
            out.write(new byte[(int) (sectorSize - rem)]);
        }
    }
}
