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

package com.dynamo.kiln.config;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.function.Predicate;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import com.dynamo.kiln.ConfigException;
import com.dynamo.kiln.fs.ProjectRootPath;
import com.dynamo.kiln.logging.Logger;

/**
 * Line-delimited persistent set backed by a UTF-8 text file.
 *
 * A transaction starts with {@link #lockAndRead()}, which takes an exclusive
 * lock shared with other processes and other instances in this process, and
 * ends with either {@link #unlockAndCommit()} or {@link #unlockAndDiscard()}.
 * Lines are kept in insertion order without duplicates.
 */
public class ConfigFile {

    private static Logger logger = Logger.getLogger(ConfigFile.class.getName());

    // FileChannel locks are held per JVM, so instances in the same process
    // also need to exclude each other
    private static final Map<String, Semaphore> processLocks = new ConcurrentHashMap<>();

    private final File file;
    private final File lockFile;
    private final LinkedHashSet<String> lines = new LinkedHashSet<String>();

    private Semaphore processLock;
    private RandomAccessFile lockAccess;
    private FileLock fileLock;
    private Thread owner;

    public ConfigFile(ProjectRootPath root, String name) {
        this(new File(new File(root.toFile(), ProjectRootPath.DOT_DIR), name));
    }

    public ConfigFile(File file) {
        this.file = file.getAbsoluteFile();
        this.lockFile = new File(this.file.getParentFile(), this.file.getName() + ".lock");
    }

    public File getFile() {
        return file;
    }

    public synchronized boolean isLocked() {
        return fileLock != null;
    }

    /**
     * Lock the file and read its lines. Blocks until no other transaction
     * holds the lock, including one started from another thread on this
     * instance.
     * @return read-only view of the lines, updated by {@link #addLine} and {@link #removeLine}
     * @throws ConfigException if the lock can't be acquired or the file can't be read
     * @throws IllegalStateException if the calling thread already holds the lock
     */
    public List<String> lockAndRead() throws ConfigException {
        synchronized (this) {
            if (owner == Thread.currentThread()) {
                throw new IllegalStateException(String.format("'%s' is already locked", file));
            }
        }
        Semaphore semaphore = processLocks.computeIfAbsent(file.getPath(), k -> new Semaphore(1));
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigException(String.format("Interrupted while waiting for lock on '%s'", file), e);
        }
        synchronized (this) {
            try {
                FileUtils.forceMkdirParent(file);
                lockAccess = new RandomAccessFile(lockFile, "rw");
                fileLock = lockAccess.getChannel().lock();
            } catch (IOException | RuntimeException e) {
                IOUtils.closeQuietly(lockAccess);
                lockAccess = null;
                fileLock = null;
                semaphore.release();
                throw new ConfigException(String.format("Unable to lock '%s'", file), e);
            }
            processLock = semaphore;
            owner = Thread.currentThread();

            lines.clear();
            try {
                readLines();
            } catch (IOException e) {
                release();
                throw new ConfigException(String.format("Unable to read '%s'", file), e);
            }
            return getLines();
        }
    }

    private void readLines() throws IOException {
        if (!file.exists()) {
            return;
        }
        byte[] content = Files.readAllBytes(file.toPath());
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            logger.warning("'%s' is malformed and will be treated as empty", file);
            return;
        }
        for (String line : text.split("\r?\n")) {
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
    }

    private void checkLocked() {
        if (fileLock == null) {
            throw new IllegalStateException(String.format("'%s' is not locked", file));
        }
    }

    /**
     * Get the current lines of a locked file
     * @return read-only view of the lines
     */
    public synchronized List<String> getLines() {
        checkLocked();
        return Collections.unmodifiableList(new ArrayList<String>(lines));
    }

    /**
     * Add a line. Adding a line that already exists does nothing.
     * @param line line to add
     */
    public synchronized void addLine(String line) {
        checkLocked();
        if (line.isEmpty() || line.indexOf('\n') != -1 || line.indexOf('\r') != -1) {
            throw new IllegalArgumentException(String.format("Invalid config line '%s'", line));
        }
        lines.add(line);
    }

    /**
     * Remove a line. Removing a line that doesn't exist does nothing.
     * @param line line to remove
     */
    public synchronized void removeLine(String line) {
        checkLocked();
        lines.remove(line);
    }

    /**
     * Remove all lines matching a predicate
     * @param filter predicate selecting the lines to remove
     * @return number of removed lines
     */
    public synchronized int removeLines(Predicate<String> filter) {
        checkLocked();
        int before = lines.size();
        lines.removeIf(filter);
        return before - lines.size();
    }

    public synchronized boolean checkForLine(String line) {
        checkLocked();
        return lines.contains(line);
    }

    /**
     * Release the lock without writing any changes
     */
    public synchronized void unlockAndDiscard() {
        checkLocked();
        lines.clear();
        release();
    }

    /**
     * Write the lines back and release the lock. The lock is released even
     * if the write fails; in that case the previous file content is intact.
     * @throws ConfigException if the file can't be written
     */
    public synchronized void unlockAndCommit() throws ConfigException {
        checkLocked();
        try {
            write();
        } catch (IOException e) {
            throw new ConfigException(String.format("Unable to write '%s'", file), e);
        } finally {
            lines.clear();
            release();
        }
    }

    private void write() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        File tmp = new File(file.getParentFile(), file.getName() + ".tmp");
        Files.write(tmp.toPath(), sb.toString().getBytes(StandardCharsets.UTF_8));
        try {
            Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void release() {
        try {
            if (fileLock != null) {
                fileLock.release();
            }
        } catch (IOException e) {
            logger.warning("Unable to release lock on '%s': %s", file, e.getMessage());
        } finally {
            IOUtils.closeQuietly(lockAccess);
            fileLock = null;
            lockAccess = null;
            owner = null;
            if (processLock != null) {
                processLock.release();
                processLock = null;
            }
        }
    }
}
