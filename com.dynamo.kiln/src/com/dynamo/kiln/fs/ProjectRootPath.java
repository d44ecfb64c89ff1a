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

package com.dynamo.kiln.fs;

import java.io.File;
import java.nio.file.Path;

/**
 * Absolute location of a project on disk. All {@link ProjectPath}s of a
 * project are relative to its root.
 */
public final class ProjectRootPath {

    /**
     * Hidden directory holding configuration stores and cooked output.
     */
    public static final String DOT_DIR = ".kiln";

    private final Path path;

    public ProjectRootPath(File directory) {
        this(directory.toPath());
    }

    public ProjectRootPath(Path directory) {
        this.path = directory.toAbsolutePath().normalize();
    }

    /**
     * Search for the root of the project containing a directory. The
     * directory itself and all of its parents are inspected for a
     * {@value #DOT_DIR} directory.
     * @param start directory to start from
     * @return root path or null if the directory isn't part of a project
     */
    public static ProjectRootPath search(File start) {
        File dir = start.getAbsoluteFile();
        while (dir != null) {
            if (new File(dir, DOT_DIR).isDirectory()) {
                return new ProjectRootPath(dir);
            }
            dir = dir.getParentFile();
        }
        return null;
    }

    /**
     * Initialise a new project in a directory
     * @param directory directory to turn into a project root
     * @return root path
     */
    public static ProjectRootPath create(File directory) {
        File dotDir = new File(directory, DOT_DIR);
        if (!dotDir.isDirectory() && !dotDir.mkdirs()) {
            throw new IllegalArgumentException(String.format("Unable to create '%s'", dotDir));
        }
        return new ProjectRootPath(directory);
    }

    public Path toPath() {
        return path;
    }

    public File toFile() {
        return path.toFile();
    }

    public String getAbsolutePath() {
        return path.toString();
    }

    public boolean isDirectory() {
        return path.toFile().isDirectory();
    }

    /**
     * Get the path of the root directory itself
     * @return project path with an empty relative path
     */
    public ProjectPath getRootPath() {
        return new ProjectPath(this, "");
    }

    /**
     * Create a project path
     * @param relativePath path relative to this root
     * @return project path
     */
    public ProjectPath path(String relativePath) {
        return new ProjectPath(this, relativePath);
    }

    /**
     * Create a project path from a file located inside the project
     * @param file absolute or cwd-relative file
     * @return project path
     * @throws IllegalArgumentException if the file is outside the project
     */
    public ProjectPath relativize(File file) {
        Path abs = file.toPath().toAbsolutePath().normalize();
        if (!abs.startsWith(path)) {
            throw new IllegalArgumentException(String.format("'%s' is not inside project '%s'", file, path));
        }
        return new ProjectPath(this, path.relativize(abs).toString());
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ProjectRootPath) {
            return path.equals(((ProjectRootPath) obj).path);
        }
        return false;
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
