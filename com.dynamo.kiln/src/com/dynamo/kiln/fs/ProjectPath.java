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

import org.apache.commons.io.FilenameUtils;

/**
 * Immutable path relative to a project root. Paths are normalized on
 * construction (unix separators, no "." or ".." segments, no leading or
 * trailing separator), so two paths are equal iff their normalized forms are.
 */
public final class ProjectPath implements Comparable<ProjectPath> {

    private final ProjectRootPath root;
    private final String path;

    public ProjectPath(ProjectRootPath root, String path) {
        if (root == null) {
            throw new IllegalArgumentException("Project root must not be null");
        }
        this.root = root;
        this.path = normalize(path);
    }

    public ProjectPath(ProjectPath parent, String child) {
        this(parent.root, parent.path.isEmpty() ? child : parent.path + "/" + child);
    }

    static String normalize(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Path must not be null");
        }
        String p = path.replace('\\', '/');
        // root relative paths are accepted
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (FilenameUtils.getPrefixLength(p) != 0) {
            throw new IllegalArgumentException(String.format("'%s' is not a project relative path", path));
        }
        if (p.isEmpty() || p.equals(".")) {
            return "";
        }
        String normalized = FilenameUtils.normalizeNoEndSeparator(p, true);
        if (normalized == null || normalized.equals("..") || normalized.startsWith("../")) {
            throw new IllegalArgumentException(String.format("'%s' escapes the project root", path));
        }
        if (normalized.equals(".")) {
            return "";
        }
        return normalized;
    }

    public ProjectRootPath getRoot() {
        return root;
    }

    /**
     * Get normalized root-relative path
     * @return path, empty string for the root itself
     */
    public String getRelativePath() {
        return path;
    }

    public String getAbsolutePath() {
        return toFile().getAbsolutePath();
    }

    public File toFile() {
        return toPath().toFile();
    }

    public Path toPath() {
        return path.isEmpty() ? root.toPath() : root.toPath().resolve(path);
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    public boolean exists() {
        return toFile().exists();
    }

    public boolean isFile() {
        return toFile().isFile();
    }

    public boolean isDirectory() {
        return toFile().isDirectory();
    }

    /**
     * Get last path segment
     * @return name, empty string for the root
     */
    public String getName() {
        return FilenameUtils.getName(path);
    }

    /**
     * Get extension without the dot
     * @return extension or empty string
     */
    public String getExtension() {
        return FilenameUtils.getExtension(path);
    }

    /**
     * Get parent path
     * @return parent or null for the root
     */
    public ProjectPath getParent() {
        if (path.isEmpty()) {
            return null;
        }
        int i = path.lastIndexOf('/');
        return new ProjectPath(root, i == -1 ? "" : path.substring(0, i));
    }

    public ProjectPath resolve(String child) {
        return new ProjectPath(this, child);
    }

    /**
     * Create a sibling path with a new extension
     * @param ext new extension including dot
     * @return path
     */
    public ProjectPath changeExt(String ext) {
        return new ProjectPath(root, FilenameUtils.removeExtension(path) + ext);
    }

    /**
     * Check if this path equals or is located below a directory path
     * @param dir directory path
     * @return true if this path is dir or a descendant of dir
     */
    public boolean isUnder(ProjectPath dir) {
        if (!root.equals(dir.root)) {
            return false;
        }
        if (dir.path.isEmpty() || path.equals(dir.path)) {
            return true;
        }
        return path.startsWith(dir.path + "/");
    }

    /**
     * Get this path relative to a base directory
     * @param base directory this path is located under
     * @return relative path string
     */
    public String relativeTo(ProjectPath base) {
        if (!isUnder(base)) {
            throw new IllegalArgumentException(String.format("'%s' is not below '%s'", this, base));
        }
        if (base.path.isEmpty()) {
            return path;
        }
        return path.equals(base.path) ? "" : path.substring(base.path.length() + 1);
    }

    /**
     * Move this path from one directory to another, keeping the layout below
     * it. Used to map working paths to the cooked tree.
     * @param fromDir directory this path is under
     * @param toDir new directory
     * @return rebased path
     */
    public ProjectPath rebase(ProjectPath fromDir, ProjectPath toDir) {
        String rel = relativeTo(fromDir);
        return rel.isEmpty() ? toDir : toDir.resolve(rel);
    }

    @Override
    public int compareTo(ProjectPath o) {
        return path.compareTo(o.path);
    }

    @Override
    public int hashCode() {
        return 31 * root.hashCode() + path.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ProjectPath) {
            ProjectPath p = (ProjectPath) obj;
            return path.equals(p.path) && root.equals(p.root);
        }
        return false;
    }

    @Override
    public String toString() {
        return path.isEmpty() ? "." : path;
    }
}
