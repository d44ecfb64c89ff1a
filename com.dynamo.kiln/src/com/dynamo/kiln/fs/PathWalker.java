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
import java.util.Arrays;
import java.util.Collection;

/**
 * Working tree traversal. Directory entries are visited in name order so
 * that every walk over an unchanged tree yields the same sequence.
 */
public class PathWalker {

    /**
     * Used to traverse the working tree.
     */
    public interface IWalker {
        /**
         * Inspect the directory described by the path.
         * @param path project path of the directory
         * @param results result of traversed paths, write to the collection if the supplied path should be included
         * @return true if the directory should be entered, false to disregard
         */
        boolean handleDirectory(ProjectPath path, Collection<ProjectPath> results);
        /**
         * Inspect the file described by the path.
         * @param path project path of the file
         * @param results result of traversed paths, write to the collection if the supplied path should be included
         */
        void handleFile(ProjectPath path, Collection<ProjectPath> results);
    }

    /**
     * Default walker. Collects all files and skips hidden entries.
     */
    public static class FileWalker implements IWalker {
        @Override
        public boolean handleDirectory(ProjectPath path, Collection<ProjectPath> results) {
            return !isHidden(path);
        }

        @Override
        public void handleFile(ProjectPath path, Collection<ProjectPath> results) {
            if (!isHidden(path)) {
                results.add(path);
            }
        }
    }

    public static boolean isHidden(ProjectPath path) {
        return path.getName().startsWith(".");
    }

    /**
     * Walk a file or directory.
     * @param path file or directory to walk
     * @param recursive enter sub directories
     * @param walker walker to perform and possibly store the result
     * @param results collection to write the results to
     */
    public static void walk(ProjectPath path, boolean recursive, IWalker walker, Collection<ProjectPath> results) {
        File file = path.toFile();
        if (file.isFile()) {
            walker.handleFile(path, results);
        } else if (file.isDirectory()) {
            if (!path.isRoot() && !walker.handleDirectory(path, results)) {
                return;
            }
            walkDirectory(path, file, recursive, walker, results);
        }
    }

    private static void walkDirectory(ProjectPath dirPath, File dir, boolean recursive, IWalker walker, Collection<ProjectPath> results) {
        String[] names = dir.list();
        if (names == null) {
            return;
        }
        Arrays.sort(names);
        for (String name : names) {
            ProjectPath child = dirPath.resolve(name);
            File childFile = new File(dir, name);
            if (childFile.isDirectory()) {
                if (recursive && walker.handleDirectory(child, results)) {
                    walkDirectory(child, childFile, true, walker, results);
                }
            } else if (childFile.isFile()) {
                walker.handleFile(child, results);
            }
        }
    }
}
