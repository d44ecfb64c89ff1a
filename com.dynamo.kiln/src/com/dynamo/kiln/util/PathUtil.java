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

import java.util.regex.Pattern;

import org.apache.commons.io.FilenameUtils;

public class PathUtil {

    /**
     * Check if a string contains wildcard characters
     * @param pattern string to check
     * @return true if the string contains * or ?
     */
    public static boolean isWildcard(String pattern) {
        return pattern.indexOf('*') != -1 || pattern.indexOf('?') != -1;
    }

    /**
     * Get the directory part of a wildcard pattern that contains no wildcards,
     * ie where a walk for matches has to start.
     * @param pattern wildcard pattern
     * @return leading directory, empty string if the pattern starts with a wildcard
     */
    public static String wildcardBase(String pattern) {
        String p = FilenameUtils.separatorsToUnix(pattern);
        int wildcard = p.length();
        for (int i = 0; i < p.length(); ++i) {
            char c = p.charAt(i);
            if (c == '*' || c == '?') {
                wildcard = i;
                break;
            }
        }
        int slash = p.lastIndexOf('/', wildcard);
        return slash == -1 ? "" : p.substring(0, slash);
    }

    /**
     * Translate an Ant style pattern to a regular expression:
     * * matches zero or more characters within a path name,
     * ? matches exactly one character within a path name and
     * ** (with an optional trailing /) matches zero or more path names.
     * @param pattern wildcard pattern with unix separators
     * @return compiled pattern
     */
    public static Pattern compileWildcard(String pattern) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '*' && pattern.startsWith("**", i)) {
                regex.append(".*");
                i += pattern.startsWith("**/", i) ? 3 : 2;
                continue;
            }
            if (c == '*') {
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            ++i;
        }
        return Pattern.compile(regex.toString());
    }

    /**
     * Match a path against an Ant style pattern, see {@link #compileWildcard}.
     * The path is normalized with unix separators before matching.
     * @param path path to test
     * @param pattern pattern to match against, null matches everything
     * @return true if the path matches
     */
    public static boolean wildcardMatch(String path, String pattern) {
        if (pattern == null) {
            return true;
        }
        String normalized = FilenameUtils.normalize(path, true);
        return normalized != null && compileWildcard(FilenameUtils.separatorsToUnix(pattern)).matcher(normalized).matches();
    }
}
