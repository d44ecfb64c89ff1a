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

package com.dynamo.kiln.bridge;

import java.util.HashMap;
import java.util.Map;

import com.dynamo.kiln.fs.ProjectPath;
import com.dynamo.kiln.logging.Logger;

/**
 * Maps runtime object ids back to working paths. Filled while cooking and
 * while building a package depsgraph; safe to use from cook workers.
 */
public class BridgePathCache {

    private static Logger logger = Logger.getLogger(BridgePathCache.class.getName());

    private final Map<Long, ProjectPath> paths = new HashMap<Long, ProjectPath>();

    /**
     * Add a mapping. An id that is already mapped to another path keeps its
     * first path.
     * @param id object id
     * @param path working path
     */
    public synchronized void add(long id, ProjectPath path) {
        ProjectPath previous = paths.putIfAbsent(id, path);
        if (previous != null && !previous.equals(path)) {
            logger.warning("Object id %016x of '%s' collides with '%s'", id, path, previous);
        }
    }

    /**
     * Lookup path of an id
     * @param id object id
     * @return working path or null if the id is unknown
     */
    public synchronized ProjectPath lookup(long id) {
        return paths.get(id);
    }

    public synchronized void clear() {
        paths.clear();
    }

    public synchronized int size() {
        return paths.size();
    }
}
