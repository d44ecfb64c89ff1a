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
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

import com.dynamo.kiln.logging.Logger;
import com.dynamo.kiln.util.FileUtil;

/**
 * Persistent map of working path to the fingerprint of the source that the
 * current cooked output was produced from. One state is kept per data spec
 * in the project dot directory.
 */
public class CookState implements Serializable {

    public static final String EXTENSION = ".cookstate";

    private static final long serialVersionUID = 4716301870928730371L;
    private static Logger logger = Logger.getLogger(CookState.class.getName());

    private final Map<String, String> fingerprints = new HashMap<String, String>();

    /**
     * Get fingerprint for path
     * @param path relative working path
     * @return fingerprint or null if the path has no cooked output on record
     */
    public synchronized String getFingerprint(String path) {
        return fingerprints.get(path);
    }

    public synchronized void putFingerprint(String path, String fingerprint) {
        fingerprints.put(path, fingerprint);
    }

    public synchronized void removeFingerprint(String path) {
        fingerprints.remove(path);
    }

    /**
     * Remove all entries whose path matches a predicate
     * @param filter selects the paths to remove
     * @return number of removed entries
     */
    public synchronized int removeFingerprints(Predicate<String> filter) {
        int before = fingerprints.size();
        fingerprints.keySet().removeIf(filter);
        return before - fingerprints.size();
    }

    public synchronized int size() {
        return fingerprints.size();
    }

    /**
     * Load state from file. A missing or unreadable file gives an empty state.
     * @param file state file
     * @return {@link CookState}
     */
    public static CookState load(File file) {
        if (!file.isFile()) {
            return new CookState();
        }
        try (InputStream in = Files.newInputStream(file.toPath());
             ObjectInputStream is = new ObjectInputStream(in)) {
            return (CookState) is.readObject();
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            logger.warning("Unable to load cook state '%s', all objects will be recooked: %s", file, e.getMessage());
            return new CookState();
        }
    }

    /**
     * Save state
     * @param file state file
     * @throws IOException
     */
    public synchronized void save(File file) throws IOException {
        FileUtil.writeAtomic(file, (OutputStream os) -> {
            ObjectOutputStream oos = new ObjectOutputStream(os);
            oos.writeObject(this);
            oos.flush();
        });
    }
}
