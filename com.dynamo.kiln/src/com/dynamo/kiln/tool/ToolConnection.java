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

package com.dynamo.kiln.tool;

import java.util.concurrent.locks.ReentrantLock;

import com.dynamo.kiln.logging.Logger;

/**
 * Process wide handle on a tool bridge. The bridge is used by one session
 * at a time; {@link #openSession()} blocks while another thread holds a
 * session.
 */
public class ToolConnection {

    private static Logger logger = Logger.getLogger(ToolConnection.class.getName());

    private final IToolBridge bridge;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean shutdown;

    public ToolConnection(IToolBridge bridge) {
        this.bridge = bridge;
    }

    /**
     * Get exclusive access to the tool. Close the session on the thread that
     * opened it.
     * @return session
     * @throws IllegalStateException if the connection is shut down or the
     *         calling thread already has a session open
     */
    public ToolSession openSession() {
        checkNotHeld();
        lock.lock();
        if (shutdown) {
            lock.unlock();
            throw new IllegalStateException("Tool connection is shut down");
        }
        return new ToolSession(this, bridge);
    }

    private void checkNotHeld() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Tool session already open on this thread");
        }
    }

    void release() {
        lock.unlock();
    }

    public boolean isBusy() {
        return lock.isLocked();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Shut down the tool. Waits for the current session to close.
     * @throws IllegalStateException if the calling thread has a session open
     */
    public void shutdown() {
        checkNotHeld();
        lock.lock();
        try {
            if (!shutdown) {
                shutdown = true;
                bridge.shutdown();
                logger.fine("Tool connection shut down");
            }
        } finally {
            lock.unlock();
        }
    }
}
