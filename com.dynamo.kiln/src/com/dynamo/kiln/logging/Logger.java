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

package com.dynamo.kiln.logging;

import java.util.logging.Level;

/**
 * Printf-style front for java.util.logging. Messages are only formatted
 * when the level is enabled.
 */
public class Logger {

    private final java.util.logging.Logger logger;

    private Logger(java.util.logging.Logger logger) {
        this.logger = logger;
    }

    public static Logger getLogger(String name) {
        java.util.logging.Logger logger = java.util.logging.Logger.getLogger(name);
        LogHelper.configureLogger(logger);
        return new Logger(logger);
    }

    public boolean isLoggable(Level level) {
        return logger.isLoggable(level);
    }

    public void log(Level level, String fmt, Object... args) {
        if (logger.isLoggable(level)) {
            logger.log(level, args.length > 0 ? String.format(fmt, args) : fmt);
        }
    }

    public void log(Level level, String message, Throwable e) {
        logger.log(level, message, e);
    }

    public void severe(String fmt, Object... args) {
        log(Level.SEVERE, fmt, args);
    }

    public void warning(String fmt, Object... args) {
        log(Level.WARNING, fmt, args);
    }

    public void info(String fmt, Object... args) {
        log(Level.INFO, fmt, args);
    }

    public void fine(String fmt, Object... args) {
        log(Level.FINE, fmt, args);
    }
}
