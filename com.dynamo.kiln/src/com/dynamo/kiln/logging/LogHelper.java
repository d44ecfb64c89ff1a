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

import java.util.Collections;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;

/**
 * Configures the loggers of the com.dynamo.kiln namespace. The initial level
 * is read from the "kiln.log.level" system property (a java.util.logging
 * level name), INFO if unset.
 */
public class LogHelper {

    public static final String NAMESPACE = "com.dynamo.kiln";
    public static final String LEVEL_PROPERTY = "kiln.log.level";

    private static volatile Level logLevel = initialLevel();
    private static volatile boolean timestamps;

    private static Level initialLevel() {
        String name = System.getProperty(LEVEL_PROPERTY);
        if (name == null) {
            return Level.INFO;
        }
        try {
            return Level.parse(name.toUpperCase());
        } catch (IllegalArgumentException e) {
            System.err.println(String.format("Invalid %s '%s', using INFO", LEVEL_PROPERTY, name));
            return Level.INFO;
        }
    }

    /**
     * Replace the handlers of a logger with a single {@link LogHandler}
     * @param logger logger to configure
     */
    public static void configureLogger(java.util.logging.Logger logger) {
        for (Handler h : logger.getHandlers()) {
            logger.removeHandler(h);
        }
        Handler handler = new LogHandler();
        handler.setFormatter(new LogFormatter(timestamps ? LogFormatter.TIMESTAMP_FORMAT : LogFormatter.DEFAULT_FORMAT));
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
        logger.setLevel(logLevel);
    }

    private static void reconfigure() {
        LogManager logManager = LogManager.getLogManager();
        for (String loggerName : Collections.list(logManager.getLoggerNames())) {
            if (loggerName.startsWith(NAMESPACE)) {
                java.util.logging.Logger logger = logManager.getLogger(loggerName);
                if (logger != null) {
                    configureLogger(logger);
                }
            }
        }
    }

    public static Level getLogLevel() {
        return logLevel;
    }

    /**
     * Set the level of all existing and future kiln loggers
     * @param level level
     */
    public static void setLogLevel(Level level) {
        logLevel = level;
        reconfigure();
    }

    public static void setVerboseLogging(boolean enabled) {
        setLogLevel(enabled ? Level.FINE : Level.INFO);
    }

    /**
     * Prefix log lines with date and time
     * @param enabled true to print timestamps
     */
    public static void setTimestamps(boolean enabled) {
        timestamps = enabled;
        reconfigure();
    }
}
