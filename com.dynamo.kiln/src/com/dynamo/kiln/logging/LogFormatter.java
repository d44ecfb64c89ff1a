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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Date;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Formats kiln log records. Format arguments, in order: date, logger name,
 * level, message and the stack trace of an attached exception (empty if
 * none).
 */
public class LogFormatter extends Formatter {

    public static final String DEFAULT_FORMAT = "%3$s: %4$s%n%5$s";
    public static final String TIMESTAMP_FORMAT = "%1$tF %1$tT %3$-7s %4$s%n%5$s";

    private final String format;

    public LogFormatter() {
        this(DEFAULT_FORMAT);
    }

    public LogFormatter(String format) {
        this.format = format;
    }

    @Override
    public String format(LogRecord record) {
        String message = record.getMessage();
        Object[] params = record.getParameters();
        if (message != null && params != null && params.length > 0) {
            message = String.format(message, params);
        }
        String trace = "";
        Throwable thrown = record.getThrown();
        if (thrown != null) {
            StringWriter sw = new StringWriter();
            thrown.printStackTrace(new PrintWriter(sw));
            trace = sw.toString();
        }
        return String.format(format, new Date(record.getMillis()), record.getLoggerName(), record.getLevel(), message, trace);
    }
}
