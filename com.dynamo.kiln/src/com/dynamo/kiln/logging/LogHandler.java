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

import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.LogRecord;


/**
 * Basic log handler which publishes log records directly to
 * system out as soon as they are received. Records at SEVERE go
 * to system err.
 */
public class LogHandler extends Handler {
    public LogHandler() {
        super();
    }

    @Override
    public void publish(final LogRecord record) {
        if (!isLoggable(record)) {
            return;
        }
        String text;
        Formatter f = getFormatter();
        if (f != null) {
            text = f.format(record);
        }
        else {
            text = record.getMessage() + System.lineSeparator();
        }
        if (record.getLevel().intValue() >= java.util.logging.Level.SEVERE.intValue()) {
            System.err.print(text);
        } else {
            System.out.print(text);
        }
    }

    @Override
    public void close() throws SecurityException {}

    @Override
    public void flush() {}
}
