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

package com.dynamo.kiln;

/**
 * Configuration error. Thrown when the project root is unusable or a
 * configuration store can't be locked, read or committed.
 */
public class ConfigException extends KilnException {
    private static final long serialVersionUID = -6521830112473360142L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable e) {
        super(message, e);
    }
}
