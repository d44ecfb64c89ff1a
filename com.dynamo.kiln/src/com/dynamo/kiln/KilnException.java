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
 * Structural failure of a project operation, ie bad configuration or an
 * incomplete dependency graph. Aborts the whole operation.
 */
public class KilnException extends Exception {
    private static final long serialVersionUID = 4316420982216871304L;

    public KilnException(String message) {
        super(message);
    }

    public KilnException(String message, Throwable e) {
        super(message, e);
    }
}
