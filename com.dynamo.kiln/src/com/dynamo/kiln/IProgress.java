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
 * Progress sink. Receives a label and the amount of work done; sinks derive
 * the fraction complete from the work announced in {@link #beginTask}.
 */
public interface IProgress {
    void beginTask(Task task, int work);
    void worked(String label, int amount);
    void done();

    enum Task {
        ADDING,
        COOKING,
        PACKAGING,
        CLEANING,
        EXTRACTING,
        IMAGING
    }
}
