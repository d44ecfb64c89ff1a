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
 * Serializes progress reports coming from several cook workers onto a single
 * sink.
 */
public class MultiProgress implements IProgress {

    private final IProgress target;

    public MultiProgress(IProgress target) {
        this.target = target;
    }

    @Override
    public synchronized void beginTask(Task task, int work) {
        target.beginTask(task, work);
    }

    @Override
    public synchronized void worked(String label, int amount) {
        target.worked(label, amount);
    }

    @Override
    public synchronized void done() {
        target.done();
    }
}
