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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a cook, package or extract operation. Interruption is reported
 * separately from failure so callers can tell them apart.
 */
public class OperationResult {

    public enum Result {
        SUCCESS,
        FAILED,
        INTERRUPTED
    }

    private Result result = Result.SUCCESS;
    private final List<TaskResult> taskResults = new ArrayList<TaskResult>();
    private KilnException exception;

    public Result getResult() {
        return result;
    }

    public void setResult(Result result) {
        this.result = result;
    }

    public boolean isOk() {
        return result == Result.SUCCESS;
    }

    public boolean isInterrupted() {
        return result == Result.INTERRUPTED;
    }

    public void addTaskResult(TaskResult taskResult) {
        synchronized (taskResults) {
            taskResults.add(taskResult);
        }
    }

    public List<TaskResult> getTaskResults() {
        synchronized (taskResults) {
            return Collections.unmodifiableList(new ArrayList<TaskResult>(taskResults));
        }
    }

    /**
     * Count task results with a specific outcome
     * @param r outcome to count
     * @return number of matching task results
     */
    public int count(TaskResult.Result r) {
        int n = 0;
        for (TaskResult taskResult : getTaskResults()) {
            if (taskResult.getResult() == r) {
                ++n;
            }
        }
        return n;
    }

    /**
     * Mark the operation as failed because of a structural error
     * @param exception cause, eg a {@link MissingDependencyException}
     */
    public void fail(KilnException exception) {
        this.result = Result.FAILED;
        this.exception = exception;
    }

    public KilnException getException() {
        return exception;
    }

    public static OperationResult failed(KilnException exception) {
        OperationResult r = new OperationResult();
        r.fail(exception);
        return r;
    }

    @Override
    public String toString() {
        return String.format("%s (%d tasks)%s", result, taskResults.size(),
                exception != null ? ": " + exception.getMessage() : "");
    }
}
