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

import com.dynamo.kiln.fs.ProjectPath;

/**
 * TaskResult. Contains information for a single object cook or package step
 */
public class TaskResult {

    public enum Result {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    private Result result = Result.SUCCESS;
    private String message = "OK";
    private final ProjectPath path;
    private final String dataSpec;
    private Throwable exception;

    public TaskResult(ProjectPath path, String dataSpec) {
        this.path = path;
        this.dataSpec = dataSpec;
    }

    public void setResult(Result result) {
        this.result = result;
    }

    public Result getResult() {
        return this.result;
    }

    public boolean isOk() {
        return this.result != Result.FAILED;
    }

    /**
     * Set informative message. Used primarily for warnings and errors
     * @param message message to set
     */
    public void setMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Get the working path the result applies to
     * @return path
     */
    public ProjectPath getPath() {
        return path;
    }

    /**
     * Get name of the data spec that produced this result
     * @return data spec name
     */
    public String getDataSpec() {
        return dataSpec;
    }

    /**
     * Set exception. Should only be set, ie not null, when errors occur
     * @param exception exception to set. null is accepted.
     */
    public void setException(Throwable exception) {
        this.exception = exception;
    }

    public Throwable getException() {
        return exception;
    }

    public boolean hasException() {
        return exception != null;
    }

    @Override
    public String toString() {
        return String.format("%s [%s] %s (%s)", path, dataSpec, message, this.result);
    }
}
