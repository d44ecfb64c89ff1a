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

import java.io.PrintStream;

public class ConsoleProgress implements IProgress {

    private final PrintStream out;
    private final boolean isATTY;
    private float totalWork;
    private float worked;
    private int prevPercent = -1;

    public ConsoleProgress() {
        this(System.out);
    }

    public ConsoleProgress(PrintStream out) {
        this.out = out;
        this.isATTY = System.console() != null;
    }

    @Override
    public void beginTask(Task task, int work) {
        out.print(switch (task) {
            case ADDING -> "Adding...";
            case COOKING -> "Cooking...";
            case PACKAGING -> "Packaging...";
            case CLEANING -> "Cleaning...";
            case EXTRACTING -> "Extracting...";
            case IMAGING -> "Imaging...";
        });
        this.totalWork = Math.max(work, 1);
        this.worked = 0;
        this.prevPercent = -1;
    }

    @Override
    public void worked(String label, int amount) {
        worked = Math.min(totalWork, worked + amount);
        printProgress(label);
    }

    private void printProgress(String label) {
        int percent = (int)(100 * worked / totalWork);
        if (percent == prevPercent && !isATTY) {
            return;
        }
        if (this.isATTY) {
            out.print("\r                                                            \r");
            out.print(String.format("%3d%% %s", percent, label != null ? label : ""));
        } else {
            out.print(String.format(" %d%%", percent));
        }
        prevPercent = percent;
    }

    @Override
    public void done() {
        worked = totalWork;
        printProgress(null);
        out.println(" ...done!");
    }
}
