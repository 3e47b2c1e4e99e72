package io.musrtools.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import picocli.CommandLine;

/// Shared time window options, in microseconds.
///
/// An unset bound means the extent of the data.
public class TimeWindowOption {

    @CommandLine.Option(
        names = {"--time-min"},
        paramLabel = "US",
        description = "Start of the time window in microseconds (default: start of data)"
    )
    private Double timeMin;

    @CommandLine.Option(
        names = {"--time-max"},
        paramLabel = "US",
        description = "End of the time window in microseconds (default: end of data)"
    )
    private Double timeMax;

    public Double getTimeMin() {
        return timeMin;
    }

    public Double getTimeMax() {
        return timeMax;
    }

    public boolean isSpecified() {
        return timeMin != null || timeMax != null;
    }

    /// @throws IllegalArgumentException when both bounds are given and the window is empty
    public void validate() {
        if (timeMin != null && timeMax != null && !(timeMin < timeMax)) {
            throw new IllegalArgumentException("--time-min must be less than --time-max, got ["
                + timeMin + ", " + timeMax + "]");
        }
    }

    @Override
    public String toString() {
        return "[" + (timeMin == null ? "start" : timeMin) + ", " + (timeMax == null ? "end" : timeMax) + "]";
    }
}
