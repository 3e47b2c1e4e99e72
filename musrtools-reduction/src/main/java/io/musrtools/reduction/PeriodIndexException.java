package io.musrtools.reduction;

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

/// Thrown when a period index falls outside `[1, periodCount]`.
public class PeriodIndexException extends ReductionException {

    private final int period;
    private final int periodCount;

    public PeriodIndexException(int period, int periodCount) {
        super("Period " + period + " is out of range: the data has " + periodCount
            + (periodCount == 1 ? " period" : " periods"));
        this.period = period;
        this.periodCount = periodCount;
    }

    /// @return the requested one-based period index
    public int period() {
        return period;
    }

    /// @return the number of periods actually available
    public int periodCount() {
        return periodCount;
    }
}
