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

import io.musrtools.reduction.model.PeriodSelection;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared summed/subtracted period options. Without either option, period 1 is used.
 */
public class PeriodsOption {

    @CommandLine.Option(
        names = {"--summed"},
        split = ",",
        paramLabel = "PERIOD",
        description = "Periods to sum, one-based, comma separated (default: 1)"
    )
    private List<Integer> summed = new ArrayList<>();

    @CommandLine.Option(
        names = {"--subtracted"},
        split = ",",
        paramLabel = "PERIOD",
        description = "Periods to subtract from the sum, one-based, comma separated"
    )
    private List<Integer> subtracted = new ArrayList<>();

    /**
     * Gets the selection; period 1 alone when nothing was given.
     */
    public PeriodSelection getSelection() {
        if (summed.isEmpty() && subtracted.isEmpty()) {
            return PeriodSelection.FIRST;
        }
        return new PeriodSelection(summed, subtracted);
    }

    /**
     * Gets the summed periods exactly as given.
     */
    public List<Integer> getSummed() {
        return summed;
    }

    @Override
    public String toString() {
        return getSelection().format();
    }
}
