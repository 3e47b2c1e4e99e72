package io.musrtools.reduction.naming;

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

/// The quantity a published dataset holds, as written in its name.
public enum PlotType {
    COUNTS("Counts"),
    ASYMMETRY("Asym"),
    LOGS("Logs");

    private final String label;

    PlotType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Anything other than `Asym` or `Counts` reads as [#LOGS].
    public static PlotType fromLabel(String label) {
        if (ASYMMETRY.label.equals(label)) {
            return ASYMMETRY;
        }
        if (COUNTS.label.equals(label)) {
            return COUNTS;
        }
        return LOGS;
    }
}
