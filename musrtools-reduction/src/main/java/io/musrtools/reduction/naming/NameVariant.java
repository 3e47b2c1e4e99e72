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

/// Suffix variants published next to the primary name of an item.
public enum NameVariant {
    /// Rebinned output.
    PRIMARY(""),
    /// Output at the original binning.
    RAW("_Raw"),
    /// Decay-corrected counts before normalization, rebinned.
    UNNORM("_unNorm"),
    /// Decay-corrected counts before normalization, original binning.
    UNNORM_RAW("_unNorm_Raw");

    private final String suffix;

    NameVariant(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /// @return the variant whose suffix ends the name, [#PRIMARY] if none does
    public static NameVariant of(String name) {
        // longest suffix first: "_unNorm_Raw" also ends with "_Raw"
        if (name.endsWith(UNNORM_RAW.suffix)) {
            return UNNORM_RAW;
        }
        if (name.endsWith(UNNORM.suffix)) {
            return UNNORM;
        }
        if (name.endsWith(RAW.suffix)) {
            return RAW;
        }
        return PRIMARY;
    }
}
