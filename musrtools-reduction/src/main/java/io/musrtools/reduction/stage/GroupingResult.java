package io.musrtools.reduction.stage;

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

import io.musrtools.reduction.model.ChannelDataset;

import java.util.Objects;
import java.util.Optional;

/**
 * Outputs of one group reduction.
 *
 * @param output rebinned counts or asymmetry
 * @param rawOutput the same quantity at the input binning
 * @param unnormalized rebinned decay-corrected counts, asymmetry only
 * @param unnormalizedRaw decay-corrected counts at the input binning, asymmetry only
 */
public record GroupingResult(ChannelDataset output, ChannelDataset rawOutput,
                             ChannelDataset unnormalized, ChannelDataset unnormalizedRaw) {

    public GroupingResult {
        Objects.requireNonNull(output, "output cannot be null");
        Objects.requireNonNull(rawOutput, "rawOutput cannot be null");
        if ((unnormalized == null) != (unnormalizedRaw == null)) {
            throw new IllegalArgumentException("unnormalized outputs must be given together");
        }
    }

    public static GroupingResult counts(ChannelDataset output, ChannelDataset rawOutput) {
        return new GroupingResult(output, rawOutput, null, null);
    }

    public boolean hasUnnormalized() {
        return unnormalized != null;
    }

    public Optional<ChannelDataset> unnormalizedOutput() {
        return Optional.ofNullable(unnormalized);
    }

    public Optional<ChannelDataset> unnormalizedRawOutput() {
        return Optional.ofNullable(unnormalizedRaw);
    }
}
