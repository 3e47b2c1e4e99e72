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

/**
 * Outputs of one pair reduction.
 *
 * @param output rebinned pair asymmetry
 * @param rawOutput pair asymmetry at the input binning
 */
public record PairingResult(ChannelDataset output, ChannelDataset rawOutput) {

    public PairingResult {
        Objects.requireNonNull(output, "output cannot be null");
        Objects.requireNonNull(rawOutput, "rawOutput cannot be null");
    }
}
