package io.musrtools.reduction.asymmetry;

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

import java.util.List;
import java.util.Objects;

/**
 * Result of converting counts to asymmetry.
 *
 * @param asymmetry the normalized asymmetry, one spectrum per input spectrum
 * @param unnormalized the decay-corrected, frame-normalized counts before normalization
 * @param normalizations the normalization constant used for each spectrum
 */
public record AsymmetryEstimate(ChannelDataset asymmetry, ChannelDataset unnormalized, List<Double> normalizations) {

    public AsymmetryEstimate {
        Objects.requireNonNull(asymmetry, "asymmetry cannot be null");
        Objects.requireNonNull(unnormalized, "unnormalized cannot be null");
        normalizations = List.copyOf(normalizations);
    }

    /** @return the normalization constant of the first spectrum */
    public double normalization() {
        return normalizations.get(0);
    }
}
