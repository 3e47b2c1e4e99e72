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

import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.combine.GroupReducer;
import io.musrtools.reduction.combine.PeriodCombiner;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// Guesses the balance factor between a forward and a backward group.
///
/// Both groups are reduced and their periods combined, then
/// `α = ΣF / ΣB` over the bins whose centre lies in `[firstGoodX, lastX]`.
/// An unset `lastX` means the end of the data.
public final class AlphaEstimator {

    private static final Logger logger = LogManager.getLogger(AlphaEstimator.class);

    private final GroupReducer reducer;
    private final PeriodCombiner combiner;

    public AlphaEstimator() {
        this(new GroupReducer(), new PeriodCombiner());
    }

    public AlphaEstimator(GroupReducer reducer, PeriodCombiner combiner) {
        this.reducer = Objects.requireNonNull(reducer, "reducer cannot be null");
        this.combiner = Objects.requireNonNull(combiner, "combiner cannot be null");
    }

    /// @param summed periods to sum; empty means period 1
    /// @throws ValidationException if the backward group has no counts in the window
    public double estimate(PeriodSet periods, Collection<Integer> forwardIds, Collection<Integer> backwardIds,
                           List<Integer> summed, double firstGoodX, Double lastX) {
        Objects.requireNonNull(periods, "periods cannot be null");
        if (forwardIds.equals(backwardIds)) {
            throw new ValidationException("Forward and backward groups must differ");
        }
        List<Integer> periodList = summed == null || summed.isEmpty() ? List.of(1) : summed;
        ChannelDataset forward = combiner.combine(reducer.reduceGroup(periods, forwardIds), periodList, List.of());
        ChannelDataset backward = combiner.combine(reducer.reduceGroup(periods, backwardIds), periodList, List.of());

        double upper = lastX == null ? Double.POSITIVE_INFINITY : lastX;
        if (!(firstGoodX < upper)) {
            throw new ValidationException("Alpha window [" + firstGoodX + ", " + lastX + "] must satisfy start < end");
        }
        double forwardSum = windowSum(forward.spectrum(0), firstGoodX, upper);
        double backwardSum = windowSum(backward.spectrum(0), firstGoodX, upper);
        if (backwardSum == 0.0) {
            throw new ValidationException("Backward group has no counts in [" + firstGoodX + ", " + lastX + "]");
        }
        double alpha = forwardSum / backwardSum;
        logger.debug("Alpha {} from forward {} / backward {}", alpha, forwardSum, backwardSum);
        return alpha;
    }

    private static double windowSum(Spectrum s, double lo, double hi) {
        double sum = 0.0;
        for (int k = 0; k < s.size(); k++) {
            double t = s.binCentre(k);
            if (t >= lo && t <= hi) {
                sum += s.y(k);
            }
        }
        return sum;
    }
}
