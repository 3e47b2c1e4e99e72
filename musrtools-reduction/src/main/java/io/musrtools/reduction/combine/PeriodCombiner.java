package io.musrtools.reduction.combine;

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

import io.musrtools.reduction.PeriodIndexException;
import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.histogram.HistogramArithmetic;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.RunMetadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Sums and subtracts periods of a run.
 *
 * <pre>{@code
 * S = Σ periods[i] for i in summed
 * D = Σ periods[j] for j in subtracted
 * result = S - D        (just S when nothing is subtracted, -D when nothing is summed)
 * }</pre>
 *
 * <p>Period indices are one-based. Errors combine in quadrature at every step.
 * The result carries the metadata of the first summed period (or the first
 * subtracted one) with the good frames of all summed periods added up.
 */
public final class PeriodCombiner {

    private static final Logger logger = LogManager.getLogger(PeriodCombiner.class);

    /**
     * @throws ValidationException if both period lists are empty
     * @throws PeriodIndexException if an index is outside the period set
     * @throws io.musrtools.reduction.IncompatibleShapeException if combined periods have different X axes
     */
    public ChannelDataset combine(PeriodSet periods, List<Integer> summed, List<Integer> subtracted) {
        Objects.requireNonNull(periods, "periods cannot be null");
        Objects.requireNonNull(summed, "summed cannot be null");
        Objects.requireNonNull(subtracted, "subtracted cannot be null");
        validate(periods, summed, subtracted);

        logger.debug("Combining periods {} minus {} of {}", summed, subtracted, periods);
        ChannelDataset result;
        if (summed.isEmpty()) {
            result = HistogramArithmetic.negate(sum(periods, subtracted));
        } else {
            result = sum(periods, summed);
            if (!subtracted.isEmpty()) {
                result = HistogramArithmetic.subtract(result, sum(periods, subtracted));
            }
        }
        return result.withMetadata(combinedMetadata(periods, summed, subtracted));
    }

    /**
     * Checks period lists against a period set without doing any arithmetic.
     */
    public static void validate(PeriodSet periods, List<Integer> summed, List<Integer> subtracted) {
        if (summed.isEmpty() && subtracted.isEmpty()) {
            throw new ValidationException("At least one summed or subtracted period is required");
        }
        for (Integer period : summed) {
            periods.requireValidPeriod(period);
        }
        for (Integer period : subtracted) {
            periods.requireValidPeriod(period);
        }
    }

    private static ChannelDataset sum(PeriodSet periods, List<Integer> indices) {
        ChannelDataset total = periods.period(indices.get(0)).copy();
        for (int i = 1; i < indices.size(); i++) {
            total = HistogramArithmetic.add(total, periods.period(indices.get(i)));
        }
        return total;
    }

    static RunMetadata combinedMetadata(PeriodSet periods, List<Integer> summed, List<Integer> subtracted) {
        if (summed.isEmpty()) {
            return periods.period(subtracted.get(0)).metadata();
        }
        RunMetadata first = periods.period(summed.get(0)).metadata();
        Double frames = 0.0;
        for (Integer index : summed) {
            Double periodFrames = periods.period(index).metadata().goodFrames();
            if (periodFrames == null) {
                frames = null;
                break;
            }
            frames += periodFrames;
        }
        return first.withGoodFrames(frames);
    }
}
