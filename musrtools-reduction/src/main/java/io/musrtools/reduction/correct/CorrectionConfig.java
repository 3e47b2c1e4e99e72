package io.musrtools.reduction.correct;

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
import io.musrtools.reduction.histogram.RebinParams;

import java.util.Optional;

/**
 * The corrections applied to one dataset, all optional.
 *
 * <h2>Options</h2>
 *
 * <ul>
 *   <li><b>deadTimes</b> - per-channel dead-time coefficients</li>
 *   <li><b>timeZeros</b> - one X shift per spectrum, in spectrum order</li>
 *   <li><b>timeOffset</b> - one X shift for every spectrum; exclusive with timeZeros</li>
 *   <li><b>xMin / xMax</b> - crop window; an unset bound means the data extent</li>
 *   <li><b>rebin</b> - rebin parameters; empty means no rebinning</li>
 * </ul>
 *
 * <pre>{@code
 * CorrectionConfig config = CorrectionConfig.builder()
 *     .deadTimes(DeadTimeTable.sequential(1, 0.005, 0.006))
 *     .timeOffset(-0.1)
 *     .xMin(0.1).xMax(16.0)
 *     .rebin(RebinParams.of(0.032))
 *     .build();
 * }</pre>
 */
public final class CorrectionConfig {

    /** A configuration that applies nothing. */
    public static final CorrectionConfig NONE = builder().build();

    private final DeadTimeTable deadTimes;
    private final double[] timeZeros;
    private final Double timeOffset;
    private final Double xMin;
    private final Double xMax;
    private final RebinParams rebin;

    private CorrectionConfig(Builder builder) {
        if (builder.timeZeros != null && builder.timeOffset != null) {
            throw new ValidationException("A time-zero table and a scalar time offset cannot both be given");
        }
        if (builder.xMin != null && builder.xMax != null && !(builder.xMin < builder.xMax)) {
            throw new ValidationException("Crop window [" + builder.xMin + ", " + builder.xMax + "] is empty or inverted");
        }
        this.deadTimes = builder.deadTimes;
        this.timeZeros = builder.timeZeros == null ? null : builder.timeZeros.clone();
        this.timeOffset = builder.timeOffset;
        this.xMin = builder.xMin;
        this.xMax = builder.xMax;
        this.rebin = builder.rebin == null ? RebinParams.NONE : builder.rebin;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder pre-filled with this configuration */
    public Builder toBuilder() {
        return new Builder()
            .deadTimes(deadTimes)
            .timeZeros(timeZeros)
            .timeOffset(timeOffset)
            .xMin(xMin)
            .xMax(xMax)
            .rebin(rebin);
    }

    public Optional<DeadTimeTable> deadTimes() {
        return Optional.ofNullable(deadTimes);
    }

    public Optional<double[]> timeZeros() {
        return Optional.ofNullable(timeZeros).map(double[]::clone);
    }

    public Optional<Double> timeOffset() {
        return Optional.ofNullable(timeOffset);
    }

    public Optional<Double> xMin() {
        return Optional.ofNullable(xMin);
    }

    public Optional<Double> xMax() {
        return Optional.ofNullable(xMax);
    }

    public RebinParams rebin() {
        return rebin;
    }

    public boolean hasCrop() {
        return xMin != null || xMax != null;
    }

    /** @return true when none of the corrections is configured */
    public boolean isEmpty() {
        return deadTimes == null && timeZeros == null && timeOffset == null && !hasCrop() && rebin.isEmpty();
    }

    public static final class Builder {
        private DeadTimeTable deadTimes;
        private double[] timeZeros;
        private Double timeOffset;
        private Double xMin;
        private Double xMax;
        private RebinParams rebin = RebinParams.NONE;

        public Builder deadTimes(DeadTimeTable deadTimes) {
            this.deadTimes = deadTimes;
            return this;
        }

        public Builder timeZeros(double[] timeZeros) {
            this.timeZeros = timeZeros;
            return this;
        }

        public Builder timeOffset(Double timeOffset) {
            this.timeOffset = timeOffset;
            return this;
        }

        public Builder xMin(Double xMin) {
            this.xMin = xMin;
            return this;
        }

        public Builder xMax(Double xMax) {
            this.xMax = xMax;
            return this;
        }

        public Builder rebin(RebinParams rebin) {
            this.rebin = rebin;
            return this;
        }

        public CorrectionConfig build() {
            return new CorrectionConfig(this);
        }
    }
}
