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

import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.histogram.RebinParams;
import io.musrtools.reduction.model.PeriodSelection;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Options shared by the grouping and pairing stages.
 *
 * <h2>Options</h2>
 *
 * <ul>
 *   <li><b>kind</b> - counts or asymmetry, default counts</li>
 *   <li><b>periods</b> - summed and subtracted periods, default period 1</li>
 *   <li><b>timeMin / timeMax</b> - normalization window; unset bounds use the data extent</li>
 *   <li><b>rebin</b> - binning of the primary output; the raw output keeps the input binning</li>
 *   <li><b>fixedNormalization</b> - normalization constant, 0 to estimate it</li>
 * </ul>
 */
public final class AnalysisOptions {

    /** Counts of period 1, no rebinning. */
    public static final AnalysisOptions DEFAULTS = builder().build();

    private final AnalysisKind kind;
    private final PeriodSelection periods;
    private final Double timeMin;
    private final Double timeMax;
    private final RebinParams rebin;
    private final double fixedNormalization;

    private AnalysisOptions(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind cannot be null");
        this.periods = Objects.requireNonNull(builder.periods, "periods cannot be null");
        this.rebin = builder.rebin == null ? RebinParams.NONE : builder.rebin;
        if (builder.timeMin != null && builder.timeMax != null && !(builder.timeMin < builder.timeMax)) {
            throw new ValidationException("Time window [" + builder.timeMin + ", " + builder.timeMax
                + "] must satisfy start < end");
        }
        if (!Double.isFinite(builder.fixedNormalization) || builder.fixedNormalization < 0) {
            throw new ValidationException("Normalization must be a finite non-negative number, got "
                + builder.fixedNormalization);
        }
        this.timeMin = builder.timeMin;
        this.timeMax = builder.timeMax;
        this.fixedNormalization = builder.fixedNormalization;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .kind(kind)
            .periods(periods)
            .timeMin(timeMin)
            .timeMax(timeMax)
            .rebin(rebin)
            .fixedNormalization(fixedNormalization);
    }

    public AnalysisOptions withKind(AnalysisKind newKind) {
        return toBuilder().kind(newKind).build();
    }

    public AnalysisKind kind() {
        return kind;
    }

    public PeriodSelection periods() {
        return periods;
    }

    public Optional<Double> timeMin() {
        return Optional.ofNullable(timeMin);
    }

    public Optional<Double> timeMax() {
        return Optional.ofNullable(timeMax);
    }

    public RebinParams rebin() {
        return rebin;
    }

    public double fixedNormalization() {
        return fixedNormalization;
    }

    @Override
    public String toString() {
        return "AnalysisOptions{kind=" + kind + ", periods=" + periods + ", window=[" + timeMin + ", " + timeMax
            + "], rebin=" + rebin + ", fixedNormalization=" + fixedNormalization + "}";
    }

    public static final class Builder {
        private AnalysisKind kind = AnalysisKind.COUNTS;
        private PeriodSelection periods = PeriodSelection.FIRST;
        private Double timeMin;
        private Double timeMax;
        private RebinParams rebin = RebinParams.NONE;
        private double fixedNormalization;

        public Builder kind(AnalysisKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder periods(PeriodSelection periods) {
            this.periods = periods;
            return this;
        }

        public Builder periods(List<Integer> summed, List<Integer> subtracted) {
            this.periods = new PeriodSelection(summed, subtracted);
            return this;
        }

        public Builder timeMin(Double timeMin) {
            this.timeMin = timeMin;
            return this;
        }

        public Builder timeMax(Double timeMax) {
            this.timeMax = timeMax;
            return this;
        }

        public Builder rebin(RebinParams rebin) {
            this.rebin = rebin;
            return this;
        }

        public Builder fixedNormalization(double fixedNormalization) {
            this.fixedNormalization = fixedNormalization;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
