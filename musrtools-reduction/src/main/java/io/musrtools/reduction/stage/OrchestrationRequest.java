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

import io.musrtools.reduction.correct.CorrectionConfig;
import io.musrtools.reduction.model.GroupingSpec;
import io.musrtools.reduction.model.RunData;
import io.musrtools.reduction.naming.RunLabel;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything one {@link OrchestrationStage} run needs.
 *
 * <pre>{@code
 * OrchestrationRequest request = OrchestrationRequest.builder()
 *     .input(RunData.of(periodSet))
 *     .grouping(grouping)
 *     .corrections(CorrectionConfig.builder().timeOffset(-0.1).build())
 *     .options(AnalysisOptions.builder().timeMin(0.1).timeMax(16.0).build())
 *     .groupAsymmetry(true)
 *     .build();
 * }</pre>
 *
 * <p>The input is either given directly or read from the registry by name.
 */
public final class OrchestrationRequest {

    private final RunData input;
    private final String inputName;
    private final GroupingSpec grouping;
    private final CorrectionConfig corrections;
    private final AnalysisOptions options;
    private final boolean groupAsymmetry;
    private final String label;
    private final int version;
    private final int zeroPadding;

    private OrchestrationRequest(Builder builder) {
        if ((builder.input == null) == (builder.inputName == null)) {
            throw new IllegalArgumentException("exactly one of input or inputName must be given");
        }
        if (builder.version < 1) {
            throw new IllegalArgumentException("version must be at least 1, got " + builder.version);
        }
        if (builder.zeroPadding < 0) {
            throw new IllegalArgumentException("zeroPadding cannot be negative, got " + builder.zeroPadding);
        }
        this.input = builder.input;
        this.inputName = builder.inputName;
        this.grouping = Objects.requireNonNull(builder.grouping, "grouping cannot be null");
        this.corrections = builder.corrections == null ? CorrectionConfig.NONE : builder.corrections;
        this.options = builder.options == null ? AnalysisOptions.DEFAULTS : builder.options;
        this.groupAsymmetry = builder.groupAsymmetry;
        this.label = builder.label;
        this.version = builder.version;
        this.zeroPadding = builder.zeroPadding;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RunData> input() {
        return Optional.ofNullable(input);
    }

    public Optional<String> inputName() {
        return Optional.ofNullable(inputName);
    }

    public GroupingSpec grouping() {
        return grouping;
    }

    public CorrectionConfig corrections() {
        return corrections;
    }

    public AnalysisOptions options() {
        return options;
    }

    public boolean groupAsymmetry() {
        return groupAsymmetry;
    }

    /** @return the caller's label override, if any */
    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public int version() {
        return version;
    }

    public int zeroPadding() {
        return zeroPadding;
    }

    public static final class Builder {
        private RunData input;
        private String inputName;
        private GroupingSpec grouping;
        private CorrectionConfig corrections;
        private AnalysisOptions options;
        private boolean groupAsymmetry;
        private String label;
        private int version = 1;
        private int zeroPadding = RunLabel.DEFAULT_ZERO_PADDING;

        public Builder input(RunData input) {
            this.input = input;
            return this;
        }

        public Builder inputName(String inputName) {
            this.inputName = inputName;
            return this;
        }

        public Builder grouping(GroupingSpec grouping) {
            this.grouping = grouping;
            return this;
        }

        public Builder corrections(CorrectionConfig corrections) {
            this.corrections = corrections;
            return this;
        }

        public Builder options(AnalysisOptions options) {
            this.options = options;
            return this;
        }

        public Builder groupAsymmetry(boolean groupAsymmetry) {
            this.groupAsymmetry = groupAsymmetry;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder zeroPadding(int zeroPadding) {
            this.zeroPadding = zeroPadding;
            return this;
        }

        public OrchestrationRequest build() {
            return new OrchestrationRequest(this);
        }
    }
}
