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
import io.musrtools.reduction.correct.CorrectionEngine;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.RunData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Runs the [CorrectionEngine] over every period of a run.
///
/// The input is never modified; the result is a new period set with the same
/// layout.
public final class PreProcessStage {

    private static final Logger logger = LogManager.getLogger(PreProcessStage.class);

    private final CorrectionEngine engine;

    public PreProcessStage() {
        this(new CorrectionEngine());
    }

    public PreProcessStage(CorrectionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    public PeriodSet process(RunData input, CorrectionConfig config) {
        Objects.requireNonNull(input, "input cannot be null");
        return process(input.normalize(), config);
    }

    public PeriodSet process(PeriodSet periods, CorrectionConfig config) {
        Objects.requireNonNull(periods, "periods cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        logger.debug("Correcting {} period(s)", periods.size());
        return periods.map(period -> engine.correct(period, config));
    }
}
