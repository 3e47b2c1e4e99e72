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

import io.musrtools.reduction.TestSpectra;
import io.musrtools.reduction.correct.CorrectionConfig;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.RunData;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.musrtools.reduction.TestSpectra.row;
import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PreProcessStageTest {

    private final PreProcessStage stage = new PreProcessStage();

    @Test
    void singleDatasetBecomesOnePeriod() {
        ChannelDataset d = TestSpectra.channels(row(1, 2));
        PeriodSet out = stage.process(RunData.of(d), CorrectionConfig.NONE);
        assertThat(out.size()).isEqualTo(1);
        assertThat(out.first().contentEquals(d)).isTrue();
        assertThat(out.first()).isNotSameAs(d);
    }

    @Test
    void correctsEveryPeriodAlike() {
        RunData periods = RunData.of(List.of(
            TestSpectra.channels(row(1, 2, 3)),
            TestSpectra.channels(row(4, 5, 6))));
        PeriodSet out = stage.process(periods, CorrectionConfig.builder().timeOffset(0.5).xMax(2.5).build());
        assertThat(out.size()).isEqualTo(2);
        assertThat(out.period(1).spectrum(0).x()).containsExactly(0.5, 1.5, 2.5);
        assertThat(out.period(2).spectrum(0).y()).containsExactly(4.0, 5.0);
    }
}
