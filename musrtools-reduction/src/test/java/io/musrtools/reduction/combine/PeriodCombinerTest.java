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

import io.musrtools.reduction.IncompatibleShapeException;
import io.musrtools.reduction.PeriodIndexException;
import io.musrtools.reduction.TestSpectra;
import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.RunMetadata;
import io.musrtools.reduction.model.Spectrum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.musrtools.reduction.TestSpectra.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@DisplayName("PeriodCombiner")
class PeriodCombinerTest {

    private final PeriodCombiner combiner = new PeriodCombiner();

    private static PeriodSet twoPeriods(Double framesOne, Double framesTwo) {
        return PeriodSet.of(
            TestSpectra.channels(new RunMetadata("MUSR", 15189, framesOne), row(1, 2)),
            TestSpectra.channels(new RunMetadata("MUSR", 15189, framesTwo), row(3, 4)));
    }

    @Test
    void sumsPeriodsWithQuadratureErrors() {
        ChannelDataset out = combiner.combine(twoPeriods(100.0, 50.0), List.of(1, 2), List.of());
        Spectrum s = out.spectrum(0);
        assertThat(s.y()).containsExactly(4.0, 6.0);
        assertThat(s.e(0)).isCloseTo(2.0, within(1e-12));
        assertThat(s.e(1)).isCloseTo(Math.sqrt(6), within(1e-12));
    }

    @Test
    void subtractsSecondList() {
        ChannelDataset out = combiner.combine(twoPeriods(100.0, 50.0), List.of(1), List.of(2));
        assertThat(out.spectrum(0).y()).containsExactly(-2.0, -2.0);
        assertThat(out.spectrum(0).e(1)).isCloseTo(Math.sqrt(6), within(1e-12));
    }

    @Test
    void emptySummedListNegatesSubtracted() {
        ChannelDataset out = combiner.combine(twoPeriods(100.0, 50.0), List.of(), List.of(2));
        assertThat(out.spectrum(0).y()).containsExactly(-3.0, -4.0);
        assertThat(out.spectrum(0).e(1)).isEqualTo(2.0);
    }

    @Test
    void singlePeriodIsACopy() {
        PeriodSet periods = twoPeriods(100.0, 50.0);
        ChannelDataset out = combiner.combine(periods, List.of(1), List.of());
        assertThat(out.contentEquals(periods.first())).isTrue();
        assertThat(out.spectrum(0)).isNotSameAs(periods.first().spectrum(0));
    }

    @Test
    void combinationIsAdditive() {
        PeriodSet periods = PeriodSet.of(
            TestSpectra.channels(row(1, 2), row(5, 6)),
            TestSpectra.channels(row(3, 4), row(7, 8)),
            TestSpectra.channels(row(9, 10), row(11, 12)));
        ChannelDataset all = combiner.combine(periods, List.of(1, 2, 3), List.of());
        ChannelDataset firstTwo = combiner.combine(periods, List.of(1, 2), List.of());
        for (int s = 0; s < 2; s++) {
            for (int k = 0; k < 2; k++) {
                assertThat(all.spectrum(s).y(k))
                    .isEqualTo(firstTwo.spectrum(s).y(k) + periods.period(3).spectrum(s).y(k));
            }
        }
    }

    @Test
    void goodFramesAreSummedOverSummedPeriods() {
        ChannelDataset out = combiner.combine(twoPeriods(100.0, 50.0), List.of(1, 2), List.of());
        assertThat(out.metadata().goodFrames()).isEqualTo(150.0);
        assertThat(out.metadata().runNumber()).isEqualTo(15189);
    }

    @Test
    void goodFramesUnknownIfAnyPeriodLacksThem() {
        ChannelDataset out = combiner.combine(twoPeriods(100.0, null), List.of(1, 2), List.of());
        assertThat(out.metadata().hasGoodFrames()).isFalse();
    }

    @Test
    void rejectsEmptyLists() {
        assertThatThrownBy(() -> combiner.combine(twoPeriods(1.0, 1.0), List.of(), List.of()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsPeriodOutsideSet() {
        assertThatThrownBy(() -> combiner.combine(twoPeriods(1.0, 1.0), List.of(1), List.of(3)))
            .isInstanceOfSatisfying(PeriodIndexException.class, ex -> {
                assertThat(ex.period()).isEqualTo(3);
                assertThat(ex.periodCount()).isEqualTo(2);
            });
    }

    @Test
    void rejectsPeriodsWithDifferentXAxes() {
        ChannelDataset shifted = TestSpectra.dataset(
            Spectrum.ofCounts(TestSpectra.edges(0.5, 1.0, 2), new double[]{3, 4}, List.of(1)));
        PeriodSet periods = PeriodSet.of(TestSpectra.channels(row(1, 2)), shifted);
        assertThatThrownBy(() -> combiner.combine(periods, List.of(1, 2), List.of()))
            .isInstanceOf(IncompatibleShapeException.class);
    }
}
