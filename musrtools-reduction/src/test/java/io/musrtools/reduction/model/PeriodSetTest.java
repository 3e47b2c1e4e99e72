package io.musrtools.reduction.model;

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
import io.musrtools.reduction.TestSpectra;
import io.musrtools.reduction.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
@DisplayName("Periods")
class PeriodSetTest {

    private static PeriodSet twoPeriods() {
        return PeriodSet.of(
            TestSpectra.channels(TestSpectra.row(1, 2), TestSpectra.row(3, 4)),
            TestSpectra.channels(TestSpectra.row(5, 6), TestSpectra.row(7, 8)));
    }

    @Nested
    @DisplayName("PeriodSet")
    class Sets {

        @Test
        void periodsAreOneBased() {
            PeriodSet set = twoPeriods();
            assertEquals(2, set.size());
            assertEquals(5.0, set.period(2).spectrum(0).y(0));
            assertEquals(set.first(), set.period(1));
        }

        @Test
        void outOfRangePeriodReportsIndexAndCount() {
            PeriodIndexException ex = assertThrows(PeriodIndexException.class, () -> twoPeriods().period(3));
            assertEquals(3, ex.period());
            assertEquals(2, ex.periodCount());
            assertThat(ex).hasMessageContaining("Period 3").hasMessageContaining("2 periods");
        }

        @Test
        void periodZeroIsOutOfRange() {
            assertThrows(PeriodIndexException.class, () -> twoPeriods().requireValidPeriod(0));
        }

        @Test
        void rejectsPeriodsWithDifferentChannelLayout() {
            ChannelDataset a = TestSpectra.channels(TestSpectra.row(1), TestSpectra.row(2));
            ChannelDataset b = TestSpectra.dataset(TestSpectra.counts(1, 1), TestSpectra.counts(5, 2));
            assertThatThrownBy(() -> PeriodSet.of(a, b))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("owns channels");
        }

        @Test
        void rejectsPeriodsWithDifferentSpectrumCounts() {
            ChannelDataset a = TestSpectra.channels(TestSpectra.row(1), TestSpectra.row(2));
            ChannelDataset b = TestSpectra.channels(TestSpectra.row(1));
            assertThrows(ValidationException.class, () -> PeriodSet.of(a, b));
        }

        @Test
        void mapAppliesToEveryPeriod() {
            PeriodSet tagged = twoPeriods().map(d -> d.withTag("seen", "yes"));
            assertThat(tagged.periods()).allSatisfy(d -> assertThat(d.tags()).containsEntry("seen", "yes"));
        }
    }

    @Nested
    @DisplayName("RunData")
    class Runs {

        @Test
        void singleNormalizesToOnePeriod() {
            RunData single = RunData.of(TestSpectra.channels(TestSpectra.row(1, 2)));
            assertEquals(1, single.periodCount());
            assertEquals(1, single.normalize().size());
            assertThat(single.normalize().isMultiPeriod()).isFalse();
        }

        @Test
        void periodSetRoundTripsThroughRunData() {
            RunData multi = RunData.of(twoPeriods());
            assertInstanceOf(RunData.Periods.class, multi);
            assertEquals(2, multi.normalize().size());
            assertInstanceOf(RunData.Single.class, RunData.of(PeriodSet.of(twoPeriods().first())));
        }
    }

    @Nested
    @DisplayName("PeriodSelection")
    class Selections {

        @Test
        void formatsSummedThenSubtracted() {
            assertEquals("1+2-3", new PeriodSelection(List.of(1, 2), List.of(3)).format());
            assertEquals("-2", new PeriodSelection(List.of(), List.of(2)).format());
        }

        @Test
        void parsesCompactForm() {
            PeriodSelection parsed = PeriodSelection.parse("1+2-3");
            assertThat(parsed.summed()).containsExactly(1, 2);
            assertThat(parsed.subtracted()).containsExactly(3);
            assertThat(parsed.hasSubtracted()).isTrue();
        }

        @Test
        void leadingMinusMeansOnlySubtracted() {
            PeriodSelection parsed = PeriodSelection.parse("-2");
            assertThat(parsed.summed()).isEmpty();
            assertThat(parsed.subtracted()).containsExactly(2);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "1++2", "1,2", "a", "+"})
        void rejectsMalformedStrings(String text) {
            assertThrows(ValidationException.class, () -> PeriodSelection.parse(text));
        }

        @Test
        void rejectsEmptySelection() {
            assertThrows(ValidationException.class, () -> new PeriodSelection(List.of(), List.of()));
        }

        @Test
        void validatesAgainstPeriodSet() {
            PeriodIndexException ex = assertThrows(PeriodIndexException.class,
                () -> new PeriodSelection(List.of(1), List.of(3)).requireValidFor(twoPeriods()));
            assertEquals(3, ex.period());
        }
    }
}
