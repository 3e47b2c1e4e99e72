package io.musrtools.reduction.histogram;

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
import io.musrtools.reduction.TestSpectra;
import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.Spectrum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@DisplayName("Rebinning")
class RebinnerTest {

    @Nested
    @DisplayName("RebinParams")
    class Params {

        @Test
        void parsesCommaSeparatedValues() {
            assertThat(RebinParams.parse("0, 0.5, 2").values()).containsExactly(0.0, 0.5, 2.0);
            assertThat(RebinParams.parse(" ")).isEqualTo(RebinParams.NONE);
            assertThat(RebinParams.NONE.isEmpty()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"0,1", "0", "0,0.5,1,2", "2,0.5,1", "x"})
        void rejectsInvalidParameters(String text) {
            assertThatThrownBy(() -> RebinParams.parse(text)).isInstanceOf(ValidationException.class);
        }

        @Test
        void stepOnlyUsesSuppliedRange() {
            assertThat(RebinParams.of(0.5).edges(0, 2, true)).containsExactly(0.0, 0.5, 1.0, 1.5, 2.0);
        }

        @Test
        void partialLastBinIsKeptOrDropped() {
            double[] kept = RebinParams.of(0.0, 0.3, 1.0).edges(0, 1, true);
            assertThat(kept).hasSize(5);
            assertThat(kept[3]).isCloseTo(0.9, within(1e-12));
            assertThat(kept[4]).isEqualTo(1.0);

            double[] dropped = RebinParams.of(0.0, 0.3, 1.0).edges(0, 1, false);
            assertThat(dropped).hasSize(4);
            assertThat(dropped[3]).isCloseTo(0.9, within(1e-12));
        }

        @Test
        void negativeStepIsLogarithmic() {
            assertThat(RebinParams.of(1, -1, 8).edges(0, 0, true)).containsExactly(1.0, 2.0, 4.0, 8.0);
        }

        @Test
        void logarithmicNeedsPositiveStart() {
            assertThatThrownBy(() -> RebinParams.of(0, -1, 8).edges(0, 0, true))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Rebinner")
    class Histograms {

        @Test
        void splitsBinsProportionally() {
            Spectrum rebinned = Rebinner.rebin(TestSpectra.counts(1, 1, 2, 3, 4), new double[]{0, 1.5, 4});
            assertThat(rebinned.y(0)).isCloseTo(2.0, within(1e-12));
            assertThat(rebinned.y(1)).isCloseTo(8.0, within(1e-12));
            assertThat(rebinned.e(0)).isCloseTo(Math.sqrt(2), within(1e-12));
            assertThat(rebinned.e(1)).isCloseTo(Math.sqrt(8), within(1e-12));
        }

        @Test
        void preservesTotalCounts() {
            ChannelDataset d = TestSpectra.channels(TestSpectra.row(1, 2, 3, 4, 5));
            ChannelDataset rebinned = Rebinner.rebin(d, RebinParams.of(2), true);
            assertThat(rebinned.spectrum(0).x()).containsExactly(0.0, 2.0, 4.0, 5.0);
            assertThat(rebinned.spectrum(0).y()).containsExactly(3.0, 7.0, 5.0);
            assertThat(rebinned.spectrum(0).sumY()).isEqualTo(d.spectrum(0).sumY());
        }

        @Test
        void emptyParamsReturnInput() {
            ChannelDataset d = TestSpectra.channels(TestSpectra.row(1, 2));
            assertThat(Rebinner.rebin(d, RebinParams.NONE, true)).isSameAs(d);
        }

        @Test
        void rejectsPointData() {
            Spectrum points = new Spectrum(new double[]{0, 1}, new double[]{1, 2}, new double[]{1, 1}, List.of(1));
            assertThatThrownBy(() -> Rebinner.rebin(TestSpectra.dataset(points), RebinParams.of(2), true))
                .isInstanceOf(IncompatibleShapeException.class);
        }
    }
}
