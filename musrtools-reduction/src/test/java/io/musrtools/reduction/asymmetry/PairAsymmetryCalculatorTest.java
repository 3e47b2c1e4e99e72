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

import io.musrtools.reduction.IncompatibleShapeException;
import io.musrtools.reduction.TestSpectra;
import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.Spectrum;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.musrtools.reduction.TestSpectra.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class PairAsymmetryCalculatorTest {

    private final PairAsymmetryCalculator calculator = new PairAsymmetryCalculator();

    @Test
    void asymmetryOfBalancedPair() {
        ChannelDataset out = calculator.calculate(TestSpectra.channels(row(10), row(2)), 1.0);
        Spectrum s = out.spectrum(0);
        assertThat(s.y(0)).isEqualTo((10.0 - 2.0) / (10.0 + 2.0));
        assertThat(s.e(0)).isCloseTo(2.0 * Math.sqrt(4 * 10 + 100 * 2) / 144.0, within(1e-12));
        assertThat(out.yUnit()).isEqualTo(ChannelDataset.UNIT_ASYMMETRY);
        assertThat(s.channels()).containsExactly(1, 2);
        assertThat(out.spectrumCount()).isEqualTo(1);
    }

    @Test
    void alphaScalesBackward() {
        ChannelDataset out = calculator.calculate(TestSpectra.channels(row(10, 6), row(2, 3)), 2.0);
        assertThat(out.spectrum(0).y(0)).isCloseTo(6.0 / 14.0, within(1e-12));
        assertThat(out.spectrum(0).y(1)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void emptyBinsGiveZeroWithUnitError() {
        ChannelDataset out = calculator.calculate(TestSpectra.channels(row(0, 4), row(0, 4)), 1.0);
        assertThat(out.spectrum(0).y(0)).isEqualTo(0.0);
        assertThat(out.spectrum(0).e(0)).isEqualTo(1.0);
        assertThat(out.spectrum(0).y(1)).isEqualTo(0.0);
        assertThat(out.spectrum(0).e(1)).isLessThan(1.0);
    }

    @Test
    void keepsForwardXAxis() {
        ChannelDataset in = TestSpectra.channels(row(5, 5, 5), row(1, 2, 3));
        assertThat(calculator.calculate(in, 1.0).spectrum(0).x()).containsExactly(in.spectrum(0).x());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.5})
    void rejectsNonPositiveAlpha(double alpha) {
        assertThatThrownBy(() -> calculator.calculate(TestSpectra.channels(row(1), row(1)), alpha))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void needsExactlyTwoSpectra() {
        assertThatThrownBy(() -> calculator.calculate(TestSpectra.channels(row(1)), 1.0))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("exactly two");
    }

    @Test
    void rejectsDifferentLengths() {
        ChannelDataset in = TestSpectra.dataset(TestSpectra.counts(1, 1, 2), TestSpectra.counts(2, 1));
        assertThatThrownBy(() -> calculator.calculate(in, 1.0))
            .isInstanceOf(IncompatibleShapeException.class);
    }
}
