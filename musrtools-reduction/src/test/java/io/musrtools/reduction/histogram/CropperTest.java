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

import io.musrtools.reduction.TestSpectra;
import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.Spectrum;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CropperTest {

    private static final double[] TEN_BINS = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

    @Test
    void keepsBinsWhollyInsideWindow() {
        Spectrum cropped = Cropper.crop(TestSpectra.counts(1, TEN_BINS), 2.0, 5.0);
        assertThat(cropped.x()).containsExactly(2.0, 3.0, 4.0, 5.0);
        assertThat(cropped.y()).containsExactly(2.0, 3.0, 4.0);
    }

    @Test
    void partiallyCoveredBinsAreDropped() {
        Spectrum cropped = Cropper.crop(TestSpectra.counts(1, TEN_BINS), 1.5, 4.5);
        assertThat(cropped.x()).containsExactly(2.0, 3.0, 4.0);
        assertThat(cropped.y()).containsExactly(2.0, 3.0);
    }

    @Test
    void edgesWithinRoundingOfTheBoundaryAreKept() {
        Spectrum cropped = Cropper.crop(TestSpectra.counts(1, TEN_BINS), 2.0 + 1e-12, 5.0 - 1e-12);
        assertThat(cropped.size()).isEqualTo(3);
    }

    @Test
    void nullBoundsMeanDatasetRange() {
        ChannelDataset d = TestSpectra.channels(TestSpectra.row(1, 2, 3));
        ChannelDataset cropped = Cropper.crop(d, null, 2.0);
        assertThat(cropped.spectrum(0).y()).containsExactly(1.0, 2.0);
        assertThat(Cropper.crop(d, null, null).contentEquals(d)).isTrue();
    }

    @Test
    void pointDataKeepsPointsInsideWindow() {
        Spectrum points = new Spectrum(new double[]{0, 1, 2, 3}, new double[]{5, 6, 7, 8},
            new double[]{1, 1, 1, 1}, List.of(1));
        Spectrum cropped = Cropper.crop(points, 0.5, 2.0);
        assertThat(cropped.x()).containsExactly(1.0, 2.0);
        assertThat(cropped.y()).containsExactly(6.0, 7.0);
    }

    @Test
    void raggedCropUsesOneWindowPerSpectrum() {
        ChannelDataset d = TestSpectra.channels(TestSpectra.row(TEN_BINS), TestSpectra.row(TEN_BINS));
        ChannelDataset cropped = Cropper.cropRagged(d, new double[]{0, 4}, new double[]{2, 9});
        assertThat(cropped.spectrum(0).size()).isEqualTo(2);
        assertThat(cropped.spectrum(1).size()).isEqualTo(5);
    }

    @Test
    void raggedCropNeedsOneBoundPerSpectrum() {
        ChannelDataset d = TestSpectra.channels(TestSpectra.row(1, 2), TestSpectra.row(1, 2));
        assertThatThrownBy(() -> Cropper.cropRagged(d, new double[]{0}, new double[]{2, 2}))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsInvertedWindow() {
        assertThatThrownBy(() -> Cropper.crop(TestSpectra.counts(1, TEN_BINS), 5.0, 2.0))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("empty or inverted");
    }

    @Test
    void rejectsWindowWithNoCompleteBin() {
        assertThatThrownBy(() -> Cropper.crop(TestSpectra.counts(1, TEN_BINS), 2.2, 2.8))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("leaves no data");
    }
}
