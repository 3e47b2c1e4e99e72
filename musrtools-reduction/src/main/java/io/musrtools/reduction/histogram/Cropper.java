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

import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.Spectrum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Restricts spectra to an X window.
 *
 * <h2>Window Semantics</h2>
 *
 * <ul>
 *   <li>histogram data keeps the bins whose lower and upper edges both lie inside the window</li>
 *   <li>point data keeps the points inside the window</li>
 *   <li>bounds are compared with a tolerance of 1e-9 of the mean bin width,
 *       so a bound written to fewer digits than the axis still lands on its edge</li>
 * </ul>
 *
 * <p>{@link #crop} applies one window to every spectrum. {@link #cropRagged}
 * takes a window per spectrum, so the output spectra may have distinct X ranges.
 */
public final class Cropper {

    private static final double RELATIVE_TOLERANCE = 1e-9;

    private Cropper() {
    }

    /**
     * Crops every spectrum to the same window.
     *
     * @param xMin lower bound, or null for the smallest X in the dataset
     * @param xMax upper bound, or null for the largest X in the dataset
     * @throws ValidationException if the window is inverted or leaves a spectrum empty
     */
    public static ChannelDataset crop(ChannelDataset dataset, Double xMin, Double xMax) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        double lo = xMin != null ? xMin : dataset.minX();
        double hi = xMax != null ? xMax : dataset.maxX();
        double[] mins = new double[dataset.spectrumCount()];
        double[] maxs = new double[dataset.spectrumCount()];
        Arrays.fill(mins, lo);
        Arrays.fill(maxs, hi);
        return cropRagged(dataset, mins, maxs);
    }

    /**
     * Crops each spectrum to its own window.
     *
     * @param xMins one lower bound per spectrum
     * @param xMaxs one upper bound per spectrum
     * @throws ValidationException if the bound arrays do not match the spectrum count,
     *         a window is inverted, or a window leaves a spectrum empty
     */
    public static ChannelDataset cropRagged(ChannelDataset dataset, double[] xMins, double[] xMaxs) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(xMins, "xMins cannot be null");
        Objects.requireNonNull(xMaxs, "xMaxs cannot be null");
        if (xMins.length != dataset.spectrumCount() || xMaxs.length != dataset.spectrumCount()) {
            throw new ValidationException("Ragged crop needs " + dataset.spectrumCount()
                + " bounds per side, got " + xMins.length + " and " + xMaxs.length);
        }
        List<Spectrum> out = new ArrayList<>(dataset.spectrumCount());
        for (int i = 0; i < dataset.spectrumCount(); i++) {
            out.add(crop(dataset.spectrum(i), xMins[i], xMaxs[i]));
        }
        return dataset.withSpectra(out);
    }

    /**
     * Crops one spectrum to {@code [lo, hi]}.
     */
    public static Spectrum crop(Spectrum spectrum, double lo, double hi) {
        if (!(lo < hi)) {
            throw new ValidationException("Crop window [" + lo + ", " + hi + "] is empty or inverted");
        }
        double[] x = spectrum.x();
        double tolerance = RELATIVE_TOLERANCE * (spectrum.lastX() - spectrum.firstX()) / Math.max(1, x.length - 1);

        int first = 0;
        while (first < x.length && x[first] < lo - tolerance) {
            first++;
        }
        int last = x.length - 1;
        while (last >= 0 && x[last] > hi + tolerance) {
            last--;
        }

        int valueStart = first;
        int valueEnd;
        int xEnd;
        if (spectrum.isHistogram()) {
            valueEnd = last;
            xEnd = last + 1;
        } else {
            valueEnd = last + 1;
            xEnd = last + 1;
        }
        if (valueEnd - valueStart < 1) {
            throw new ValidationException("Crop window [" + lo + ", " + hi + "] leaves no data in " + spectrum);
        }
        return new Spectrum(
            Arrays.copyOfRange(x, first, xEnd),
            Arrays.copyOfRange(spectrum.y(), valueStart, valueEnd),
            Arrays.copyOfRange(spectrum.e(), valueStart, valueEnd),
            spectrum.channels());
    }
}
