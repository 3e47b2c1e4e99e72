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
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.Spectrum;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Elementwise addition and subtraction of spectra and datasets.
 *
 * <h2>Error Propagation</h2>
 *
 * <pre>{@code
 * Y_out = Y1 ± Y2
 * E_out = sqrt(E1² + E2²)
 * }</pre>
 *
 * <p>Operands must have exactly identical X axes. The left operand's channel
 * ownership, metadata, unit and tags are carried into the result.
 */
public final class HistogramArithmetic {

    private HistogramArithmetic() {
    }

    public static Spectrum add(Spectrum left, Spectrum right) {
        return combine(left, right, 1.0);
    }

    public static Spectrum subtract(Spectrum left, Spectrum right) {
        return combine(left, right, -1.0);
    }

    public static ChannelDataset add(ChannelDataset left, ChannelDataset right) {
        return combine(left, right, 1.0);
    }

    public static ChannelDataset subtract(ChannelDataset left, ChannelDataset right) {
        return combine(left, right, -1.0);
    }

    /**
     * Negates the values of every spectrum; errors are unchanged.
     */
    public static ChannelDataset negate(ChannelDataset dataset) {
        List<Spectrum> out = new ArrayList<>(dataset.spectrumCount());
        for (Spectrum s : dataset.spectra()) {
            double[] y = s.y();
            for (int i = 0; i < y.length; i++) {
                y[i] = -y[i];
            }
            out.add(s.withValues(y, s.e()));
        }
        return dataset.withSpectra(out);
    }

    private static ChannelDataset combine(ChannelDataset left, ChannelDataset right, double sign) {
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
        if (left.spectrumCount() != right.spectrumCount()) {
            throw new IncompatibleShapeException("Cannot combine datasets with " + left.spectrumCount()
                + " and " + right.spectrumCount() + " spectra");
        }
        List<Spectrum> out = new ArrayList<>(left.spectrumCount());
        for (int i = 0; i < left.spectrumCount(); i++) {
            out.add(combine(left.spectrum(i), right.spectrum(i), sign));
        }
        return left.withSpectra(out);
    }

    private static Spectrum combine(Spectrum left, Spectrum right, double sign) {
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
        if (!left.sameX(right)) {
            throw new IncompatibleShapeException("X axes differ: " + left + " vs " + right);
        }
        int n = left.size();
        double[] y = new double[n];
        double[] e = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = left.y(i) + sign * right.y(i);
            double e1 = left.e(i);
            double e2 = right.e(i);
            e[i] = Math.sqrt(e1 * e1 + e2 * e2);
        }
        return left.withValues(y, e);
    }
}
