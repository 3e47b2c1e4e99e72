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
 * Redistributes histogram counts onto new bin edges.
 *
 * <h2>Redistribution</h2>
 *
 * <p>Each old bin contributes to every new bin it overlaps, in proportion to
 * the overlapping fraction {@code f} of its own width:
 *
 * <pre>{@code
 * Y_new += Y_old * f
 * E_new² += E_old² * f
 * }</pre>
 *
 * <p>New bins entirely outside the old range receive zero. With
 * {@code keepPartialBins} the last bin is kept even when narrower than its step,
 * so the integrated counts over the full range are preserved.
 *
 * @see RebinParams
 */
public final class Rebinner {

    private Rebinner() {
    }

    /**
     * Rebins every spectrum of a histogram dataset. Step-only parameters use
     * each spectrum's own X range.
     *
     * @throws IncompatibleShapeException if the dataset holds point data
     */
    public static ChannelDataset rebin(ChannelDataset dataset, RebinParams params, boolean keepPartialBins) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        if (params.isEmpty()) {
            return dataset;
        }
        if (!dataset.isHistogram()) {
            throw new IncompatibleShapeException("Rebinning needs histogram data (bin edges), got point data");
        }
        List<Spectrum> out = new ArrayList<>(dataset.spectrumCount());
        for (Spectrum s : dataset.spectra()) {
            double[] edges = params.edges(s.firstX(), s.lastX(), keepPartialBins);
            out.add(rebin(s, edges));
        }
        return dataset.withSpectra(out);
    }

    /**
     * Rebins one histogram spectrum onto explicit edges.
     */
    public static Spectrum rebin(Spectrum spectrum, double[] newEdges) {
        if (!spectrum.isHistogram()) {
            throw new IncompatibleShapeException("Rebinning needs histogram data (bin edges), got point data");
        }
        double[] oldX = spectrum.x();
        double[] oldY = spectrum.y();
        double[] oldE = spectrum.e();
        int bins = newEdges.length - 1;
        double[] y = new double[bins];
        double[] e2 = new double[bins];

        int j = 0;
        for (int k = 0; k < bins; k++) {
            double lo = newEdges[k];
            double hi = newEdges[k + 1];
            while (j < oldY.length && oldX[j + 1] <= lo) {
                j++;
            }
            int m = j;
            while (m < oldY.length && oldX[m] < hi) {
                double overlap = Math.min(hi, oldX[m + 1]) - Math.max(lo, oldX[m]);
                if (overlap > 0) {
                    double fraction = overlap / (oldX[m + 1] - oldX[m]);
                    y[k] += oldY[m] * fraction;
                    e2[k] += oldE[m] * oldE[m] * fraction;
                }
                m++;
            }
        }
        double[] e = new double[bins];
        for (int k = 0; k < bins; k++) {
            e[k] = Math.sqrt(e2[k]);
        }
        return new Spectrum(newEdges, y, e, spectrum.channels());
    }
}
