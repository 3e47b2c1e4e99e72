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
import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.PairSpec;
import io.musrtools.reduction.model.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Forward/backward asymmetry of a two-spectrum dataset.
 *
 * <pre>{@code
 * A  = (F - αB) / (F + αB)
 * σA = 2α · sqrt(B²σF² + F²σB²) / (F + αB)²
 * }</pre>
 *
 * <p>Spectrum 0 is forward, spectrum 1 backward. A bin where {@code F + αB}
 * is zero gets {@code A = 0, σA = 1}.
 */
public final class PairAsymmetryCalculator {

    private static final Logger logger = LogManager.getLogger(PairAsymmetryCalculator.class);

    /**
     * @return a one-spectrum dataset in asymmetry units, on the forward X axis
     * @throws ValidationException if the dataset does not hold exactly two spectra or alpha is not positive
     * @throws IncompatibleShapeException if the two spectra differ in length
     */
    public ChannelDataset calculate(ChannelDataset forwardBackward, double alpha) {
        Objects.requireNonNull(forwardBackward, "forwardBackward cannot be null");
        PairSpec.requirePositiveAlpha(alpha);
        if (forwardBackward.spectrumCount() != 2) {
            throw new ValidationException("Pair asymmetry needs exactly two spectra, got " + forwardBackward.spectrumCount());
        }
        Spectrum forward = forwardBackward.spectrum(0);
        Spectrum backward = forwardBackward.spectrum(1);
        if (forward.size() != backward.size()) {
            throw new IncompatibleShapeException("Forward and backward spectra have " + forward.size()
                + " and " + backward.size() + " bins");
        }

        int n = forward.size();
        double[] y = new double[n];
        double[] e = new double[n];
        int zeroBins = 0;
        for (int k = 0; k < n; k++) {
            double f = forward.y(k);
            double b = backward.y(k);
            double denominator = f + alpha * b;
            if (denominator == 0.0) {
                y[k] = 0.0;
                e[k] = 1.0;
                zeroBins++;
                continue;
            }
            double sf = forward.e(k);
            double sb = backward.e(k);
            y[k] = (f - alpha * b) / denominator;
            e[k] = 2.0 * alpha * Math.sqrt(b * b * sf * sf + f * f * sb * sb) / (denominator * denominator);
        }
        if (zeroBins > 0) {
            logger.warn("{} bins have no forward or backward counts; their asymmetry is set to 0 with error 1", zeroBins);
        }

        TreeSet<Integer> owners = new TreeSet<>(forward.channels());
        owners.addAll(backward.channels());
        Spectrum pair = new Spectrum(forward.x(), y, e, owners);
        return forwardBackward.withSpectra(List.of(pair)).withYUnit(ChannelDataset.UNIT_ASYMMETRY);
    }
}
