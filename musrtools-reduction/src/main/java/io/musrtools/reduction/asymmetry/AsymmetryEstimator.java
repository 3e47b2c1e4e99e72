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

import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.RunMetadata;
import io.musrtools.reduction.model.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts muon counts into asymmetry by removing the exponential decay and
 * normalizing.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 * 1. n(t) = Y(t)·exp(t/τμ) / F          σn(t) = E(t)·exp(t/τμ) / F
 * 2. N0   = ΣY / (F · Σexp(-t/τμ))      over bins with centre in [startX, endX]
 *          (or the fixed normalization when it is non-zero)
 * 3. A(t) = n(t)/N0 - 1                 σA(t) = σn(t)/N0
 * }</pre>
 *
 * <p>{@code t} is the bin centre, {@code F} the good-frame count from the run
 * metadata. A missing or zero frame count is replaced by 1 with a warning.
 */
public final class AsymmetryEstimator {

    private static final Logger logger = LogManager.getLogger(AsymmetryEstimator.class);

    /** Muon lifetime in microseconds. */
    public static final double MUON_LIFETIME = 2.1969811;

    /** Passing this as the fixed normalization requests an estimate. */
    public static final double ESTIMATE_NORMALIZATION = 0.0;

    /**
     * Converts every spectrum of a counts dataset.
     *
     * @param startX start of the normalization window
     * @param endX end of the normalization window
     * @param fixedNorm normalization constant to use, or 0 to estimate it
     * @throws ValidationException if the window is inverted or degenerate, if it
     *         contains no bins, or if the estimated constant is zero
     */
    public AsymmetryEstimate estimate(ChannelDataset counts, double startX, double endX, double fixedNorm) {
        Objects.requireNonNull(counts, "counts cannot be null");
        validateWindow(startX, endX);
        if (!Double.isFinite(fixedNorm) || fixedNorm < 0) {
            throw new ValidationException("Fixed normalization must be a finite non-negative number, got " + fixedNorm);
        }
        double frames = goodFrames(counts.metadata());

        List<Spectrum> asymmetry = new ArrayList<>(counts.spectrumCount());
        List<Spectrum> unnormalized = new ArrayList<>(counts.spectrumCount());
        List<Double> norms = new ArrayList<>(counts.spectrumCount());
        for (Spectrum s : counts.spectra()) {
            Spectrum decayRemoved = removeDecay(s, frames);
            double norm = fixedNorm != ESTIMATE_NORMALIZATION ? fixedNorm : estimateNormalization(s, frames, startX, endX);
            unnormalized.add(decayRemoved);
            asymmetry.add(normalize(decayRemoved, norm));
            norms.add(norm);
        }
        logger.debug("Asymmetry of {} spectra over [{}, {}] with normalization {}", counts.spectrumCount(), startX, endX, norms);
        return new AsymmetryEstimate(
            counts.withSpectra(asymmetry).withYUnit(ChannelDataset.UNIT_ASYMMETRY),
            counts.withSpectra(unnormalized),
            norms);
    }

    /**
     * @throws ValidationException unless {@code startX < endX}, both finite
     */
    public static void validateWindow(double startX, double endX) {
        if (!Double.isFinite(startX) || !Double.isFinite(endX) || !(startX < endX)) {
            throw new ValidationException("Time window [" + startX + ", " + endX + "] must satisfy start < end");
        }
    }

    /**
     * @throws ValidationException if no bin centre of the spectrum lies in {@code [startX, endX]}
     */
    public static void requireBinsInWindow(Spectrum s, double startX, double endX) {
        for (int k = 0; k < s.size(); k++) {
            double t = s.binCentre(k);
            if (t >= startX && t <= endX) {
                return;
            }
        }
        throw new ValidationException("No bins of channels " + s.channels() + " lie in the window ["
            + startX + ", " + endX + "]");
    }

    /// Step 1: decay removal and frame normalization.
    static Spectrum removeDecay(Spectrum s, double frames) {
        double[] y = s.y();
        double[] e = s.e();
        for (int k = 0; k < y.length; k++) {
            double growth = Math.exp(s.binCentre(k) / MUON_LIFETIME) / frames;
            y[k] *= growth;
            e[k] *= growth;
        }
        return s.withValues(y, e);
    }

    /// Step 2: `N0 = ΣY / (F·Σexp(-t/τ))` over the window.
    static double estimateNormalization(Spectrum s, double frames, double startX, double endX) {
        requireBinsInWindow(s, startX, endX);
        double counts = 0.0;
        double decay = 0.0;
        for (int k = 0; k < s.size(); k++) {
            double t = s.binCentre(k);
            if (t >= startX && t <= endX) {
                counts += s.y(k);
                decay += Math.exp(-t / MUON_LIFETIME);
            }
        }
        double norm = counts / (frames * decay);
        if (norm == 0.0 || !Double.isFinite(norm)) {
            throw new ValidationException("Normalization of channels " + s.channels() + " over ["
                + startX + ", " + endX + "] is " + norm);
        }
        return norm;
    }

    /// Step 3: `A = n/N0 - 1`.
    private static Spectrum normalize(Spectrum decayRemoved, double norm) {
        double[] y = decayRemoved.y();
        double[] e = decayRemoved.e();
        for (int k = 0; k < y.length; k++) {
            y[k] = y[k] / norm - 1.0;
            e[k] = e[k] / norm;
        }
        return decayRemoved.withValues(y, e);
    }

    private static double goodFrames(RunMetadata metadata) {
        Double frames = metadata.goodFrames();
        if (frames == null || frames == 0.0) {
            logger.warn("Run {}{} has no good-frame count; counts are normalized by 1 frame",
                metadata.instrument(), metadata.runNumber());
            return 1.0;
        }
        return frames;
    }
}
