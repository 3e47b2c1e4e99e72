package io.musrtools.reduction.correct;

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
import io.musrtools.reduction.histogram.Cropper;
import io.musrtools.reduction.histogram.Rebinner;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.RunMetadata;
import io.musrtools.reduction.model.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies dead-time, time-zero, crop and rebin corrections to one dataset.
 *
 * <h2>Order of Application</h2>
 *
 * <pre>{@code
 *   1. dead time     Y' = Y / (1 - Y·τ / (Δt·F)),  E' = E / (same)
 *   2. time zero     per-spectrum table shift, or one scalar shift (x' = x + value)
 *   3. crop          ragged per spectrum when a time-zero table was given, scalar otherwise
 *   4. rebin         keeping the trailing partial bin
 * }</pre>
 *
 * <p>{@code F} is the run's good-frame count. The output is always a new dataset,
 * also when nothing is configured.
 *
 * <h2>Validation</h2>
 *
 * <p>Table sizes and dead-time channel references are checked before any
 * arithmetic, so a rejected configuration leaves no partial result.
 */
public final class CorrectionEngine {

    private static final Logger logger = LogManager.getLogger(CorrectionEngine.class);

    /**
     * Corrects one dataset.
     *
     * @return a new dataset, never the input instance
     * @throws ValidationException if a correction table has more rows than the
     *         dataset has spectra, or names a channel the dataset does not have
     */
    public ChannelDataset correct(ChannelDataset dataset, CorrectionConfig config) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        validate(dataset, config);

        ChannelDataset out = dataset.copy();
        if (config.isEmpty()) {
            return out;
        }
        if (config.deadTimes().isPresent()) {
            out = applyDeadTime(out, config.deadTimes().get());
        }
        if (config.timeZeros().isPresent()) {
            out = shiftEach(out, config.timeZeros().get());
        } else if (config.timeOffset().isPresent()) {
            out = shiftAll(out, config.timeOffset().get());
        }
        if (config.hasCrop()) {
            out = crop(out, config);
        }
        if (!config.rebin().isEmpty()) {
            out = Rebinner.rebin(out, config.rebin(), true);
        }
        return out;
    }

    private void validate(ChannelDataset dataset, CorrectionConfig config) {
        int spectra = dataset.spectrumCount();
        config.deadTimes().ifPresent(table -> {
            if (table.rowCount() > spectra) {
                throw new ValidationException("Dead-time table has " + table.rowCount()
                    + " rows but the data has only " + spectra + " spectra");
            }
            for (Integer channel : table.rows().keySet()) {
                if (dataset.indexOfChannel(channel) < 0) {
                    throw new ValidationException("Dead-time table names channel " + channel
                        + " which is not in the data");
                }
            }
        });
        config.timeZeros().ifPresent(zeros -> {
            if (zeros.length > spectra) {
                throw new ValidationException("Time-zero table has " + zeros.length
                    + " rows but the data has only " + spectra + " spectra");
            }
        });
    }

    /**
     * Applies the non-paralysable dead-time correction using the table row of
     * the first channel each spectrum owns.
     */
    ChannelDataset applyDeadTime(ChannelDataset dataset, DeadTimeTable table) {
        double frames = goodFrames(dataset.metadata());
        List<Spectrum> out = new ArrayList<>(dataset.spectrumCount());
        for (Spectrum s : dataset.spectra()) {
            Double tau = null;
            for (Integer channel : s.channels()) {
                if (table.deadTime(channel).isPresent()) {
                    tau = table.deadTime(channel).getAsDouble();
                    break;
                }
            }
            if (tau == null || tau == 0.0) {
                out.add(s);
                continue;
            }
            double[] y = s.y();
            double[] e = s.e();
            for (int k = 0; k < y.length; k++) {
                double denominator = 1.0 - y[k] * tau / (s.binWidth(k) * frames);
                if (!(denominator > 0)) {
                    throw new ValidationException("Dead-time correction of channels " + s.channels()
                        + " gives a non-positive denominator at bin " + k + " (dead time " + tau + ")");
                }
                y[k] = y[k] / denominator;
                e[k] = e[k] / denominator;
            }
            out.add(s.withValues(y, e));
        }
        return dataset.withSpectra(out);
    }

    private static double goodFrames(RunMetadata metadata) {
        Double frames = metadata.goodFrames();
        if (frames == null || frames == 0.0) {
            logger.warn("Run {}{} has no good-frame count; dead-time correction assumes 1 frame",
                metadata.instrument(), metadata.runNumber());
            return 1.0;
        }
        return frames;
    }

    private static ChannelDataset shiftEach(ChannelDataset dataset, double[] offsets) {
        List<Spectrum> out = new ArrayList<>(dataset.spectrumCount());
        for (int i = 0; i < dataset.spectrumCount(); i++) {
            Spectrum s = dataset.spectrum(i);
            out.add(i < offsets.length ? shift(s, offsets[i]) : s);
        }
        return dataset.withSpectra(out);
    }

    private static ChannelDataset shiftAll(ChannelDataset dataset, double offset) {
        List<Spectrum> out = new ArrayList<>(dataset.spectrumCount());
        for (Spectrum s : dataset.spectra()) {
            out.add(shift(s, offset));
        }
        return dataset.withSpectra(out);
    }

    private static Spectrum shift(Spectrum s, double offset) {
        if (offset == 0.0) {
            return s;
        }
        double[] x = s.x();
        for (int i = 0; i < x.length; i++) {
            x[i] += offset;
        }
        return s.withX(x);
    }

    private static ChannelDataset crop(ChannelDataset dataset, CorrectionConfig config) {
        Double xMin = config.xMin().orElse(null);
        Double xMax = config.xMax().orElse(null);
        if (config.timeZeros().isEmpty()) {
            return Cropper.crop(dataset, xMin, xMax);
        }
        int n = dataset.spectrumCount();
        double[] mins = new double[n];
        double[] maxs = new double[n];
        for (int i = 0; i < n; i++) {
            Spectrum s = dataset.spectrum(i);
            mins[i] = xMin != null ? xMin : s.firstX();
            maxs[i] = xMax != null ? xMax : s.lastX();
        }
        logger.debug("Ragged crop of {} spectra to per-spectrum windows", n);
        return Cropper.cropRagged(dataset, mins, maxs);
    }
}
