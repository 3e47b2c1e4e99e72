package io.musrtools.reduction.stage;

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
import io.musrtools.reduction.asymmetry.PairAsymmetryCalculator;
import io.musrtools.reduction.combine.GroupReducer;
import io.musrtools.reduction.combine.PeriodCombiner;
import io.musrtools.reduction.histogram.HistogramArithmetic;
import io.musrtools.reduction.histogram.RebinParams;
import io.musrtools.reduction.histogram.Rebinner;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.GroupSpec;
import io.musrtools.reduction.model.PairSpec;
import io.musrtools.reduction.model.PeriodSelection;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.RunData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Produces the asymmetry between a forward and a backward group.
 *
 * <h2>Entry Modes</h2>
 *
 * <ul>
 *   <li><b>Manual</b> - both groups are reduced here from one corrected period set.</li>
 *   <li><b>Pre-reduced</b> - two single-spectrum inputs are taken as they are; they
 *       must have the same number of periods.</li>
 * </ul>
 *
 * <h2>Period Sequencing</h2>
 *
 * <p>Forward and backward are placed side by side in every period. The summed
 * periods are combined and turned into asymmetry; when periods are subtracted,
 * the same is done for them and the two asymmetries are subtracted:
 *
 * <pre>{@code
 * A = asym(Σ summed) - asym(Σ subtracted)
 * }</pre>
 *
 * <p>Subtraction happens after the asymmetry transform, not on the counts.
 *
 * @see PairAsymmetryCalculator
 */
public final class PairingStage {

    private static final Logger logger = LogManager.getLogger(PairingStage.class);

    public static final String TAG_PAIR = "pair";
    public static final String TAG_FORWARD = "forward";
    public static final String TAG_BACKWARD = "backward";
    public static final String TAG_ALPHA = "alpha";
    public static final String TAG_PERIODS = "periods";

    private final GroupReducer reducer;
    private final PeriodCombiner combiner;
    private final PairAsymmetryCalculator calculator;

    public PairingStage() {
        this(new GroupReducer(), new PeriodCombiner(), new PairAsymmetryCalculator());
    }

    public PairingStage(GroupReducer reducer, PeriodCombiner combiner, PairAsymmetryCalculator calculator) {
        this.reducer = Objects.requireNonNull(reducer, "reducer cannot be null");
        this.combiner = Objects.requireNonNull(combiner, "combiner cannot be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator cannot be null");
    }

    /**
     * Manual mode: reduces both groups from the same period set.
     *
     * @throws ValidationException if the groups are identical or alpha is not positive
     */
    public PairingResult pairAndAnalyze(PeriodSet periods, PairSpec pair, GroupSpec forward, GroupSpec backward,
                                        AnalysisOptions options) {
        Objects.requireNonNull(periods, "periods cannot be null");
        Objects.requireNonNull(pair, "pair cannot be null");
        Objects.requireNonNull(forward, "forward cannot be null");
        Objects.requireNonNull(backward, "backward cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        if (forward.name().equals(backward.name())
            || new HashSet<>(forward.channels()).equals(new HashSet<>(backward.channels()))) {
            throw new ValidationException("Pair '" + pair.name() + "' needs two different groups, got '"
                + forward.name() + "' and '" + backward.name() + "'");
        }
        PairSpec.requirePositiveAlpha(pair.alpha());
        options.periods().requireValidFor(periods);

        PeriodSet forwardSet = reducer.reduceGroup(periods, forward.channels());
        PeriodSet backwardSet = reducer.reduceGroup(periods, backward.channels());
        return analyze(forwardSet, backwardSet, pair, options);
    }

    /**
     * Pre-reduced mode: takes two single-spectrum inputs directly.
     *
     * @throws ValidationException if the inputs are the same group, do not hold exactly one
     *         spectrum per period, or differ in period count
     */
    public PairingResult pairAndAnalyze(RunData forward, RunData backward, PairSpec pair, AnalysisOptions options) {
        Objects.requireNonNull(forward, "forward cannot be null");
        Objects.requireNonNull(backward, "backward cannot be null");
        Objects.requireNonNull(pair, "pair cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        PeriodSet forwardSet = forward.normalize();
        PeriodSet backwardSet = backward.normalize();
        if (forwardSet.size() != backwardSet.size()) {
            throw new ValidationException("Pair '" + pair.name() + "' inputs have " + forwardSet.size() + " and "
                + backwardSet.size() + " periods");
        }
        requireSingleSpectrum(forwardSet, "forward");
        requireSingleSpectrum(backwardSet, "backward");
        if (forwardSet.first().spectrum(0).channels().equals(backwardSet.first().spectrum(0).channels())) {
            throw new ValidationException("Pair '" + pair.name() + "' needs two different groups, both own channels "
                + forwardSet.first().spectrum(0).channels());
        }
        PairSpec.requirePositiveAlpha(pair.alpha());
        options.periods().requireValidFor(forwardSet);
        return analyze(forwardSet, backwardSet, pair, options);
    }

    private PairingResult analyze(PeriodSet forward, PeriodSet backward, PairSpec pair, AnalysisOptions options) {
        List<ChannelDataset> sideBySide = new ArrayList<>(forward.size());
        for (int i = 0; i < forward.size(); i++) {
            ChannelDataset f = forward.periods().get(i);
            ChannelDataset b = backward.periods().get(i);
            sideBySide.add(f.withSpectra(List.of(f.spectrum(0), b.spectrum(0))));
        }
        PeriodSet pairs = new PeriodSet(sideBySide);
        PeriodSelection selection = options.periods();

        ChannelDataset raw = asymmetry(pairs, selection, pair.alpha(), RebinParams.NONE);
        ChannelDataset binned = asymmetry(pairs, selection, pair.alpha(), options.rebin());
        logger.debug("Pair {} asymmetry over periods {} with alpha {}", pair.name(), selection, pair.alpha());
        return new PairingResult(tag(binned, pair, selection), tag(raw, pair, selection));
    }

    private ChannelDataset asymmetry(PeriodSet pairs, PeriodSelection selection, double alpha, RebinParams rebin) {
        ChannelDataset result = null;
        if (!selection.summed().isEmpty()) {
            result = asymmetryOfSum(pairs, selection.summed(), alpha, rebin);
        }
        if (selection.hasSubtracted()) {
            ChannelDataset subtracted = asymmetryOfSum(pairs, selection.subtracted(), alpha, rebin);
            result = result == null
                ? HistogramArithmetic.negate(subtracted)
                : HistogramArithmetic.subtract(result, subtracted);
        }
        return result;
    }

    private ChannelDataset asymmetryOfSum(PeriodSet pairs, List<Integer> periods, double alpha, RebinParams rebin) {
        ChannelDataset combined = combiner.combine(pairs, periods, List.of());
        return calculator.calculate(Rebinner.rebin(combined, rebin, true), alpha);
    }

    private static ChannelDataset tag(ChannelDataset dataset, PairSpec pair, PeriodSelection selection) {
        return dataset
            .withTag(TAG_PAIR, pair.name())
            .withTag(TAG_FORWARD, pair.forward())
            .withTag(TAG_BACKWARD, pair.backward())
            .withTag(TAG_ALPHA, Double.toString(pair.alpha()))
            .withTag(TAG_PERIODS, selection.format());
    }

    private static void requireSingleSpectrum(PeriodSet periods, String side) {
        for (ChannelDataset period : periods) {
            if (period.spectrumCount() != 1) {
                throw new ValidationException("The " + side + " input must hold exactly one spectrum per period, got "
                    + period.spectrumCount());
            }
        }
    }
}
