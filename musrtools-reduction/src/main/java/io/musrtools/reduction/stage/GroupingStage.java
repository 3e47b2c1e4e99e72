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

import io.musrtools.reduction.asymmetry.AsymmetryEstimate;
import io.musrtools.reduction.asymmetry.AsymmetryEstimator;
import io.musrtools.reduction.combine.GroupReducer;
import io.musrtools.reduction.combine.PeriodCombiner;
import io.musrtools.reduction.histogram.Rebinner;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.ChannelIdList;
import io.musrtools.reduction.model.GroupSpec;
import io.musrtools.reduction.model.PeriodSelection;
import io.musrtools.reduction.model.PeriodSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Produces one named group's counts or asymmetry from a corrected period set.
 *
 * <h2>Steps</h2>
 *
 * <ol>
 *   <li>Reduce the group's channels to one spectrum in every period.</li>
 *   <li>Combine the summed and subtracted periods.</li>
 *   <li>Counts: the combined spectrum is the raw output and, rebinned, the
 *       primary output.</li>
 *   <li>Asymmetry: the raw and the rebinned combined spectra each go through
 *       the {@link AsymmetryEstimator}; the decay-corrected intermediates are
 *       returned as the unnormalized outputs.</li>
 * </ol>
 *
 * <p>Outputs are tagged with the group name, its channels, the periods used
 * and, for asymmetry, the normalization constant.
 */
public final class GroupingStage {

    private static final Logger logger = LogManager.getLogger(GroupingStage.class);

    public static final String TAG_GROUP = "group";
    public static final String TAG_CHANNELS = "channels";
    public static final String TAG_SUMMED = "summed_periods";
    public static final String TAG_SUBTRACTED = "subtracted_periods";
    public static final String TAG_NORMALIZATION = "normalization";

    private final GroupReducer reducer;
    private final PeriodCombiner combiner;
    private final AsymmetryEstimator estimator;

    public GroupingStage() {
        this(new GroupReducer(), new PeriodCombiner(), new AsymmetryEstimator());
    }

    public GroupingStage(GroupReducer reducer, PeriodCombiner combiner, AsymmetryEstimator estimator) {
        this.reducer = Objects.requireNonNull(reducer, "reducer cannot be null");
        this.combiner = Objects.requireNonNull(combiner, "combiner cannot be null");
        this.estimator = Objects.requireNonNull(estimator, "estimator cannot be null");
    }

    /**
     * @throws io.musrtools.reduction.ValidationException on missing channels or an invalid window
     * @throws io.musrtools.reduction.PeriodIndexException if a period is outside the set
     */
    public GroupingResult groupAndAnalyze(PeriodSet periods, GroupSpec group, AnalysisOptions options) {
        Objects.requireNonNull(periods, "periods cannot be null");
        Objects.requireNonNull(group, "group cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        PeriodSelection selection = options.periods();
        selection.requireValidFor(periods);
        if (options.kind() == AnalysisKind.ASYMMETRY && options.timeMin().isPresent() && options.timeMax().isPresent()) {
            AsymmetryEstimator.validateWindow(options.timeMin().get(), options.timeMax().get());
        }

        PeriodSet reduced = reducer.reduceGroup(periods, group.channels());
        ChannelDataset combined = combiner.combine(reduced, selection.summed(), selection.subtracted())
            .withTag(TAG_GROUP, group.name())
            .withTag(TAG_CHANNELS, ChannelIdList.format(group.channels()))
            .withTag(TAG_SUMMED, join(selection.summed()))
            .withTag(TAG_SUBTRACTED, join(selection.subtracted()));
        ChannelDataset rebinned = Rebinner.rebin(combined, options.rebin(), true);

        if (options.kind() == AnalysisKind.COUNTS) {
            logger.debug("Group {} counts over periods {}", group.name(), selection);
            return GroupingResult.counts(rebinned, combined);
        }

        double start = options.timeMin().orElse(combined.minX());
        double end = options.timeMax().orElse(combined.maxX());
        AsymmetryEstimate raw = estimator.estimate(combined, start, end, options.fixedNormalization());
        AsymmetryEstimate binned = estimator.estimate(rebinned, start, end, options.fixedNormalization());
        logger.debug("Group {} asymmetry over periods {} with normalization {}", group.name(), selection,
            binned.normalization());
        return new GroupingResult(
            binned.asymmetry().withTag(TAG_NORMALIZATION, Double.toString(binned.normalization())),
            raw.asymmetry().withTag(TAG_NORMALIZATION, Double.toString(raw.normalization())),
            binned.unnormalized(),
            raw.unnormalized());
    }

    private static String join(List<Integer> periods) {
        StringBuilder sb = new StringBuilder();
        for (Integer period : periods) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(period);
        }
        return sb.toString();
    }
}
