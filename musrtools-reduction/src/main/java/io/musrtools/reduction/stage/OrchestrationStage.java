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
import io.musrtools.reduction.asymmetry.AsymmetryEstimator;
import io.musrtools.reduction.combine.GroupReducer;
import io.musrtools.reduction.histogram.Rebinner;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.GroupSpec;
import io.musrtools.reduction.model.GroupingSpec;
import io.musrtools.reduction.model.PairSpec;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.RunData;
import io.musrtools.reduction.model.RunMetadata;
import io.musrtools.reduction.model.Spectrum;
import io.musrtools.reduction.naming.DatasetName;
import io.musrtools.reduction.naming.NameVariant;
import io.musrtools.reduction.naming.PlotType;
import io.musrtools.reduction.naming.RunLabel;
import io.musrtools.reduction.registry.DatasetRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Drives the whole reduction for one run and publishes every output.
 *
 * <h2>States</h2>
 *
 * <pre>{@code
 * CREATED -> VALIDATED -> GROUPS_APPLIED -> PAIRS_APPLIED -> [GROUP_ASYMMETRY_APPLIED] -> PUBLISHED
 *                  \-> FAILED
 * }</pre>
 *
 * <p>A run that fails validation stays in {@code CREATED} and publishes nothing.
 * A run that fails after {@code VALIDATED} ends in {@code FAILED}.
 *
 * <h2>Validation</h2>
 *
 * <p>Before any correction runs, every channel referenced by a group must be
 * present in the data, each group's channels must resolve to distinct spectra,
 * every pair must join two different groups, and every requested period must
 * exist. After correction and before anything is published, the group asymmetry
 * window must hold at least one bin of every group, raw and rebinned. Names and
 * pair references are checked when the {@link GroupingSpec} is built.
 *
 * <h2>Publication</h2>
 *
 * <p>Each group or pair is computed completely before any of its names is
 * written, always with overwrite on. When an item fails, items published
 * before it stay published, the failing item publishes nothing and the
 * exception propagates.
 *
 * <h2>Names</h2>
 *
 * <pre>{@code
 * counts:          <label>; Group; <name>; Counts; [periods; ]#v   and  ..._Raw
 * group asymmetry: <label>; Group; <name>; Asym; [periods; ]#v     plus _Raw, _unNorm, _unNorm_Raw
 * pair asymmetry:  <label>; Pair; <name>; Asym; [periods; ]#v      and  ..._Raw
 * }</pre>
 */
public final class OrchestrationStage {

    private static final Logger logger = LogManager.getLogger(OrchestrationStage.class);

    private final DatasetRegistry registry;
    private final PreProcessStage preProcess;
    private final GroupingStage grouping;
    private final PairingStage pairing;

    private OrchestrationState state = OrchestrationState.CREATED;

    public OrchestrationStage(DatasetRegistry registry) {
        this(registry, new PreProcessStage(), new GroupingStage(), new PairingStage());
    }

    public OrchestrationStage(DatasetRegistry registry, PreProcessStage preProcess, GroupingStage grouping,
                              PairingStage pairing) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.preProcess = Objects.requireNonNull(preProcess, "preProcess cannot be null");
        this.grouping = Objects.requireNonNull(grouping, "grouping cannot be null");
        this.pairing = Objects.requireNonNull(pairing, "pairing cannot be null");
    }

    /** @return the state the most recent run reached */
    public OrchestrationState state() {
        return state;
    }

    public OrchestrationReport run(OrchestrationRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        state = OrchestrationState.CREATED;

        RunData input = request.input().orElseGet(() -> registry.get(request.inputName().orElseThrow()));
        PeriodSet raw = input.normalize();
        GroupingSpec spec = request.grouping();
        AnalysisOptions options = request.options();
        validate(raw, spec, options);
        PeriodSet corrected = preProcess.process(raw, request.corrections());
        if (request.groupAsymmetry()) {
            validateAsymmetryWindows(corrected, spec, options);
        }
        state = OrchestrationState.VALIDATED;

        try {
            return publishAll(request, raw, corrected);
        } catch (RuntimeException e) {
            state = OrchestrationState.FAILED;
            throw e;
        }
    }

    private OrchestrationReport publishAll(OrchestrationRequest request, PeriodSet raw, PeriodSet corrected) {
        GroupingSpec spec = request.grouping();
        AnalysisOptions options = request.options();
        String label = request.label().orElseGet(() -> runLabel(raw.first().metadata(), request.zeroPadding()));
        String periods = raw.isMultiPeriod() ? options.periods().format() : "";
        int version = request.version();
        List<String> published = new ArrayList<>();

        AnalysisOptions countOptions = options.withKind(AnalysisKind.COUNTS);
        for (GroupSpec group : spec.groups()) {
            GroupingResult result = grouping.groupAndAnalyze(corrected, group, countOptions);
            DatasetName name = DatasetName.group(label, group.name(), PlotType.COUNTS, periods, version);
            Map<String, ChannelDataset> outputs = new LinkedHashMap<>();
            outputs.put(name.format(), result.output());
            outputs.put(name.withVariant(NameVariant.RAW).format(), result.rawOutput());
            publish(outputs, published);
        }
        state = OrchestrationState.GROUPS_APPLIED;

        for (PairSpec pair : spec.pairs()) {
            GroupSpec forward = spec.group(pair.forward()).orElseThrow();
            GroupSpec backward = spec.group(pair.backward()).orElseThrow();
            PairingResult result = pairing.pairAndAnalyze(corrected, pair, forward, backward, options);
            DatasetName name = DatasetName.pair(label, pair.name(), PlotType.ASYMMETRY, periods, version);
            Map<String, ChannelDataset> outputs = new LinkedHashMap<>();
            outputs.put(name.format(), result.output());
            outputs.put(name.withVariant(NameVariant.RAW).format(), result.rawOutput());
            publish(outputs, published);
        }
        state = OrchestrationState.PAIRS_APPLIED;

        if (request.groupAsymmetry()) {
            AnalysisOptions asymmetryOptions = options.withKind(AnalysisKind.ASYMMETRY);
            for (GroupSpec group : spec.groups()) {
                GroupingResult result = grouping.groupAndAnalyze(corrected, group, asymmetryOptions);
                DatasetName name = DatasetName.group(label, group.name(), PlotType.ASYMMETRY, periods, version);
                Map<String, ChannelDataset> outputs = new LinkedHashMap<>();
                outputs.put(name.format(), result.output());
                outputs.put(name.withVariant(NameVariant.RAW).format(), result.rawOutput());
                outputs.put(name.withVariant(NameVariant.UNNORM).format(), result.unnormalizedOutput().orElseThrow());
                outputs.put(name.withVariant(NameVariant.UNNORM_RAW).format(),
                    result.unnormalizedRawOutput().orElseThrow());
                publish(outputs, published);
            }
            state = OrchestrationState.GROUP_ASYMMETRY_APPLIED;
        }

        state = OrchestrationState.PUBLISHED;
        logger.info("Published {} datasets for {}", published.size(), label);
        return new OrchestrationReport(label, published, state);
    }

    /**
     * Checks a grouping against the data it will be applied to.
     *
     * @throws ValidationException listing channels absent from the data, on a group whose channels share a
     *         spectrum, or naming a pair of identical groups
     * @throws io.musrtools.reduction.PeriodIndexException if a requested period does not exist
     */
    public static void validate(PeriodSet periods, GroupingSpec spec, AnalysisOptions options) {
        Set<Integer> present = periods.first().channelIds();
        List<Integer> missing = new ArrayList<>();
        for (Integer id : spec.referencedChannels()) {
            if (!present.contains(id)) {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Detectors not found in the data: " + missing);
        }
        for (GroupSpec group : spec.groups()) {
            GroupReducer.requireResolvable(periods.first(), group.channels());
        }
        for (PairSpec pair : spec.pairs()) {
            GroupSpec forward = spec.group(pair.forward()).orElseThrow();
            GroupSpec backward = spec.group(pair.backward()).orElseThrow();
            if (forward.name().equals(backward.name())
                || new HashSet<>(forward.channels()).equals(new HashSet<>(backward.channels()))) {
                throw new ValidationException("Pair '" + pair.name() + "' needs two different groups, got '"
                    + forward.name() + "' and '" + backward.name() + "'");
            }
        }
        options.periods().requireValidFor(periods);
    }

    /**
     * Checks that the normalization window holds bins of every group in the corrected data.
     *
     * @throws ValidationException on an empty or inverted window, or a window without bins
     */
    public static void validateAsymmetryWindows(PeriodSet corrected, GroupingSpec spec, AnalysisOptions options) {
        if (options.fixedNormalization() != AsymmetryEstimator.ESTIMATE_NORMALIZATION) {
            return;
        }
        ChannelDataset first = corrected.first();
        for (GroupSpec group : spec.groups()) {
            Spectrum s = first.spectrum(first.indexOfChannel(group.channels().get(0)));
            double start = options.timeMin().orElse(s.firstX());
            double end = options.timeMax().orElse(s.lastX());
            AsymmetryEstimator.validateWindow(start, end);
            AsymmetryEstimator.requireBinsInWindow(s, start, end);
            ChannelDataset rebinned = Rebinner.rebin(first.withSpectra(List.of(s)), options.rebin(), true);
            AsymmetryEstimator.requireBinsInWindow(rebinned.spectrum(0), start, end);
        }
    }

    private void publish(Map<String, ChannelDataset> outputs, List<String> published) {
        for (Map.Entry<String, ChannelDataset> output : outputs.entrySet()) {
            registry.put(output.getKey(), output.getValue(), true);
            published.add(output.getKey());
            logger.info("Published {}", output.getKey());
        }
    }

    private static String runLabel(RunMetadata metadata, int zeroPadding) {
        return RunLabel.of(metadata.instrument(), metadata.runNumber()).format(zeroPadding);
    }
}
