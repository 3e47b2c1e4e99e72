package io.musrtools.command.reduce;

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

import io.musrtools.command.common.PeriodsOption;
import io.musrtools.command.common.RebinOption;
import io.musrtools.command.common.TimeWindowOption;
import io.musrtools.reduction.correct.CorrectionConfig;
import io.musrtools.reduction.correct.DeadTimeTable;
import io.musrtools.reduction.io.DatasetExport;
import io.musrtools.reduction.io.GroupingFiles;
import io.musrtools.reduction.io.RunDataFiles;
import io.musrtools.reduction.model.GroupSpec;
import io.musrtools.reduction.model.GroupingSpec;
import io.musrtools.reduction.model.PairSpec;
import io.musrtools.reduction.model.RunData;
import io.musrtools.reduction.registry.InMemoryDatasetRegistry;
import io.musrtools.reduction.stage.AnalysisOptions;
import io.musrtools.reduction.stage.OrchestrationReport;
import io.musrtools.reduction.stage.OrchestrationRequest;
import io.musrtools.reduction.stage.OrchestrationStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Reduce one run: correct it, build every group and pair, and publish the results.
///
/// ## Usage
///
/// ```bash
/// # Groups and pairs from a grouping file, results written as JSON
/// musr reduce --input run15189.json --grouping emu.json --output reduced/
///
/// # Inline groups, two periods summed, 0.032 us bins, group asymmetry too
/// musr reduce --input run15189.json --group fwd=1-16 --group bwd=17-32 \
///     --pair long=fwd,bwd --alpha 1.05 --summed 1,2 --rebin 0.032 --group-asymmetry
/// ```
///
/// ## Output
///
/// The published dataset names, one per line. With `--output`, every dataset
/// is also written to the directory as a JSON run data file.
@CommandLine.Command(
    name = "reduce",
    header = "Reduce a muon run into group counts and pair asymmetry",
    description = "Applies dead-time, time-offset, crop and rebin corrections, then produces the counts of every "
        + "group, the asymmetry of every pair and optionally the asymmetry of every group.",
    exitCodeList = {
        "0: Success",
        "1: Invalid input or reduction failure"
    }
)
public class CMD_musr_reduce implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_musr_reduce.class);

    @CommandLine.Option(
        names = {"--input", "-i"},
        description = "Run data file (JSON)",
        required = true
    )
    private Path inputPath;

    @CommandLine.Option(
        names = {"--grouping", "-g"},
        description = "Grouping file (JSON) declaring groups and pairs"
    )
    private Path groupingPath;

    @CommandLine.Option(
        names = {"--group"},
        paramLabel = "NAME=CHANNELS",
        description = "Inline group, e.g. fwd=1-16,20; repeatable"
    )
    private Map<String, String> groups = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"--pair"},
        paramLabel = "NAME=FORWARD,BACKWARD",
        description = "Inline pair of two inline groups, e.g. long=fwd,bwd; repeatable"
    )
    private Map<String, String> pairs = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"--alpha"},
        description = "Balance factor for inline pairs (default: ${DEFAULT-VALUE})",
        defaultValue = "1.0"
    )
    private double alpha;

    @CommandLine.Option(
        names = {"--output", "-o"},
        description = "Directory to write the published datasets to"
    )
    private Path outputDir;

    @CommandLine.Mixin
    private PeriodsOption periodsOption = new PeriodsOption();

    @CommandLine.Mixin
    private TimeWindowOption timeWindow = new TimeWindowOption();

    @CommandLine.Mixin
    private RebinOption rebinOption = new RebinOption();

    @CommandLine.Option(
        names = {"--time-offset"},
        paramLabel = "US",
        description = "Shift added to the time axis of every spectrum, in microseconds"
    )
    private Double timeOffset;

    @CommandLine.Option(
        names = {"--dead-time"},
        paramLabel = "CHANNEL=US",
        description = "Dead time of one channel in microseconds, e.g. 3=0.0051; repeatable"
    )
    private Map<Integer, Double> deadTimes = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"--normalization"},
        description = "Fixed normalization constant for group asymmetry; 0 estimates it (default: ${DEFAULT-VALUE})",
        defaultValue = "0"
    )
    private double normalization;

    @CommandLine.Option(
        names = {"--group-asymmetry"},
        description = "Also publish the asymmetry of every group"
    )
    private boolean groupAsymmetry = false;

    @CommandLine.Option(
        names = {"--label"},
        description = "Label used in published names instead of the generated run label"
    )
    private String label;

    @CommandLine.Option(
        names = {"--version"},
        description = "Version number used in published names (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    private int version;

    @Override
    public Integer call() {
        try {
            if (groupingPath != null && !groups.isEmpty()) {
                System.err.println("Error: Use either --grouping or --group, not both");
                return 1;
            }
            if (groupingPath == null && groups.isEmpty()) {
                System.err.println("Error: Specify --grouping or at least one --group");
                return 1;
            }
            timeWindow.validate();

            RunData data = RunDataFiles.load(inputPath);
            GroupingSpec grouping = groupingPath != null ? GroupingFiles.load(groupingPath) : inlineGrouping();
            logger.info("Reducing {} with {}, periods {}, window {}, rebin {}",
                inputPath, grouping, periodsOption, timeWindow, rebinOption);

            OrchestrationRequest.Builder request = OrchestrationRequest.builder()
                .input(data)
                .grouping(grouping)
                .corrections(corrections())
                .options(analysisOptions())
                .groupAsymmetry(groupAsymmetry)
                .version(version);
            if (label != null) {
                request.label(label);
            }

            InMemoryDatasetRegistry registry = new InMemoryDatasetRegistry();
            OrchestrationReport report = new OrchestrationStage(registry).run(request.build());
            for (String name : report.publishedNames()) {
                System.out.println(name);
            }
            if (outputDir != null) {
                List<Path> written = DatasetExport.export(registry, report.publishedNames(), outputDir);
                logger.info("Wrote {} datasets to {}", written.size(), outputDir);
            }
            return 0;
        } catch (Exception e) {
            logger.error("Error reducing " + inputPath, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private GroupingSpec inlineGrouping() {
        List<GroupSpec> groupSpecs = new ArrayList<>();
        for (Map.Entry<String, String> group : groups.entrySet()) {
            groupSpecs.add(new GroupSpec(group.getKey(), group.getValue()));
        }
        List<PairSpec> pairSpecs = new ArrayList<>();
        for (Map.Entry<String, String> pair : pairs.entrySet()) {
            String[] sides = pair.getValue().split(",");
            if (sides.length != 2) {
                throw new IllegalArgumentException("--pair needs NAME=FORWARD,BACKWARD, got " + pair.getKey() + "="
                    + pair.getValue());
            }
            pairSpecs.add(new PairSpec(pair.getKey(), sides[0].trim(), sides[1].trim(), alpha));
        }
        return new GroupingSpec(groupSpecs, pairSpecs);
    }

    private CorrectionConfig corrections() {
        return CorrectionConfig.builder()
            .deadTimes(deadTimes.isEmpty() ? null : new DeadTimeTable(deadTimes))
            .timeOffset(timeOffset)
            .xMin(timeWindow.getTimeMin())
            .xMax(timeWindow.getTimeMax())
            .build();
    }

    private AnalysisOptions analysisOptions() {
        return AnalysisOptions.builder()
            .periods(periodsOption.getSelection())
            .timeMin(timeWindow.getTimeMin())
            .timeMax(timeWindow.getTimeMax())
            .rebin(rebinOption.getRebin())
            .fixedNormalization(normalization)
            .build();
    }
}
