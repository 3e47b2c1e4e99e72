package io.musrtools.command.name;

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

import io.musrtools.reduction.naming.DatasetName;
import io.musrtools.reduction.naming.ItemType;
import io.musrtools.reduction.naming.NameVariant;
import io.musrtools.reduction.naming.PlotType;
import io.musrtools.reduction.naming.RunLabel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Parse or generate published dataset names.
///
/// ## Usage
///
/// ```bash
/// # Parse a name into its fields
/// musr name "MUSR00015189-91; Pair; long; Asym; 1+2; #1_Raw"
///
/// # Generate a name
/// musr name --instrument MUSR --runs 15189,15190,15191 --item-type PAIR --item long \
///     --plot-type ASYMMETRY --periods 1+2 --variant RAW
/// ```
@CommandLine.Command(
    name = "name",
    header = "Parse or generate published dataset names",
    description = "With a NAME argument, prints its fields. Without one, builds a name from the options.",
    exitCodeList = {
        "0: Success",
        "1: Invalid name or fields"
    }
)
public class CMD_musr_name implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_musr_name.class);

    @CommandLine.Parameters(
        arity = "0..1",
        paramLabel = "NAME",
        description = "Published name to parse"
    )
    private String name;

    @CommandLine.Option(names = {"--label"}, description = "Label to use instead of instrument and runs")
    private String label;

    @CommandLine.Option(names = {"--instrument"}, description = "Instrument name, e.g. MUSR")
    private String instrument = "";

    @CommandLine.Option(names = {"--runs"}, split = ",", paramLabel = "RUN", description = "Run numbers")
    private List<Integer> runs = new ArrayList<>();

    @CommandLine.Option(
        names = {"--zero-padding"},
        description = "Digits the first run is padded to (default: ${DEFAULT-VALUE})",
        defaultValue = "8"
    )
    private int zeroPadding;

    @CommandLine.Option(
        names = {"--item-type"},
        description = "GROUP or PAIR (default: ${DEFAULT-VALUE})",
        defaultValue = "GROUP"
    )
    private ItemType itemType;

    @CommandLine.Option(names = {"--item"}, description = "Group or pair name")
    private String item;

    @CommandLine.Option(
        names = {"--plot-type"},
        description = "COUNTS, ASYMMETRY or LOGS (default: ${DEFAULT-VALUE})",
        defaultValue = "COUNTS"
    )
    private PlotType plotType;

    @CommandLine.Option(names = {"--periods"}, description = "Period string, e.g. 1+2-3; omit for single-period runs")
    private String periods = "";

    @CommandLine.Option(
        names = {"--version"},
        description = "Version number (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    private int version;

    @CommandLine.Option(
        names = {"--variant"},
        description = "PRIMARY, RAW, UNNORM or UNNORM_RAW (default: ${DEFAULT-VALUE})",
        defaultValue = "PRIMARY"
    )
    private NameVariant variant;

    @Override
    public Integer call() {
        try {
            if (name != null) {
                printFields(DatasetName.parse(name));
                return 0;
            }
            if (item == null) {
                System.err.println("Error: Specify a NAME to parse, or --item to generate one");
                return 1;
            }
            String effectiveLabel = label;
            if (effectiveLabel == null) {
                if (runs.isEmpty()) {
                    System.err.println("Error: Specify --label or --runs");
                    return 1;
                }
                effectiveLabel = new RunLabel(instrument, runs).format(zeroPadding);
            }
            DatasetName generated = itemType == ItemType.GROUP
                ? DatasetName.group(effectiveLabel, item, plotType, periods, version)
                : DatasetName.pair(effectiveLabel, item, plotType, periods, version);
            System.out.println(generated.withVariant(variant).format());
            return 0;
        } catch (Exception e) {
            logger.error("Error handling name", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printFields(DatasetName parsed) {
        System.out.println("label:     " + parsed.label());
        System.out.println("item type: " + parsed.itemType().label());
        System.out.println("item:      " + parsed.itemName());
        System.out.println("plot type: " + parsed.plotType().label());
        System.out.println("periods:   " + (parsed.periods().isEmpty() ? "-" : parsed.periods()));
        System.out.println("version:   " + parsed.version());
        System.out.println("variant:   " + parsed.variant());
        if (!parsed.label().isEmpty() && Character.isDigit(parsed.label().charAt(parsed.label().length() - 1))) {
            RunLabel runLabel = RunLabel.parse(parsed.label());
            System.out.println("instrument: " + runLabel.instrument());
            System.out.println("runs:       " + runLabel.runs());
        }
    }
}
