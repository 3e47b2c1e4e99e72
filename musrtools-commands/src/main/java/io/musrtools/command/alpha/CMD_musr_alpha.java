package io.musrtools.command.alpha;

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
import io.musrtools.command.common.TimeWindowOption;
import io.musrtools.reduction.asymmetry.AlphaEstimator;
import io.musrtools.reduction.io.RunDataFiles;
import io.musrtools.reduction.model.ChannelIdList;
import io.musrtools.reduction.model.PeriodSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Estimate the balance factor between a forward and a backward group.
///
/// ## Usage
///
/// ```bash
/// musr alpha --input run15189.json --forward 1-16 --backward 17-32 --time-min 0.1
/// ```
///
/// Prints `alpha: <value>`. Subtracted periods are ignored; only the summed
/// periods (default period 1) are used.
@CommandLine.Command(
    name = "alpha",
    header = "Estimate the balance factor of a detector pair",
    description = "Computes alpha as the ratio of forward to backward counts over the time window.",
    exitCodeList = {
        "0: Success",
        "1: Invalid input or no backward counts in the window"
    }
)
public class CMD_musr_alpha implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_musr_alpha.class);

    @CommandLine.Option(
        names = {"--input", "-i"},
        description = "Run data file (JSON)",
        required = true
    )
    private Path inputPath;

    @CommandLine.Option(
        names = {"--forward", "-f"},
        paramLabel = "CHANNELS",
        description = "Forward group channels, e.g. 1-16",
        required = true
    )
    private String forward;

    @CommandLine.Option(
        names = {"--backward", "-b"},
        paramLabel = "CHANNELS",
        description = "Backward group channels, e.g. 17-32",
        required = true
    )
    private String backward;

    @CommandLine.Mixin
    private PeriodsOption periodsOption = new PeriodsOption();

    @CommandLine.Mixin
    private TimeWindowOption timeWindow = new TimeWindowOption();

    @Override
    public Integer call() {
        try {
            timeWindow.validate();
            PeriodSet periods = RunDataFiles.load(inputPath).normalize();
            double firstGood = timeWindow.getTimeMin() != null ? timeWindow.getTimeMin() : periods.first().minX();
            double alpha = new AlphaEstimator().estimate(periods,
                ChannelIdList.parse(forward), ChannelIdList.parse(backward),
                periodsOption.getSummed(), firstGood, timeWindow.getTimeMax());
            logger.info("Alpha for {} / {} over {}: {}", forward, backward, timeWindow, alpha);
            System.out.println(String.format(Locale.ROOT, "alpha: %.6f", alpha));
            return 0;
        } catch (Exception e) {
            logger.error("Error estimating alpha from " + inputPath, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
