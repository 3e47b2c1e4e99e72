package io.musrtools.command;

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

import io.musrtools.command.alpha.CMD_musr_alpha;
import io.musrtools.command.name.CMD_musr_name;
import io.musrtools.command.reduce.CMD_musr_reduce;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The musr command groups the muon reduction tools.
///
/// This is an umbrella command; the work happens in its subcommands.
@CommandLine.Command(name = "musr",
    header = "Muon spectroscopy reduction tools",
    description = "Contains subcommands to reduce runs, estimate pair balance factors and work with dataset names",
    subcommands = {
        CMD_musr_reduce.class,
        CMD_musr_alpha.class,
        CMD_musr_name.class
    })
public class CMD_musr implements Callable<Integer> {

    /// Run CMD_musr
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_musr()).execute(args));
    }

    /// Print usage when no subcommand is given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
