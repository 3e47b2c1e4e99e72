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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
public class CMD_musr_reduceTest {

    private static final String FOUR_CHANNEL_RUN = """
        {
          "instrument": "EMU",
          "run_number": 20884,
          "good_frames": 100.0,
          "periods": [
            {
              "spectra": [
                {"channels": [1], "x": [0, 1, 2, 3, 4], "y": [90, 70, 50, 40]},
                {"channels": [2], "x": [0, 1, 2, 3, 4], "y": [80, 66, 52, 38]},
                {"channels": [3], "x": [0, 1, 2, 3, 4], "y": [30, 28, 26, 24]},
                {"channels": [4], "x": [0, 1, 2, 3, 4], "y": [35, 30, 27, 20]}
              ]
            }
          ]
        }
        """;

    private static final String GROUPING = """
        {
          "groups": [{"name": "fwd", "channels": "1-2"}, {"name": "bwd", "channels": "3-4"}],
          "pairs": [{"name": "long", "forward": "fwd", "backward": "bwd", "alpha": 1.2}]
        }
        """;

    @TempDir
    Path tempDir;

    private Path runFile;
    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        runFile = tempDir.resolve("run.json");
        Files.writeString(runFile, FOUR_CHANNEL_RUN, StandardCharsets.UTF_8);
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int execute(String... args) {
        return new CommandLine(new CMD_musr_reduce()).execute(args);
    }

    private String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return errContent.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testInlineGroupsAndPair() {
        int exitCode = execute("--input", runFile.toString(),
            "--group", "fwd=1-2", "--group", "bwd=3-4", "--pair", "long=fwd,bwd");

        assertEquals(0, exitCode, "Command should exit with code 0");
        assertThat(output()).contains(
            "EMU00020884; Group; fwd; Counts; #1",
            "EMU00020884; Group; bwd; Counts; #1_Raw",
            "EMU00020884; Pair; long; Asym; #1",
            "EMU00020884; Pair; long; Asym; #1_Raw");
    }

    @Test
    public void testGroupingFileAndGroupAsymmetry() throws IOException {
        Path grouping = tempDir.resolve("grouping.json");
        Files.writeString(grouping, GROUPING, StandardCharsets.UTF_8);

        int exitCode = execute("-i", runFile.toString(), "-g", grouping.toString(),
            "--group-asymmetry", "--label", "cal", "--version", "2");

        assertEquals(0, exitCode);
        assertThat(output()).contains(
            "cal; Pair; long; Asym; #2",
            "cal; Group; fwd; Asym; #2_unNorm",
            "cal; Group; bwd; Asym; #2_unNorm_Raw");
    }

    @Test
    public void testOutputDirectoryReceivesEveryDataset() throws IOException {
        Path out = tempDir.resolve("reduced");
        int exitCode = execute("--input", runFile.toString(), "--group", "fwd=1-2", "--group", "bwd=3-4",
            "--pair", "long=fwd,bwd", "--rebin", "2", "--output", out.toString());

        assertEquals(0, exitCode);
        assertThat(out.resolve("EMU00020884_Group_fwd_Counts_1.json")).exists();
        assertThat(out.resolve("EMU00020884_Pair_long_Asym_1_Raw.json")).exists();
        try (var files = Files.list(out)) {
            assertEquals(6, files.count());
        }
    }

    @Test
    public void testGroupingAndInlineGroupsAreExclusive() throws IOException {
        Path grouping = tempDir.resolve("grouping.json");
        Files.writeString(grouping, GROUPING, StandardCharsets.UTF_8);

        int exitCode = execute("--input", runFile.toString(), "--grouping", grouping.toString(),
            "--group", "fwd=1-2");

        assertEquals(1, exitCode);
        assertThat(errors()).contains("Error: Use either --grouping or --group");
        assertThat(output()).isEmpty();
    }

    @Test
    public void testGroupsAreRequired() {
        assertEquals(1, execute("--input", runFile.toString()));
        assertThat(errors()).contains("Error: Specify --grouping or at least one --group");
    }

    @Test
    public void testMissingDetectorsFail() {
        int exitCode = execute("--input", runFile.toString(), "--group", "fwd=1-2,7");

        assertEquals(1, exitCode);
        assertThat(errors()).contains("Error:").contains("7");
        assertThat(output()).isEmpty();
    }

    @Test
    public void testMissingInputFileFails() {
        int exitCode = execute("--input", tempDir.resolve("absent.json").toString(), "--group", "fwd=1");

        assertEquals(1, exitCode);
        assertThat(errors()).contains("not found");
    }

    @Test
    public void testInvalidRebinIsAUsageError() {
        int exitCode = execute("--input", runFile.toString(), "--group", "fwd=1", "--rebin", "0,0.5");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertThat(errors()).contains("Invalid rebin parameters");
    }

    @Test
    public void testEmptyTimeWindowFails() {
        int exitCode = execute("--input", runFile.toString(), "--group", "fwd=1",
            "--time-min", "3", "--time-max", "1");

        assertEquals(1, exitCode);
        assertThat(errors()).contains("--time-min must be less than --time-max");
    }
}
