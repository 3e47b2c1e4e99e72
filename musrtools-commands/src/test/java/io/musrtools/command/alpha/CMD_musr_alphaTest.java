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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CMD_musr_alphaTest {

    // forward 1-2 holds 1.5 times the counts of backward 3-4 in every bin but the last
    private static final String TWO_PERIOD_RUN = """
        {
          "instrument": "MUSR",
          "run_number": 15189,
          "good_frames": 10,
          "periods": [
            {
              "spectra": [
                {"channels": [1], "x": [0, 1, 2, 3], "y": [20, 10, 40]},
                {"channels": [2], "x": [0, 1, 2, 3], "y": [10, 5, 0]},
                {"channels": [3], "x": [0, 1, 2, 3], "y": [12, 6, 1]},
                {"channels": [4], "x": [0, 1, 2, 3], "y": [8, 4, 1]}
              ]
            },
            {
              "spectra": [
                {"channels": [1], "x": [0, 1, 2, 3], "y": [30, 30, 30]},
                {"channels": [2], "x": [0, 1, 2, 3], "y": [0, 0, 0]},
                {"channels": [3], "x": [0, 1, 2, 3], "y": [10, 10, 10]},
                {"channels": [4], "x": [0, 1, 2, 3], "y": [10, 10, 10]}
              ]
            }
          ]
        }
        """;

    @TempDir
    Path tempDir;

    private String runAlpha(int expectedExit, ByteArrayOutputStream out, String... args) throws IOException {
        Path runFile = tempDir.resolve("run.json");
        Files.writeString(runFile, TWO_PERIOD_RUN, StandardCharsets.UTF_8);
        String[] fullArgs = new String[args.length + 2];
        fullArgs[0] = "--input";
        fullArgs[1] = runFile.toString();
        System.arraycopy(args, 0, fullArgs, 2, args.length);

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(out, true, StandardCharsets.UTF_8));
        try {
            int exitCode = new CommandLine(new CMD_musr_alpha()).execute(fullArgs);
            assertEquals(expectedExit, exitCode);
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Test
    public void testAlphaOverWindow() throws IOException {
        String output = runAlpha(0, new ByteArrayOutputStream(),
            "--forward", "1-2", "--backward", "3-4", "--time-max", "2");
        assertTrue(output.contains("alpha: 1.500000"), output);
    }

    @Test
    public void testAlphaOverWholeRun() throws IOException {
        // (45 + 40) / (30 + 2)
        String output = runAlpha(0, new ByteArrayOutputStream(), "-f", "1-2", "-b", "3-4");
        assertTrue(output.contains("alpha: 2.656250"), output);
    }

    @Test
    public void testSummedPeriods() throws IOException {
        // (45 + 60) / (30 + 40)
        String output = runAlpha(0, new ByteArrayOutputStream(),
            "-f", "1,2", "-b", "3,4", "--summed", "1,2", "--time-max", "2");
        assertTrue(output.contains("alpha: 1.500000"), output);
    }

    @Test
    public void testEmptyBackwardGroupFails() throws IOException {
        String output = runAlpha(1, new ByteArrayOutputStream(),
            "-f", "1", "-b", "2", "--summed", "2");
        assertTrue(output.contains("Error: Backward group has no counts"), output);
    }

    @Test
    public void testIdenticalGroupsFail() throws IOException {
        String output = runAlpha(1, new ByteArrayOutputStream(), "-f", "1-2", "-b", "1-2");
        assertTrue(output.contains("Error: Forward and backward groups must differ"), output);
    }
}
