package io.musrtools.reduction.io;

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

import io.musrtools.reduction.TestSpectra;
import io.musrtools.reduction.model.RunData;
import io.musrtools.reduction.registry.InMemoryDatasetRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.musrtools.reduction.TestSpectra.row;
import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DatasetExportTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "MUSR00015189; Group; fwd; Counts; #1_Raw | MUSR00015189_Group_fwd_Counts_1_Raw.json",
        "MUSR00015189-91; Pair; long; Asym; 1+2; #1 | MUSR00015189-91_Pair_long_Asym_1+2_1.json",
        "'MUSR1, 3; Group; g; Counts; #2' | MUSR1_3_Group_g_Counts_2.json",
        "';;' | dataset.json"
    })
    void fileNamesAreFilesystemSafe(String name, String expected) {
        assertThat(DatasetExport.fileName(name)).isEqualTo(expected);
    }

    @Test
    void writesOneFilePerName(@TempDir Path tempDir) throws Exception {
        InMemoryDatasetRegistry registry = new InMemoryDatasetRegistry();
        registry.put("A; Group; a; Counts; #1", TestSpectra.channels(row(1, 2)), false);
        registry.put("A; Group; b; Counts; #1", TestSpectra.channels(row(3, 4)), false);

        Path out = tempDir.resolve("reduced");
        List<Path> written = DatasetExport.export(registry, registry.names(), out);

        assertThat(written).containsExactly(
            out.resolve("A_Group_a_Counts_1.json"),
            out.resolve("A_Group_b_Counts_1.json"));
        assertThat(written).allSatisfy(p -> assertThat(Files.exists(p)).isTrue());

        RunData reloaded = RunDataFiles.load(written.get(1));
        assertThat(((RunData.Single) reloaded).dataset().spectrum(0).y()).containsExactly(3.0, 4.0);
    }
}
