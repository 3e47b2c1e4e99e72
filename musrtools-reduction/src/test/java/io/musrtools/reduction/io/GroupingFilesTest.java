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

import io.musrtools.reduction.io.RunDataFiles.DataFileException;
import io.musrtools.reduction.model.GroupSpec;
import io.musrtools.reduction.model.GroupingSpec;
import io.musrtools.reduction.model.PairSpec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GroupingFilesTest {

    @Test
    void readsGroupsAndPairs() throws Exception {
        GroupingSpec spec = GroupingFiles.fromJson("""
            {
              "groups": [
                {"name": "fwd", "channels": "1-16"},
                {"name": "bwd", "channels": "17-32"}
              ],
              "pairs": [
                {"name": "long", "forward": "fwd", "backward": "bwd", "alpha": 1.05},
                {"name": "plain", "forward": "bwd", "backward": "fwd"}
              ]
            }
            """);
        assertThat(spec.groups()).extracting(GroupSpec::name).containsExactly("fwd", "bwd");
        assertThat(spec.group("bwd").orElseThrow().channels()).hasSize(16);
        assertThat(spec.pair("long").orElseThrow().alpha()).isEqualTo(1.05);
        assertThat(spec.pair("plain").orElseThrow().alpha()).isEqualTo(1.0);
    }

    @Test
    void pairsAreOptional() throws Exception {
        GroupingSpec spec = GroupingFiles.fromJson("{\"groups\": [{\"name\": \"g\", \"channels\": \"1\"}]}");
        assertThat(spec.pairs()).isEmpty();
    }

    @Test
    void saveAndLoadRoundTrip(@TempDir Path tempDir) throws Exception {
        GroupingSpec original = new GroupingSpec(
            List.of(new GroupSpec("top", "1-4,9"), new GroupSpec("bottom", "5-8")),
            List.of(new PairSpec("tb", "top", "bottom", 0.93)));
        Path path = tempDir.resolve("grouping.json");
        GroupingFiles.save(path, original);

        GroupingSpec restored = GroupingFiles.load(path);
        assertThat(restored.groups()).isEqualTo(original.groups());
        assertThat(restored.pairs()).isEqualTo(original.pairs());
    }

    @Test
    void rejectsFileWithoutGroups() {
        assertThatThrownBy(() -> GroupingFiles.fromJson("{\"pairs\": []}"))
            .isInstanceOf(DataFileException.class)
            .hasMessageContaining("no groups");
    }

    @Test
    void rejectsPairWithoutBackward() {
        assertThatThrownBy(() -> GroupingFiles.fromJson("""
            {"groups": [{"name": "a", "channels": "1"}], "pairs": [{"name": "p", "forward": "a"}]}
            """))
            .isInstanceOf(DataFileException.class)
            .hasMessageContaining("'p'");
    }

    @Test
    void wrapsInvalidGroupings() {
        assertThatThrownBy(() -> GroupingFiles.fromJson("""
            {"groups": [{"name": "Group", "channels": "1"}]}
            """))
            .isInstanceOf(DataFileException.class)
            .hasMessageStartingWith("Invalid grouping")
            .hasCauseInstanceOf(io.musrtools.reduction.ValidationException.class);
    }

    @Test
    void missingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> GroupingFiles.load(tempDir.resolve("none.json")))
            .isInstanceOf(DataFileException.class);
    }
}
