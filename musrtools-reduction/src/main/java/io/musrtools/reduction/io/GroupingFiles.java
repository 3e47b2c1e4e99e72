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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.musrtools.reduction.ReductionException;
import io.musrtools.reduction.io.RunDataFiles.DataFileException;
import io.musrtools.reduction.model.GroupSpec;
import io.musrtools.reduction.model.GroupingSpec;
import io.musrtools.reduction.model.PairSpec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes grouping specifications as JSON.
 *
 * <pre>{@code
 * {
 *   "groups": [ { "name": "fwd", "channels": "1-32" }, { "name": "bwd", "channels": "33-64" } ],
 *   "pairs":  [ { "name": "long", "forward": "fwd", "backward": "bwd", "alpha": 1.0 } ]
 * }
 * }</pre>
 *
 * <p>A missing {@code pairs} list means no pairs.
 */
public final class GroupingFiles {

    private GroupingFiles() {
    }

    public static GroupingSpec load(Path path) throws IOException, DataFileException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new DataFileException("Grouping file not found: " + path);
        }
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static GroupingSpec fromJson(String json) throws DataFileException {
        GroupingJson file;
        try {
            file = ReductionGsonConfig.gson().fromJson(json, GroupingJson.class);
        } catch (JsonParseException e) {
            throw new DataFileException("Invalid grouping JSON: " + e.getMessage(), e);
        }
        if (file == null || file.groups == null) {
            throw new DataFileException("Grouping file declares no groups");
        }
        try {
            List<GroupSpec> groups = new ArrayList<>();
            for (GroupJson group : file.groups) {
                groups.add(new GroupSpec(group.name, group.channels));
            }
            List<PairSpec> pairs = new ArrayList<>();
            if (file.pairs != null) {
                for (PairJson pair : file.pairs) {
                    if (pair.forward == null || pair.backward == null) {
                        throw new DataFileException("Pair '" + pair.name + "' needs a forward and a backward group");
                    }
                    pairs.add(new PairSpec(pair.name, pair.forward, pair.backward, pair.alpha == null ? 1.0 : pair.alpha));
                }
            }
            return new GroupingSpec(groups, pairs);
        } catch (ReductionException e) {
            throw new DataFileException("Invalid grouping: " + e.getMessage(), e);
        }
    }

    public static void save(Path path, GroupingSpec spec) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(spec, "spec cannot be null");
        RunDataFiles.writeAtomically(path, toJson(spec));
    }

    public static String toJson(GroupingSpec spec) {
        GroupingJson file = new GroupingJson();
        file.groups = new ArrayList<>();
        for (GroupSpec group : spec.groups()) {
            GroupJson json = new GroupJson();
            json.name = group.name();
            json.channels = group.channelIds();
            file.groups.add(json);
        }
        file.pairs = new ArrayList<>();
        for (PairSpec pair : spec.pairs()) {
            PairJson json = new PairJson();
            json.name = pair.name();
            json.forward = pair.forward();
            json.backward = pair.backward();
            json.alpha = pair.alpha();
            file.pairs.add(json);
        }
        return ReductionGsonConfig.gson().toJson(file);
    }

    private static final class GroupingJson {
        @SerializedName("groups")
        List<GroupJson> groups;

        @SerializedName("pairs")
        List<PairJson> pairs;
    }

    private static final class GroupJson {
        @SerializedName("name")
        String name;

        @SerializedName("channels")
        String channels;
    }

    private static final class PairJson {
        @SerializedName("name")
        String name;

        @SerializedName("forward")
        String forward;

        @SerializedName("backward")
        String backward;

        @SerializedName("alpha")
        Double alpha;
    }
}
