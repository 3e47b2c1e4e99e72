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

import io.musrtools.reduction.registry.DatasetRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// Writes published datasets to a directory, one JSON file per name.
public final class DatasetExport {

    private static final Logger logger = LogManager.getLogger(DatasetExport.class);

    private DatasetExport() {
    }

    /// Writes the named registry entries into `directory`, creating it when needed.
    ///
    /// @return the written files, in the order of `names`
    public static List<Path> export(DatasetRegistry registry, Collection<String> names, Path directory)
        throws IOException {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(names, "names cannot be null");
        Objects.requireNonNull(directory, "directory cannot be null");
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>(names.size());
        for (String name : names) {
            Path file = directory.resolve(fileName(name));
            RunDataFiles.save(file, registry.get(name));
            logger.debug("Wrote {} to {}", name, file);
            written.add(file);
        }
        return written;
    }

    /// Maps a published name to a file name: runs of characters other than
    /// letters, digits, `+`, `-` and `_` become one `_`.
    ///
    /// `"MUSR00015189; Group; fwd; Counts; #1_Raw"` becomes `MUSR00015189_Group_fwd_Counts_1_Raw.json`.
    public static String fileName(String name) {
        String safe = name.replaceAll("[^A-Za-z0-9+_-]+", "_");
        safe = safe.replaceAll("_{2,}", "_");
        safe = safe.replaceAll("^_+|_+$", "");
        return (safe.isEmpty() ? "dataset" : safe) + ".json";
    }
}
