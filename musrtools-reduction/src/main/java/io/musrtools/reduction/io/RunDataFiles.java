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
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.RunData;
import io.musrtools.reduction.model.RunMetadata;
import io.musrtools.reduction.model.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Reads and writes run data as JSON.
///
/// ## Format
///
/// ```json
/// {
///   "instrument": "MUSR",
///   "run_number": 15189,
///   "good_frames": 2000.0,
///   "periods": [
///     { "spectra": [ { "channels": [1], "x": [0.0, 0.1, 0.2], "y": [30, 42], "e": [5.5, 6.5] } ] }
///   ]
/// }
/// ```
///
/// - `e` is optional and defaults to `sqrt(|y|)`.
/// - a period may carry its own `good_frames`, overriding the run's.
/// - exported datasets add `y_unit` and `tags` to the single period they hold.
///
/// Files are written to a temporary sibling first and then moved into place.
public final class RunDataFiles {

    private static final Logger logger = LogManager.getLogger(RunDataFiles.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private RunDataFiles() {
    }

    /// Loads run data from a file.
    ///
    /// @throws IOException if reading fails
    /// @throws DataFileException if the file is missing, malformed or describes invalid data
    public static RunData load(Path path) throws IOException, DataFileException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new DataFileException("Run data file not found: " + path);
        }
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static RunData fromJson(String json) throws DataFileException {
        RunFileJson file;
        try {
            file = ReductionGsonConfig.gson().fromJson(json, RunFileJson.class);
        } catch (JsonParseException e) {
            throw new DataFileException("Invalid run data JSON: " + e.getMessage(), e);
        }
        if (file == null) {
            throw new DataFileException("Run data file is empty");
        }
        if (file.periods == null || file.periods.isEmpty()) {
            throw new DataFileException("Run data has no periods");
        }
        try {
            List<ChannelDataset> periods = new ArrayList<>(file.periods.size());
            for (PeriodJson period : file.periods) {
                periods.add(toDataset(file, period));
            }
            return periods.size() == 1 ? RunData.of(periods.get(0)) : RunData.of(new PeriodSet(periods));
        } catch (ReductionException e) {
            throw new DataFileException("Invalid run data: " + e.getMessage(), e);
        }
    }

    /// Saves run data atomically.
    ///
    /// @throws IOException if writing fails
    public static void save(Path path, RunData data) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        writeAtomically(path, toJson(data));
    }

    public static String toJson(RunData data) {
        PeriodSet periods = data.normalize();
        RunMetadata metadata = periods.first().metadata();
        RunFileJson file = new RunFileJson();
        file.instrument = metadata.instrument();
        file.runNumber = metadata.runNumber();
        file.goodFrames = metadata.goodFrames();
        file.periods = new ArrayList<>();
        for (ChannelDataset period : periods) {
            PeriodJson json = fromDataset(period);
            if (!Objects.equals(period.metadata().goodFrames(), metadata.goodFrames())) {
                json.goodFrames = period.metadata().goodFrames();
            }
            file.periods.add(json);
        }
        return ReductionGsonConfig.gson().toJson(file);
    }

    static void writeAtomically(Path path, String json) throws IOException {
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        moveIntoPlace(tempPath, path,
            (source, target) -> Files.move(source, target, StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE));
    }

    /// Moves a finished temp file over the target, falling back to a plain
    /// replacing move where the filesystem has no atomic rename.
    static void moveIntoPlace(Path tempPath, Path path, AtomicMove atomicMove) throws IOException {
        try {
            atomicMove.move(tempPath, path);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing it directly", path);
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    interface AtomicMove {
        void move(Path source, Path target) throws IOException;
    }

    private static ChannelDataset toDataset(RunFileJson file, PeriodJson period) throws DataFileException {
        if (period.spectra == null || period.spectra.isEmpty()) {
            throw new DataFileException("A period has no spectra");
        }
        Double frames = period.goodFrames != null ? period.goodFrames : file.goodFrames;
        RunMetadata metadata = new RunMetadata(file.instrument, file.runNumber, frames);
        List<Spectrum> spectra = new ArrayList<>(period.spectra.size());
        for (SpectrumJson s : period.spectra) {
            if (s.x == null || s.y == null || s.channels == null) {
                throw new DataFileException("A spectrum needs channels, x and y");
            }
            List<Integer> channels = Arrays.stream(s.channels).boxed().toList();
            spectra.add(s.e == null ? Spectrum.ofCounts(s.x, s.y, channels) : new Spectrum(s.x, s.y, s.e, channels));
        }
        return new ChannelDataset(spectra, metadata, period.yUnit, period.tags);
    }

    private static PeriodJson fromDataset(ChannelDataset dataset) {
        PeriodJson period = new PeriodJson();
        period.spectra = new ArrayList<>(dataset.spectrumCount());
        for (Spectrum s : dataset.spectra()) {
            SpectrumJson json = new SpectrumJson();
            json.channels = s.channels().stream().mapToInt(Integer::intValue).toArray();
            json.x = s.x();
            json.y = s.y();
            json.e = s.e();
            period.spectra.add(json);
        }
        if (!ChannelDataset.UNIT_COUNTS.equals(dataset.yUnit())) {
            period.yUnit = dataset.yUnit();
        }
        if (!dataset.tags().isEmpty()) {
            period.tags = new LinkedHashMap<>(dataset.tags());
        }
        return period;
    }

    /// Raised when a data file cannot be turned into run data.
    public static class DataFileException extends Exception {

        public DataFileException(String message) {
            super(message);
        }

        public DataFileException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static final class RunFileJson {
        @SerializedName("instrument")
        String instrument;

        @SerializedName("run_number")
        int runNumber;

        @SerializedName("good_frames")
        Double goodFrames;

        @SerializedName("periods")
        List<PeriodJson> periods;
    }

    private static final class PeriodJson {
        @SerializedName("good_frames")
        Double goodFrames;

        @SerializedName("y_unit")
        String yUnit;

        @SerializedName("tags")
        Map<String, String> tags;

        @SerializedName("spectra")
        List<SpectrumJson> spectra;
    }

    private static final class SpectrumJson {
        @SerializedName("channels")
        int[] channels;

        @SerializedName("x")
        double[] x;

        @SerializedName("y")
        double[] y;

        @SerializedName("e")
        double[] e;
    }
}
