package io.musrtools.reduction.model;

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

/**
 * Per-run information carried alongside the counts.
 *
 * @param instrument instrument name, letters only (e.g. {@code MUSR})
 * @param runNumber run number
 * @param goodFrames number of valid measurement frames, or null when the run did not record it
 */
public record RunMetadata(String instrument, int runNumber, Double goodFrames) {

    /** Metadata for data that did not come from an identifiable run. */
    public static final RunMetadata UNKNOWN = new RunMetadata("", 0, null);

    public RunMetadata {
        instrument = instrument == null ? "" : instrument;
    }

    /** @return true when a good-frame count is recorded, even if it is zero */
    public boolean hasGoodFrames() {
        return goodFrames != null;
    }

    public RunMetadata withGoodFrames(Double frames) {
        return new RunMetadata(instrument, runNumber, frames);
    }
}
