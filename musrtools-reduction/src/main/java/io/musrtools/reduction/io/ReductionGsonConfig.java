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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Shared Gson configuration for run data, grouping and exported dataset files.
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | Enabled |
/// | HTML escaping | Disabled |
/// | NaN / Infinity | Serialized |
///
/// The instance is thread-safe.
public final class ReductionGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private ReductionGsonConfig() {
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    private static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
