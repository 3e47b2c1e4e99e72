package io.musrtools.reduction.registry;

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

import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.RunData;

import java.util.List;

/// Named store that reduced datasets are published to and raw data is read from.
///
/// Values are [RunData], so one name holds either a single dataset or a
/// whole period set.
public interface DatasetRegistry {

    /// @throws io.musrtools.reduction.ValidationException if nothing is stored under the name
    RunData get(String name);

    /// Stores a value.
    ///
    /// @param overwrite whether an existing value under the same name may be replaced
    /// @throws io.musrtools.reduction.ValidationException if the name is taken and overwrite is false
    void put(String name, RunData value, boolean overwrite);

    boolean exists(String name);

    /// @return stored names in the order they were first stored
    List<String> names();

    /// Convenience for storing one dataset.
    default void put(String name, ChannelDataset dataset, boolean overwrite) {
        put(name, RunData.of(dataset), overwrite);
    }
}
