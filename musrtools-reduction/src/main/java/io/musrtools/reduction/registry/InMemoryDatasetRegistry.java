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

import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.RunData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Insertion-ordered [DatasetRegistry] held in memory. Not thread-safe.
public final class InMemoryDatasetRegistry implements DatasetRegistry {

    private static final Logger logger = LogManager.getLogger(InMemoryDatasetRegistry.class);

    private final Map<String, RunData> entries = new LinkedHashMap<>();

    @Override
    public RunData get(String name) {
        RunData value = entries.get(name);
        if (value == null) {
            throw new ValidationException("Nothing is stored under '" + name + "'");
        }
        return value;
    }

    @Override
    public void put(String name, RunData value, boolean overwrite) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (name.isBlank()) {
            throw new ValidationException("Registry names cannot be blank");
        }
        if (!overwrite && entries.containsKey(name)) {
            throw new ValidationException("'" + name + "' already exists and overwrite is off");
        }
        if (entries.put(name, value) != null) {
            logger.debug("Replaced {}", name);
        }
    }

    @Override
    public boolean exists(String name) {
        return entries.containsKey(name);
    }

    @Override
    public List<String> names() {
        return new ArrayList<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }
}
