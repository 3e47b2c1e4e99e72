package io.musrtools.reduction.correct;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/// Dead-time coefficients (microseconds) keyed by channel identifier, one row per channel.
public final class DeadTimeTable {

    private final Map<Integer, Double> rows;

    public DeadTimeTable(Map<Integer, Double> rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        for (Map.Entry<Integer, Double> row : rows.entrySet()) {
            Double tau = row.getValue();
            if (tau == null || !Double.isFinite(tau) || tau < 0) {
                throw new ValidationException("Dead time for channel " + row.getKey()
                    + " must be a finite non-negative number, got " + tau);
            }
        }
        this.rows = Collections.unmodifiableMap(new LinkedHashMap<>(rows));
    }

    /// Builds a table where row `i` belongs to channel `firstChannel + i`.
    public static DeadTimeTable sequential(int firstChannel, double... deadTimes) {
        Map<Integer, Double> rows = new LinkedHashMap<>();
        for (int i = 0; i < deadTimes.length; i++) {
            rows.put(firstChannel + i, deadTimes[i]);
        }
        return new DeadTimeTable(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public OptionalDouble deadTime(int channelId) {
        Double tau = rows.get(channelId);
        return tau == null ? OptionalDouble.empty() : OptionalDouble.of(tau);
    }

    public Map<Integer, Double> rows() {
        return rows;
    }
}
