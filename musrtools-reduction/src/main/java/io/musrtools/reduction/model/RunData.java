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

import java.util.List;
import java.util.Objects;

/// Data as it arrives from a loader or sits in a registry: either one dataset
/// or a list of per-period datasets.
///
/// Every stage works on a [PeriodSet]; [#normalize()] is the single place where
/// the two shapes converge.
///
/// ```java
/// RunData data = registry.get("MUSR00015189");
/// PeriodSet periods = data.normalize();
/// ```
public sealed interface RunData permits RunData.Single, RunData.Periods {

    /// @return the data as a period set; a single dataset becomes a one-period set
    PeriodSet normalize();

    /// @return the number of periods represented
    int periodCount();

    static RunData of(ChannelDataset dataset) {
        return new Single(dataset);
    }

    static RunData of(List<ChannelDataset> periods) {
        return new Periods(periods);
    }

    static RunData of(PeriodSet periodSet) {
        return periodSet.isMultiPeriod() ? new Periods(periodSet.periods()) : new Single(periodSet.first());
    }

    /// A single dataset.
    record Single(ChannelDataset dataset) implements RunData {
        public Single {
            Objects.requireNonNull(dataset, "dataset cannot be null");
        }

        @Override
        public PeriodSet normalize() {
            return PeriodSet.of(dataset);
        }

        @Override
        public int periodCount() {
            return 1;
        }
    }

    /// One dataset per period.
    record Periods(List<ChannelDataset> datasets) implements RunData {
        public Periods {
            datasets = List.copyOf(Objects.requireNonNull(datasets, "datasets cannot be null"));
        }

        @Override
        public PeriodSet normalize() {
            return new PeriodSet(datasets);
        }

        @Override
        public int periodCount() {
            return datasets.size();
        }
    }
}
