/// Immutable data model: spectra, datasets, period sets and grouping specifications.
///
/// ## Key Components
///
/// - [io.musrtools.reduction.model.Spectrum]: X/Y/E arrays and the owning channels
/// - [io.musrtools.reduction.model.ChannelDataset]: ordered spectra plus run metadata
/// - [io.musrtools.reduction.model.PeriodSet]: one dataset per period, same layout
/// - [io.musrtools.reduction.model.RunData]: single dataset or period list, as loaded
/// - [io.musrtools.reduction.model.GroupingSpec]: named groups and pairs
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
