/// Correction and combination of muon spectroscopy histograms.
///
/// Raw per-channel, per-period counts go through three stages:
///
/// ```text
/// raw periods -> PreProcessStage -> GroupingStage (per group) -> PairingStage (per pair)
///
/// OrchestrationStage drives all three and publishes the outputs to a DatasetRegistry.
/// ```
///
/// All failures are unchecked [io.musrtools.reduction.ReductionException]s:
/// [io.musrtools.reduction.ValidationException] for bad configuration,
/// [io.musrtools.reduction.PeriodIndexException] for periods that do not exist and
/// [io.musrtools.reduction.IncompatibleShapeException] for data that cannot be combined.
package io.musrtools.reduction;

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
