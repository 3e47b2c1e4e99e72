package io.musrtools.reduction.stage;

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

/// Progress of one [OrchestrationStage] run, in the order the states are reached.
public enum OrchestrationState {
    /// Nothing has run yet.
    CREATED,
    /// Names, channel coverage, pair references and periods have been checked.
    VALIDATED,
    /// Every group's counts are published.
    GROUPS_APPLIED,
    /// Every pair's asymmetry is published.
    PAIRS_APPLIED,
    /// Every group's asymmetry is published; skipped unless requested.
    GROUP_ASYMMETRY_APPLIED,
    /// The run finished.
    PUBLISHED,
    /// Publication stopped part way; items published before the failure stay in the registry.
    FAILED
}
