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

import io.musrtools.reduction.naming.PlotType;

/// What a group reduction produces.
public enum AnalysisKind {
    COUNTS(PlotType.COUNTS),
    ASYMMETRY(PlotType.ASYMMETRY);

    private final PlotType plotType;

    AnalysisKind(PlotType plotType) {
        this.plotType = plotType;
    }

    /// @return the plot type written into published names
    public PlotType plotType() {
        return plotType;
    }
}
