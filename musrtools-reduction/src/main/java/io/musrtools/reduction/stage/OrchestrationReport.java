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

import java.util.List;

/**
 * What an {@link OrchestrationStage} run published.
 *
 * @param label the run label used in every name
 * @param publishedNames names written to the registry, in publication order
 * @param state the state the run finished in
 */
public record OrchestrationReport(String label, List<String> publishedNames, OrchestrationState state) {

    public OrchestrationReport {
        publishedNames = List.copyOf(publishedNames);
    }
}
