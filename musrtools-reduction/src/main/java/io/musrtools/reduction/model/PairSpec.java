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

import io.musrtools.reduction.ValidationException;

import java.util.Objects;

/**
 * Two opposite groups combined into one asymmetry curve.
 *
 * @param name legal item name, see {@link ItemNames}
 * @param forward name of the forward group
 * @param backward name of the backward group
 * @param alpha balance factor applied to the backward group, must be positive
 */
public record PairSpec(String name, String forward, String backward, double alpha) {

    public PairSpec {
        ItemNames.requireValid(name, "pair");
        Objects.requireNonNull(forward, "forward cannot be null");
        Objects.requireNonNull(backward, "backward cannot be null");
        requirePositiveAlpha(alpha);
    }

    /**
     * @throws ValidationException unless alpha is a finite positive number
     */
    public static void requirePositiveAlpha(double alpha) {
        if (!(alpha > 0) || Double.isInfinite(alpha)) {
            throw new ValidationException("Alpha must be a positive number, got " + alpha);
        }
    }
}
