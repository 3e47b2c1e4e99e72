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

/// Base type for every failure raised by the reduction pipeline itself.
///
/// Failures raised by collaborators (registry implementations, file access)
/// are not wrapped; they propagate unchanged.
///
/// @see ValidationException
/// @see PeriodIndexException
/// @see IncompatibleShapeException
public class ReductionException extends RuntimeException {

    public ReductionException(String message) {
        super(message);
    }

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
