package io.musrtools.reduction.naming;

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

/// Whether a published dataset belongs to a group or a pair.
public enum ItemType {
    GROUP("Group"),
    PAIR("Pair");

    private final String label;

    ItemType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ItemType fromLabel(String label) {
        for (ItemType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new ValidationException("Unknown item type '" + label + "', expected Group or Pair");
    }
}
