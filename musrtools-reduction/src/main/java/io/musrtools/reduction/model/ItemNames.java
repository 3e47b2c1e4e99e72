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

import java.util.regex.Pattern;

/// Naming rule shared by groups and pairs. Names end up as a field of a
/// `;`-separated published name, so they are restricted to letters, digits
/// and underscores, and may not collide with the item-type field values.
public final class ItemNames {

    private static final Pattern LEGAL = Pattern.compile("[A-Za-z0-9_]+");

    private ItemNames() {
    }

    public static boolean isValid(String name) {
        return name != null
            && LEGAL.matcher(name).matches()
            && !name.equals("Group")
            && !name.equals("Pair");
    }

    /// @param kind "group" or "pair", used in the message
    /// @throws ValidationException if the name breaks the rule
    public static String requireValid(String name, String kind) {
        if (!isValid(name)) {
            throw new ValidationException("Invalid " + kind + " name '" + name
                + "': use letters, digits and underscores only, and not 'Group' or 'Pair'");
        }
        return name;
    }
}
