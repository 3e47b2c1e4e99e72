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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/// Parses and formats channel identifier lists written as comma separated
/// single values and inclusive ranges, e.g. `1-5,8`.
///
/// Parsing keeps duplicates and order so callers can detect a repeated
/// identifier; formatting sorts, de-duplicates and compresses runs.
public final class ChannelIdList {

    private ChannelIdList() {
    }

    /// @param text e.g. `"1-5, 8"`
    /// @return identifiers in written order, ranges expanded
    /// @throws ValidationException if the text is empty or malformed
    public static List<Integer> parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Channel list cannot be empty");
        }
        List<Integer> ids = new ArrayList<>();
        for (String token : text.split(",")) {
            String part = token.trim();
            if (part.isEmpty()) {
                throw new ValidationException("Empty entry in channel list '" + text + "'");
            }
            int dash = part.indexOf('-', 1);
            try {
                if (dash > 0) {
                    int start = Integer.parseInt(part.substring(0, dash).trim());
                    int end = Integer.parseInt(part.substring(dash + 1).trim());
                    if (end < start) {
                        throw new ValidationException("Descending range '" + part + "' in channel list '" + text + "'");
                    }
                    for (int id = start; id <= end; id++) {
                        ids.add(id);
                    }
                } else {
                    ids.add(Integer.parseInt(part));
                }
            } catch (NumberFormatException ex) {
                throw new ValidationException("Not a channel number: '" + part + "' in '" + text + "'", ex);
            }
        }
        return ids;
    }

    /// @return compact form, e.g. `[8, 1, 2, 3]` gives `"1-3,8"`
    public static String format(Collection<Integer> ids) {
        StringBuilder sb = new StringBuilder();
        Integer start = null;
        Integer previous = null;
        for (int id : new TreeSet<>(ids)) {
            if (start == null) {
                start = id;
            } else if (id != previous + 1) {
                appendRange(sb, start, previous);
                start = id;
            }
            previous = id;
        }
        if (start != null) {
            appendRange(sb, start, previous);
        }
        return sb.toString();
    }

    private static void appendRange(StringBuilder sb, int start, int end) {
        if (sb.length() > 0) {
            sb.append(',');
        }
        sb.append(start);
        if (end != start) {
            sb.append('-').append(end);
        }
    }
}
