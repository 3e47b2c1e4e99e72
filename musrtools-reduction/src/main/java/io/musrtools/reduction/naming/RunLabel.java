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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * The label identifying which runs of an instrument a dataset came from.
 *
 * <h2>Format</h2>
 *
 * <pre>{@code
 * MUSR00015189            one run, zero padded
 * MUSR00015189-91         consecutive runs 15189 to 15191
 * MUSR00015189-91, 15193  two ranges; only the first run is padded
 * }</pre>
 *
 * <p>The end of a range drops the leading digits it shares with the start.
 *
 * @param instrument instrument name, may be empty
 * @param runs run numbers, sorted and distinct
 */
public record RunLabel(String instrument, List<Integer> runs) {

    /** Zero padding used when an instrument does not specify one. */
    public static final int DEFAULT_ZERO_PADDING = 8;

    /**
     * A range of consecutive run numbers, both ends inclusive.
     */
    public record RunRange(int first, int last) {
    }

    public RunLabel {
        instrument = instrument == null ? "" : instrument;
        Objects.requireNonNull(runs, "runs cannot be null");
        if (runs.isEmpty()) {
            throw new ValidationException("A run label needs at least one run");
        }
        runs = List.copyOf(new TreeSet<>(runs));
    }

    public static RunLabel of(String instrument, Integer... runs) {
        return new RunLabel(instrument, List.of(runs));
    }

    public String format() {
        return format(DEFAULT_ZERO_PADDING);
    }

    public String format(int zeroPadding) {
        StringBuilder label = new StringBuilder(instrument);
        List<RunRange> ranges = findConsecutiveRuns(runs);
        for (int i = 0; i < ranges.size(); i++) {
            RunRange range = ranges.get(i);
            String first = Integer.toString(range.first());
            if (i == 0) {
                label.append("0".repeat(Math.max(0, zeroPadding - first.length())));
            } else {
                label.append(", ");
            }
            label.append(first);
            if (range.last() != range.first()) {
                label.append('-').append(dropSharedPrefix(first, Integer.toString(range.last())));
            }
        }
        return label.toString();
    }

    /**
     * Splits sorted run numbers into maximal consecutive ranges.
     */
    public static List<RunRange> findConsecutiveRuns(List<Integer> runs) {
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(runs));
        List<RunRange> ranges = new ArrayList<>();
        if (sorted.isEmpty()) {
            return ranges;
        }
        int start = sorted.get(0);
        int previous = start;
        for (int i = 1; i < sorted.size(); i++) {
            int run = sorted.get(i);
            if (run != previous + 1) {
                ranges.add(new RunRange(start, previous));
                start = run;
            }
            previous = run;
        }
        ranges.add(new RunRange(start, previous));
        return ranges;
    }

    /**
     * Parses a label back into its instrument and runs.
     *
     * @throws ValidationException if the label carries no run number
     */
    public static RunLabel parse(String label) {
        Objects.requireNonNull(label, "label cannot be null");
        int digits = 0;
        while (digits < label.length() && !Character.isDigit(label.charAt(digits))) {
            digits++;
        }
        String instrument = label.substring(0, digits);
        String rest = label.substring(digits).trim();
        if (rest.isEmpty()) {
            throw new ValidationException("No run number in label '" + label + "'");
        }
        List<Integer> runs = new ArrayList<>();
        for (String part : rest.split(",")) {
            String range = part.trim();
            int dash = range.indexOf('-');
            try {
                if (dash < 0) {
                    runs.add(Integer.parseInt(range));
                    continue;
                }
                String firstText = range.substring(0, dash);
                String endText = range.substring(dash + 1);
                int first = Integer.parseInt(firstText);
                String unpaddedFirst = Integer.toString(first);
                String lastText = endText.length() < unpaddedFirst.length()
                    ? unpaddedFirst.substring(0, unpaddedFirst.length() - endText.length()) + endText
                    : endText;
                int last = Integer.parseInt(lastText);
                if (last < first) {
                    throw new ValidationException("Descending run range '" + range + "' in label '" + label + "'");
                }
                for (int run = first; run <= last; run++) {
                    runs.add(run);
                }
            } catch (NumberFormatException ex) {
                throw new ValidationException("Malformed run range '" + range + "' in label '" + label + "'", ex);
            }
        }
        return new RunLabel(instrument, runs);
    }

    private static String dropSharedPrefix(String first, String last) {
        for (int i = 0; i < first.length() && i < last.length(); i++) {
            if (first.charAt(i) != last.charAt(i)) {
                return last.substring(i);
            }
        }
        return last;
    }

    @Override
    public String toString() {
        return format();
    }
}
