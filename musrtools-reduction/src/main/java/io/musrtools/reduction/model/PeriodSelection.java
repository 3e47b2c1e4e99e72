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
import java.util.List;
import java.util.Objects;

/**
 * Which periods of a run are summed and which are subtracted.
 *
 * <p>Indices are one-based. The compact form joins summed periods with
 * {@code +} and prefixes each subtracted period with {@code -}, so summing
 * 1 and 2 and subtracting 3 reads {@code 1+2-3}.
 *
 * @param summed periods added together
 * @param subtracted periods subtracted from the sum
 */
public record PeriodSelection(List<Integer> summed, List<Integer> subtracted) {

    /** Period 1 alone. */
    public static final PeriodSelection FIRST = new PeriodSelection(List.of(1), List.of());

    public PeriodSelection {
        summed = List.copyOf(Objects.requireNonNull(summed, "summed cannot be null"));
        subtracted = List.copyOf(Objects.requireNonNull(subtracted, "subtracted cannot be null"));
        if (summed.isEmpty() && subtracted.isEmpty()) {
            throw new ValidationException("At least one summed or subtracted period is required");
        }
    }

    public static PeriodSelection summing(Integer... periods) {
        return new PeriodSelection(List.of(periods), List.of());
    }

    public boolean hasSubtracted() {
        return !subtracted.isEmpty();
    }

    /** @throws io.musrtools.reduction.PeriodIndexException if an index is outside the set */
    public void requireValidFor(PeriodSet periods) {
        summed.forEach(periods::requireValidPeriod);
        subtracted.forEach(periods::requireValidPeriod);
    }

    /** @return the compact form, e.g. {@code 1+2-3} */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < summed.size(); i++) {
            if (i > 0) {
                sb.append('+');
            }
            sb.append(summed.get(i));
        }
        for (Integer period : subtracted) {
            sb.append('-').append(period);
        }
        return sb.toString();
    }

    /**
     * Parses the compact form.
     *
     * @throws ValidationException on anything but digits separated by {@code +} and {@code -}
     */
    public static PeriodSelection parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Empty period string");
        }
        List<Integer> summed = new ArrayList<>();
        List<Integer> subtracted = new ArrayList<>();
        String compact = text.replace(" ", "");
        int i = 0;
        while (i < compact.length()) {
            char sign = '+';
            if (compact.charAt(i) == '+' || compact.charAt(i) == '-') {
                sign = compact.charAt(i);
                i++;
            }
            int start = i;
            while (i < compact.length() && Character.isDigit(compact.charAt(i))) {
                i++;
            }
            if (start == i) {
                throw new ValidationException("Malformed period string '" + text + "'");
            }
            int period = Integer.parseInt(compact.substring(start, i));
            (sign == '-' ? subtracted : summed).add(period);
        }
        return new PeriodSelection(summed, subtracted);
    }

    @Override
    public String toString() {
        return format();
    }
}
