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
import io.musrtools.reduction.model.ItemNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The name under which a reduced dataset is published.
 *
 * <h2>Format</h2>
 *
 * <pre>{@code
 * <label>; <Group|Pair>; <item>; <Counts|Asym|Logs>; [<periods>; ]#<version>[suffix]
 *
 * MUSR00015189; Group; fwd; Counts; #1
 * MUSR00015189; Pair; long; Asym; 1+2-3; #2_Raw
 * }</pre>
 *
 * <p>The periods field is present only for multi-period runs. The suffix is
 * one of the {@link NameVariant}s.
 *
 * @param label run label or a caller supplied override
 * @param itemType group or pair
 * @param itemName name of the group or pair
 * @param plotType quantity held
 * @param periods compact period string, empty when the run has one period
 * @param version version number, at least 1
 * @param variant suffix variant
 */
public record DatasetName(String label, ItemType itemType, String itemName, PlotType plotType,
                          String periods, int version, NameVariant variant) {

    private static final String SEPARATOR = "; ";
    private static final Pattern VERSION = Pattern.compile("#?(\\d{1,9})");

    public DatasetName {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(itemType, "itemType cannot be null");
        Objects.requireNonNull(itemName, "itemName cannot be null");
        Objects.requireNonNull(plotType, "plotType cannot be null");
        periods = periods == null ? "" : periods;
        variant = variant == null ? NameVariant.PRIMARY : variant;
        if (version < 1) {
            throw new ValidationException("Version must be at least 1, got " + version);
        }
    }

    public static DatasetName group(String label, String name, PlotType plotType, String periods, int version) {
        return new DatasetName(label, ItemType.GROUP, ItemNames.requireValid(name, "group"), plotType, periods, version,
            NameVariant.PRIMARY);
    }

    public static DatasetName pair(String label, String name, PlotType plotType, String periods, int version) {
        return new DatasetName(label, ItemType.PAIR, ItemNames.requireValid(name, "pair"), plotType, periods, version,
            NameVariant.PRIMARY);
    }

    public DatasetName withVariant(NameVariant newVariant) {
        return new DatasetName(label, itemType, itemName, plotType, periods, version, newVariant);
    }

    /** @return the published name */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(label).append(SEPARATOR)
            .append(itemType.label()).append(SEPARATOR)
            .append(itemName).append(SEPARATOR)
            .append(plotType.label()).append(SEPARATOR);
        if (!periods.isEmpty()) {
            sb.append(periods).append(SEPARATOR);
        }
        sb.append('#').append(version);
        sb.append(variant.suffix());
        return sb.toString();
    }

    /**
     * Parses a published name.
     *
     * <p>Fields are trimmed. An unrecognised plot type reads as {@link PlotType#LOGS};
     * a version that is not a number reads as 1.
     *
     * @throws ValidationException if the name has fewer than five fields
     */
    public static DatasetName parse(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        NameVariant variant = NameVariant.of(name);
        String body = name.substring(0, name.length() - variant.suffix().length());

        List<String> tokens = new ArrayList<>();
        for (String token : body.split(";")) {
            tokens.add(token.trim());
        }
        if (tokens.size() < 5) {
            throw new ValidationException("Published name '" + name + "' has " + tokens.size()
                + " fields, at least 5 are required");
        }
        String periods = "";
        String versionToken = tokens.get(4);
        if (tokens.size() > 5) {
            periods = tokens.get(4);
            versionToken = tokens.get(5);
        }
        return new DatasetName(tokens.get(0), ItemType.fromLabel(tokens.get(1)), tokens.get(2),
            PlotType.fromLabel(tokens.get(3)), periods, parseVersion(versionToken), variant);
    }

    private static int parseVersion(String token) {
        Matcher matcher = VERSION.matcher(token);
        if (!matcher.matches()) {
            return 1;
        }
        return Math.max(1, Integer.parseInt(matcher.group(1)));
    }

    @Override
    public String toString() {
        return format();
    }
}
