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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An ordered collection of spectra from one period of one run.
 *
 * <h2>Invariants</h2>
 *
 * <ul>
 *   <li>at least one spectrum</li>
 *   <li>all spectra share the same axis form (all histogram or all point data)</li>
 *   <li>individual spectra may have distinct X ranges, which ragged cropping produces</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ChannelDataset period = ChannelDataset.builder()
 *     .metadata(new RunMetadata("MUSR", 15189, 2000.0))
 *     .addSpectrum(Spectrum.ofCounts(edges, counts1, List.of(1)))
 *     .addSpectrum(Spectrum.ofCounts(edges, counts2, List.of(2)))
 *     .build();
 * }</pre>
 *
 * <p>Instances are immutable; every {@code with*} method returns a new dataset.
 */
public final class ChannelDataset {

    /** Y unit of raw counting data. */
    public static final String UNIT_COUNTS = "Counts";
    /** Y unit of asymmetry data. */
    public static final String UNIT_ASYMMETRY = "Asymmetry";

    private final List<Spectrum> spectra;
    private final RunMetadata metadata;
    private final String yUnit;
    private final Map<String, String> tags;

    public ChannelDataset(List<Spectrum> spectra, RunMetadata metadata, String yUnit, Map<String, String> tags) {
        Objects.requireNonNull(spectra, "spectra cannot be null");
        if (spectra.isEmpty()) {
            throw new ValidationException("A dataset needs at least one spectrum");
        }
        boolean histogram = spectra.get(0).isHistogram();
        for (Spectrum s : spectra) {
            Objects.requireNonNull(s, "spectra cannot contain null");
            if (s.isHistogram() != histogram) {
                throw new ValidationException("Spectra in one dataset must all be histogram or all point data");
            }
        }
        this.spectra = List.copyOf(spectra);
        this.metadata = metadata == null ? RunMetadata.UNKNOWN : metadata;
        this.yUnit = yUnit == null ? UNIT_COUNTS : yUnit;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags == null ? Map.of() : tags));
    }

    public ChannelDataset(List<Spectrum> spectra, RunMetadata metadata) {
        this(spectra, metadata, UNIT_COUNTS, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Spectrum> spectra() {
        return spectra;
    }

    public Spectrum spectrum(int index) {
        return spectra.get(index);
    }

    public int spectrumCount() {
        return spectra.size();
    }

    public RunMetadata metadata() {
        return metadata;
    }

    public String yUnit() {
        return yUnit;
    }

    /** @return informational tags, in insertion order */
    public Map<String, String> tags() {
        return tags;
    }

    public boolean isHistogram() {
        return spectra.get(0).isHistogram();
    }

    /** @return the union of every spectrum's channel identifiers */
    public SortedSet<Integer> channelIds() {
        SortedSet<Integer> ids = new TreeSet<>();
        for (Spectrum s : spectra) {
            ids.addAll(s.channels());
        }
        return ids;
    }

    /**
     * Finds the spectrum owning a channel.
     *
     * @return the spectrum position, or -1 when no spectrum owns the channel
     */
    public int indexOfChannel(int channelId) {
        for (int i = 0; i < spectra.size(); i++) {
            if (spectra.get(i).channels().contains(channelId)) {
                return i;
            }
        }
        return -1;
    }

    /** @return the smallest first X value over all spectra */
    public double minX() {
        double min = Double.POSITIVE_INFINITY;
        for (Spectrum s : spectra) {
            min = Math.min(min, s.firstX());
        }
        return min;
    }

    /** @return the largest last X value over all spectra */
    public double maxX() {
        double max = Double.NEGATIVE_INFINITY;
        for (Spectrum s : spectra) {
            max = Math.max(max, s.lastX());
        }
        return max;
    }

    public ChannelDataset withSpectra(List<Spectrum> newSpectra) {
        return new ChannelDataset(newSpectra, metadata, yUnit, tags);
    }

    public ChannelDataset withMetadata(RunMetadata newMetadata) {
        return new ChannelDataset(spectra, newMetadata, yUnit, tags);
    }

    public ChannelDataset withYUnit(String newUnit) {
        return new ChannelDataset(spectra, metadata, newUnit, tags);
    }

    public ChannelDataset withTag(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(tags);
        merged.put(key, value);
        return new ChannelDataset(spectra, metadata, yUnit, merged);
    }

    public ChannelDataset withTags(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(tags);
        merged.putAll(extra);
        return new ChannelDataset(spectra, metadata, yUnit, merged);
    }

    /**
     * Returns an independent copy: new spectrum instances with copied arrays.
     */
    public ChannelDataset copy() {
        List<Spectrum> copied = new ArrayList<>(spectra.size());
        for (Spectrum s : spectra) {
            copied.add(new Spectrum(s.x(), s.y(), s.e(), s.channels()));
        }
        return new ChannelDataset(copied, metadata, yUnit, tags);
    }

    /**
     * Elementwise comparison of every spectrum's X, Y, E and channel set.
     * Metadata, unit and tags are not compared.
     */
    public boolean contentEquals(ChannelDataset other) {
        if (other == null || other.spectra.size() != spectra.size()) {
            return false;
        }
        for (int i = 0; i < spectra.size(); i++) {
            if (!spectra.get(i).contentEquals(other.spectra.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "ChannelDataset{spectra=" + spectra.size() + ", unit=" + yUnit
            + ", run=" + metadata.instrument() + metadata.runNumber() + "}";
    }

    /** Fluent builder for {@link ChannelDataset}. */
    public static final class Builder {
        private final List<Spectrum> spectra = new ArrayList<>();
        private RunMetadata metadata = RunMetadata.UNKNOWN;
        private String yUnit = UNIT_COUNTS;
        private final Map<String, String> tags = new LinkedHashMap<>();

        public Builder addSpectrum(Spectrum spectrum) {
            spectra.add(spectrum);
            return this;
        }

        public Builder spectra(List<Spectrum> all) {
            spectra.clear();
            spectra.addAll(all);
            return this;
        }

        public Builder metadata(RunMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder yUnit(String yUnit) {
            this.yUnit = yUnit;
            return this;
        }

        public Builder tag(String key, String value) {
            tags.put(key, value);
            return this;
        }

        public ChannelDataset build() {
            return new ChannelDataset(spectra, metadata, yUnit, tags);
        }
    }
}
