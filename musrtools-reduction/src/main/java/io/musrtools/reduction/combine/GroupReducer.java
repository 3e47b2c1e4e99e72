package io.musrtools.reduction.combine;

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

import io.musrtools.reduction.IncompatibleShapeException;
import io.musrtools.reduction.ValidationException;
import io.musrtools.reduction.model.ChannelDataset;
import io.musrtools.reduction.model.PeriodSet;
import io.musrtools.reduction.model.Spectrum;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sums the spectra owned by a set of channels into one spectrum.
 *
 * <h2>Contract</h2>
 *
 * <ul>
 *   <li>Every requested channel must resolve to a spectrum, and no two requested
 *       channels may resolve to the same spectrum.</li>
 *   <li>X comes from the first resolved spectrum; Y is the elementwise sum and
 *       E the quadrature sum.</li>
 *   <li>The output spectrum owns the union of the resolved spectra's channels.</li>
 * </ul>
 *
 * <p>Grouping is applied per period, before periods are combined.
 */
public final class GroupReducer {

    /**
     * Reduces one dataset to a single-spectrum dataset.
     *
     * @throws ValidationException if channels are missing or resolve to the same spectrum
     * @throws IncompatibleShapeException if the resolved spectra differ in length
     */
    public ChannelDataset reduceGroup(ChannelDataset dataset, Collection<Integer> channelIds) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(channelIds, "channelIds cannot be null");
        if (channelIds.isEmpty()) {
            throw new ValidationException("A group needs at least one channel");
        }
        List<Integer> positions = resolve(dataset, channelIds);

        Spectrum first = dataset.spectrum(positions.get(0));
        int n = first.size();
        double[] y = new double[n];
        double[] e2 = new double[n];
        Set<Integer> owners = new TreeSet<>();
        for (int position : positions) {
            Spectrum s = dataset.spectrum(position);
            if (s.size() != n) {
                throw new IncompatibleShapeException("Cannot group spectra of " + n + " and " + s.size()
                    + " bins (channels " + first.channels() + " and " + s.channels() + ")");
            }
            for (int k = 0; k < n; k++) {
                y[k] += s.y(k);
                e2[k] += s.e(k) * s.e(k);
            }
            owners.addAll(s.channels());
        }
        double[] e = new double[n];
        for (int k = 0; k < n; k++) {
            e[k] = Math.sqrt(e2[k]);
        }
        return dataset.withSpectra(List.of(new Spectrum(first.x(), y, e, owners)));
    }

    /**
     * Reduces every period of a set with the same channels.
     */
    public PeriodSet reduceGroup(PeriodSet periods, Collection<Integer> channelIds) {
        Objects.requireNonNull(periods, "periods cannot be null");
        return periods.map(period -> reduceGroup(period, channelIds));
    }

    /**
     * Checks that a group can be reduced from a dataset without reducing it.
     *
     * @throws ValidationException if channels are missing or resolve to the same spectrum
     */
    public static void requireResolvable(ChannelDataset dataset, Collection<Integer> channelIds) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(channelIds, "channelIds cannot be null");
        if (channelIds.isEmpty()) {
            throw new ValidationException("A group needs at least one channel");
        }
        resolve(dataset, channelIds);
    }

    private static List<Integer> resolve(ChannelDataset dataset, Collection<Integer> channelIds) {
        Set<Integer> positions = new LinkedHashSet<>();
        List<Integer> missing = new ArrayList<>();
        for (Integer id : channelIds) {
            int position = dataset.indexOfChannel(id);
            if (position < 0) {
                missing.add(id);
            } else {
                positions.add(position);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Detectors not found in the data: " + missing);
        }
        if (positions.size() != channelIds.size()) {
            throw new ValidationException("Detectors not found: " + channelIds.size() + " channels requested but "
                + positions.size() + " distinct spectra resolved (duplicate channels?)");
        }
        return new ArrayList<>(positions);
    }
}
