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

import io.musrtools.reduction.PeriodIndexException;
import io.musrtools.reduction.ValidationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/// An ordered sequence of datasets, one per period of a run.
///
/// Every period has the same number of spectra and the same channel ownership
/// at each spectrum position. Period indices exposed by this class are one-based,
/// matching the way periods are named in analysis options.
public final class PeriodSet implements Iterable<ChannelDataset> {

    private final List<ChannelDataset> periods;

    public PeriodSet(List<ChannelDataset> periods) {
        Objects.requireNonNull(periods, "periods cannot be null");
        if (periods.isEmpty()) {
            throw new ValidationException("A period set needs at least one period");
        }
        ChannelDataset first = periods.get(0);
        for (int p = 1; p < periods.size(); p++) {
            ChannelDataset other = Objects.requireNonNull(periods.get(p), "periods cannot contain null");
            if (other.spectrumCount() != first.spectrumCount()) {
                throw new ValidationException("Period " + (p + 1) + " has " + other.spectrumCount()
                    + " spectra but period 1 has " + first.spectrumCount());
            }
            for (int s = 0; s < first.spectrumCount(); s++) {
                if (!other.spectrum(s).channels().equals(first.spectrum(s).channels())) {
                    throw new ValidationException("Period " + (p + 1) + " spectrum " + s
                        + " owns channels " + other.spectrum(s).channels()
                        + " but period 1 owns " + first.spectrum(s).channels());
                }
            }
        }
        this.periods = List.copyOf(periods);
    }

    public static PeriodSet of(ChannelDataset... datasets) {
        return new PeriodSet(List.of(datasets));
    }

    public int size() {
        return periods.size();
    }

    public boolean isMultiPeriod() {
        return periods.size() > 1;
    }

    /// @param period one-based period index
    /// @throws PeriodIndexException when the index is outside `[1, size()]`
    public ChannelDataset period(int period) {
        requireValidPeriod(period);
        return periods.get(period - 1);
    }

    public ChannelDataset first() {
        return periods.get(0);
    }

    public List<ChannelDataset> periods() {
        return periods;
    }

    /// Checks a one-based period index against this set.
    public void requireValidPeriod(int period) {
        if (period < 1 || period > periods.size()) {
            throw new PeriodIndexException(period, periods.size());
        }
    }

    /// Applies an operation to every period, producing a new set.
    public PeriodSet map(UnaryOperator<ChannelDataset> operation) {
        List<ChannelDataset> mapped = new ArrayList<>(periods.size());
        for (ChannelDataset period : periods) {
            mapped.add(operation.apply(period));
        }
        return new PeriodSet(mapped);
    }

    @Override
    public Iterator<ChannelDataset> iterator() {
        return periods.iterator();
    }

    @Override
    public String toString() {
        return "PeriodSet{periods=" + periods.size() + ", spectra=" + first().spectrumCount() + "}";
    }
}
