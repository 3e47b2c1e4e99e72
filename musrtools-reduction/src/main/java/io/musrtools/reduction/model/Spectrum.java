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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One logical channel record: an (X, Y, E) triple plus the set of channel
 * identifiers that own it.
 *
 * <h2>Axis Forms</h2>
 *
 * <ul>
 *   <li><b>histogram</b> - {@code x.length == y.length + 1}, X holds bin edges</li>
 *   <li><b>point</b> - {@code x.length == y.length}, X holds bin centres</li>
 * </ul>
 *
 * <p>X must be strictly increasing. E holds one standard deviation per Y value.
 *
 * <h2>Immutability</h2>
 *
 * <p>Arrays are copied on the way in and on the way out, so a spectrum can be
 * shared freely between datasets. The {@code with*} methods return new instances.
 */
public final class Spectrum {

    private final double[] x;
    private final double[] y;
    private final double[] e;
    private final SortedSet<Integer> channels;

    /**
     * Creates a spectrum.
     *
     * @param x bin edges or bin centres, strictly increasing
     * @param y values
     * @param e standard deviations, same length as {@code y}
     * @param channels owning channel identifiers
     * @throws ValidationException if the array lengths or the X ordering are inconsistent
     */
    public Spectrum(double[] x, double[] y, double[] e, Collection<Integer> channels) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        Objects.requireNonNull(e, "e cannot be null");
        Objects.requireNonNull(channels, "channels cannot be null");
        if (y.length == 0) {
            throw new ValidationException("A spectrum needs at least one value");
        }
        if (e.length != y.length) {
            throw new ValidationException("Error array length " + e.length
                + " does not match value array length " + y.length);
        }
        if (x.length != y.length && x.length != y.length + 1) {
            throw new ValidationException("X length " + x.length
                + " must equal the value count " + y.length + " or exceed it by one");
        }
        for (int i = 1; i < x.length; i++) {
            if (!(x[i] > x[i - 1])) {
                throw new ValidationException("X values must be strictly increasing (index " + i + ")");
            }
        }
        this.x = x.clone();
        this.y = y.clone();
        this.e = e.clone();
        this.channels = Collections.unmodifiableSortedSet(new TreeSet<>(channels));
    }

    /**
     * Creates a counting spectrum whose errors are the Poisson estimate {@code sqrt(|y|)}.
     */
    public static Spectrum ofCounts(double[] x, double[] y, Collection<Integer> channels) {
        double[] e = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            e[i] = Math.sqrt(Math.abs(y[i]));
        }
        return new Spectrum(x, y, e, channels);
    }

    /** @return a copy of the X axis */
    public double[] x() {
        return x.clone();
    }

    /** @return a copy of the values */
    public double[] y() {
        return y.clone();
    }

    /** @return a copy of the standard deviations */
    public double[] e() {
        return e.clone();
    }

    public double x(int index) {
        return x[index];
    }

    public double y(int index) {
        return y[index];
    }

    public double e(int index) {
        return e[index];
    }

    /** @return the owning channel identifiers, ascending */
    public SortedSet<Integer> channels() {
        return channels;
    }

    /** @return number of Y values */
    public int size() {
        return y.length;
    }

    /** @return true when X holds bin edges */
    public boolean isHistogram() {
        return x.length == y.length + 1;
    }

    public double firstX() {
        return x[0];
    }

    public double lastX() {
        return x[x.length - 1];
    }

    /**
     * Returns the time associated with a value: the bin centre for histogram
     * data, the point itself otherwise.
     */
    public double binCentre(int index) {
        return isHistogram() ? 0.5 * (x[index] + x[index + 1]) : x[index];
    }

    /**
     * Returns the width of a bin. For point data the distance to the neighbouring
     * point is used, with the last point reusing the previous spacing.
     */
    public double binWidth(int index) {
        if (isHistogram()) {
            return x[index + 1] - x[index];
        }
        if (x.length == 1) {
            return 1.0;
        }
        return index + 1 < x.length ? x[index + 1] - x[index] : x[index] - x[index - 1];
    }

    /** @return total of all Y values, summed in order */
    public double sumY() {
        double sum = 0;
        for (double v : y) {
            sum += v;
        }
        return sum;
    }

    public Spectrum withX(double[] newX) {
        return new Spectrum(newX, y, e, channels);
    }

    public Spectrum withValues(double[] newY, double[] newE) {
        return new Spectrum(x, newY, newE, channels);
    }

    public Spectrum withChannels(Collection<Integer> newChannels) {
        return new Spectrum(x, y, e, newChannels);
    }

    /** @return true when X is exactly identical, element by element */
    public boolean sameX(Spectrum other) {
        return Arrays.equals(x, other.x);
    }

    /**
     * Elementwise comparison of X, Y, E and channel sets.
     */
    public boolean contentEquals(Spectrum other) {
        return other != null
            && Arrays.equals(x, other.x)
            && Arrays.equals(y, other.y)
            && Arrays.equals(e, other.e)
            && channels.equals(other.channels);
    }

    @Override
    public String toString() {
        return "Spectrum{channels=" + channels + ", bins=" + y.length
            + (isHistogram() ? ", histogram" : ", points")
            + ", x=[" + firstX() + ", " + lastX() + "]}";
    }
}
