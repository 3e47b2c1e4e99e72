package io.musrtools.reduction.histogram;

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
import java.util.Arrays;
import java.util.List;

/**
 * Rebin parameters in the usual boundary/step form.
 *
 * <h2>Accepted Forms</h2>
 *
 * <pre>{@code
 * [Δ]                      one step over each spectrum's own X range
 * [x0, Δ, x1]              one step over an explicit range
 * [x0, Δ1, x1, Δ2, x2 ...] piecewise steps
 * }</pre>
 *
 * <p>A negative step is logarithmic: {@code x(k+1) = x(k) * (1 + |Δ|)}, which
 * needs a positive start.
 *
 * @param values the raw parameter list; empty means no rebinning
 */
public record RebinParams(double[] values) {

    /** No rebinning. */
    public static final RebinParams NONE = new RebinParams(new double[0]);

    public RebinParams {
        values = values == null ? new double[0] : values.clone();
        if (values.length > 0) {
            if (values.length != 1 && (values.length < 3 || values.length % 2 == 0)) {
                throw new ValidationException("Rebin parameters need one value or an odd count of at least three, got "
                    + Arrays.toString(values));
            }
            for (int i = (values.length == 1 ? 0 : 1); i < values.length; i += 2) {
                if (values[i] == 0 || !Double.isFinite(values[i])) {
                    throw new ValidationException("Rebin step must be finite and non-zero, got " + values[i]);
                }
            }
            for (int i = 2; i < values.length; i += 2) {
                if (!(values[i] > values[i - 2])) {
                    throw new ValidationException("Rebin boundaries must increase, got " + Arrays.toString(values));
                }
            }
        }
    }

    public static RebinParams of(double... values) {
        return new RebinParams(values);
    }

    public static RebinParams of(List<Double> values) {
        return new RebinParams(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /**
     * Parses a comma separated list; a blank string means no rebinning.
     */
    public static RebinParams parse(String text) {
        if (text == null || text.isBlank()) {
            return NONE;
        }
        String[] parts = text.split(",");
        double[] parsed = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                parsed[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException ex) {
                throw new ValidationException("Not a number in rebin parameters: '" + parts[i].trim() + "'", ex);
            }
        }
        return new RebinParams(parsed);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    /**
     * Generates the new bin edges.
     *
     * @param xMin lower limit used when the parameters carry only a step
     * @param xMax upper limit used when the parameters carry only a step
     * @param keepPartialBins whether a trailing bin narrower than its step is kept
     * @return strictly increasing bin edges
     */
    public double[] edges(double xMin, double xMax, boolean keepPartialBins) {
        if (isEmpty()) {
            throw new IllegalStateException("No rebin parameters to generate edges from");
        }
        double[] full = values.length == 1 ? new double[]{xMin, values[0], xMax} : values;
        List<Double> edges = new ArrayList<>();
        edges.add(full[0]);
        for (int seg = 0; seg + 2 < full.length; seg += 2) {
            double start = full[seg];
            double step = full[seg + 1];
            double end = full[seg + 2];
            if (step < 0 && start <= 0) {
                throw new ValidationException("Logarithmic rebin needs a positive start, got " + start);
            }
            double tolerance = 1e-9 * Math.abs(step > 0 ? step : start * -step);
            double x = start;
            while (true) {
                double next = step > 0 ? x + step : x * (1 - step);
                if (next >= end - tolerance) {
                    boolean lastSegment = seg + 3 >= full.length;
                    boolean partial = next > end + tolerance;
                    if (!partial || keepPartialBins || !lastSegment) {
                        edges.add(end);
                    }
                    break;
                }
                edges.add(next);
                x = next;
            }
        }
        if (edges.size() < 2) {
            throw new ValidationException("Rebin parameters " + Arrays.toString(full) + " produce no complete bin");
        }
        return edges.stream().mapToDouble(Double::doubleValue).toArray();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RebinParams other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (double v : values) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(v);
        }
        return sb.toString();
    }
}
