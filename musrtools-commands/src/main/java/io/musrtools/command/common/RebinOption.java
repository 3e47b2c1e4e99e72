package io.musrtools.command.common;

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
import io.musrtools.reduction.histogram.RebinParams;
import picocli.CommandLine;

/**
 * Shared rebin option using {@link RebinParams} with automatic parsing.
 */
public class RebinOption {

    /**
     * Picocli type converter for rebin parameters.
     * Supports formats: {@code step}, {@code start,step,end}, {@code x0,s1,x1,s2,x2...}
     */
    public static class RebinConverter implements CommandLine.ITypeConverter<RebinParams> {

        @Override
        public RebinParams convert(String value) {
            try {
                return RebinParams.parse(value);
            } catch (ValidationException e) {
                throw new CommandLine.TypeConversionException("Invalid rebin parameters '" + value + "': "
                    + e.getMessage());
            }
        }
    }

    @CommandLine.Option(
        names = {"--rebin"},
        paramLabel = "PARAMS",
        description = "Rebin parameters: 'step', 'start,step,end' or piecewise; a negative step is logarithmic",
        converter = RebinConverter.class
    )
    private RebinParams rebin = RebinParams.NONE;

    /**
     * Gets the parsed parameters; {@link RebinParams#NONE} when not given.
     */
    public RebinParams getRebin() {
        return rebin;
    }

    public boolean isSpecified() {
        return !rebin.isEmpty();
    }

    @Override
    public String toString() {
        return rebin.isEmpty() ? "none" : rebin.toString();
    }
}
