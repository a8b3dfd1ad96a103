/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.tspanel.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/**
 * The strategies for filling missing values.
 *
 * @author Inscope Metrics
 */
public enum FillMethod {

    /**
     * The maximum of the present values in the trailing window.
     */
    MAX("max", true),

    /**
     * The minimum of the present values in the trailing window.
     */
    MIN("min", true),

    /**
     * The mean of the present values in the trailing window.
     */
    AVG("avg", true),

    /**
     * The median of the present values in the trailing window.
     */
    MEDIAN("median", true),

    /**
     * The closest present value before the missing one.
     */
    PREVIOUS("pre", false),

    /**
     * The closest present value after the missing one.
     */
    NEXT("back", false),

    /**
     * Zero.
     */
    ZERO("zero", false);

    /**
     * Look up a method by name, ignoring case. {@code mean} is accepted for
     * {@link #AVG}.
     *
     * @param name The method name.
     * @return The method.
     * @throws IllegalArgumentException if the name is not a fill method.
     */
    @JsonCreator
    public static FillMethod fromName(final String name) {
        final FillMethod method = METHODS_BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
        if (method == null) {
            throw new IllegalArgumentException(String.format("Invalid fill method; name=%s", name));
        }
        return method;
    }

    @JsonValue
    public String getName() {
        return _name;
    }

    /**
     * Whether this method aggregates a trailing window of values.
     *
     * @return True for max, min, avg and median.
     */
    public boolean isWindowed() {
        return _windowed;
    }

    FillMethod(final String name, final boolean windowed) {
        _name = name;
        _windowed = windowed;
    }

    private final String _name;
    private final boolean _windowed;

    private static final ImmutableMap<String, FillMethod> METHODS_BY_NAME;

    static {
        final ImmutableMap.Builder<String, FillMethod> builder = ImmutableMap.builder();
        for (final FillMethod method : values()) {
            builder.put(method.getName(), method);
        }
        builder.put("mean", AVG);
        METHODS_BY_NAME = builder.build();
    }
}
