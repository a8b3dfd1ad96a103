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
package com.arpnetworking.tspanel.model;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/**
 * The roles a column can play in a {@link Panel}. The declaration order is
 * the order in which column names are resolved.
 *
 * @author Inscope Metrics
 */
public enum Partition {

    /**
     * The series to be modeled.
     */
    TARGET("target", true),

    /**
     * Covariates only known up to the present.
     */
    OBSERVED("observed_cov", true),

    /**
     * Covariates known into the future.
     */
    KNOWN("known_cov", true),

    /**
     * Time invariant covariates.
     */
    STATIC("static_cov", false);

    /**
     * Look up a partition by name. Accepts {@code target}, {@code observed},
     * {@code observed_cov}, {@code known}, {@code known_cov}, {@code static}
     * and {@code static_cov}, ignoring case.
     *
     * @param name The partition name.
     * @return The partition.
     * @throws IllegalArgumentException if the name is not a partition.
     */
    public static Partition fromName(final String name) {
        final Partition partition = PARTITIONS_BY_NAME.get(name.trim().toLowerCase(Locale.ROOT));
        if (partition == null) {
            throw new IllegalArgumentException(String.format("Invalid partition name; name=%s", name));
        }
        return partition;
    }

    public String getName() {
        return _name;
    }

    /**
     * Whether this partition holds a regular series rather than static values.
     *
     * @return True for target, observed and known.
     */
    public boolean isTimeVarying() {
        return _timeVarying;
    }

    Partition(final String name, final boolean timeVarying) {
        _name = name;
        _timeVarying = timeVarying;
    }

    private final String _name;
    private final boolean _timeVarying;

    private static final ImmutableMap<String, Partition> PARTITIONS_BY_NAME = ImmutableMap.<String, Partition>builder()
            .put("target", TARGET)
            .put("observed", OBSERVED)
            .put("observed_cov", OBSERVED)
            .put("known", KNOWN)
            .put("known_cov", KNOWN)
            .put("static", STATIC)
            .put("static_cov", STATIC)
            .build();
}
