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
package com.arpnetworking.tspanel.time;

import java.util.regex.Pattern;

/**
 * The spacing between consecutive points of a time axis. Either an integer
 * step for ordinal axes or a calendar period for calendar axes.
 *
 * @author Inscope Metrics
 */
public abstract class Frequency {

    /**
     * Parse a frequency. A string of digits is an ordinal step, anything else
     * is parsed as a {@link PeriodCode}.
     *
     * @param value The frequency, for example {@code "1"}, {@code "D"} or {@code "W-MON"}.
     * @return The frequency.
     * @throws IllegalArgumentException if the value is neither a positive step nor a period code.
     */
    public static Frequency parse(final String value) {
        final String trimmed = value.trim();
        if (DIGITS.matcher(trimmed).matches()) {
            try {
                return ordinal(Long.parseLong(trimmed));
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Invalid ordinal step; value=%s", value), e);
            }
        }
        return calendar(PeriodCode.parse(trimmed));
    }

    /**
     * Create an ordinal frequency.
     *
     * @param step The positive distance between consecutive integer points.
     * @return The frequency.
     */
    public static OrdinalFrequency ordinal(final long step) {
        return new OrdinalFrequency(step);
    }

    /**
     * Create a calendar frequency.
     *
     * @param period The period between consecutive timestamps.
     * @return The frequency.
     */
    public static CalendarFrequency calendar(final PeriodCode period) {
        return new CalendarFrequency(period);
    }

    /**
     * Create a calendar frequency from a period code.
     *
     * @param code The period code.
     * @return The frequency.
     */
    public static CalendarFrequency calendar(final String code) {
        return new CalendarFrequency(PeriodCode.parse(code));
    }

    /**
     * The type of axis this frequency indexes.
     *
     * @return The axis type.
     */
    public abstract AxisType getAxisType();

    Frequency() { }

    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
}
