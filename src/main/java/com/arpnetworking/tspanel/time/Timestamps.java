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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Conversions from loosely typed time values to {@link LocalDateTime}.
 *
 * @author Inscope Metrics
 */
public final class Timestamps {

    /**
     * Whether a value is a timestamp or something that can be parsed into one.
     *
     * @param value The value.
     * @return True for strings, dates and date-times.
     */
    public static boolean isTemporal(final Object value) {
        return value instanceof String || value instanceof LocalDateTime || value instanceof LocalDate;
    }

    /**
     * Convert a temporal value to a timestamp. Dates map to the start of the day.
     *
     * @param value A string, date or date-time.
     * @return The timestamp.
     * @throws IllegalArgumentException if the value is not temporal or cannot be parsed.
     */
    public static LocalDateTime toLocalDateTime(final Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof String) {
            try {
                return parse((String) value);
            } catch (final DateTimeParseException e) {
                throw new IllegalArgumentException(String.format("Invalid timestamp; value=%s", value), e);
            }
        }
        throw new IllegalArgumentException(String.format(
                "Value is not a timestamp; value=%s, type=%s",
                value,
                value.getClass().getName()));
    }

    /**
     * Parse an ISO-8601 date or date-time. The date and time may be separated
     * by either {@code 'T'} or a single space.
     *
     * @param value The text to parse.
     * @return The timestamp.
     * @throws DateTimeParseException if the text is not a date or date-time.
     */
    public static LocalDateTime parse(final String value) {
        final String trimmed = value.trim();
        if (trimmed.length() == DATE_LENGTH) {
            return LocalDate.parse(trimmed).atStartOfDay();
        }
        if (trimmed.length() > DATE_LENGTH && trimmed.charAt(DATE_LENGTH) == ' ') {
            return LocalDateTime.parse(trimmed.substring(0, DATE_LENGTH) + 'T' + trimmed.substring(DATE_LENGTH + 1));
        }
        return LocalDateTime.parse(trimmed);
    }

    private Timestamps() { }

    private static final int DATE_LENGTH = 10;
}
