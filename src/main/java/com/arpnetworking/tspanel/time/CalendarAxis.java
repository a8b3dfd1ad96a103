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

import com.arpnetworking.tspanel.model.SchemaException;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An axis of timestamps where each point is one period after the previous one.
 *
 * @author Inscope Metrics
 */
public final class CalendarAxis extends TimeAxis {

    /**
     * Create a calendar axis from consecutive timestamps.
     *
     * @param timestamps The timestamps in order.
     * @param frequency The frequency between consecutive timestamps.
     * @return The axis.
     * @throws SchemaException if the timestamps are not consecutive points of the frequency.
     */
    public static CalendarAxis of(final List<LocalDateTime> timestamps, final CalendarFrequency frequency) {
        final PeriodCode period = frequency.getPeriod();
        for (int i = 1; i < timestamps.size(); ++i) {
            if (!period.next(timestamps.get(i - 1)).equals(timestamps.get(i))) {
                throw new SchemaException(String.format(
                        "Timestamps are not consecutive for the frequency; previous=%s, current=%s, frequency=%s",
                        timestamps.get(i - 1),
                        timestamps.get(i),
                        period));
            }
        }
        return new CalendarAxis(ImmutableList.copyOf(timestamps), frequency);
    }

    /**
     * Create a calendar axis from a start and a number of points.
     *
     * @param start The first timestamp.
     * @param size The number of points.
     * @param frequency The frequency.
     * @return The axis.
     */
    public static CalendarAxis of(final LocalDateTime start, final int size, final CalendarFrequency frequency) {
        Preconditions.checkArgument(size >= 0, "size must not be negative; size=%s", size);
        final ImmutableList.Builder<LocalDateTime> timestamps = ImmutableList.builder();
        LocalDateTime current = start;
        for (int i = 0; i < size; ++i) {
            timestamps.add(current);
            current = frequency.getPeriod().next(current);
        }
        return new CalendarAxis(timestamps.build(), frequency);
    }

    public ImmutableList<LocalDateTime> getTimestamps() {
        return _timestamps;
    }

    @Override
    public CalendarFrequency getFrequency() {
        return _frequency;
    }

    @Override
    public int size() {
        return _timestamps.size();
    }

    @Override
    public LocalDateTime get(final int position) {
        return _timestamps.get(position);
    }

    @Override
    public int indexOf(final Object point) {
        if (!(point instanceof LocalDateTime)) {
            return -1;
        }
        final int position = Collections.binarySearch(_timestamps, (LocalDateTime) point);
        return position >= 0 ? position : -1;
    }

    @Override
    public int countAtOrBefore(final Object point) {
        if (!(point instanceof LocalDateTime)) {
            throw new IllegalArgumentException(String.format("Point is not a timestamp; point=%s", point));
        }
        final int position = Collections.binarySearch(_timestamps, (LocalDateTime) point);
        return position >= 0 ? position + 1 : -position - 1;
    }

    /**
     * The position of the first point at or after a timestamp.
     *
     * @param timestamp The timestamp.
     * @return The position, or {@code -1} if every point is before the timestamp.
     */
    public int ceilingIndex(final LocalDateTime timestamp) {
        final int count = countAtOrBefore(timestamp);
        if (count > 0 && _timestamps.get(count - 1).equals(timestamp)) {
            return count - 1;
        }
        return count < size() ? count : -1;
    }

    /**
     * The position of the last point at or before a timestamp.
     *
     * @param timestamp The timestamp.
     * @return The position, or {@code -1} if every point is after the timestamp.
     */
    public int floorIndex(final LocalDateTime timestamp) {
        return countAtOrBefore(timestamp) - 1;
    }

    @Override
    public CalendarAxis slice(final int from, final int to) {
        return new CalendarAxis(_timestamps.subList(from, to), _frequency);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CalendarAxis)) {
            return false;
        }
        final CalendarAxis otherAxis = (CalendarAxis) other;
        return _frequency.equals(otherAxis._frequency)
                && _timestamps.equals(otherAxis._timestamps);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_frequency, _timestamps);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Frequency", _frequency)
                .add("Start", _timestamps.isEmpty() ? null : _timestamps.get(0))
                .add("Size", _timestamps.size())
                .toString();
    }

    static List<LocalDateTime> generate(final LocalDateTime start, final LocalDateTime end, final PeriodCode period) {
        final List<LocalDateTime> timestamps = new ArrayList<>();
        LocalDateTime current = start;
        while (!current.isAfter(end)) {
            timestamps.add(current);
            current = period.next(current);
        }
        return timestamps;
    }

    private CalendarAxis(final ImmutableList<LocalDateTime> timestamps, final CalendarFrequency frequency) {
        _timestamps = timestamps;
        _frequency = frequency;
    }

    private final ImmutableList<LocalDateTime> _timestamps;
    private final CalendarFrequency _frequency;
}
