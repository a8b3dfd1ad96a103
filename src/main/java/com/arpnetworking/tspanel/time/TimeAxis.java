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
import com.google.common.collect.ImmutableList;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * An immutable, strictly increasing sequence of time points separated by a
 * single {@link Frequency}. Points are {@link Long} on an ordinal axis and
 * {@link LocalDateTime} on a calendar axis.
 *
 * @author Inscope Metrics
 */
public abstract class TimeAxis {

    /**
     * Create an axis without points.
     *
     * @param frequency The frequency of the axis.
     * @return The empty axis.
     */
    public static TimeAxis empty(final Frequency frequency) {
        if (frequency instanceof OrdinalFrequency) {
            return OrdinalAxis.of(0, ((OrdinalFrequency) frequency).getStep(), 0);
        }
        return CalendarAxis.of(ImmutableList.of(), (CalendarFrequency) frequency);
    }

    /**
     * Create the smallest axis of the given frequency covering all points.
     * Points between the first and the last one that are not present are
     * part of the axis.
     *
     * @param frequency The frequency of the axis.
     * @param points The points to cover, in any order; duplicates are allowed.
     * @return The covering axis.
     * @throws SchemaException if a point does not match the axis type or is not on the frequency's grid.
     */
    public static TimeAxis span(final Frequency frequency, final Collection<?> points) {
        if (points.isEmpty()) {
            return empty(frequency);
        }
        if (frequency instanceof OrdinalFrequency) {
            return spanOrdinal((OrdinalFrequency) frequency, points);
        }
        return spanCalendar((CalendarFrequency) frequency, points);
    }

    /**
     * The frequency between consecutive points.
     *
     * @return The frequency.
     */
    public abstract Frequency getFrequency();

    public AxisType getType() {
        return getFrequency().getAxisType();
    }

    /**
     * The number of points.
     *
     * @return The number of points.
     */
    public abstract int size();

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * The point at a position.
     *
     * @param position The zero based position.
     * @return The point; a {@link Long} or a {@link LocalDateTime}.
     * @throws IndexOutOfBoundsException if the position is outside the axis.
     */
    public abstract Object get(int position);

    /**
     * The position of a point.
     *
     * @param point The point to find.
     * @return The position, or {@code -1} if the point is not on this axis.
     */
    public abstract int indexOf(Object point);

    /**
     * The number of points less than or equal to a point.
     *
     * @param point The point to compare against.
     * @return The count.
     * @throws IllegalArgumentException if the point does not match the axis type.
     */
    public abstract int countAtOrBefore(Object point);

    /**
     * The sub-axis between two positions.
     *
     * @param from The first position, inclusive.
     * @param to The last position, exclusive.
     * @return The sub-axis.
     */
    public abstract TimeAxis slice(int from, int to);

    /**
     * All points in order.
     *
     * @return The points.
     */
    public ImmutableList<Object> getPoints() {
        final ImmutableList.Builder<Object> points = ImmutableList.builder();
        for (int i = 0; i < size(); ++i) {
            points.add(get(i));
        }
        return points.build();
    }

    TimeAxis() { }

    private static TimeAxis spanOrdinal(final OrdinalFrequency frequency, final Collection<?> points) {
        final long step = frequency.getStep();
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (final Object point : points) {
            if (!OrdinalAxis.isIntegral(point)) {
                throw new SchemaException(String.format(
                        "Time value does not match an ordinal axis; value=%s",
                        point));
            }
            final long value = ((Number) point).longValue();
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        for (final Object point : points) {
            if ((((Number) point).longValue() - min) % step != 0) {
                throw new SchemaException(String.format(
                        "Time value is not aligned with the frequency; value=%s, start=%d, step=%d",
                        point,
                        min,
                        step));
            }
        }
        return OrdinalAxis.of(min, step, Math.toIntExact((max - min) / step + 1));
    }

    private static TimeAxis spanCalendar(final CalendarFrequency frequency, final Collection<?> points) {
        final TreeSet<LocalDateTime> sorted = new TreeSet<>();
        for (final Object point : points) {
            if (!(point instanceof LocalDateTime)) {
                throw new SchemaException(String.format(
                        "Time value does not match a calendar axis; value=%s",
                        point));
            }
            sorted.add((LocalDateTime) point);
        }
        final PeriodCode period = frequency.getPeriod();
        final LocalDateTime start = sorted.first();
        if (!period.isOnOffset(start)) {
            throw new SchemaException(String.format(
                    "First time value is not on an offset of the frequency; value=%s, frequency=%s",
                    start,
                    period));
        }
        final List<LocalDateTime> grid = CalendarAxis.generate(start, sorted.last(), period);
        final Set<LocalDateTime> gridSet = new HashSet<>(grid);
        for (final LocalDateTime point : sorted) {
            if (!gridSet.contains(point)) {
                throw new SchemaException(String.format(
                        "Time value is not aligned with the frequency; value=%s, start=%s, frequency=%s",
                        point,
                        start,
                        period));
            }
        }
        return CalendarAxis.of(grid, frequency);
    }
}
