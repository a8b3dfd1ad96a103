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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * An axis of equally spaced integers: {@code start, start + step, ...}.
 *
 * @author Inscope Metrics
 */
public final class OrdinalAxis extends TimeAxis {

    /**
     * Create an ordinal axis.
     *
     * @param start The first point.
     * @param step The positive distance between points.
     * @param size The number of points.
     * @return The axis.
     */
    public static OrdinalAxis of(final long start, final long step, final int size) {
        Preconditions.checkArgument(size >= 0, "size must not be negative; size=%s", size);
        return new OrdinalAxis(size == 0 ? 0 : start, Frequency.ordinal(step), size);
    }

    /**
     * Whether a value is an integer point.
     *
     * @param value The value.
     * @return True for {@link Long}, {@link Integer}, {@link Short} and {@link Byte}.
     */
    public static boolean isIntegral(final Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    public long getStart() {
        return _start;
    }

    public long getStep() {
        return _frequency.getStep();
    }

    @Override
    public OrdinalFrequency getFrequency() {
        return _frequency;
    }

    @Override
    public int size() {
        return _size;
    }

    @Override
    public Long get(final int position) {
        Preconditions.checkElementIndex(position, _size);
        return _start + position * getStep();
    }

    @Override
    public int indexOf(final Object point) {
        if (!isIntegral(point)) {
            return -1;
        }
        final long offset = ((Number) point).longValue() - _start;
        if (offset < 0 || offset % getStep() != 0) {
            return -1;
        }
        final long position = offset / getStep();
        return position < _size ? (int) position : -1;
    }

    @Override
    public int countAtOrBefore(final Object point) {
        if (!isIntegral(point)) {
            throw new IllegalArgumentException(String.format("Point is not an integer; point=%s", point));
        }
        final long offset = ((Number) point).longValue() - _start;
        if (_size == 0 || offset < 0) {
            return 0;
        }
        return (int) Math.min(offset / getStep() + 1, _size);
    }

    @Override
    public OrdinalAxis slice(final int from, final int to) {
        Preconditions.checkPositionIndexes(from, to, _size);
        return of(_start + from * getStep(), getStep(), to - from);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof OrdinalAxis)) {
            return false;
        }
        final OrdinalAxis otherAxis = (OrdinalAxis) other;
        return _start == otherAxis._start
                && _size == otherAxis._size
                && _frequency.equals(otherAxis._frequency);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_start, _frequency, _size);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Start", _start)
                .add("Step", getStep())
                .add("Size", _size)
                .toString();
    }

    private OrdinalAxis(final long start, final OrdinalFrequency frequency, final int size) {
        _start = start;
        _frequency = frequency;
        _size = size;
    }

    private final long _start;
    private final OrdinalFrequency _frequency;
    private final int _size;
}
