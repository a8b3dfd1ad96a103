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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tspanel.model.Column;
import com.arpnetworking.tspanel.model.ColumnType;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Fills missing values column by column.
 *
 * Windowed methods aggregate the present values among the {@code windowSize}
 * rows ending at the missing one; a value stays missing when its whole window
 * is missing. Windowed methods and {@link FillMethod#ZERO} leave non-numeric
 * columns untouched, while {@link FillMethod#PREVIOUS} and
 * {@link FillMethod#NEXT} fill columns of any type. Filling an integer column
 * with {@link FillMethod#AVG} or {@link FillMethod#MEDIAN} turns it into a
 * floating point column.
 *
 * @author Inscope Metrics
 */
public final class WindowGapFiller implements GapFiller {

    @Override
    public RegularSeries fill(final RegularSeries series, final FillMethod method, final int windowSize) {
        Preconditions.checkArgument(windowSize >= 1, "window size must be positive; windowSize=%s", windowSize);
        final RegularSeries filled = series.copy();
        for (final Column column : series.getColumns()) {
            final int missing = column.countMissing();
            if (missing == 0) {
                continue;
            }
            final Column result = fill(column, method, windowSize);
            filled.setColumn(result);
            LOGGER.debug()
                    .setMessage("Filled missing values")
                    .addData("column", column.getName())
                    .addData("method", method)
                    .addData("missing", missing)
                    .addData("remaining", result.countMissing())
                    .log();
        }
        return filled;
    }

    private static Column fill(final Column column, final FillMethod method, final int windowSize) {
        switch (method) {
            case PREVIOUS:
                return fillForward(column);
            case NEXT:
                return fillBackward(column);
            case ZERO:
                return fillZero(column);
            default:
                return fillWindowed(column, method, windowSize);
        }
    }

    private static Column fillForward(final Column column) {
        final List<Object> values = new ArrayList<>(column.getValues());
        @Nullable Object last = null;
        for (int row = 0; row < values.size(); ++row) {
            if (values.get(row) == null) {
                values.set(row, last);
            } else {
                last = values.get(row);
            }
        }
        return Column.of(column.getName(), column.getType(), values);
    }

    private static Column fillBackward(final Column column) {
        final List<Object> values = new ArrayList<>(column.getValues());
        @Nullable Object next = null;
        for (int row = values.size() - 1; row >= 0; --row) {
            if (values.get(row) == null) {
                values.set(row, next);
            } else {
                next = values.get(row);
            }
        }
        return Column.of(column.getName(), column.getType(), values);
    }

    private static Column fillZero(final Column column) {
        if (!column.getType().isNumeric()) {
            return column;
        }
        final Object zero = column.getType() == ColumnType.INT64 ? (Object) 0L : (Object) 0.0;
        final List<Object> values = new ArrayList<>(column.getValues());
        for (int row = 0; row < values.size(); ++row) {
            if (values.get(row) == null) {
                values.set(row, zero);
            }
        }
        return Column.of(column.getName(), column.getType(), values);
    }

    private static Column fillWindowed(final Column column, final FillMethod method, final int windowSize) {
        if (!column.getType().isNumeric()) {
            return column;
        }
        final List<Object> values = new ArrayList<>(column.getValues());
        for (int row = 0; row < values.size(); ++row) {
            if (column.isMissing(row)) {
                final List<Double> window = new ArrayList<>(windowSize);
                for (int other = Math.max(0, row - windowSize + 1); other <= row; ++other) {
                    @Nullable final Double value = column.getDouble(other);
                    if (value != null) {
                        window.add(value);
                    }
                }
                values.set(row, window.isEmpty() ? null : aggregate(window, method));
            }
        }
        final ColumnType type = method == FillMethod.AVG || method == FillMethod.MEDIAN
                ? ColumnType.FLOAT64
                : column.getType();
        return Column.of(column.getName(), type, values);
    }

    private static double aggregate(final List<Double> window, final FillMethod method) {
        switch (method) {
            case MAX:
                return Collections.max(window);
            case MIN:
                return Collections.min(window);
            case AVG:
                double sum = 0;
                for (final double value : window) {
                    sum += value;
                }
                return sum / window.size();
            case MEDIAN:
                final List<Double> sorted = new ArrayList<>(window);
                Collections.sort(sorted);
                final int middle = sorted.size() / 2;
                if (sorted.size() % 2 == 1) {
                    return sorted.get(middle);
                }
                return (sorted.get(middle - 1) + sorted.get(middle)) / 2;
            default:
                throw new IllegalArgumentException(String.format("Fill method is not windowed; method=%s", method));
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(WindowGapFiller.class);
}
