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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tspanel.time.CalendarAxis;
import com.arpnetworking.tspanel.time.CalendarFrequency;
import com.arpnetworking.tspanel.time.Frequency;
import com.arpnetworking.tspanel.time.FrequencyInference;
import com.arpnetworking.tspanel.time.OrdinalAxis;
import com.arpnetworking.tspanel.time.OrdinalFrequency;
import com.arpnetworking.tspanel.time.PeriodCode;
import com.arpnetworking.tspanel.time.TimeAxis;
import com.arpnetworking.tspanel.time.Timestamps;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * A set of named, typed columns sharing one regular {@link TimeAxis}.
 *
 * The axis and the columns are immutable; operations that modify a series
 * in place replace whole columns, so values handed out by getters are never
 * affected by later modifications. Every row of the axis is present; rows
 * that had no input carry missing values.
 *
 * @author Inscope Metrics
 */
public final class RegularSeries {

    /**
     * Build a series from a table.
     *
     * An integer time column produces an ordinal axis and must form a
     * contiguous run of the step without gaps. A timestamp time column
     * produces a calendar axis; timestamps between the first and last point
     * that are absent from the input become rows of missing values.
     *
     * @param table The input table.
     * @param timeColumn The column holding time points; when null the table
     * index is used, or the row positions when there is no index.
     * @param valueColumns The columns to load; when null every column other
     * than the time column is loaded.
     * @param frequency The frequency; when null the step defaults to one for
     * integer time points and is inferred for timestamps.
     * @return The series.
     * @throws SchemaException if columns are missing or duplicated, time points
     * are missing, duplicated or irregular, or the frequency cannot be determined.
     * @throws TypeMismatchException if the time points are neither integers nor timestamps.
     */
    public static RegularSeries load(
            final Table table,
            @Nullable final String timeColumn,
            @Nullable final List<String> valueColumns,
            @Nullable final Frequency frequency) {
        final ImmutableList<String> names = table.getColumnNames();
        final List<String> selected;
        if (valueColumns == null) {
            selected = names.stream()
                    .filter(name -> !name.equals(timeColumn))
                    .collect(Collectors.toList());
        } else {
            final List<String> unknown = valueColumns.stream()
                    .filter(name -> !names.contains(name))
                    .collect(Collectors.toList());
            if (!unknown.isEmpty()) {
                throw new SchemaException(String.format("Value columns do not exist; columns=%s", unknown));
            }
            selected = valueColumns;
        }
        final Set<String> seen = new HashSet<>();
        final Set<String> duplicated = new LinkedHashSet<>();
        for (final String name : selected) {
            if (!seen.add(name) || table.countColumns(name) > 1) {
                duplicated.add(name);
            }
        }
        if (!duplicated.isEmpty()) {
            throw new SchemaException(String.format("Duplicated column names; columns=%s", duplicated));
        }

        final List<Object> times = normalizeTimes(readTimes(table, timeColumn));
        if (new HashSet<>(times).size() != times.size()) {
            throw new SchemaException(String.format("Duplicated values in the time column; column=%s", timeColumn));
        }
        final TimeAxis axis;
        if (times.get(0) instanceof Long) {
            axis = ordinalAxis(times, frequency);
        } else {
            axis = calendarAxis(times, frequency);
        }

        final int[] positions = new int[axis.size()];
        Arrays.fill(positions, -1);
        for (int row = 0; row < times.size(); ++row) {
            positions[axis.indexOf(times.get(row))] = row;
        }
        final List<Column> columns = new ArrayList<>(selected.size());
        for (final String name : selected) {
            columns.add(Column.of(name, table.getColumn(name).get()).select(positions));
        }
        if (axis.size() > times.size()) {
            LOGGER.debug()
                    .setMessage("Inserted missing rows")
                    .addData("frequency", axis.getFrequency())
                    .addData("rows", times.size())
                    .addData("inserted", axis.size() - times.size())
                    .log();
        }
        return new RegularSeries(axis, columns);
    }

    /**
     * Create a series from an axis and columns.
     *
     * @param axis The time axis.
     * @param columns The columns; each must have one value per axis point.
     * @return The series.
     * @throws IllegalArgumentException if column names repeat or a column length differs from the axis.
     */
    public static RegularSeries of(final TimeAxis axis, final List<Column> columns) {
        for (final Column column : columns) {
            Preconditions.checkArgument(
                    column.size() == axis.size(),
                    "column length does not match the axis; column=%s, length=%s, axis=%s",
                    column.getName(),
                    column.size(),
                    axis.size());
        }
        return new RegularSeries(axis, columns);
    }

    /**
     * Concatenate series.
     *
     * Along {@link ConcatAxis#TIME} the inputs must not share time points; rows
     * are ordered by time, holes between inputs become missing rows and columns
     * absent from an input are missing in its rows. Along
     * {@link ConcatAxis#COLUMNS} the inputs must not share column names; the
     * result covers every time point of every input.
     *
     * @param series The series to concatenate.
     * @param axis The concatenation axis.
     * @return The concatenated series.
     * @throws IllegalArgumentException if the list is empty, the frequencies
     * differ, time points overlap along time or column names overlap along columns.
     * @throws SchemaException if the time points of the inputs are not on one grid.
     */
    public static RegularSeries concat(final List<RegularSeries> series, final ConcatAxis axis) {
        Preconditions.checkArgument(!series.isEmpty(), "at least one series is required");
        final Set<Frequency> frequencies = series.stream()
                .map(RegularSeries::getFrequency)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (frequencies.size() != 1) {
            throw new IllegalArgumentException(String.format(
                    "Series with different frequencies cannot be concatenated; frequencies=%s",
                    frequencies));
        }
        final Frequency frequency = frequencies.iterator().next();
        if (axis == ConcatAxis.TIME) {
            return concatTime(series, frequency);
        }
        return concatColumns(series, frequency);
    }

    public TimeAxis getAxis() {
        return _axis;
    }

    public Frequency getFrequency() {
        return _axis.getFrequency();
    }

    /**
     * The number of rows.
     *
     * @return The number of rows.
     */
    public int size() {
        return _axis.size();
    }

    public boolean isEmpty() {
        return _axis.isEmpty();
    }

    public ImmutableList<String> getColumnNames() {
        return _columns.keySet().asList();
    }

    public ImmutableList<Column> getColumns() {
        return _columns.values().asList();
    }

    /**
     * Look up a column.
     *
     * @param name The column name.
     * @return The column, if present.
     */
    public Optional<Column> getColumn(final String name) {
        return Optional.ofNullable(_columns.get(name));
    }

    public boolean hasColumn(final String name) {
        return _columns.containsKey(name);
    }

    /**
     * The type of every column.
     *
     * @return The column types in column order.
     */
    public ImmutableMap<String, ColumnType> getColumnTypes() {
        return ImmutableMap.copyOf(Maps.transformValues(_columns, Column::getType));
    }

    /**
     * The first time point.
     *
     * @return A {@link Long} or a {@link LocalDateTime}.
     * @throws IllegalStateException if the series is empty.
     */
    public Object getStartTime() {
        Preconditions.checkState(!isEmpty(), "series is empty");
        return _axis.get(0);
    }

    /**
     * The last time point.
     *
     * @return A {@link Long} or a {@link LocalDateTime}.
     * @throws IllegalStateException if the series is empty.
     */
    public Object getEndTime() {
        Preconditions.checkState(!isEmpty(), "series is empty");
        return _axis.get(_axis.size() - 1);
    }

    /**
     * Resolve a point to a row position.
     *
     * <ul>
     *     <li>A {@link Double} or {@link Float} in {@code [0, 1]} is a fraction of the rows.</li>
     *     <li>An integer is a row position.</li>
     *     <li>A timestamp, date or string is a time point on a calendar axis; when it falls
     *     between two points the next one is chosen if {@code preferAfter} is set and the
     *     previous one otherwise.</li>
     * </ul>
     *
     * @param point The point.
     * @param preferAfter Whether a timestamp between two points resolves to the later one.
     * @return The row position.
     * @throws IllegalArgumentException if the point is out of range or does not suit the axis.
     * @throws TypeMismatchException if the point has an unsupported type.
     */
    public int indexAt(final Object point, final boolean preferAfter) {
        if (point instanceof Double || point instanceof Float) {
            final double fraction = ((Number) point).doubleValue();
            if (!(fraction >= 0.0 && fraction <= 1.0)) {
                throw new IllegalArgumentException(String.format("Fraction must be within [0, 1]; point=%s", point));
            }
            checkNotEmpty();
            return (int) Math.floor((size() - 1) * fraction);
        }
        if (OrdinalAxis.isIntegral(point)) {
            final long position = ((Number) point).longValue();
            if (position < 0 || position >= size()) {
                throw new IllegalArgumentException(String.format(
                        "Position is out of range; point=%s, rows=%d",
                        point,
                        size()));
            }
            return (int) position;
        }
        if (Timestamps.isTemporal(point)) {
            if (!(_axis instanceof CalendarAxis)) {
                throw new IllegalArgumentException(String.format(
                        "Timestamp points require a calendar axis; point=%s",
                        point));
            }
            checkNotEmpty();
            final CalendarAxis axis = (CalendarAxis) _axis;
            final LocalDateTime timestamp = Timestamps.toLocalDateTime(point);
            if (timestamp.isBefore(axis.get(0)) || timestamp.isAfter(axis.get(axis.size() - 1))) {
                throw new IllegalArgumentException(String.format(
                        "Timestamp is out of range; point=%s, start=%s, end=%s",
                        point,
                        axis.get(0),
                        axis.get(axis.size() - 1)));
            }
            final int exact = axis.indexOf(timestamp);
            if (exact >= 0) {
                return exact;
            }
            return preferAfter ? axis.ceilingIndex(timestamp) : axis.floorIndex(timestamp);
        }
        throw new TypeMismatchException(String.format(
                "Unsupported point type; point=%s, type=%s",
                point,
                point.getClass().getName()));
    }

    /**
     * Split at a point resolved by {@link #indexAt(Object, boolean)}. An
     * integer point starts the right half; any other point ends the left half.
     *
     * @param point The split point.
     * @param preferAfter Whether a timestamp between two points resolves to the later one.
     * @return The two halves.
     */
    public Split<RegularSeries> split(final Object point, final boolean preferAfter) {
        final int index = indexAt(point, preferAfter);
        final int boundary = OrdinalAxis.isIntegral(point) ? index : index + 1;
        return new Split<>(slice(0, boundary), slice(boundary, size()));
    }

    /**
     * Split by time: rows at or before a time point form the left half.
     *
     * @param timePoint An integer on an ordinal axis or a timestamp on a calendar axis.
     * @return The two halves.
     * @throws IllegalArgumentException if the point does not suit the axis.
     */
    public Split<RegularSeries> splitAfter(final Object timePoint) {
        final Object point = _axis instanceof CalendarAxis && Timestamps.isTemporal(timePoint)
                ? Timestamps.toLocalDateTime(timePoint)
                : timePoint;
        final int boundary = _axis.countAtOrBefore(point);
        return new Split<>(slice(0, boundary), slice(boundary, size()));
    }

    /**
     * The rows between two positions.
     *
     * @param from The first row, inclusive.
     * @param to The last row, exclusive.
     * @return The sliced series.
     */
    public RegularSeries slice(final int from, final int to) {
        Preconditions.checkPositionIndexes(from, to, size());
        final List<Column> columns = new ArrayList<>(_columns.size());
        for (final Column column : _columns.values()) {
            columns.add(column.slice(from, to));
        }
        return new RegularSeries(_axis.slice(from, to), columns);
    }

    /**
     * The rows at the points of another axis. The result uses that axis and
     * its frequency.
     *
     * @param key The axis whose points to select.
     * @return The selected rows.
     * @throws IllegalArgumentException if the axis types differ or a point is absent from this series.
     */
    public RegularSeries slice(final TimeAxis key) {
        checkAxisType(key);
        final int[] positions = new int[key.size()];
        for (int i = 0; i < key.size(); ++i) {
            positions[i] = _axis.indexOf(key.get(i));
            if (positions[i] < 0) {
                throw new IllegalArgumentException(String.format("Time point does not exist; point=%s", key.get(i)));
            }
        }
        return select(key, positions);
    }

    /**
     * Align to another axis. Points of the axis absent from this series become
     * missing rows.
     *
     * @param axis The axis to align to.
     * @return The aligned series.
     * @throws IllegalArgumentException if the axis types differ.
     */
    public RegularSeries reindex(final TimeAxis axis) {
        if (axis.equals(_axis)) {
            return copy();
        }
        checkAxisType(axis);
        final int[] positions = new int[axis.size()];
        for (int i = 0; i < axis.size(); ++i) {
            positions[i] = _axis.indexOf(axis.get(i));
        }
        return select(axis, positions);
    }

    /**
     * A series with a subset of the columns, in the requested order.
     *
     * @param names The column names.
     * @return The selected columns.
     * @throws UnknownColumnException if a column does not exist.
     */
    public RegularSeries select(final List<String> names) {
        final List<String> unknown = names.stream()
                .filter(name -> !_columns.containsKey(name))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new UnknownColumnException("Columns do not exist", unknown);
        }
        final List<Column> columns = new ArrayList<>(names.size());
        for (final String name : names) {
            columns.add(_columns.get(name));
        }
        return new RegularSeries(_axis, columns);
    }

    /**
     * Add or replace a column in place. A replaced column keeps its position.
     *
     * @param column The column.
     * @throws IllegalArgumentException if the column length differs from the axis.
     */
    public void setColumn(final Column column) {
        Preconditions.checkArgument(
                column.size() == size(),
                "column length does not match the axis; column=%s, length=%s, axis=%s",
                column.getName(),
                column.size(),
                size());
        final LinkedHashMap<String, Column> columns = new LinkedHashMap<>(_columns);
        columns.put(column.getName(), column);
        _columns = ImmutableMap.copyOf(columns);
    }

    /**
     * Remove columns in place. Names that do not exist are ignored.
     *
     * @param names The column names.
     */
    public void dropColumns(final Collection<String> names) {
        final LinkedHashMap<String, Column> columns = new LinkedHashMap<>(_columns);
        columns.keySet().removeAll(names);
        _columns = ImmutableMap.copyOf(columns);
    }

    /**
     * Convert every column to a type in place. Either every column is
     * converted or none is.
     *
     * @param type The target type.
     * @throws TypeMismatchException if a value cannot be converted.
     */
    public void cast(final ColumnType type) {
        final Map<String, ColumnType> types = new LinkedHashMap<>();
        for (final String name : _columns.keySet()) {
            types.put(name, type);
        }
        cast(types);
    }

    /**
     * Convert columns to types in place. Either every listed column is
     * converted or none is.
     *
     * @param types The target type per column name.
     * @throws UnknownColumnException if a column does not exist.
     * @throws TypeMismatchException if a value cannot be converted.
     */
    public void cast(final Map<String, ColumnType> types) {
        final List<String> unknown = types.keySet().stream()
                .filter(name -> !_columns.containsKey(name))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new UnknownColumnException("Columns do not exist", unknown);
        }
        final LinkedHashMap<String, Column> columns = new LinkedHashMap<>(_columns);
        for (final Map.Entry<String, ColumnType> entry : types.entrySet()) {
            columns.put(entry.getKey(), columns.get(entry.getKey()).cast(entry.getValue()));
        }
        _columns = ImmutableMap.copyOf(columns);
    }

    /**
     * Order the columns by name in place.
     *
     * @param ascending Whether to sort in ascending order.
     */
    public void sortColumns(final boolean ascending) {
        final Comparator<String> comparator = ascending
                ? Comparator.<String>naturalOrder()
                : Comparator.<String>reverseOrder();
        final List<String> names = new ArrayList<>(_columns.keySet());
        names.sort(comparator);
        final ImmutableMap.Builder<String, Column> columns = ImmutableMap.builder();
        for (final String name : names) {
            columns.put(name, _columns.get(name));
        }
        _columns = columns.build();
    }

    /**
     * An independent copy of this series.
     *
     * @return The copy.
     */
    public RegularSeries copy() {
        return new RegularSeries(_axis, getColumns());
    }

    /**
     * Convert to a table whose index holds the time points.
     *
     * @return The table.
     */
    public Table toTable() {
        final Table.Builder builder = new Table.Builder().setIndex(_axis.getPoints());
        for (final Column column : _columns.values()) {
            builder.addColumn(column.getName(), column.getValues());
        }
        return builder.build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final RegularSeries other = (RegularSeries) object;

        return Objects.equal(_axis, other._axis)
                && Objects.equal(getColumns(), other.getColumns());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_axis, getColumns());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Axis", _axis)
                .add("Columns", getColumnTypes())
                .toString();
    }

    private RegularSeries select(final TimeAxis axis, final int[] positions) {
        final List<Column> columns = new ArrayList<>(_columns.size());
        for (final Column column : _columns.values()) {
            columns.add(column.select(positions));
        }
        return new RegularSeries(axis, columns);
    }

    private void checkAxisType(final TimeAxis axis) {
        if (axis.getType() != _axis.getType()) {
            throw new IllegalArgumentException(String.format(
                    "Axis types do not match; expected=%s, actual=%s",
                    _axis.getType(),
                    axis.getType()));
        }
    }

    private void checkNotEmpty() {
        if (isEmpty()) {
            throw new IllegalArgumentException("Series is empty");
        }
    }

    private static List<Object> readTimes(final Table table, @Nullable final String timeColumn) {
        final List<Object> times;
        if (timeColumn != null) {
            if (table.countColumns(timeColumn) > 1) {
                throw new SchemaException(String.format("Duplicated time column; column=%s", timeColumn));
            }
            times = table.getColumn(timeColumn)
                    .orElseThrow(() -> new SchemaException(String.format(
                            "Time column does not exist; column=%s",
                            timeColumn)));
        } else if (table.getIndex().isPresent()) {
            times = table.getIndex().get();
        } else {
            final List<Object> positions = new ArrayList<>(table.getRowCount());
            for (long row = 0; row < table.getRowCount(); ++row) {
                positions.add(row);
            }
            times = positions;
        }
        if (times.isEmpty()) {
            throw new SchemaException("At least one row is required");
        }
        if (times.contains(null)) {
            throw new SchemaException(String.format("Missing values in the time column; column=%s", timeColumn));
        }
        return times;
    }

    private static List<Object> normalizeTimes(final List<Object> times) {
        if (times.stream().allMatch(OrdinalAxis::isIntegral)) {
            return times.stream()
                    .map(time -> (Object) ((Number) time).longValue())
                    .collect(Collectors.toList());
        }
        if (times.stream().allMatch(Timestamps::isTemporal)) {
            final List<Object> timestamps = new ArrayList<>(times.size());
            for (final Object time : times) {
                try {
                    timestamps.add(Timestamps.toLocalDateTime(time));
                } catch (final IllegalArgumentException e) {
                    throw new SchemaException(String.format("Invalid time value; value=%s", time), e);
                }
            }
            return timestamps;
        }
        final Set<String> types = times.stream()
                .map(time -> time.getClass().getSimpleName())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        throw new TypeMismatchException(String.format(
                "Time values must be integers or timestamps; types=%s",
                types));
    }

    private static TimeAxis ordinalAxis(final List<Object> times, @Nullable final Frequency frequency) {
        final long step;
        if (frequency == null) {
            step = 1;
        } else if (frequency instanceof OrdinalFrequency) {
            step = ((OrdinalFrequency) frequency).getStep();
        } else {
            throw new SchemaException(String.format(
                    "Integer time values require an integer step frequency; frequency=%s",
                    frequency));
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (final Object time : times) {
            min = Math.min(min, (Long) time);
            max = Math.max(max, (Long) time);
        }
        boolean aligned = (max - min) % step == 0 && (max - min) / step + 1 == times.size();
        for (final Object time : times) {
            aligned &= ((Long) time - min) % step == 0;
        }
        if (!aligned) {
            throw new SchemaException(String.format(
                    "The time column has a gap or overlap in the range; start=%d, end=%d, step=%d, rows=%d",
                    min,
                    max,
                    step,
                    times.size()));
        }
        return OrdinalAxis.of(min, step, times.size());
    }

    private static TimeAxis calendarAxis(final List<Object> times, @Nullable final Frequency frequency) {
        final CalendarFrequency calendarFrequency;
        if (frequency == null) {
            final List<LocalDateTime> timestamps = times.stream()
                    .map(LocalDateTime.class::cast)
                    .collect(Collectors.toList());
            final PeriodCode period = FrequencyInference.infer(timestamps)
                    .orElseThrow(() -> new SchemaException(
                            "Failed to infer the frequency of the time column; a valid frequency is required"));
            calendarFrequency = Frequency.calendar(period);
        } else if (frequency instanceof CalendarFrequency) {
            calendarFrequency = (CalendarFrequency) frequency;
        } else {
            throw new SchemaException(String.format(
                    "Timestamp time values require a calendar frequency; frequency=%s",
                    frequency));
        }
        return TimeAxis.span(calendarFrequency, times);
    }

    private static RegularSeries concatTime(final List<RegularSeries> series, final Frequency frequency) {
        final Set<Object> points = new HashSet<>();
        final Map<String, ColumnType> types = new LinkedHashMap<>();
        for (final RegularSeries part : series) {
            for (final Object point : part.getAxis().getPoints()) {
                if (!points.add(point)) {
                    throw new IllegalArgumentException(String.format(
                            "Duplicated time points cannot be concatenated; point=%s",
                            point));
                }
            }
            for (final Column column : part.getColumns()) {
                types.merge(column.getName(), column.getType(), ColumnType::unify);
            }
        }
        final TimeAxis axis = TimeAxis.span(frequency, points);
        final List<Column> columns = new ArrayList<>(types.size());
        for (final Map.Entry<String, ColumnType> entry : types.entrySet()) {
            final List<Object> values = new ArrayList<>(Arrays.asList(new Object[axis.size()]));
            for (final RegularSeries part : series) {
                final Optional<Column> column = part.getColumn(entry.getKey());
                if (column.isPresent()) {
                    final Column converted = column.get().cast(entry.getValue());
                    for (int row = 0; row < part.size(); ++row) {
                        values.set(axis.indexOf(part.getAxis().get(row)), converted.get(row));
                    }
                }
            }
            columns.add(Column.of(entry.getKey(), entry.getValue(), values));
        }
        return new RegularSeries(axis, columns);
    }

    private static RegularSeries concatColumns(final List<RegularSeries> series, final Frequency frequency) {
        final Set<String> names = new HashSet<>();
        final Set<String> duplicated = new LinkedHashSet<>();
        final List<Object> points = new ArrayList<>();
        for (final RegularSeries part : series) {
            for (final String name : part.getColumnNames()) {
                if (!names.add(name)) {
                    duplicated.add(name);
                }
            }
            points.addAll(part.getAxis().getPoints());
        }
        if (!duplicated.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    "Duplicated column names cannot be concatenated; columns=%s",
                    duplicated));
        }
        final TimeAxis axis = TimeAxis.span(frequency, points);
        final List<Column> columns = new ArrayList<>();
        for (final RegularSeries part : series) {
            columns.addAll(part.reindex(axis).getColumns());
        }
        return new RegularSeries(axis, columns);
    }

    private RegularSeries(final TimeAxis axis, final List<Column> columns) {
        _axis = axis;
        final Map<String, Column> columnsByName = new LinkedHashMap<>();
        for (final Column column : columns) {
            if (columnsByName.put(column.getName(), column) != null) {
                throw new IllegalArgumentException(String.format(
                        "Duplicated column names; column=%s",
                        column.getName()));
            }
        }
        _columns = ImmutableMap.copyOf(columnsByName);
    }

    private final TimeAxis _axis;
    private ImmutableMap<String, Column> _columns;

    private static final Logger LOGGER = LoggerFactory.getLogger(RegularSeries.class);
}
