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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An immutable, named and typed sequence of values. Missing values are
 * {@code null}.
 *
 * @author Inscope Metrics
 */
public final class Column {

    /**
     * Create a column inferring its type from the values.
     *
     * @param name The column name.
     * @param values The values; {@code null} is missing.
     * @return The column.
     */
    public static Column of(final String name, final List<?> values) {
        return of(name, ColumnType.infer(values), values);
    }

    /**
     * Create a column of a type, converting every value.
     *
     * @param name The column name.
     * @param type The column type.
     * @param values The values; {@code null} is missing.
     * @return The column.
     * @throws TypeMismatchException if a value cannot be converted to the type.
     */
    public static Column of(final String name, final ColumnType type, final List<?> values) {
        final List<Object> converted = new ArrayList<>(values.size());
        for (final Object value : values) {
            try {
                converted.add(type.convert(value));
            } catch (final TypeMismatchException e) {
                throw new TypeMismatchException(
                        String.format("Column cannot be converted; column=%s, type=%s", name, type.getName()),
                        e);
            }
        }
        return new Column(name, type, Collections.unmodifiableList(converted));
    }

    /**
     * Create a column repeating one value.
     *
     * @param name The column name.
     * @param value The value.
     * @param size The number of rows.
     * @return The column.
     */
    public static Column constant(final String name, final Object value, final int size) {
        return of(name, ColumnType.infer(Collections.singletonList(value)), Collections.nCopies(size, value));
    }

    /**
     * Create a column of missing values.
     *
     * @param name The column name.
     * @param type The column type.
     * @param size The number of rows.
     * @return The column.
     */
    public static Column missing(final String name, final ColumnType type, final int size) {
        return new Column(name, type, Collections.nCopies(size, null));
    }

    public String getName() {
        return _name;
    }

    public ColumnType getType() {
        return _type;
    }

    public int size() {
        return _values.size();
    }

    /**
     * The values in row order. The list is unmodifiable and may contain
     * {@code null} for missing values.
     *
     * @return The values.
     */
    public List<Object> getValues() {
        return _values;
    }

    /**
     * The value at a row.
     *
     * @param row The row position.
     * @return The value, or {@code null} if missing.
     */
    @Nullable
    public Object get(final int row) {
        return _values.get(row);
    }

    public boolean isMissing(final int row) {
        return _values.get(row) == null;
    }

    /**
     * The number of missing values.
     *
     * @return The count.
     */
    public int countMissing() {
        int missing = 0;
        for (final Object value : _values) {
            if (value == null) {
                ++missing;
            }
        }
        return missing;
    }

    /**
     * The numeric value at a row.
     *
     * @param row The row position.
     * @return The value as a double, or {@code null} if missing.
     * @throws IllegalStateException if the column is not numeric.
     */
    @Nullable
    public Double getDouble(final int row) {
        Preconditions.checkState(_type.isNumeric(), "column is not numeric; column=%s, type=%s", _name, _type);
        @Nullable final Object value = _values.get(row);
        return value == null ? null : ((Number) value).doubleValue();
    }

    /**
     * A copy of this column under a different name.
     *
     * @param name The new name.
     * @return The renamed column.
     */
    public Column rename(final String name) {
        if (_name.equals(name)) {
            return this;
        }
        return new Column(name, _type, _values);
    }

    /**
     * Convert this column to another type.
     *
     * @param type The target type.
     * @return The converted column.
     * @throws TypeMismatchException if a value cannot be converted.
     */
    public Column cast(final ColumnType type) {
        if (_type == type) {
            return this;
        }
        return of(_name, type, _values);
    }

    /**
     * The rows between two positions.
     *
     * @param from The first row, inclusive.
     * @param to The last row, exclusive.
     * @return The sliced column.
     */
    public Column slice(final int from, final int to) {
        return new Column(_name, _type, Collections.unmodifiableList(new ArrayList<>(_values.subList(from, to))));
    }

    /**
     * Gather rows by position. A position of {@code -1} produces a missing value.
     *
     * @param positions The row positions to gather.
     * @return The gathered column.
     */
    public Column select(final int[] positions) {
        final List<Object> selected = new ArrayList<>(positions.length);
        for (final int position : positions) {
            selected.add(position < 0 ? null : _values.get(position));
        }
        return new Column(_name, _type, Collections.unmodifiableList(selected));
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Column other = (Column) object;

        return Objects.equal(_name, other._name)
                && _type == other._type
                && Objects.equal(_values, other._values);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_name, _type, _values);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .add("Type", _type)
                .add("Values", _values)
                .toString();
    }

    private Column(final String name, final ColumnType type, final List<Object> values) {
        _name = name;
        _type = type;
        _values = values;
    }

    private final String _name;
    private final ColumnType _type;
    private final List<Object> _values;
}
