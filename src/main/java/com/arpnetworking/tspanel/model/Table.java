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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Raw tabular input: ordered, loosely typed columns of equal length with an
 * optional row index. Column names may repeat.
 *
 * @author Inscope Metrics
 */
public final class Table {

    public ImmutableList<String> getColumnNames() {
        return _columnNames;
    }

    public int getColumnCount() {
        return _columnNames.size();
    }

    public int getRowCount() {
        return _rowCount;
    }

    /**
     * The values of the column at a position.
     *
     * @param position The column position.
     * @return The unmodifiable values; may contain {@code null}.
     */
    public List<Object> getColumn(final int position) {
        return _columns.get(position);
    }

    /**
     * The values of the first column with a name.
     *
     * @param name The column name.
     * @return The unmodifiable values, if the column exists.
     */
    public Optional<List<Object>> getColumn(final String name) {
        final int position = _columnNames.indexOf(name);
        return position < 0 ? Optional.empty() : Optional.of(_columns.get(position));
    }

    /**
     * The number of columns with a name.
     *
     * @param name The column name.
     * @return The count.
     */
    public int countColumns(final String name) {
        return Collections.frequency(_columnNames, name);
    }

    public Optional<List<Object>> getIndex() {
        return _index;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("ColumnNames", _columnNames)
                .add("RowCount", _rowCount)
                .add("Indexed", _index.isPresent())
                .toString();
    }

    private Table(final Builder builder) {
        _columnNames = ImmutableList.copyOf(builder._columnNames);
        final ImmutableList.Builder<List<Object>> columns = ImmutableList.builder();
        for (final List<?> column : builder._columns) {
            columns.add(Collections.unmodifiableList(new ArrayList<>(column)));
        }
        _columns = columns.build();
        _index = Optional.ofNullable(builder._index)
                .map(index -> Collections.unmodifiableList(new ArrayList<>(index)));
        if (!_columns.isEmpty()) {
            _rowCount = _columns.get(0).size();
        } else {
            _rowCount = _index.map(List::size).orElse(0);
        }
    }

    private final ImmutableList<String> _columnNames;
    private final ImmutableList<List<Object>> _columns;
    private final Optional<List<Object>> _index;
    private final int _rowCount;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Table}.
     */
    public static final class Builder extends OvalBuilder<Table> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Table::new);
        }

        /**
         * Append a column. Names may repeat.
         *
         * @param name The column name.
         * @param values The values; {@code null} is missing.
         * @return This {@link Builder} instance.
         */
        public Builder addColumn(final String name, final List<?> values) {
            _columnNames.add(name);
            _columns.add(values);
            return this;
        }

        /**
         * Set the row index. Optional. Can be null.
         *
         * @param value The index values, one per row.
         * @return This {@link Builder} instance.
         */
        public Builder setIndex(@Nullable final List<?> value) {
            _index = value;
            return this;
        }

        /**
         * Checks that every column and the index have the same number of rows.
         *
         * @param columns The columns.
         * @return True if the column lengths agree.
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateColumns(final List<List<?>> columns) {
            int rows = _index == null ? -1 : _index.size();
            for (final List<?> column : columns) {
                if (rows >= 0 && column.size() != rows) {
                    return false;
                }
                rows = column.size();
            }
            return true;
        }

        @NotNull
        private List<String> _columnNames = new ArrayList<>();
        @NotNull
        @ValidateWithMethod(methodName = "validateColumns", parameterType = List.class)
        private List<List<?>> _columns = new ArrayList<>();
        @Nullable
        private List<?> _index;
    }
}
