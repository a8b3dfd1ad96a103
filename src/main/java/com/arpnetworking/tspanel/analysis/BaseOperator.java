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
package com.arpnetworking.tspanel.analysis;

import com.arpnetworking.tspanel.model.Column;
import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.arpnetworking.tspanel.model.TypeMismatchException;
import com.google.common.base.MoreObjects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Base class for operators that compute one result per column. With no
 * arguments every time varying column is used; otherwise each argument names
 * a column to use.
 *
 * @author Inscope Metrics
 */
public abstract class BaseOperator implements PanelOperator {

    @Override
    public Set<String> getAliases() {
        return Collections.emptySet();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        return object != null && getClass().equals(object.getClass());
    }

    @Override
    public int hashCode() {
        return getName().hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", getName())
                .add("Aliases", getAliases())
                .toString();
    }

    /**
     * Read the columns an invocation applies to.
     *
     * @param panel The panel.
     * @param arguments Column names, or nothing for every time varying column.
     * @return The columns.
     * @throws TypeMismatchException if an argument is not a string.
     */
    protected static List<Column> selectColumns(final Panel panel, final List<?> arguments) {
        final RegularSeries series;
        if (arguments.isEmpty()) {
            series = panel.toSeries();
        } else {
            final List<String> names = new ArrayList<>(arguments.size());
            for (final Object argument : arguments) {
                if (!(argument instanceof String)) {
                    throw new TypeMismatchException(String.format(
                            "Operator arguments must be column names; argument=%s",
                            argument));
                }
                names.add((String) argument);
            }
            series = panel.read(names);
        }
        return series.getColumns();
    }

    /**
     * The present values of a numeric column.
     *
     * @param column The column.
     * @return The values in row order.
     */
    protected static List<Double> presentValues(final Column column) {
        final List<Double> values = new ArrayList<>(column.size());
        for (int row = 0; row < column.size(); ++row) {
            @Nullable final Double value = column.getDouble(row);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
