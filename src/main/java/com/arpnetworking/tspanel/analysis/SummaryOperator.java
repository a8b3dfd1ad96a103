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
import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Descriptive statistics of each column. Numeric columns report the mean,
 * sample standard deviation, minimum and maximum of their present values;
 * other columns only report counts. Use {@link OperatorRegistry} for lookup.
 *
 * @author Inscope Metrics
 */
public final class SummaryOperator extends BaseOperator {

    @Override
    public String getName() {
        return "summary";
    }

    @Override
    public Set<String> getAliases() {
        return Collections.singleton("describe");
    }

    @Override
    public ImmutableMap<String, ColumnSummary> apply(final Panel panel, final List<?> arguments) {
        final ImmutableMap.Builder<String, ColumnSummary> result = ImmutableMap.builder();
        for (final Column column : selectColumns(panel, arguments)) {
            result.put(column.getName(), summarize(column));
        }
        return result.build();
    }

    private static ColumnSummary summarize(final Column column) {
        final ColumnSummary.Builder builder = new ColumnSummary.Builder()
                .setType(column.getType())
                .setCount((long) (column.size() - column.countMissing()))
                .setMissing((long) column.countMissing());
        if (column.getType().isNumeric()) {
            final List<Double> values = presentValues(column);
            if (!values.isEmpty()) {
                final double mean = MeanOperator.mean(values);
                builder.setMean(mean)
                        .setMin(Collections.min(values))
                        .setMax(Collections.max(values));
                if (values.size() > 1) {
                    double squares = 0;
                    for (final double value : values) {
                        squares += (value - mean) * (value - mean);
                    }
                    builder.setStandardDeviation(Math.sqrt(squares / (values.size() - 1)));
                }
            }
        }
        return builder.build();
    }

    SummaryOperator() { }
}
