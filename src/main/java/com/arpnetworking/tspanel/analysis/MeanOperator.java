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
 * The mean of the present values of each numeric column. Use
 * {@link OperatorRegistry} for lookup.
 *
 * @author Inscope Metrics
 */
public final class MeanOperator extends BaseOperator {

    @Override
    public String getName() {
        return "mean";
    }

    @Override
    public Set<String> getAliases() {
        return Collections.singleton("avg");
    }

    @Override
    public ImmutableMap<String, Double> apply(final Panel panel, final List<?> arguments) {
        final ImmutableMap.Builder<String, Double> result = ImmutableMap.builder();
        for (final Column column : selectColumns(panel, arguments)) {
            if (column.getType().isNumeric()) {
                final List<Double> values = presentValues(column);
                if (!values.isEmpty()) {
                    result.put(column.getName(), mean(values));
                }
            }
        }
        return result.build();
    }

    static double mean(final List<Double> values) {
        double sum = 0;
        for (final double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    MeanOperator() { }
}
