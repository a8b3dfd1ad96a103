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
import com.arpnetworking.tspanel.model.ColumnType;
import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.arpnetworking.tspanel.model.TypeMismatchException;
import com.arpnetworking.tspanel.model.UnknownColumnException;
import com.arpnetworking.tspanel.time.OrdinalAxis;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Tests for the built-in {@link PanelOperator} implementations.
 *
 * @author Inscope Metrics
 */
public class SummaryOperatorTest {

    @Before
    public void setUp() {
        _panel = new Panel.Builder()
                .setTarget(RegularSeries.of(
                        OrdinalAxis.of(0, 1, 4),
                        ImmutableList.of(Column.of("y", Arrays.asList(1L, 3L, null, 8L)))))
                .setObserved(RegularSeries.of(
                        OrdinalAxis.of(0, 1, 4),
                        ImmutableList.of(
                                Column.of("x", Arrays.asList(null, null, 2.5, null)),
                                Column.of("label", Arrays.asList("a", "b", null, "c")))))
                .setStaticCovariates(ImmutableMap.of("region", "west"))
                .build();
    }

    @Test
    public void summary() {
        @SuppressWarnings("unchecked")
        final Map<String, ColumnSummary> result = (Map<String, ColumnSummary>) _panel.invoke("summary");
        Assert.assertEquals(ImmutableList.of("y", "x", "label"), ImmutableList.copyOf(result.keySet()));

        final ColumnSummary y = result.get("y");
        Assert.assertEquals(ColumnType.INT64, y.getType());
        Assert.assertEquals(3, y.getCount());
        Assert.assertEquals(1, y.getMissing());
        Assert.assertEquals(4.0, y.getMean().get(), 0.0001);
        Assert.assertEquals(Math.sqrt(13.0), y.getStandardDeviation().get(), 0.0001);
        Assert.assertEquals(1.0, y.getMin().get(), 0.0001);
        Assert.assertEquals(8.0, y.getMax().get(), 0.0001);

        final ColumnSummary x = result.get("x");
        Assert.assertEquals(2.5, x.getMean().get(), 0.0001);
        Assert.assertEquals(Optional.empty(), x.getStandardDeviation());

        final ColumnSummary label = result.get("label");
        Assert.assertEquals(3, label.getCount());
        Assert.assertEquals(Optional.empty(), label.getMean());
        Assert.assertEquals(Optional.empty(), label.getMax());
    }

    @Test
    public void summaryOfSelectedColumns() {
        @SuppressWarnings("unchecked")
        final Map<String, ColumnSummary> result = (Map<String, ColumnSummary>) _panel.invoke("describe", "label", "region");
        Assert.assertEquals(ImmutableList.of("label", "region"), ImmutableList.copyOf(result.keySet()));
        Assert.assertEquals(ColumnType.STRING, result.get("region").getType());
        Assert.assertEquals(4, result.get("region").getCount());
    }

    @Test
    public void maxAndMin() {
        Assert.assertEquals(ImmutableMap.of("y", 8.0, "x", 2.5), _panel.invoke("max"));
        Assert.assertEquals(ImmutableMap.of("y", 1.0, "x", 2.5), _panel.invoke("min"));
    }

    @Test
    public void mean() {
        Assert.assertEquals(ImmutableMap.of("y", 4.0), _panel.invoke("avg", "y", "label"));
    }

    @Test
    public void count() {
        Assert.assertEquals(ImmutableMap.of("y", 3L, "x", 1L, "label", 3L), _panel.invoke("count"));
    }

    @Test(expected = UnknownColumnException.class)
    public void rejectsUnknownColumns() {
        _panel.invoke("max", "missing");
    }

    @Test(expected = TypeMismatchException.class)
    public void rejectsNonStringArguments() {
        _panel.invoke("max", 1);
    }

    private Panel _panel;
}
