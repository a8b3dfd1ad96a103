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

import com.arpnetworking.tspanel.model.Column;
import com.arpnetworking.tspanel.model.ColumnType;
import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.arpnetworking.tspanel.test.TestBeanFactory;
import com.arpnetworking.tspanel.time.OrdinalAxis;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

/**
 * Tests for the {@link WindowGapFiller} class.
 *
 * @author Inscope Metrics
 */
public class WindowGapFillerTest {

    @Test
    public void fillPrevious() {
        Assert.assertEquals(
                Arrays.asList(null, 1L, 1L, 3L, 3L),
                fill(FillMethod.PREVIOUS, 10, null, 1L, null, 3L, null));
    }

    @Test
    public void fillNext() {
        Assert.assertEquals(
                Arrays.asList(1L, 1L, 3L, 3L, null),
                fill(FillMethod.NEXT, 10, null, 1L, null, 3L, null));
    }

    @Test
    public void fillZero() {
        Assert.assertEquals(
                Arrays.asList(0.0, 1.5, 0.0),
                fill(FillMethod.ZERO, 10, null, 1.5, null));
    }

    @Test
    public void fillMaxUsesTrailingWindow() {
        Assert.assertEquals(
                Arrays.asList(5L, 1L, 2L, 2L, null),
                fill(FillMethod.MAX, 2, 5L, 1L, 2L, null, null));
    }

    @Test
    public void fillMin() {
        Assert.assertEquals(
                Arrays.asList(5L, 1L, 2L, 1L),
                fill(FillMethod.MIN, 3, 5L, 1L, 2L, null));
    }

    @Test
    public void fillAverageWidensIntegers() {
        final RegularSeries filled = FILLER.fill(
                TestBeanFactory.createOrdinalSeries("v", 1L, 2L, null),
                FillMethod.AVG,
                10);
        final Column column = filled.getColumn("v").get();
        Assert.assertEquals(ColumnType.FLOAT64, column.getType());
        Assert.assertEquals(Arrays.asList(1.0, 2.0, 1.5), column.getValues());
    }

    @Test
    public void fillMedian() {
        Assert.assertEquals(
                Arrays.asList(1.0, 9.0, 2.0, 2.0),
                fill(FillMethod.MEDIAN, 10, 1.0, 9.0, 2.0, null));
    }

    @Test
    public void fillLeavesTextForNumericMethods() {
        Assert.assertEquals(
                Arrays.asList("a", null),
                fill(FillMethod.ZERO, 10, "a", null));
        Assert.assertEquals(
                Arrays.asList("a", "a"),
                fill(FillMethod.PREVIOUS, 10, "a", null));
    }

    @Test
    public void fillDoesNotModifyInput() {
        final RegularSeries series = TestBeanFactory.createOrdinalSeries("v", 1L, null);
        FILLER.fill(series, FillMethod.PREVIOUS, 1);
        Assert.assertTrue(series.getColumn("v").get().isMissing(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void fillRejectsEmptyWindow() {
        FILLER.fill(TestBeanFactory.createOrdinalSeries("v", 1L), FillMethod.MAX, 0);
    }

    @Test
    public void fillPanel() {
        final Panel panel = new Panel.Builder()
                .setTarget(TestBeanFactory.createOrdinalSeries("y", 1L, null))
                .setKnown(RegularSeries.of(
                        OrdinalAxis.of(0, 1, 3),
                        ImmutableList.of(Column.of("k", Arrays.asList(null, 2L, null)))))
                .build();
        FILLER.fill(panel, FillMethod.ZERO, 1);
        Assert.assertEquals(ImmutableList.of(1L, 0L), panel.getTarget().get().getColumn("y").get().getValues());
        Assert.assertEquals(ImmutableList.of(0L, 2L, 0L), panel.getKnown().get().getColumn("k").get().getValues());
    }

    @Test
    public void fillMethodNames() {
        Assert.assertEquals(FillMethod.AVG, FillMethod.fromName("mean"));
        Assert.assertEquals(FillMethod.PREVIOUS, FillMethod.fromName("pre"));
        Assert.assertEquals(FillMethod.NEXT, FillMethod.fromName("BACK"));
        Assert.assertTrue(FillMethod.MEDIAN.isWindowed());
        Assert.assertFalse(FillMethod.ZERO.isWindowed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void fillMethodRejectsUnknownName() {
        FillMethod.fromName("linear");
    }

    private static List<Object> fill(final FillMethod method, final int windowSize, final Object... values) {
        return FILLER.fill(TestBeanFactory.createOrdinalSeries("v", values), method, windowSize)
                .getColumn("v")
                .get()
                .getValues();
    }

    private static final GapFiller FILLER = new WindowGapFiller();
}
