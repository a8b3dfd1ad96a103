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

import com.arpnetworking.tspanel.test.TestBeanFactory;
import com.arpnetworking.tspanel.time.CalendarAxis;
import com.arpnetworking.tspanel.time.Frequency;
import com.arpnetworking.tspanel.time.OrdinalAxis;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDateTime;
import java.util.Arrays;

/**
 * Tests for the {@link RegularSeries} class.
 *
 * @author Inscope Metrics
 */
public class RegularSeriesTest {

    @Test
    public void loadOrdinalSortsRows() {
        final Table table = new Table.Builder()
                .addColumn("t", ImmutableList.of(2L, 0L, 1L))
                .addColumn("v", ImmutableList.of(20L, 0L, 10L))
                .build();
        final RegularSeries series = RegularSeries.load(table, "t", null, null);
        Assert.assertEquals(OrdinalAxis.of(0, 1, 3), series.getAxis());
        Assert.assertEquals(ImmutableList.of("v"), series.getColumnNames());
        Assert.assertEquals(ImmutableList.of(0L, 10L, 20L), series.getColumn("v").get().getValues());
    }

    @Test
    public void loadOrdinalWithStep() {
        final Table table = new Table.Builder()
                .addColumn("t", ImmutableList.of(0L, 5L, 10L))
                .addColumn("v", ImmutableList.of(1.0, 2.0, 3.0))
                .build();
        final RegularSeries series = RegularSeries.load(table, "t", null, Frequency.ordinal(5));
        Assert.assertEquals(Frequency.ordinal(5), series.getFrequency());
        Assert.assertEquals(10L, series.getEndTime());
    }

    @Test(expected = SchemaException.class)
    public void loadOrdinalRejectsGaps() {
        final Table table = new Table.Builder()
                .addColumn("t", ImmutableList.of(0L, 1L, 3L))
                .addColumn("v", ImmutableList.of(1L, 2L, 3L))
                .build();
        RegularSeries.load(table, "t", null, null);
    }

    @Test
    public void loadWithoutTimeColumnUsesRowPositions() {
        final Table table = new Table.Builder()
                .addColumn("v", ImmutableList.of("a", "b"))
                .build();
        final RegularSeries series = RegularSeries.load(table, null, null, null);
        Assert.assertEquals(OrdinalAxis.of(0, 1, 2), series.getAxis());
        Assert.assertEquals(ColumnType.STRING, series.getColumnTypes().get("v"));
    }

    @Test
    public void loadWithIndex() {
        final Table table = new Table.Builder()
                .setIndex(ImmutableList.of("2021-03-01", "2021-03-02", "2021-03-03"))
                .addColumn("v", ImmutableList.of(1L, 2L, 3L))
                .build();
        final RegularSeries series = RegularSeries.load(table, null, null, null);
        Assert.assertEquals(Frequency.calendar("D"), series.getFrequency());
        Assert.assertEquals(LocalDateTime.of(2021, 3, 1, 0, 0), series.getStartTime());
    }

    @Test
    public void loadCalendarInsertsMissingRows() {
        final Table table = new Table.Builder()
                .addColumn("date", ImmutableList.of("2021-01-01", "2021-01-02", "2021-01-04"))
                .addColumn("v", ImmutableList.of(1L, 2L, 4L))
                .build();
        final RegularSeries series = RegularSeries.load(table, "date", ImmutableList.of("v"), Frequency.calendar("D"));
        Assert.assertEquals(4, series.size());
        Assert.assertEquals(Arrays.asList(1L, 2L, null, 4L), series.getColumn("v").get().getValues());
        Assert.assertEquals(ColumnType.INT64, series.getColumn("v").get().getType());
    }

    @Test(expected = SchemaException.class)
    public void loadCalendarRequiresInferableFrequency() {
        final Table table = new Table.Builder()
                .addColumn("date", ImmutableList.of("2021-01-01", "2021-01-02", "2021-01-04"))
                .addColumn("v", ImmutableList.of(1L, 2L, 4L))
                .build();
        RegularSeries.load(table, "date", null, null);
    }

    @Test(expected = SchemaException.class)
    public void loadCalendarRejectsOrdinalFrequency() {
        final Table table = new Table.Builder()
                .addColumn("date", ImmutableList.of("2021-01-01", "2021-01-02"))
                .addColumn("v", ImmutableList.of(1L, 2L))
                .build();
        RegularSeries.load(table, "date", null, Frequency.ordinal(1));
    }

    @Test(expected = SchemaException.class)
    public void loadRejectsUnknownValueColumn() {
        final Table table = new Table.Builder()
                .addColumn("t", ImmutableList.of(0L, 1L))
                .build();
        RegularSeries.load(table, "t", ImmutableList.of("v"), null);
    }

    @Test(expected = SchemaException.class)
    public void loadRejectsUnknownTimeColumn() {
        final Table table = new Table.Builder()
                .addColumn("v", ImmutableList.of(0L, 1L))
                .build();
        RegularSeries.load(table, "t", null, null);
    }

    @Test(expected = SchemaException.class)
    public void loadRejectsDuplicatedTimes() {
        final Table table = new Table.Builder()
                .addColumn("t", ImmutableList.of(0L, 0L))
                .addColumn("v", ImmutableList.of(1L, 2L))
                .build();
        RegularSeries.load(table, "t", null, null);
    }

    @Test(expected = SchemaException.class)
    public void loadRejectsDuplicatedColumns() {
        final Table table = new Table.Builder()
                .addColumn("t", ImmutableList.of(0L, 1L))
                .addColumn("v", ImmutableList.of(1L, 2L))
                .addColumn("v", ImmutableList.of(3L, 4L))
                .build();
        RegularSeries.load(table, "t", null, null);
    }

    @Test(expected = TypeMismatchException.class)
    public void loadRejectsUnsupportedTimeValues() {
        final Table table = new Table.Builder()
                .addColumn("t", ImmutableList.of(true, false))
                .addColumn("v", ImmutableList.of(1L, 2L))
                .build();
        RegularSeries.load(table, "t", null, null);
    }

    @Test
    public void indexAtFraction() {
        final RegularSeries series = TestBeanFactory.createOrdinalSeries("v", 1L, 2L, 3L, 4L, 5L);
        Assert.assertEquals(0, series.indexAt(0.0, false));
        Assert.assertEquals(2, series.indexAt(0.5, false));
        Assert.assertEquals(4, series.indexAt(1.0, false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void indexAtRejectsFractionOutOfRange() {
        TestBeanFactory.createOrdinalSeries("v", 1L, 2L).indexAt(1.5, false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void indexAtRejectsPositionOutOfRange() {
        TestBeanFactory.createOrdinalSeries("v", 1L, 2L).indexAt(2, false);
    }

    @Test
    public void indexAtTimestampBetweenPoints() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L, 3L);
        Assert.assertEquals(1, series.indexAt("2021-01-02", false));
        Assert.assertEquals(1, series.indexAt(LocalDateTime.of(2021, 1, 2, 12, 0), false));
        Assert.assertEquals(2, series.indexAt(LocalDateTime.of(2021, 1, 2, 12, 0), true));
    }

    @Test
    public void indexAtExactTimestampIgnoresPreference() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L, 3L);
        Assert.assertEquals(1, series.indexAt("2021-01-02", true));
        Assert.assertEquals(1, series.indexAt(LocalDateTime.of(2021, 1, 2, 0, 0), true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void indexAtTimestampRequiresCalendarAxis() {
        TestBeanFactory.createOrdinalSeries("v", 1L, 2L).indexAt("2021-01-01", false);
    }

    @Test(expected = TypeMismatchException.class)
    public void indexAtRejectsUnsupportedType() {
        TestBeanFactory.createOrdinalSeries("v", 1L, 2L).indexAt(Boolean.TRUE, false);
    }

    @Test
    public void splitAtPosition() {
        final RegularSeries series = TestBeanFactory.createOrdinalSeries("v", 1L, 2L, 3L, 4L);
        final Split<RegularSeries> split = series.split(1, false);
        Assert.assertEquals(1, split.getLeft().size());
        Assert.assertEquals(3, split.getRight().size());
        Assert.assertEquals(1L, split.getRight().getStartTime());
    }

    @Test
    public void splitAtTimestampIncludesPointOnTheLeft() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L, 3L, 4L);
        final Split<RegularSeries> split = series.split("2021-01-02", false);
        Assert.assertEquals(2, split.getLeft().size());
        Assert.assertEquals(LocalDateTime.of(2021, 1, 3, 0, 0), split.getRight().getStartTime());
    }

    @Test
    public void splitAfter() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L, 3L, 4L);
        final Split<RegularSeries> split = series.splitAfter(LocalDateTime.of(2021, 1, 3, 6, 0));
        Assert.assertEquals(3, split.getLeft().size());
        Assert.assertEquals(1, split.getRight().size());
    }

    @Test
    public void concatTimeRestoresSplitSeries() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L, 3L, 4L, 5L);
        final ImmutableList<Object> points = ImmutableList.of(
                0.25,
                0.5,
                1,
                3,
                "2021-01-02",
                LocalDateTime.of(2021, 1, 3, 12, 0));
        for (final Object point : points) {
            for (final boolean preferAfter : new boolean[] {false, true}) {
                final Split<RegularSeries> split = series.split(point, preferAfter);
                Assert.assertEquals(
                        "point=" + point + ", preferAfter=" + preferAfter,
                        series,
                        RegularSeries.concat(ImmutableList.of(split.getLeft(), split.getRight()), ConcatAxis.TIME));
            }
        }
    }

    @Test
    public void concatTimeFillsHoles() {
        final RegularSeries first = TestBeanFactory.createDailySeries("2021-01-04", "v", 4L, 5L);
        final RegularSeries second = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L);
        final RegularSeries result = RegularSeries.concat(ImmutableList.of(first, second), ConcatAxis.TIME);
        Assert.assertEquals(LocalDateTime.of(2021, 1, 1, 0, 0), result.getStartTime());
        Assert.assertEquals(Arrays.asList(1L, 2L, null, 4L, 5L), result.getColumn("v").get().getValues());
    }

    @Test
    public void concatTimeUnifiesColumnTypes() {
        final RegularSeries first = TestBeanFactory.createOrdinalSeries("v", 1L, 2L);
        final RegularSeries second = TestBeanFactory.createSeries(OrdinalAxis.of(2, 1, 1), "v", 2.5);
        final RegularSeries result = RegularSeries.concat(ImmutableList.of(first, second), ConcatAxis.TIME);
        Assert.assertEquals(ColumnType.FLOAT64, result.getColumn("v").get().getType());
        Assert.assertEquals(ImmutableList.of(1.0, 2.0, 2.5), result.getColumn("v").get().getValues());
    }

    @Test(expected = IllegalArgumentException.class)
    public void concatTimeRejectsOverlap() {
        final RegularSeries first = TestBeanFactory.createOrdinalSeries("v", 1L, 2L);
        final RegularSeries second = TestBeanFactory.createSeries(OrdinalAxis.of(1, 1, 2), "v", 3L, 4L);
        RegularSeries.concat(ImmutableList.of(first, second), ConcatAxis.TIME);
    }

    @Test(expected = IllegalArgumentException.class)
    public void concatRejectsDifferentFrequencies() {
        final RegularSeries first = TestBeanFactory.createOrdinalSeries("a", 1L, 2L);
        final RegularSeries second = TestBeanFactory.createSeries(OrdinalAxis.of(0, 2, 2), "b", 3L, 4L);
        RegularSeries.concat(ImmutableList.of(first, second), ConcatAxis.COLUMNS);
    }

    @Test
    public void concatColumnsCoversEveryPoint() {
        final RegularSeries first = TestBeanFactory.createDailySeries("2021-01-01", "a", 1L, 2L);
        final RegularSeries second = TestBeanFactory.createDailySeries("2021-01-02", "b", 20L, 30L);
        final RegularSeries result = RegularSeries.concat(ImmutableList.of(first, second), ConcatAxis.COLUMNS);
        Assert.assertEquals(3, result.size());
        Assert.assertEquals(ImmutableList.of("a", "b"), result.getColumnNames());
        Assert.assertEquals(Arrays.asList(1L, 2L, null), result.getColumn("a").get().getValues());
        Assert.assertEquals(Arrays.asList(null, 20L, 30L), result.getColumn("b").get().getValues());
    }

    @Test(expected = IllegalArgumentException.class)
    public void concatColumnsRejectsDuplicatedNames() {
        final RegularSeries series = TestBeanFactory.createOrdinalSeries("a", 1L, 2L);
        RegularSeries.concat(ImmutableList.of(series, series.copy()), ConcatAxis.COLUMNS);
    }

    @Test
    public void sliceByAxis() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L, 3L);
        final CalendarAxis key = CalendarAxis.of(LocalDateTime.of(2021, 1, 2, 0, 0), 2, Frequency.calendar("D"));
        Assert.assertEquals(ImmutableList.of(2L, 3L), series.slice(key).getColumn("v").get().getValues());
    }

    @Test(expected = IllegalArgumentException.class)
    public void sliceByAxisRejectsAbsentPoints() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L, 3L);
        series.slice(CalendarAxis.of(LocalDateTime.of(2021, 1, 3, 0, 0), 2, Frequency.calendar("D")));
    }

    @Test
    public void reindex() {
        final RegularSeries series = TestBeanFactory.createOrdinalSeries("v", 1L, 2L);
        final RegularSeries result = series.reindex(OrdinalAxis.of(1, 1, 3));
        Assert.assertEquals(Arrays.asList(2L, null, null), result.getColumn("v").get().getValues());
    }

    @Test(expected = UnknownColumnException.class)
    public void selectRejectsUnknownColumns() {
        TestBeanFactory.createOrdinalSeries("v", 1L).select(ImmutableList.of("v", "w"));
    }

    @Test
    public void castIsAtomic() {
        final RegularSeries series = RegularSeries.of(
                OrdinalAxis.of(0, 1, 2),
                ImmutableList.of(
                        Column.of("a", ImmutableList.of(1L, 2L)),
                        Column.of("b", ImmutableList.of("x", "y"))));
        try {
            series.cast(ColumnType.FLOAT64);
            Assert.fail("Expected exception");
        } catch (final TypeMismatchException e) {
            Assert.assertEquals(
                    ImmutableMap.of("a", ColumnType.INT64, "b", ColumnType.STRING),
                    series.getColumnTypes());
        }
        series.cast(ImmutableMap.of("a", ColumnType.FLOAT64));
        Assert.assertEquals(ImmutableList.of(1.0, 2.0), series.getColumn("a").get().getValues());
    }

    @Test
    public void setAndDropColumns() {
        final RegularSeries series = TestBeanFactory.createOrdinalSeries("a", 1L, 2L);
        final RegularSeries original = series.copy();
        series.setColumn(Column.of("b", ImmutableList.of(true, false)));
        series.setColumn(Column.of("a", ImmutableList.of(5L, 6L)));
        Assert.assertEquals(ImmutableList.of("a", "b"), series.getColumnNames());
        Assert.assertEquals(ImmutableList.of(5L, 6L), series.getColumn("a").get().getValues());
        series.dropColumns(ImmutableList.of("a", "missing"));
        Assert.assertEquals(ImmutableList.of("b"), series.getColumnNames());
        Assert.assertEquals(ImmutableList.of("a"), original.getColumnNames());
    }

    @Test
    public void sortColumns() {
        final RegularSeries series = RegularSeries.of(
                OrdinalAxis.of(0, 1, 1),
                ImmutableList.of(
                        Column.of("b", ImmutableList.of(1L)),
                        Column.of("c", ImmutableList.of(1L)),
                        Column.of("a", ImmutableList.of(1L))));
        series.sortColumns(true);
        Assert.assertEquals(ImmutableList.of("a", "b", "c"), series.getColumnNames());
        series.sortColumns(false);
        Assert.assertEquals(ImmutableList.of("c", "b", "a"), series.getColumnNames());
    }

    @Test
    public void toTable() {
        final RegularSeries series = TestBeanFactory.createDailySeries("2021-01-01", "v", 1L, 2L);
        final Table table = series.toTable();
        Assert.assertEquals(ImmutableList.of("v"), table.getColumnNames());
        Assert.assertEquals(
                ImmutableList.of(LocalDateTime.of(2021, 1, 1, 0, 0), LocalDateTime.of(2021, 1, 2, 0, 0)),
                table.getIndex().get());
        Assert.assertEquals(series, RegularSeries.load(table, null, null, Frequency.calendar("D")));
    }

    @Test(expected = IllegalStateException.class)
    public void startTimeOfEmptySeries() {
        TestBeanFactory.createOrdinalSeries("v").getStartTime();
    }
}
