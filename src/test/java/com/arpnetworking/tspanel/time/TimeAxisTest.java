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
package com.arpnetworking.tspanel.time;

import com.arpnetworking.tspanel.model.SchemaException;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDateTime;

/**
 * Tests for the {@link TimeAxis} implementations.
 *
 * @author Inscope Metrics
 */
public class TimeAxisTest {

    @Test
    public void spanOrdinalCoversGaps() {
        final TimeAxis axis = TimeAxis.span(Frequency.ordinal(2), ImmutableList.of(10L, 4L, 8));
        Assert.assertEquals(OrdinalAxis.of(4, 2, 4), axis);
        Assert.assertEquals(ImmutableList.of(4L, 6L, 8L, 10L), axis.getPoints());
    }

    @Test(expected = SchemaException.class)
    public void spanOrdinalRejectsMisalignedPoints() {
        TimeAxis.span(Frequency.ordinal(2), ImmutableList.of(0L, 3L));
    }

    @Test(expected = SchemaException.class)
    public void spanOrdinalRejectsTimestamps() {
        TimeAxis.span(Frequency.ordinal(1), ImmutableList.of(LocalDateTime.of(2021, 1, 1, 0, 0)));
    }

    @Test
    public void spanCalendarCoversGaps() {
        final TimeAxis axis = TimeAxis.span(
                Frequency.calendar("D"),
                ImmutableList.of(LocalDateTime.of(2021, 1, 4, 0, 0), LocalDateTime.of(2021, 1, 1, 0, 0)));
        Assert.assertEquals(4, axis.size());
        Assert.assertEquals(LocalDateTime.of(2021, 1, 1, 0, 0), axis.get(0));
        Assert.assertEquals(LocalDateTime.of(2021, 1, 4, 0, 0), axis.get(3));
    }

    @Test(expected = SchemaException.class)
    public void spanCalendarRejectsOffGridPoints() {
        TimeAxis.span(
                Frequency.calendar("D"),
                ImmutableList.of(LocalDateTime.of(2021, 1, 1, 0, 0), LocalDateTime.of(2021, 1, 2, 12, 0)));
    }

    @Test(expected = SchemaException.class)
    public void spanCalendarRejectsStartOffAnchor() {
        TimeAxis.span(
                Frequency.calendar("MS"),
                ImmutableList.of(LocalDateTime.of(2021, 1, 15, 0, 0), LocalDateTime.of(2021, 2, 15, 0, 0)));
    }

    @Test(expected = SchemaException.class)
    public void calendarAxisRejectsNonConsecutiveTimestamps() {
        CalendarAxis.of(
                ImmutableList.of(LocalDateTime.of(2021, 1, 1, 0, 0), LocalDateTime.of(2021, 1, 3, 0, 0)),
                Frequency.calendar("D"));
    }

    @Test
    public void ordinalIndexOf() {
        final OrdinalAxis axis = OrdinalAxis.of(10, 5, 3);
        Assert.assertEquals(0, axis.indexOf(10L));
        Assert.assertEquals(2, axis.indexOf(20));
        Assert.assertEquals(-1, axis.indexOf(12L));
        Assert.assertEquals(-1, axis.indexOf(25L));
        Assert.assertEquals(-1, axis.indexOf("10"));
    }

    @Test
    public void ordinalCountAtOrBefore() {
        final OrdinalAxis axis = OrdinalAxis.of(10, 5, 3);
        Assert.assertEquals(0, axis.countAtOrBefore(9L));
        Assert.assertEquals(1, axis.countAtOrBefore(10L));
        Assert.assertEquals(2, axis.countAtOrBefore(19L));
        Assert.assertEquals(3, axis.countAtOrBefore(100L));
    }

    @Test
    public void calendarCeilingAndFloor() {
        final CalendarAxis axis = CalendarAxis.of(LocalDateTime.of(2021, 1, 1, 0, 0), 3, Frequency.calendar("D"));
        final LocalDateTime noon = LocalDateTime.of(2021, 1, 2, 12, 0);
        Assert.assertEquals(2, axis.ceilingIndex(noon));
        Assert.assertEquals(1, axis.floorIndex(noon));
        Assert.assertEquals(1, axis.ceilingIndex(LocalDateTime.of(2021, 1, 2, 0, 0)));
        Assert.assertEquals(-1, axis.ceilingIndex(LocalDateTime.of(2021, 1, 4, 0, 0)));
        Assert.assertEquals(-1, axis.floorIndex(LocalDateTime.of(2020, 12, 31, 0, 0)));
    }

    @Test
    public void sliceKeepsFrequency() {
        final CalendarAxis axis = CalendarAxis.of(LocalDateTime.of(2021, 1, 1, 0, 0), 5, Frequency.calendar("H"));
        final CalendarAxis slice = axis.slice(1, 3);
        Assert.assertEquals(2, slice.size());
        Assert.assertEquals(LocalDateTime.of(2021, 1, 1, 1, 0), slice.get(0));
        Assert.assertEquals(axis.getFrequency(), slice.getFrequency());
    }

    @Test
    public void parseFrequency() {
        Assert.assertEquals(Frequency.ordinal(3), Frequency.parse("3"));
        Assert.assertEquals(AxisType.ORDINAL, Frequency.parse("1").getAxisType());
        Assert.assertEquals(Frequency.calendar("W-SUN"), Frequency.parse("W"));
        Assert.assertEquals(AxisType.CALENDAR, Frequency.parse("D").getAxisType());
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseFrequencyRejectsZeroStep() {
        Frequency.parse("0");
    }

    @Test
    public void parseTimestamps() {
        final LocalDateTime expected = LocalDateTime.of(2021, 3, 4, 5, 6, 7);
        Assert.assertEquals(expected, Timestamps.parse("2021-03-04T05:06:07"));
        Assert.assertEquals(expected, Timestamps.parse("2021-03-04 05:06:07"));
        Assert.assertEquals(LocalDateTime.of(2021, 3, 4, 0, 0), Timestamps.parse("2021-03-04"));
    }
}
