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
package com.arpnetworking.tspanel.test;

import com.arpnetworking.tspanel.model.Column;
import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.arpnetworking.tspanel.time.CalendarAxis;
import com.arpnetworking.tspanel.time.Frequency;
import com.arpnetworking.tspanel.time.OrdinalAxis;
import com.arpnetworking.tspanel.time.TimeAxis;
import com.arpnetworking.tspanel.time.Timestamps;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Creates reasonable random instances of common data types for testing. This is
 * strongly preferred over mocking data type classes as mocking should be
 * reserved for defining behavior and not data.
 *
 * @author Inscope Metrics
 */
public final class TestBeanFactory {

    /**
     * Create a single column series on an ordinal axis starting at zero.
     *
     * @param name The column name.
     * @param values The values; {@code null} is missing.
     * @return New series.
     */
    public static RegularSeries createOrdinalSeries(final String name, final Object... values) {
        return createSeries(OrdinalAxis.of(0, 1, values.length), name, values);
    }

    /**
     * Create a single column series on a daily calendar axis.
     *
     * @param start The first day, for example {@code "2021-01-01"}.
     * @param name The column name.
     * @param values The values; {@code null} is missing.
     * @return New series.
     */
    public static RegularSeries createDailySeries(final String start, final String name, final Object... values) {
        return createSeries(
                CalendarAxis.of(Timestamps.parse(start), values.length, Frequency.calendar("D")),
                name,
                values);
    }

    /**
     * Create a single column series on an axis.
     *
     * @param axis The axis.
     * @param name The column name.
     * @param values The values; {@code null} is missing.
     * @return New series.
     */
    public static RegularSeries createSeries(final TimeAxis axis, final String name, final Object... values) {
        return RegularSeries.of(axis, ImmutableList.of(Column.of(name, Arrays.asList(values))));
    }

    /**
     * Create a series of pseudo-random floating point columns on a daily axis.
     *
     * @param start The first day.
     * @param size The number of days.
     * @param names The column names.
     * @return New series.
     */
    public static RegularSeries createRandomDailySeries(final LocalDateTime start, final int size, final String... names) {
        final List<Column> columns = new ArrayList<>(names.length);
        for (final String name : names) {
            final List<Object> values = new ArrayList<>(size);
            for (int i = 0; i < size; ++i) {
                values.add(RANDOM.nextDouble() * 100);
            }
            columns.add(Column.of(name, values));
        }
        return RegularSeries.of(CalendarAxis.of(start, size, Frequency.calendar("D")), columns);
    }

    /**
     * Create a builder for a pseudo-random daily {@link Panel} with target
     * {@code y}, observed covariate {@code temperature}, known covariate
     * {@code holiday} and static covariate {@code region}.
     *
     * @return New builder for a pseudo-random {@link Panel}.
     */
    public static Panel.Builder createPanelBuilder() {
        return new Panel.Builder()
                .setTarget(createRandomDailySeries(START, PANEL_DAYS, "y"))
                .setObserved(createRandomDailySeries(START, PANEL_DAYS, "temperature"))
                .setKnown(createRandomDailySeries(START, PANEL_DAYS + FORECAST_DAYS, "holiday"))
                .setStaticCovariates(ImmutableMap.of("region", "west"));
    }

    /**
     * Create a new reasonable pseudo-random {@link Panel}.
     *
     * @return New reasonable pseudo-random {@link Panel}.
     */
    public static Panel createPanel() {
        return createPanelBuilder().build();
    }

    private TestBeanFactory() {}

    /**
     * The first day of panels created by this factory.
     */
    public static final LocalDateTime START = LocalDateTime.of(2021, 1, 1, 0, 0);
    /**
     * The number of days of target and observed data in panels created by this factory.
     */
    public static final int PANEL_DAYS = 30;
    /**
     * The number of additional days of known covariates in panels created by this factory.
     */
    public static final int FORECAST_DAYS = 7;

    private static final Random RANDOM = new Random();
}
