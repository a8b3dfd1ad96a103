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

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Infers the calendar period of a set of timestamps.
 *
 * Timestamps that all fall on month boundaries with a constant number of
 * months between them map to a month, quarter or year based period. Otherwise
 * the timestamps must be equally spaced and map to the coarsest fixed unit
 * dividing the spacing; spacing in whole weeks maps to a weekly period
 * anchored on the weekday of the first timestamp.
 *
 * @author Inscope Metrics
 */
public final class FrequencyInference {

    /**
     * Infer the period of a set of timestamps.
     *
     * @param timestamps The timestamps, in any order.
     * @return The period, or empty if there are fewer than three distinct
     * timestamps or no single period describes them.
     */
    public static Optional<PeriodCode> infer(final Collection<LocalDateTime> timestamps) {
        final List<LocalDateTime> sorted = ImmutableList.copyOf(new TreeSet<>(timestamps));
        if (sorted.size() < MINIMUM_POINTS) {
            return Optional.empty();
        }
        final Optional<PeriodCode> monthBased = inferMonthBased(sorted);
        if (monthBased.isPresent()) {
            return monthBased;
        }
        return inferFixed(sorted);
    }

    private static Optional<PeriodCode> inferMonthBased(final List<LocalDateTime> sorted) {
        final LocalTime timeOfDay = sorted.get(0).toLocalTime();
        boolean allStart = true;
        boolean allEnd = true;
        for (final LocalDateTime timestamp : sorted) {
            if (!timestamp.toLocalTime().equals(timeOfDay)) {
                return Optional.empty();
            }
            allStart &= timestamp.getDayOfMonth() == 1;
            allEnd &= timestamp.getDayOfMonth() == timestamp.toLocalDate().lengthOfMonth();
        }
        if (!allStart && !allEnd) {
            return Optional.empty();
        }
        final long months = monthIndex(sorted.get(1)) - monthIndex(sorted.get(0));
        for (int i = 2; i < sorted.size(); ++i) {
            if (monthIndex(sorted.get(i)) - monthIndex(sorted.get(i - 1)) != months) {
                return Optional.empty();
            }
        }
        if (months <= 0 || months > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        final int step = (int) months;
        if (allStart) {
            return Optional.of(monthBased(sorted, step, PeriodUnit.YEAR_START, PeriodUnit.QUARTER_START, PeriodUnit.MONTH_START));
        }
        return Optional.of(monthBased(sorted, step, PeriodUnit.YEAR_END, PeriodUnit.QUARTER_END, PeriodUnit.MONTH_END));
    }

    private static PeriodCode monthBased(
            final List<LocalDateTime> sorted,
            final int months,
            final PeriodUnit yearly,
            final PeriodUnit quarterly,
            final PeriodUnit monthly) {
        if (months % yearly.getMonths() == 0 && allOnOffset(sorted, yearly)) {
            return PeriodCode.of(months / yearly.getMonths(), yearly);
        }
        if (months % quarterly.getMonths() == 0 && allOnOffset(sorted, quarterly)) {
            return PeriodCode.of(months / quarterly.getMonths(), quarterly);
        }
        return PeriodCode.of(months, monthly);
    }

    private static boolean allOnOffset(final List<LocalDateTime> sorted, final PeriodUnit unit) {
        for (final LocalDateTime timestamp : sorted) {
            if (!unit.isOnOffset(timestamp)) {
                return false;
            }
        }
        return true;
    }

    private static Optional<PeriodCode> inferFixed(final List<LocalDateTime> sorted) {
        final Duration spacing = Duration.between(sorted.get(0), sorted.get(1));
        for (int i = 2; i < sorted.size(); ++i) {
            if (!Duration.between(sorted.get(i - 1), sorted.get(i)).equals(spacing)) {
                return Optional.empty();
            }
        }
        if (spacing.getNano() % NANOS_PER_MILLI != 0) {
            return Optional.empty();
        }
        final long millis = spacing.toMillis();
        for (final PeriodUnit unit : FIXED_UNITS_BY_DESCENDING_SIZE) {
            final long unitMillis = unit.getFixedDuration().get().toMillis();
            if (millis % unitMillis == 0) {
                final long multiplier = millis / unitMillis;
                if (multiplier > Integer.MAX_VALUE) {
                    return Optional.empty();
                }
                if (unit == PeriodUnit.WEEK) {
                    return Optional.of(PeriodCode.weekly((int) multiplier, sorted.get(0).getDayOfWeek()));
                }
                return Optional.of(PeriodCode.of((int) multiplier, unit));
            }
        }
        return Optional.empty();
    }

    private static long monthIndex(final LocalDateTime timestamp) {
        return timestamp.getYear() * 12L + timestamp.getMonthValue() - 1;
    }

    private FrequencyInference() { }

    private static final int MINIMUM_POINTS = 3;
    private static final int NANOS_PER_MILLI = 1_000_000;
    private static final ImmutableList<PeriodUnit> FIXED_UNITS_BY_DESCENDING_SIZE = ImmutableList.of(
            PeriodUnit.WEEK,
            PeriodUnit.DAY,
            PeriodUnit.HOUR,
            PeriodUnit.MINUTE,
            PeriodUnit.SECOND,
            PeriodUnit.MILLISECOND);
}
