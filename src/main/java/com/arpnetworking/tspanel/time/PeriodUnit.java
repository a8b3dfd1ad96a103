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

import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The units a calendar period can be expressed in. Fixed units have a constant
 * duration while month based units snap to the start or end of a month.
 *
 * @author Inscope Metrics
 */
public enum PeriodUnit {
    /**
     * One millisecond.
     */
    MILLISECOND("L", Duration.ofMillis(1), 0, false),
    /**
     * One second.
     */
    SECOND("S", Duration.ofSeconds(1), 0, false),
    /**
     * One minute.
     */
    MINUTE("T", Duration.ofMinutes(1), 0, false),
    /**
     * One hour.
     */
    HOUR("H", Duration.ofHours(1), 0, false),
    /**
     * One calendar day.
     */
    DAY("D", Duration.ofDays(1), 0, false),
    /**
     * One week anchored on a day of the week.
     */
    WEEK("W", Duration.ofDays(7), 0, false),
    /**
     * The first day of each month.
     */
    MONTH_START("MS", null, 1, false),
    /**
     * The last day of each month.
     */
    MONTH_END("M", null, 1, true),
    /**
     * The first day of each calendar quarter.
     */
    QUARTER_START("QS", null, 3, false),
    /**
     * The last day of each calendar quarter.
     */
    QUARTER_END("Q", null, 3, true),
    /**
     * The first day of each year.
     */
    YEAR_START("AS", null, 12, false),
    /**
     * The last day of each year.
     */
    YEAR_END("A", null, 12, true);

    /**
     * Look up a unit by its code or one of the accepted aliases.
     *
     * @param code The unit code, for example {@code "D"}, {@code "min"} or {@code "YS"}.
     * @return The matching unit, if any.
     */
    public static Optional<PeriodUnit> fromCode(final String code) {
        return Optional.ofNullable(UNITS_BY_CODE.get(code));
    }

    public String getCode() {
        return _code;
    }

    /**
     * The constant duration of one unit.
     *
     * @return The duration; empty for month based units.
     */
    public Optional<Duration> getFixedDuration() {
        return Optional.ofNullable(_fixedDuration);
    }

    public boolean isMonthBased() {
        return _months > 0;
    }

    public int getMonths() {
        return _months;
    }

    /**
     * Move a timestamp forward by a number of units.
     *
     * @param timestamp The timestamp to move.
     * @param count The number of units; may be negative.
     * @return The moved timestamp.
     */
    public LocalDateTime advance(final LocalDateTime timestamp, final long count) {
        if (_fixedDuration != null) {
            return timestamp.plus(_fixedDuration.multipliedBy(count));
        }
        final LocalDateTime shifted = timestamp.plusMonths(_months * count);
        if (_monthEnd) {
            return shifted.with(TemporalAdjusters.lastDayOfMonth());
        }
        return shifted.withDayOfMonth(1);
    }

    /**
     * Whether a timestamp lies on an offset of this unit. Fixed units accept
     * every timestamp; weekly anchoring is checked by {@link PeriodCode}.
     *
     * @param timestamp The timestamp to check.
     * @return True if the timestamp is on an offset.
     */
    public boolean isOnOffset(final LocalDateTime timestamp) {
        if (_months == 0) {
            return true;
        }
        final boolean onDay;
        if (_monthEnd) {
            onDay = timestamp.getDayOfMonth() == timestamp.toLocalDate().lengthOfMonth();
        } else {
            onDay = timestamp.getDayOfMonth() == 1;
        }
        if (!onDay) {
            return false;
        }
        final int month = timestamp.getMonthValue();
        if (_monthEnd) {
            return month % _months == 0;
        }
        return (month - 1) % _months == 0;
    }

    PeriodUnit(
            final String code,
            @Nullable final Duration fixedDuration,
            final int months,
            final boolean monthEnd) {
        _code = code;
        _fixedDuration = fixedDuration;
        _months = months;
        _monthEnd = monthEnd;
    }

    private final String _code;
    @Nullable
    private final Duration _fixedDuration;
    private final int _months;
    private final boolean _monthEnd;

    private static final ImmutableMap<String, PeriodUnit> UNITS_BY_CODE;

    static {
        final ImmutableMap.Builder<String, PeriodUnit> builder = ImmutableMap.builder();
        for (final PeriodUnit unit : values()) {
            builder.put(unit.getCode(), unit);
        }
        builder.put("ms", MILLISECOND);
        builder.put("s", SECOND);
        builder.put("min", MINUTE);
        builder.put("h", HOUR);
        builder.put("d", DAY);
        builder.put("YS", YEAR_START);
        builder.put("Y", YEAR_END);
        UNITS_BY_CODE = builder.build();
    }
}
