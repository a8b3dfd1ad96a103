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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * A calendar period such as {@code "D"}, {@code "15T"}, {@code "W-MON"} or
 * {@code "QS"}: a positive multiplier of a {@link PeriodUnit}, anchored on a
 * day of the week for weekly periods.
 *
 * Equivalent codes normalize to the same instance state, so {@code "1D"} equals
 * {@code "D"}, {@code "min"} equals {@code "T"} and {@code "W"} equals
 * {@code "W-SUN"}.
 *
 * @author Inscope Metrics
 */
public final class PeriodCode {

    /**
     * Parse a period code.
     *
     * @param code The code to parse.
     * @return The parsed period.
     * @throws IllegalArgumentException if the code is not a supported period.
     */
    public static PeriodCode parse(final String code) {
        final Matcher matcher = CODE_PATTERN.matcher(code.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(String.format("Invalid period code; code=%s", code));
        }
        final int multiplier;
        try {
            multiplier = matcher.group("multiplier") == null ? 1 : Integer.parseInt(matcher.group("multiplier"));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Invalid period multiplier; code=%s", code), e);
        }
        final Optional<PeriodUnit> unit = PeriodUnit.fromCode(matcher.group("unit"));
        if (!unit.isPresent() || multiplier < 1) {
            throw new IllegalArgumentException(String.format("Invalid period code; code=%s", code));
        }
        @Nullable final String suffix = matcher.group("anchor");
        if (unit.get() == PeriodUnit.WEEK) {
            if (suffix == null) {
                return weekly(multiplier, DayOfWeek.SUNDAY);
            }
            @Nullable final DayOfWeek anchor = DAYS_BY_CODE.get(suffix.toUpperCase(Locale.ROOT));
            if (anchor == null) {
                throw new IllegalArgumentException(String.format("Invalid weekly anchor; code=%s", code));
            }
            return weekly(multiplier, anchor);
        }
        if (suffix != null) {
            @Nullable final String accepted = DEFAULT_MONTH_ANCHORS.get(unit.get());
            if (accepted == null || !accepted.equalsIgnoreCase(suffix)) {
                throw new IllegalArgumentException(String.format("Unsupported period anchor; code=%s", code));
            }
        }
        return of(multiplier, unit.get());
    }

    /**
     * Create a period from a multiplier and a non-weekly unit.
     *
     * @param multiplier The number of units per period; at least one.
     * @param unit The unit.
     * @return The period.
     */
    public static PeriodCode of(final int multiplier, final PeriodUnit unit) {
        Preconditions.checkArgument(unit != PeriodUnit.WEEK, "weekly periods require an anchor");
        return new PeriodCode(multiplier, unit, null);
    }

    /**
     * Create a weekly period anchored on a day of the week.
     *
     * @param multiplier The number of weeks per period; at least one.
     * @param anchor The day of the week every point falls on.
     * @return The period.
     */
    public static PeriodCode weekly(final int multiplier, final DayOfWeek anchor) {
        return new PeriodCode(multiplier, PeriodUnit.WEEK, anchor);
    }

    public int getMultiplier() {
        return _multiplier;
    }

    public PeriodUnit getUnit() {
        return _unit;
    }

    public Optional<DayOfWeek> getAnchor() {
        return Optional.ofNullable(_anchor);
    }

    /**
     * The point one period after the given timestamp.
     *
     * @param timestamp The timestamp.
     * @return The next point.
     */
    public LocalDateTime next(final LocalDateTime timestamp) {
        return _unit.advance(timestamp, _multiplier);
    }

    /**
     * Move a timestamp by a number of periods.
     *
     * @param timestamp The timestamp.
     * @param periods The number of periods; may be negative.
     * @return The moved timestamp.
     */
    public LocalDateTime advance(final LocalDateTime timestamp, final long periods) {
        return _unit.advance(timestamp, periods * _multiplier);
    }

    /**
     * Whether a timestamp is a valid starting point for this period. Anchored
     * periods require the month boundary or the weekday; fixed periods accept
     * any timestamp.
     *
     * @param timestamp The timestamp.
     * @return True if the timestamp is on an offset.
     */
    public boolean isOnOffset(final LocalDateTime timestamp) {
        if (_anchor != null) {
            return timestamp.getDayOfWeek() == _anchor;
        }
        return _unit.isOnOffset(timestamp);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PeriodCode)) {
            return false;
        }
        final PeriodCode otherPeriodCode = (PeriodCode) other;
        return _multiplier == otherPeriodCode._multiplier
                && _unit == otherPeriodCode._unit
                && _anchor == otherPeriodCode._anchor;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_multiplier, _unit, _anchor);
    }

    /**
     * The canonical code, for example {@code "2H"} or {@code "W-MON"}.
     *
     * @return The canonical code.
     */
    @Override
    public String toString() {
        final StringBuilder code = new StringBuilder();
        if (_multiplier > 1) {
            code.append(_multiplier);
        }
        code.append(_unit.getCode());
        if (_anchor != null) {
            code.append('-').append(CODES_BY_DAY.get(_anchor));
        }
        return code.toString();
    }

    /**
     * A verbose representation for logging.
     *
     * @return The verbose representation.
     */
    public String toDebugString() {
        return MoreObjects.toStringHelper(this)
                .add("Multiplier", _multiplier)
                .add("Unit", _unit)
                .add("Anchor", _anchor)
                .toString();
    }

    private PeriodCode(final int multiplier, final PeriodUnit unit, @Nullable final DayOfWeek anchor) {
        Preconditions.checkArgument(multiplier >= 1, "period multiplier must be positive; multiplier=%s", multiplier);
        _multiplier = multiplier;
        _unit = unit;
        _anchor = anchor;
    }

    private final int _multiplier;
    private final PeriodUnit _unit;
    @Nullable
    private final DayOfWeek _anchor;

    private static final Pattern CODE_PATTERN =
            Pattern.compile("^(?<multiplier>\\d+)?(?<unit>[A-Za-z]+)(?:-(?<anchor>[A-Za-z]{3}))?$");
    private static final ImmutableMap<DayOfWeek, String> CODES_BY_DAY = ImmutableMap.<DayOfWeek, String>builder()
            .put(DayOfWeek.MONDAY, "MON")
            .put(DayOfWeek.TUESDAY, "TUE")
            .put(DayOfWeek.WEDNESDAY, "WED")
            .put(DayOfWeek.THURSDAY, "THU")
            .put(DayOfWeek.FRIDAY, "FRI")
            .put(DayOfWeek.SATURDAY, "SAT")
            .put(DayOfWeek.SUNDAY, "SUN")
            .build();
    private static final ImmutableMap<String, DayOfWeek> DAYS_BY_CODE;
    private static final ImmutableMap<PeriodUnit, String> DEFAULT_MONTH_ANCHORS = ImmutableMap.of(
            PeriodUnit.QUARTER_START, "JAN",
            PeriodUnit.YEAR_START, "JAN",
            PeriodUnit.QUARTER_END, "DEC",
            PeriodUnit.YEAR_END, "DEC");

    static {
        final ImmutableMap.Builder<String, DayOfWeek> builder = ImmutableMap.builder();
        for (final Map.Entry<DayOfWeek, String> entry : CODES_BY_DAY.entrySet()) {
            builder.put(entry.getValue(), entry.getKey());
        }
        DAYS_BY_CODE = builder.build();
    }
}
