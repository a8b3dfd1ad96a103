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

/**
 * Frequency of a calendar axis.
 *
 * @author Inscope Metrics
 */
public final class CalendarFrequency extends Frequency {

    public PeriodCode getPeriod() {
        return _period;
    }

    @Override
    public AxisType getAxisType() {
        return AxisType.CALENDAR;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CalendarFrequency)) {
            return false;
        }
        return _period.equals(((CalendarFrequency) other)._period);
    }

    @Override
    public int hashCode() {
        return _period.hashCode();
    }

    @Override
    public String toString() {
        return _period.toString();
    }

    CalendarFrequency(final PeriodCode period) {
        _period = period;
    }

    private final PeriodCode _period;
}
