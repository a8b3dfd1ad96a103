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

import com.google.common.base.Preconditions;

/**
 * Frequency of an ordinal axis: the positive step between integer points.
 *
 * @author Inscope Metrics
 */
public final class OrdinalFrequency extends Frequency {

    public long getStep() {
        return _step;
    }

    @Override
    public AxisType getAxisType() {
        return AxisType.ORDINAL;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof OrdinalFrequency)) {
            return false;
        }
        return _step == ((OrdinalFrequency) other)._step;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(_step);
    }

    @Override
    public String toString() {
        return Long.toString(_step);
    }

    OrdinalFrequency(final long step) {
        Preconditions.checkArgument(step >= 1, "ordinal step must be a positive integer; step=%s", step);
        _step = step;
    }

    private final long _step;
}
