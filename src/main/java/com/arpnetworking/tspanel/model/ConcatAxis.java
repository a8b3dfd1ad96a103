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

/**
 * The axis along which series are concatenated.
 *
 * @author Inscope Metrics
 */
public enum ConcatAxis {
    /**
     * Append rows; the time points of the inputs must not overlap.
     */
    TIME,
    /**
     * Append columns; the column names of the inputs must not overlap.
     */
    COLUMNS;

    /**
     * Look up an axis by its position, {@code 0} for time and {@code 1} for columns.
     *
     * @param index The position.
     * @return The axis.
     * @throws IllegalArgumentException for any other position.
     */
    public static ConcatAxis fromIndex(final int index) {
        if (index == 0) {
            return TIME;
        }
        if (index == 1) {
            return COLUMNS;
        }
        throw new IllegalArgumentException(String.format("Invalid concat axis; axis=%d", index));
    }
}
