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

import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.RegularSeries;

/**
 * Fills missing values of regular series.
 *
 * @author Inscope Metrics
 */
public interface GapFiller {

    /**
     * Fill the missing values of a series.
     *
     * @param series The series; it is not modified.
     * @param method The fill method.
     * @param windowSize The number of rows in the trailing window of windowed methods.
     * @return The filled series.
     */
    RegularSeries fill(RegularSeries series, FillMethod method, int windowSize);

    /**
     * Fill the missing values of every time varying partition of a panel in place.
     *
     * @param panel The panel.
     * @param method The fill method.
     * @param windowSize The number of rows in the trailing window of windowed methods.
     */
    default void fill(final Panel panel, final FillMethod method, final int windowSize) {
        panel.transform(series -> fill(series, method, windowSize));
    }
}
