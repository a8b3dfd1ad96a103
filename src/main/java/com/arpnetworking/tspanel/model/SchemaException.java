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
 * Thrown when tabular input or a time axis does not form a valid regular
 * series: missing or duplicated columns, missing or duplicated time values,
 * gaps, overlaps or an undeterminable frequency.
 *
 * @author Inscope Metrics
 */
public class SchemaException extends IllegalArgumentException {

    /**
     * Public constructor.
     *
     * @param message The failure description.
     */
    public SchemaException(final String message) {
        super(message);
    }

    /**
     * Public constructor.
     *
     * @param message The failure description.
     * @param cause The underlying failure.
     */
    public SchemaException(final String message, final Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = 1L;
}
