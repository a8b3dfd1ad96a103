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
 * Thrown when a value has a type the operation cannot accept, for example a
 * time point of an unsupported type or a cell that cannot be converted to the
 * requested column type.
 *
 * @author Inscope Metrics
 */
public class TypeMismatchException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param message The failure description.
     */
    public TypeMismatchException(final String message) {
        super(message);
    }

    /**
     * Public constructor.
     *
     * @param message The failure description.
     * @param cause The underlying failure.
     */
    public TypeMismatchException(final String message, final Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = 1L;
}
