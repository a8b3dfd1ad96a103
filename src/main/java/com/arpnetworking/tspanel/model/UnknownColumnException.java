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

import com.google.common.collect.ImmutableList;

import java.util.Collection;

/**
 * Thrown when a referenced column does not exist.
 *
 * @author Inscope Metrics
 */
public class UnknownColumnException extends IllegalArgumentException {

    /**
     * Public constructor.
     *
     * @param message The failure description.
     * @param columns The columns that could not be resolved.
     */
    public UnknownColumnException(final String message, final Collection<String> columns) {
        super(String.format("%s; columns=%s", message, columns));
        _columns = ImmutableList.copyOf(columns);
    }

    public ImmutableList<String> getColumns() {
        return _columns;
    }

    private final ImmutableList<String> _columns;

    private static final long serialVersionUID = 1L;
}
