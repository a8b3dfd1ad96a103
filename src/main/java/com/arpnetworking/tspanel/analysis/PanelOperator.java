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
package com.arpnetworking.tspanel.analysis;

import com.arpnetworking.tspanel.model.Panel;

import java.util.List;
import java.util.Set;

/**
 * A named computation over a panel. Use {@link OperatorRegistry} to look up
 * operators by name.
 *
 * @author Inscope Metrics
 */
public interface PanelOperator {

    /**
     * The name of the operator.
     *
     * @return The name.
     */
    String getName();

    /**
     * Other names the operator is registered under.
     *
     * @return The aliases.
     */
    Set<String> getAliases();

    /**
     * Apply the operator.
     *
     * @param panel The panel; operators do not modify it.
     * @param arguments The arguments passed by the caller.
     * @return The result.
     */
    Object apply(Panel panel, List<?> arguments);
}
