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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves panel operators by name or alias. The built-in operators are
 * {@code summary}, {@code max}, {@code min}, {@code mean} and {@code count};
 * further operators can be registered and are visible to every registry
 * instance.
 *
 * @author Inscope Metrics
 */
public class OperatorRegistry {

    /**
     * Get an operator by name.
     *
     * @param name The name or alias of the desired operator.
     * @return The <code>PanelOperator</code>.
     * @throws IllegalArgumentException if no operator is registered under the name.
     */
    public PanelOperator getOperator(final String name) {
        final Optional<PanelOperator> operator = tryGetOperator(name);
        if (!operator.isPresent()) {
            throw new IllegalArgumentException(String.format("Invalid operator name; name=%s", name));
        }
        return operator.get();
    }

    /**
     * Get an operator by name.
     *
     * @param name The name or alias of the desired operator.
     * @return The <code>PanelOperator</code>, if registered.
     */
    public Optional<PanelOperator> tryGetOperator(final String name) {
        return Optional.ofNullable(OPERATORS_BY_NAME_AND_ALIAS.get(name));
    }

    /**
     * Register an operator under its name and aliases.
     *
     * @param operator The operator.
     * @throws IllegalArgumentException if a different operator is registered under one of the names.
     */
    public void register(final PanelOperator operator) {
        final ImmutableList<String> keys = ImmutableList.<String>builder()
                .add(operator.getName())
                .addAll(operator.getAliases())
                .build();
        for (final String key : keys) {
            final PanelOperator existing = OPERATORS_BY_NAME_AND_ALIAS.get(key);
            if (existing != null && !existing.equals(operator)) {
                throw new IllegalArgumentException(String.format(
                        "Operator already registered; key=%s, existing=%s, new=%s",
                        key,
                        existing,
                        operator));
            }
        }
        checkedPut(OPERATORS_BY_NAME_AND_ALIAS, operator);
        LOGGER.debug()
                .setMessage("Registered operator")
                .addData("name", operator.getName())
                .addData("aliases", operator.getAliases())
                .log();
    }

    /**
     * The registered names and aliases.
     *
     * @return The names.
     */
    public ImmutableSet<String> getNames() {
        return ImmutableSet.copyOf(OPERATORS_BY_NAME_AND_ALIAS.keySet());
    }

    private static void checkedPut(final ConcurrentMap<String, PanelOperator> map, final PanelOperator operator) {
        checkedPut(map, operator, operator.getName());
        for (final String alias : operator.getAliases()) {
            checkedPut(map, operator, alias);
        }
    }

    private static void checkedPut(final ConcurrentMap<String, PanelOperator> map, final PanelOperator operator, final String key) {
        final PanelOperator existingOperator = map.putIfAbsent(key, operator);
        if (existingOperator != null && !existingOperator.equals(operator)) {
            LOGGER.error()
                    .setMessage("Operator already registered")
                    .addData("key", key)
                    .addData("existing", existingOperator)
                    .addData("new", operator)
                    .log();
        }
    }

    private static final ConcurrentMap<String, PanelOperator> OPERATORS_BY_NAME_AND_ALIAS;
    private static final ImmutableList<PanelOperator> BUILT_IN_OPERATORS = ImmutableList.of(
            new SummaryOperator(),
            new MaxOperator(),
            new MinOperator(),
            new MeanOperator(),
            new CountOperator());
    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorRegistry.class);

    static {
        // NOTE: Do not put log messages in static blocks since they can lock the logger thread!
        final ConcurrentMap<String, PanelOperator> operatorsByNameAndAlias = Maps.newConcurrentMap();
        for (final PanelOperator operator : BUILT_IN_OPERATORS) {
            operatorsByNameAndAlias.put(operator.getName(), operator);
            for (final String alias : operator.getAliases()) {
                operatorsByNameAndAlias.put(alias, operator);
            }
        }
        OPERATORS_BY_NAME_AND_ALIAS = operatorsByNameAndAlias;
    }
}
