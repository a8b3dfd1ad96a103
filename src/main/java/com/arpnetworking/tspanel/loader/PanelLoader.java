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
package com.arpnetworking.tspanel.loader;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.arpnetworking.tspanel.model.SchemaException;
import com.arpnetworking.tspanel.model.Table;
import com.arpnetworking.tspanel.time.Frequency;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Builds panels from tables according to a {@link PanelLoadConfiguration}.
 *
 * When the configuration assigns no column a role, every column other than
 * the time column becomes a target column. Each static column must hold a
 * single distinct value.
 *
 * @author Inscope Metrics
 */
public final class PanelLoader {

    /**
     * Build a panel from a table.
     *
     * @param table The table.
     * @param configuration The load configuration.
     * @return The panel.
     * @throws SchemaException if the table does not match the configuration.
     */
    public Panel load(final Table table, final PanelLoadConfiguration configuration) {
        final Set<String> duplicated = new LinkedHashSet<>();
        final Set<String> seen = new HashSet<>();
        for (final String name : table.getColumnNames()) {
            if (!seen.add(name)) {
                duplicated.add(name);
            }
        }
        if (!duplicated.isEmpty()) {
            throw new SchemaException(String.format("Duplicated column names in the input; columns=%s", duplicated));
        }

        @Nullable final String timeColumn = configuration.getTimeColumn().orElse(null);
        @Nullable final Frequency frequency = configuration.getFrequency().orElse(null);
        final List<String> targetColumns;
        if (configuration.hasRoleColumns()) {
            targetColumns = configuration.getTargetColumns();
        } else {
            targetColumns = table.getColumnNames().stream()
                    .filter(name -> !name.equals(timeColumn))
                    .collect(Collectors.toList());
        }

        final Panel panel = new Panel.Builder()
                .setTarget(loadSeries(table, timeColumn, targetColumns, frequency))
                .setObserved(loadSeries(table, timeColumn, configuration.getObservedColumns(), frequency))
                .setKnown(loadSeries(table, timeColumn, configuration.getKnownColumns(), frequency))
                .setStaticCovariates(loadStatic(table, configuration.getStaticColumns()))
                .setFillMissingDates(configuration.getFillMissingDates())
                .setFillMethod(configuration.getFillMethod())
                .setFillWindowSize(configuration.getFillWindowSize())
                .build();
        LOGGER.debug()
                .setMessage("Loaded panel")
                .addData("columns", panel.getColumns())
                .addData("frequency", panel.getFrequency())
                .log();
        return panel;
    }

    /**
     * Build a panel from CSV input. The reader is not closed.
     *
     * @param reader The CSV input.
     * @param configuration The load configuration.
     * @return The panel.
     * @throws IOException if the input cannot be read.
     */
    public Panel loadCsv(final Reader reader, final PanelLoadConfiguration configuration) throws IOException {
        return load(new CsvTableReader(configuration.getSeparator()).read(reader), configuration);
    }

    /**
     * Build a panel from a UTF-8 CSV file.
     *
     * @param path The CSV file.
     * @param configuration The load configuration.
     * @return The panel.
     * @throws IOException if the file cannot be read.
     */
    public Panel loadCsv(final Path path, final PanelLoadConfiguration configuration) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return loadCsv(reader, configuration);
        }
    }

    @Nullable
    private static RegularSeries loadSeries(
            final Table table,
            @Nullable final String timeColumn,
            final List<String> columns,
            @Nullable final Frequency frequency) {
        if (columns.isEmpty()) {
            return null;
        }
        return RegularSeries.load(table, timeColumn, columns, frequency);
    }

    @Nullable
    private static Map<String, Object> loadStatic(final Table table, final ImmutableList<String> columns) {
        if (columns.isEmpty()) {
            return null;
        }
        final Map<String, Object> values = new LinkedHashMap<>();
        for (final String name : columns) {
            final List<Object> column = table.getColumn(name)
                    .orElseThrow(() -> new SchemaException(String.format("Static column does not exist; column=%s", name)));
            final Set<Object> distinct = new LinkedHashSet<>(column);
            if (distinct.size() != 1 || distinct.contains(null)) {
                throw new SchemaException(String.format(
                        "Static column must hold a single value; column=%s, values=%s",
                        name,
                        distinct));
            }
            values.put(name, Objects.requireNonNull(column.get(0)));
        }
        return values;
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(PanelLoader.class);
}
