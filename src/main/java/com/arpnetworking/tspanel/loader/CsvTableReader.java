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
import com.arpnetworking.tspanel.model.SchemaException;
import com.arpnetworking.tspanel.model.Table;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Reads CSV input with a header row into a {@link Table}.
 *
 * Empty cells are missing. A column whose present cells all parse as
 * integers holds {@link Long} values, one whose present cells all parse as
 * numbers holds {@link Double} values, one of only {@code true} and
 * {@code false} holds {@link Boolean} values, and any other column holds
 * strings.
 *
 * @author Inscope Metrics
 */
public final class CsvTableReader {

    /**
     * Public constructor.
     *
     * @param separator The cell separator.
     */
    public CsvTableReader(final char separator) {
        _separator = separator;
    }

    /**
     * Read a table. The reader is not closed.
     *
     * @param reader The CSV input.
     * @return The table.
     * @throws IOException if the input cannot be read or is not valid CSV.
     * @throws SchemaException if the header is missing or a row has the wrong number of cells.
     */
    public Table read(final Reader reader) throws IOException {
        final CSVReader csvReader = new CSVReaderBuilder(reader)
                .withCSVParser(new CSVParserBuilder().withSeparator(_separator).build())
                .build();
        try {
            final String[] header = csvReader.readNext();
            if (header == null) {
                throw new SchemaException("CSV input has no header row");
            }
            final List<List<String>> cells = new ArrayList<>(header.length);
            for (int i = 0; i < header.length; ++i) {
                cells.add(new ArrayList<>());
            }
            String[] row = csvReader.readNext();
            while (row != null) {
                if (row.length == 1 && row[0].isEmpty()) {
                    row = csvReader.readNext();
                    continue;
                }
                if (row.length != header.length) {
                    throw new SchemaException(String.format(
                            "CSV row has the wrong number of cells; line=%d, cells=%d, expected=%d",
                            csvReader.getLinesRead(),
                            row.length,
                            header.length));
                }
                for (int i = 0; i < row.length; ++i) {
                    cells.get(i).add(row[i]);
                }
                row = csvReader.readNext();
            }
            final Table.Builder builder = new Table.Builder();
            for (int i = 0; i < header.length; ++i) {
                builder.addColumn(header[i].trim(), typeCells(cells.get(i)));
            }
            final Table table = builder.build();
            LOGGER.debug()
                    .setMessage("Read CSV table")
                    .addData("columns", Arrays.asList(header))
                    .addData("rows", table.getRowCount())
                    .log();
            return table;
        } catch (final CsvValidationException e) {
            throw new IOException("Invalid CSV input", e);
        }
    }

    private static List<Object> typeCells(final List<String> cells) {
        boolean allLong = true;
        boolean allDouble = true;
        boolean allBoolean = true;
        for (final String cell : cells) {
            if (cell.trim().isEmpty()) {
                continue;
            }
            allLong &= parseLong(cell) != null;
            allDouble &= parseDouble(cell) != null;
            allBoolean &= parseBoolean(cell) != null;
        }
        final List<Object> values = new ArrayList<>(cells.size());
        for (final String cell : cells) {
            if (cell.trim().isEmpty()) {
                values.add(null);
            } else if (allLong) {
                values.add(parseLong(cell));
            } else if (allDouble) {
                values.add(parseDouble(cell));
            } else if (allBoolean) {
                values.add(parseBoolean(cell));
            } else {
                values.add(cell);
            }
        }
        return values;
    }

    @Nullable
    private static Boolean parseBoolean(final String cell) {
        final String text = cell.trim();
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        return null;
    }

    @Nullable
    private static Long parseLong(final String cell) {
        try {
            return Long.parseLong(cell.trim());
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    @Nullable
    private static Double parseDouble(final String cell) {
        try {
            return Double.parseDouble(cell.trim());
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    private final char _separator;

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableReader.class);
}
