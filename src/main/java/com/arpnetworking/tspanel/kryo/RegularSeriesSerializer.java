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
package com.arpnetworking.tspanel.kryo;

import com.arpnetworking.tspanel.model.Column;
import com.arpnetworking.tspanel.model.ColumnType;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.arpnetworking.tspanel.time.CalendarAxis;
import com.arpnetworking.tspanel.time.CalendarFrequency;
import com.arpnetworking.tspanel.time.Frequency;
import com.arpnetworking.tspanel.time.OrdinalAxis;
import com.arpnetworking.tspanel.time.OrdinalFrequency;
import com.arpnetworking.tspanel.time.TimeAxis;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Kryo serializer for {@link RegularSeries}. The axis is written as its
 * frequency, first point and size; each column as its name, type and values.
 *
 * @author Inscope Metrics
 */
public final class RegularSeriesSerializer extends Serializer<RegularSeries> {

    @Override
    public void write(final Kryo kryo, final Output output, final RegularSeries series) {
        final TimeAxis axis = series.getAxis();
        output.writeString(axis.getFrequency().toString());
        output.writeInt(axis.size(), true);
        if (axis instanceof OrdinalAxis) {
            output.writeLong(((OrdinalAxis) axis).getStart());
        } else if (!axis.isEmpty()) {
            final LocalDateTime start = ((CalendarAxis) axis).get(0);
            output.writeLong(start.toEpochSecond(ZoneOffset.UTC));
            output.writeInt(start.getNano(), true);
        }

        output.writeInt(series.getColumns().size(), true);
        for (final Column column : series.getColumns()) {
            output.writeString(column.getName());
            output.writeString(column.getType().getName());
            for (final Object value : column.getValues()) {
                writeValue(output, column.getType(), value);
            }
        }
    }

    @Override
    public RegularSeries read(final Kryo kryo, final Input input, final Class<? extends RegularSeries> type) {
        final Frequency frequency = Frequency.parse(input.readString());
        final int size = input.readInt(true);
        final TimeAxis axis;
        if (frequency instanceof CalendarFrequency) {
            if (size == 0) {
                axis = TimeAxis.empty(frequency);
            } else {
                final LocalDateTime start = LocalDateTime.ofEpochSecond(
                        input.readLong(),
                        input.readInt(true),
                        ZoneOffset.UTC);
                axis = CalendarAxis.of(start, size, (CalendarFrequency) frequency);
            }
        } else {
            axis = OrdinalAxis.of(input.readLong(), ((OrdinalFrequency) frequency).getStep(), size);
        }

        final int columnCount = input.readInt(true);
        final List<Column> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; ++i) {
            final String name = input.readString();
            final ColumnType columnType = ColumnType.fromName(input.readString());
            final List<Object> values = new ArrayList<>(size);
            for (int row = 0; row < size; ++row) {
                values.add(readValue(input, columnType));
            }
            columns.add(Column.of(name, columnType, values));
        }
        return RegularSeries.of(axis, columns);
    }

    private static void writeValue(final Output output, final ColumnType type, @Nullable final Object value) {
        output.writeBoolean(value != null);
        if (value == null) {
            return;
        }
        switch (type) {
            case INT64:
                output.writeLong((Long) value);
                break;
            case FLOAT64:
                output.writeDouble((Double) value);
                break;
            case BOOLEAN:
                output.writeBoolean((Boolean) value);
                break;
            case STRING:
                output.writeString((String) value);
                break;
            default:
                throw new KryoException(String.format("Unsupported column type; type=%s", type));
        }
    }

    @Nullable
    private static Object readValue(final Input input, final ColumnType type) {
        if (!input.readBoolean()) {
            return null;
        }
        switch (type) {
            case INT64:
                return input.readLong();
            case FLOAT64:
                return input.readDouble();
            case BOOLEAN:
                return input.readBoolean();
            case STRING:
                return input.readString();
            default:
                throw new KryoException(String.format("Unsupported column type; type=%s", type));
        }
    }
}
