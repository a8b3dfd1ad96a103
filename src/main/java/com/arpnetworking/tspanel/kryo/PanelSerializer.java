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

import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.Partition;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Kryo serializer for {@link Panel}. Each time varying partition is written
 * with the registered {@link RegularSeries} serializer, followed by the
 * static covariates as tagged values.
 *
 * @author Inscope Metrics
 */
public final class PanelSerializer extends Serializer<Panel> {

    @Override
    public void write(final Kryo kryo, final Output output, final Panel panel) {
        if (TIME_VARYING.stream().noneMatch(partition -> panel.getSeries(partition).isPresent())) {
            throw new IllegalArgumentException("Panels without time varying partitions cannot be serialized");
        }
        for (final Partition partition : TIME_VARYING) {
            final Optional<RegularSeries> series = panel.getSeries(partition);
            output.writeBoolean(series.isPresent());
            if (series.isPresent()) {
                kryo.writeObject(output, series.get());
            }
        }
        final ImmutableMap<String, Object> statics = panel.getStaticCovariates().orElse(ImmutableMap.of());
        output.writeInt(statics.size(), true);
        for (final Map.Entry<String, Object> entry : statics.entrySet()) {
            output.writeString(entry.getKey());
            final Object value = entry.getValue();
            if (value instanceof Long) {
                output.writeByte(LONG_TAG);
                output.writeLong((Long) value);
            } else if (value instanceof Double) {
                output.writeByte(DOUBLE_TAG);
                output.writeDouble((Double) value);
            } else {
                output.writeByte(STRING_TAG);
                output.writeString((String) value);
            }
        }
    }

    @Override
    public Panel read(final Kryo kryo, final Input input, final Class<? extends Panel> type) {
        final Map<Partition, RegularSeries> series = new LinkedHashMap<>();
        for (final Partition partition : TIME_VARYING) {
            if (input.readBoolean()) {
                series.put(partition, kryo.readObject(input, RegularSeries.class));
            }
        }
        final int staticCount = input.readInt(true);
        final Map<String, Object> statics = new LinkedHashMap<>();
        for (int i = 0; i < staticCount; ++i) {
            final String name = input.readString();
            final byte tag = input.readByte();
            switch (tag) {
                case LONG_TAG:
                    statics.put(name, input.readLong());
                    break;
                case DOUBLE_TAG:
                    statics.put(name, input.readDouble());
                    break;
                case STRING_TAG:
                    statics.put(name, input.readString());
                    break;
                default:
                    throw new KryoException(String.format("Invalid static covariate tag; tag=%d", tag));
            }
        }
        return new Panel.Builder()
                .setTarget(series.get(Partition.TARGET))
                .setObserved(series.get(Partition.OBSERVED))
                .setKnown(series.get(Partition.KNOWN))
                .setStaticCovariates(statics)
                .build();
    }

    private static final ImmutableList<Partition> TIME_VARYING =
            ImmutableList.of(Partition.TARGET, Partition.OBSERVED, Partition.KNOWN);
    private static final byte LONG_TAG = 1;
    private static final byte DOUBLE_TAG = 2;
    private static final byte STRING_TAG = 3;
}
