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
package com.arpnetworking.tspanel.persistence;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tspanel.kryo.KryoInitialization;
import com.arpnetworking.tspanel.model.Panel;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * {@link PanelPersistence} backed by Kryo. A new {@link Kryo} instance is
 * configured for every call since instances are not thread safe.
 *
 * @author Inscope Metrics
 */
public final class KryoPanelPersistence implements PanelPersistence {

    @Override
    public void save(final Panel panel, final OutputStream stream) throws IOException {
        final Output output = new Output(stream);
        try {
            createKryo().writeObject(output, panel);
            output.flush();
        } catch (final KryoException e) {
            throw new IOException("Unable to write panel", e);
        }
        LOGGER.debug()
                .setMessage("Saved panel")
                .addData("columns", panel.getColumns().keySet())
                .log();
    }

    @Override
    public Panel load(final InputStream stream) throws IOException {
        final Input input = new Input(stream);
        try {
            final Panel panel = createKryo().readObject(input, Panel.class);
            LOGGER.debug()
                    .setMessage("Loaded panel")
                    .addData("columns", panel.getColumns().keySet())
                    .log();
            return panel;
        } catch (final KryoException e) {
            throw new IOException("Unable to read panel", e);
        }
    }

    private Kryo createKryo() {
        final Kryo kryo = new Kryo();
        _kryoInitialization.customize(kryo);
        return kryo;
    }

    private final KryoInitialization _kryoInitialization = new KryoInitialization();

    private static final Logger LOGGER = LoggerFactory.getLogger(KryoPanelPersistence.class);
}
