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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.tspanel.model.Panel;
import com.arpnetworking.tspanel.model.RegularSeries;
import com.esotericsoftware.kryo.Kryo;

/**
 * Registers the serializers needed to write panels with a {@link Kryo}
 * instance.
 *
 * @author Inscope Metrics
 */
public final class KryoInitialization {

    /**
     * Configure each instance of {@code Kryo}.
     *
     * @param kryo instance of {@code Kryo} to configure
     */
    public void customize(final Kryo kryo) {
        LOGGER.debug("Customizing Kryo...");

        kryo.register(RegularSeries.class, new RegularSeriesSerializer());
        kryo.register(Panel.class, new PanelSerializer());
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(KryoInitialization.class);
}
