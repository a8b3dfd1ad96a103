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

import com.arpnetworking.tspanel.model.Panel;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes panels to and reads panels from byte streams.
 *
 * @author Inscope Metrics
 */
public interface PanelPersistence {

    /**
     * Write a panel. The stream is flushed but not closed.
     *
     * @param panel The panel.
     * @param stream The destination.
     * @throws IOException if the panel cannot be written.
     */
    void save(Panel panel, OutputStream stream) throws IOException;

    /**
     * Read a panel. The stream is not closed.
     *
     * @param stream The source.
     * @return The panel.
     * @throws IOException if the stream does not hold a panel.
     */
    Panel load(InputStream stream) throws IOException;

    /**
     * Write a panel to a file, replacing any existing content.
     *
     * @param panel The panel.
     * @param path The file.
     * @throws IOException if the file cannot be written.
     */
    default void save(final Panel panel, final Path path) throws IOException {
        try (OutputStream stream = Files.newOutputStream(path)) {
            save(panel, stream);
        }
    }

    /**
     * Read a panel from a file.
     *
     * @param path The file.
     * @return The panel.
     * @throws IOException if the file cannot be read or does not hold a panel.
     */
    default Panel load(final Path path) throws IOException {
        try (InputStream stream = Files.newInputStream(path)) {
            return load(stream);
        }
    }
}
