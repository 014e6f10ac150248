/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Cherenkov.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cherenkov.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Writes one JSON object per line for every record, tagged with its kind under {@code "record"}: {@code telescope},
 * {@code stereo} or {@code skip}. Not thread safe; the processor delivers records from a single thread.
 *
 * @author hal.hildebrand
 */
public class JsonLinesResultSink implements ResultSink {
    public static final String KIND = "record";

    private final Writer       writer;
    private final ObjectMapper objectMapper;

    public JsonLinesResultSink(Writer writer) {
        this(writer, new ObjectMapper());
    }

    public JsonLinesResultSink(Writer writer, ObjectMapper objectMapper) {
        this.writer = Objects.requireNonNull(writer, "writer cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    @Override
    public void skipped(SkipRecord record) {
        write("skip", record);
    }

    @Override
    public void stereo(StereoRecord record) {
        write("stereo", record);
    }

    @Override
    public void telescope(TelescopeRecord record) {
        write("telescope", record);
    }

    private void write(String kind, Object record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(KIND, kind);
        node.setAll((ObjectNode) objectMapper.valueToTree(record));
        try {
            writer.write(objectMapper.writeValueAsString(node));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write " + kind + " record", e);
        }
    }
}
