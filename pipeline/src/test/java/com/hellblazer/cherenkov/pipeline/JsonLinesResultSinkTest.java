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
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class JsonLinesResultSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testRecordsAreTaggedLines() throws IOException {
        var out = new StringWriter();
        try (var sink = new JsonLinesResultSink(out)) {
            sink.skipped(new SkipRecord(7, 11, SkipRecord.STEREO, SkipReason.STEREO_UNAVAILABLE,
                                        "least-squares: degenerate ellipse (zero width)"));
            sink.stereo(new StereoRecord(7, 12, "hillas-intersection", 1.2, 0.3, 15.0, -4.0, 2.5e5, 2,
                                         Map.of(5, 80.0, 6, 95.5), new SimulatedShower(0.8, 1.21, 0.31, 14.0, -3.5),
                                         null));
        }
        var lines = out.toString().split("\n");
        assertEquals(2, lines.length);

        var skip = mapper.readTree(lines[0]);
        assertEquals("skip", skip.get(JsonLinesResultSink.KIND).asText());
        assertEquals(-1, skip.get("telescopeId").asInt());
        assertEquals("STEREO_UNAVAILABLE", skip.get("reason").asText());
        assertFalse(skip.has("stereo"));

        var stereo = mapper.readTree(lines[1]);
        assertEquals("stereo", stereo.get(JsonLinesResultSink.KIND).asText());
        assertEquals(12, stereo.get("eventId").asLong());
        assertEquals(15.0, stereo.get("coreX").asDouble(), 0.0);
        assertEquals(95.5, stereo.get("impactDistances").get("6").asDouble(), 0.0);
        assertEquals(0.8, stereo.get("simulated").get("energy").asDouble(), 0.0);
        assertEquals(-3.5, stereo.get("simulated").get("coreY").asDouble(), 0.0);
        assertFalse(stereo.has("mjd"));
    }

    @Test
    public void testWriteFailureSurfaces() throws IOException {
        var writer = mock(Writer.class);
        doThrow(new IOException("disk full")).when(writer).write(anyString());
        var sink = new JsonLinesResultSink(writer);
        var error = assertThrows(UncheckedIOException.class, () -> sink.skipped(
        new SkipRecord(1, 1, 1, SkipReason.EMPTY_CLEANING, "no pixels survived cleaning")));
        assertEquals("disk full", error.getCause().getMessage());
    }
}
