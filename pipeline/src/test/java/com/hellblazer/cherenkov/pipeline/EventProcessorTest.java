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

import com.hellblazer.cherenkov.image.CameraGeometry;
import com.hellblazer.cherenkov.image.CleaningConfiguration;
import com.hellblazer.cherenkov.image.Image;
import com.hellblazer.cherenkov.image.TimeCoincidenceCleaner;
import com.hellblazer.cherenkov.image.shape.ShapeParameterizationException;
import com.hellblazer.cherenkov.image.shape.ShapeParameterizer;
import com.hellblazer.cherenkov.reco.ArrayGeometry;
import com.hellblazer.cherenkov.reco.TelescopePointing;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.vecmath.Point3d;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class EventProcessorTest {

    private static final double SPACING = 0.03;

    private static final CameraGeometry CAMERA = CameraGeometry.hexagonal("test", 3, SPACING, 17.0);
    private static final TelescopeType  TYPE   = TelescopeType.of("test", CAMERA, new TimeCoincidenceCleaner(
    CleaningConfiguration.defaultConfig()));

    private static final ArrayGeometry ARRAY = ArrayGeometry.of(
    new ArrayGeometry.Telescope(1, new Point3d(35, -60, 0), 17.0),
    new ArrayGeometry.Telescope(2, new Point3d(-35, 60, 0), 17.0),
    new ArrayGeometry.Telescope(3, new Point3d(80, 40, 0), 17.0));

    private static final TelescopePointing POINTING = TelescopePointing.ofDegrees(70, 10);

    private ExecutorService executor;

    private static int pixelAt(double x, double y) {
        int best = -1;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < CAMERA.pixelCount(); i++) {
            double d = Math.hypot(CAMERA.pixelX(i) - x, CAMERA.pixelY(i) - y);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        assertTrue(bestDistance < 1e-9, "no pixel at " + x + ", " + y);
        return best;
    }

    /**
     * A five pixel line through the camera centre along the given hex axis, with one pixel off the line
     */
    private static Image elongated(double angle) {
        var charges = new double[CAMERA.pixelCount()];
        double ux = Math.cos(angle) * SPACING;
        double uy = Math.sin(angle) * SPACING;
        for (int k = -2; k <= 2; k++) {
            charges[pixelAt(k * ux, k * uy)] = 20;
        }
        double off = angle + Math.PI / 3;
        charges[pixelAt(Math.cos(off) * SPACING, Math.sin(off) * SPACING)] = 10;
        return Image.ofCharges(charges);
    }

    private static Image line(int pixels) {
        var charges = new double[CAMERA.pixelCount()];
        for (int k = 0; k < pixels; k++) {
            charges[pixelAt(k * SPACING, 0)] = 20;
        }
        return Image.ofCharges(charges);
    }

    private static ArrayEvent event(long id, TelescopeImage... telescopes) {
        return new ArrayEvent(4242, id, List.of(telescopes));
    }

    private static TelescopeImage telescope(int id, Image image) {
        return new TelescopeImage(id, image, POINTING);
    }

    @BeforeEach
    public void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private EventProcessor.Builder builder() {
        return EventProcessor.builder()
                             .array(ARRAY)
                             .executor(executor)
                             .telescope(1, TYPE)
                             .telescope(2, TYPE)
                             .telescope(3, TYPE);
    }

    @Test
    public void testStereoEvent() throws Exception {
        var sink = mock(ResultSink.class);
        try (var processor = builder().build()) {
            var summary = processor.process(
            event(1, telescope(1, elongated(0)), telescope(2, elongated(Math.PI / 3)),
                  telescope(3, Image.ofCharges(new double[CAMERA.pixelCount()]))), sink);

            var telescopes = ArgumentCaptor.forClass(TelescopeRecord.class);
            verify(sink, times(2)).telescope(telescopes.capture());
            assertEquals(1, telescopes.getAllValues().get(0).telescopeId());
            assertEquals(2, telescopes.getAllValues().get(1).telescopeId());
            for (var record : telescopes.getAllValues()) {
                assertEquals(6, record.numPixels());
                assertEquals(1, record.numIslands());
                assertEquals(110.0, record.intensity(), 1e-9);
                assertTrue(record.width() > 0);
                assertNull(record.simulated());
                assertNull(record.mjd());
            }

            var skips = ArgumentCaptor.forClass(SkipRecord.class);
            verify(sink).skipped(skips.capture());
            assertEquals(3, skips.getValue().telescopeId());
            assertEquals(SkipReason.EMPTY_CLEANING, skips.getValue().reason());

            var stereo = ArgumentCaptor.forClass(StereoRecord.class);
            verify(sink, times(2)).stereo(stereo.capture());
            assertEquals(Set.of("hillas-intersection", "least-squares"),
                         Set.of(stereo.getAllValues().get(0).method(), stereo.getAllValues().get(1).method()));
            for (var record : stereo.getAllValues()) {
                assertEquals(2, record.numTelescopes());
                assertTrue(Double.isFinite(record.coreX()));
                assertTrue(Double.isFinite(record.coreY()));
                assertTrue(record.totalWeight() > 0);
            }

            assertEquals(new ProcessingSummary(1, 0, 3, 2, 1, 2, 0), summary);
        }
    }

    @Test
    public void testEventMetadataCarriedToRecords() throws Exception {
        var shower = new SimulatedShower(1.5, Math.toRadians(70), Math.toRadians(10), 50, -20);
        var sink = mock(ResultSink.class);
        try (var processor = builder().build()) {
            processor.process(ArrayEvent.simulated(4242, 5, shower, List.of(telescope(1, elongated(0)),
                                                                             telescope(2, elongated(Math.PI / 3)))),
                              sink);
            processor.process(ArrayEvent.observed(4242, 6, 59215.125, List.of(telescope(1, elongated(0)))), sink);

            var telescopes = ArgumentCaptor.forClass(TelescopeRecord.class);
            verify(sink, times(3)).telescope(telescopes.capture());
            assertEquals(shower, telescopes.getAllValues().get(0).simulated());
            assertEquals(shower, telescopes.getAllValues().get(1).simulated());
            assertNull(telescopes.getAllValues().get(0).mjd());
            assertNull(telescopes.getAllValues().get(2).simulated());
            assertEquals(59215.125, telescopes.getAllValues().get(2).mjd(), 0.0);

            var stereo = ArgumentCaptor.forClass(StereoRecord.class);
            verify(sink, times(2)).stereo(stereo.capture());
            for (var record : stereo.getAllValues()) {
                assertEquals(5, record.eventId());
                assertEquals(shower, record.simulated());
                assertNull(record.mjd());
            }
        }
        assertThrows(IllegalArgumentException.class, () -> new SimulatedShower(0.0, 1.0, 0.0, 0, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> ArrayEvent.observed(1, 1, Double.NaN, List.of(telescope(1, line(3)))));
    }

    @Test
    public void testMonocularEventDeclinesStereo() throws Exception {
        var sink = mock(ResultSink.class);
        try (var processor = builder().stereo(StereoStrategy.HILLAS_INTERSECTION).build()) {
            var summary = processor.process(event(2, telescope(1, line(3)), telescope(2, elongated(0))), sink);

            verify(sink, times(1)).telescope(any());
            verify(sink, never()).stereo(any());
            var skips = ArgumentCaptor.forClass(SkipRecord.class);
            verify(sink, times(2)).skipped(skips.capture());

            var tooFew = skips.getAllValues().get(0);
            assertEquals(1, tooFew.telescopeId());
            assertEquals(SkipReason.TOO_FEW_PIXELS, tooFew.reason());

            var stereo = skips.getAllValues().get(1);
            assertTrue(stereo.isStereo());
            assertEquals(SkipReason.STEREO_UNAVAILABLE, stereo.reason());
            assertTrue(stereo.detail().contains("fewer than two telescopes"), stereo.detail());

            assertEquals(new ProcessingSummary(1, 0, 2, 1, 1, 0, 1), summary);
        }
    }

    @Test
    public void testIslandLimit() throws Exception {
        var charges = elongated(0).charges();
        // split off the end of the line
        charges[pixelAt(-SPACING, 0)] = 0;
        var sink = mock(ResultSink.class);
        try (var processor = builder().minPixels(3).maxIslands(1).build()) {
            processor.process(event(3, telescope(1, Image.ofCharges(charges))), sink);
        }
        var skips = ArgumentCaptor.forClass(SkipRecord.class);
        verify(sink, times(3)).skipped(skips.capture());
        var rejected = skips.getAllValues().get(0);
        assertEquals(SkipReason.TOO_MANY_ISLANDS, rejected.reason());
        assertEquals("2 islands, at most 1 allowed", rejected.detail());
        verify(sink, never()).telescope(any());
    }

    @Test
    public void testParameterizationFailureAndUnselectedTelescopes() throws Exception {
        var parameterizer = mock(ShapeParameterizer.class);
        when(parameterizer.parameterize(any(), any(), any(), any())).thenThrow(
        new ShapeParameterizationException("no intensity"));
        var sink = mock(ResultSink.class);
        try (var processor = builder().parameterizer(parameterizer).build()) {
            var summary = processor.process(event(4, telescope(1, elongated(0)), telescope(9, elongated(0))), sink);
            assertEquals(1, summary.telescopeImages());
        }
        var skips = ArgumentCaptor.forClass(SkipRecord.class);
        verify(sink, times(3)).skipped(skips.capture());
        var failed = skips.getAllValues().get(0);
        assertEquals(1, failed.telescopeId());
        assertEquals(SkipReason.PARAMETERIZATION_FAILED, failed.reason());
        assertEquals("no intensity", failed.detail());
        verify(sink, never()).telescope(any());
    }

    @Test
    public void testWorkerFailureIsReportedAsSkip() throws Exception {
        var sink = mock(ResultSink.class);
        try (var processor = builder().build()) {
            // wrong pixel count fails inside the worker
            var summary = processor.process(event(5, telescope(1, Image.ofCharges(1, 2, 3)),
                                                  telescope(2, elongated(0))), sink);
            assertEquals(1, summary.telescopeSkips());
            assertEquals(1, summary.telescopeRecords());
        }
        var skips = ArgumentCaptor.forClass(SkipRecord.class);
        verify(sink, times(3)).skipped(skips.capture());
        assertEquals(SkipReason.PROCESSING_ERROR, skips.getAllValues().get(0).reason());
    }

    @Test
    public void testBadPixelsAreNeverSelected() throws Exception {
        var centre = pixelAt(0, 0);
        var sink = mock(ResultSink.class);
        try (var processor = builder().badPixels(BadPixelCalculator.fixed(Map.of(1, Set.of(centre)))).build()) {
            processor.process(event(6, telescope(1, elongated(0)), telescope(2, elongated(0))), sink);
        }
        var telescopes = ArgumentCaptor.forClass(TelescopeRecord.class);
        verify(sink, times(2)).telescope(telescopes.capture());
        // the line is cut at the centre: two islands, one pixel and 20 p.e. lost
        var cut = telescopes.getAllValues().get(0);
        assertEquals(1, cut.telescopeId());
        assertEquals(5, cut.numPixels());
        assertEquals(90.0, cut.intensity(), 1e-9);
        assertEquals(2, cut.numIslands());
        assertEquals(6, telescopes.getAllValues().get(1).numPixels());
    }

    @Test
    public void testDuplicateEventsAreDropped() throws Exception {
        var sink = mock(ResultSink.class);
        var source = EventSource.of(List.of(event(1, telescope(1, elongated(0))), event(1, telescope(1, elongated(0))),
                                            event(2, telescope(1, elongated(0))),
                                            event(1, telescope(1, elongated(0)))));
        try (var processor = builder().stereo(StereoStrategy.LEAST_SQUARES).build()) {
            var summary = processor.processAll(source, sink);
            assertEquals(3, summary.events());
            assertEquals(1, summary.duplicateEvents());
            assertEquals(3, summary.telescopeRecords());
            assertEquals(3, summary.stereoSkips());
        }
        verify(sink, times(3)).telescope(any());
    }

    @Test
    public void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> EventProcessor.builder().array(ARRAY).build());
        assertThrows(IllegalArgumentException.class, () -> EventProcessor.builder().telescope(1, TYPE).build());
        assertThrows(IllegalArgumentException.class,
                     () -> EventProcessor.builder().array(ARRAY).telescope(7, TYPE).build());
        assertThrows(IllegalArgumentException.class, () -> EventProcessor.builder().minPixels(0));
        assertThrows(IllegalArgumentException.class, () -> EventProcessor.builder().telescope(1, TYPE).telescope(1,
                                                                                                                TYPE));
    }
}
