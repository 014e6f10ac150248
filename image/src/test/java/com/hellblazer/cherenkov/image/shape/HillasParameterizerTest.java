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
package com.hellblazer.cherenkov.image.shape;

import com.hellblazer.cherenkov.image.CameraGeometry;
import com.hellblazer.cherenkov.image.CleaningMask;
import com.hellblazer.cherenkov.image.Image;
import com.hellblazer.cherenkov.image.PixelTopology;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class HillasParameterizerTest {

    private static final double EPSILON = 1e-9;

    private static final CameraGeometry ROW      = new CameraGeometry("row", new double[] { 0, 1, 2, 3, 4 },
                                                                      new double[5], 1.0, 17.0);
    private static final PixelTopology  ROW_TOPO = PixelTopology.fromPairs(5, new int[][] { { 0, 1 }, { 1, 2 },
                                                                                           { 2, 3 }, { 3, 4 } });

    private final HillasParameterizer parameterizer = new HillasParameterizer();

    private static CleaningMask all(int n) {
        var selected = new boolean[n];
        java.util.Arrays.fill(selected, true);
        return CleaningMask.of(selected);
    }

    @Test
    public void testLineImageHasZeroWidth() throws ShapeParameterizationException {
        var image = Image.ofCharges(0, 10, 10, 10, 0);
        var mask = CleaningMask.of(new boolean[] { false, true, true, true, false });
        var hillas = parameterizer.parameterize(ROW, ROW_TOPO, image, mask).hillas();

        assertEquals(30.0, hillas.intensity(), EPSILON);
        assertEquals(2.0, hillas.x(), EPSILON);
        assertEquals(0.0, hillas.y(), EPSILON);
        assertEquals(Math.sqrt(2.0 / 3.0), hillas.length(), EPSILON);
        assertEquals(0.0, hillas.width(), EPSILON);
        assertEquals(0.0, hillas.psi(), EPSILON);
        assertEquals(2.0, hillas.r(), EPSILON);

        var ellipse = ShowerEllipse.of(hillas, 1);
        assertTrue(ellipse.hasZeroWidth());
        assertFalse(ellipse.hasUndefinedWidth());
    }

    @Test
    public void testDiagonalOrientation() throws ShapeParameterizationException {
        var camera = new CameraGeometry("diagonal", new double[] { 0, 1, 2, 1 }, new double[] { 0, 1, 2, 0 }, 1.0,
                                        17.0);
        var topology = PixelTopology.fromPairs(4, new int[][] { { 0, 1 }, { 1, 2 }, { 0, 3 } });
        var image = Image.ofCharges(10, 10, 10, 1);
        var hillas = parameterizer.parameterize(camera, topology, image, CleaningMask.of(
        new boolean[] { true, true, true, false })).hillas();
        assertEquals(Math.PI / 4, hillas.psi(), EPSILON);
        assertEquals(0.0, hillas.width(), EPSILON);

        var full = parameterizer.parameterize(camera, topology, image, all(4)).hillas();
        assertTrue(full.width() > 0, "off axis pixel gives the image a width");
        assertTrue(full.length() > full.width());
    }

    @Test
    public void testTimeGradient() throws ShapeParameterizationException {
        var image = new Image(new double[] { 0, 10, 20, 10, 0 }, new double[] { 0, 4, 7, 10, 0 });
        var mask = CleaningMask.of(new boolean[] { false, true, true, true, false });
        var timing = parameterizer.parameterize(ROW, ROW_TOPO, image, mask).timing();
        assertEquals(3.0, timing.slope(), EPSILON);
        assertEquals(7.0, timing.intercept(), EPSILON);
    }

    @Test
    public void testSinglePixelTimingIsUndefined() throws ShapeParameterizationException {
        var image = Image.ofCharges(0, 0, 10, 0, 0);
        var mask = CleaningMask.of(new boolean[] { false, false, true, false, false });
        var parameters = parameterizer.parameterize(ROW, ROW_TOPO, image, mask);
        assertEquals(TimingParameters.UNDEFINED, parameters.timing());
        assertEquals(0.0, parameters.hillas().length(), EPSILON);
        assertEquals(0.0, parameters.hillas().width(), EPSILON);
    }

    @Test
    public void testLeakage() throws ShapeParameterizationException {
        var camera = CameraGeometry.hexagonal("test", 1, 0.1, 17.0);
        var topology = PixelTopology.fromGeometry(camera);
        var image = Image.ofCharges(10, 0, 0, 30, 0, 0, 0);
        var mask = CleaningMask.of(new boolean[] { true, false, false, true, false, false, false });
        var leakage = parameterizer.parameterize(camera, topology, image, mask).leakage();
        assertEquals(0.75, leakage.intensityWidth1(), EPSILON);
        assertEquals(1.0, leakage.intensityWidth2(), EPSILON);
        assertEquals(1.0 / 7.0, leakage.pixelsWidth1(), EPSILON);
        assertEquals(2.0 / 7.0, leakage.pixelsWidth2(), EPSILON);
    }

    @Test
    public void testEmptySelectionFails() {
        var image = Image.ofCharges(0, 10, 10, 10, 0);
        assertThrows(ShapeParameterizationException.class,
                     () -> parameterizer.parameterize(ROW, ROW_TOPO, image, CleaningMask.empty(5)));
        var zero = Image.ofCharges(0, 0, 0, 0, 0);
        assertThrows(ShapeParameterizationException.class,
                     () -> parameterizer.parameterize(ROW, ROW_TOPO, zero, all(5)));
    }

    @Test
    public void testPixelCountMismatch() {
        assertThrows(IllegalArgumentException.class,
                     () -> parameterizer.parameterize(ROW, ROW_TOPO, Image.ofCharges(1, 2), CleaningMask.empty(5)));
    }
}
