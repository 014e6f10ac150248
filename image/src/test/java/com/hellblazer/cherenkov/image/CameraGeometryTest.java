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
package com.hellblazer.cherenkov.image;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CameraGeometryTest {

    private static final double EPSILON = 1e-12;

    @Test
    public void testHexagonalPixelCount() {
        assertEquals(1, CameraGeometry.hexagonal("one", 0, 0.1, 17.0).pixelCount());
        assertEquals(7, CameraGeometry.hexagonal("seven", 1, 0.1, 17.0).pixelCount());
        assertEquals(1027, CameraGeometry.hexagonal("large", 18, 0.1, 17.0).pixelCount());
    }

    @Test
    public void testHexagonalLayout() {
        var camera = CameraGeometry.hexagonal("test", 2, 0.5, 28.0);
        assertEquals(0.0, camera.pixelX(0), EPSILON);
        assertEquals(0.0, camera.pixelY(0), EPSILON);
        for (int i = 1; i <= 6; i++) {
            assertEquals(0.5, Math.hypot(camera.pixelX(i), camera.pixelY(i)), EPSILON, "ring 1 pixel " + i);
        }
        for (int i = 7; i < camera.pixelCount(); i++) {
            double r = Math.hypot(camera.pixelX(i), camera.pixelY(i));
            assertTrue(r > 0.8 && r < 1.0 + EPSILON, "ring 2 pixel " + i + " at " + r);
        }
        assertEquals(Math.sqrt(3.0) / 2.0 * 0.25, camera.pixelArea(), EPSILON);
        assertEquals(28.0, camera.focalLength());
    }

    @Test
    public void testScaled() {
        var camera = CameraGeometry.hexagonal("test", 1, 1.0, 17.0);
        var scaled = camera.scaled(1.0 / 1.0713);
        assertEquals(camera.pixelCount(), scaled.pixelCount());
        assertEquals(camera.pixelX(3) / 1.0713, scaled.pixelX(3), EPSILON);
        assertEquals(camera.focalLength(), scaled.focalLength());
        assertNotEquals(camera, scaled);
        assertEquals(camera, CameraGeometry.hexagonal("test", 1, 1.0, 17.0));
    }

    @Test
    public void testInvalidGeometry() {
        assertThrows(IllegalArgumentException.class,
                     () -> new CameraGeometry("bad", new double[2], new double[3], 1.0, 1.0));
        assertThrows(IllegalArgumentException.class,
                     () -> new CameraGeometry("bad", new double[0], new double[0], 1.0, 1.0));
        assertThrows(IllegalArgumentException.class,
                     () -> new CameraGeometry("bad", new double[1], new double[1], 1.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> CameraGeometry.hexagonal("bad", -1, 1.0, 1.0));
        assertThrows(NullPointerException.class,
                     () -> new CameraGeometry(null, new double[1], new double[1], 1.0, 1.0));
    }
}
