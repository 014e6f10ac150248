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
package com.hellblazer.cherenkov.reco;

import org.junit.jupiter.api.Test;

import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CameraFrameTest {

    private static final double EPSILON = 1e-9;

    @Test
    public void testPointingDirections() {
        var zenith = TelescopePointing.ofDegrees(90, 0).direction();
        assertEquals(0.0, zenith.x, EPSILON);
        assertEquals(0.0, zenith.y, EPSILON);
        assertEquals(1.0, zenith.z, EPSILON);

        var north = TelescopePointing.ofDegrees(0, 0).direction();
        assertEquals(1.0, north.x, EPSILON);

        // east is negative y in a north, west, up frame
        var east = TelescopePointing.ofDegrees(0, 90).direction();
        assertEquals(0.0, east.x, EPSILON);
        assertEquals(-1.0, east.y, EPSILON);
    }

    @Test
    public void testDirectionRoundTrip() {
        var pointing = TelescopePointing.ofDegrees(63.5, 271.25);
        var back = TelescopePointing.fromDirection(pointing.direction());
        assertEquals(pointing.altitude(), back.altitude(), EPSILON);
        assertEquals(pointing.azimuth(), back.azimuth(), EPSILON);
        assertEquals(0.0, pointing.angularSeparation(back), 1e-7);

        var scaled = new Vector3d(pointing.direction());
        scaled.scale(42.0);
        assertEquals(pointing.azimuth(), TelescopePointing.fromDirection(scaled).azimuth(), EPSILON);
    }

    @Test
    public void testInvalidPointing() {
        assertThrows(IllegalArgumentException.class, () -> new TelescopePointing(2.0, 0));
        assertThrows(IllegalArgumentException.class, () -> new TelescopePointing(Double.NaN, 0));
        assertThrows(IllegalArgumentException.class, () -> new TelescopePointing(0.5, Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> TelescopePointing.fromDirection(new Vector3d()));
    }

    @Test
    public void testProjection() {
        var pointing = TelescopePointing.ofDegrees(70, 15);
        var frame = new CameraFrame(pointing, 17.0);

        var centre = frame.toCamera(pointing.direction());
        assertEquals(0.0, centre.x, EPSILON);
        assertEquals(0.0, centre.y, EPSILON);

        var sky = frame.toSky(0.12, -0.07);
        assertEquals(1.0, sky.length(), EPSILON);
        var camera = frame.toCamera(sky);
        assertEquals(0.12, camera.x, EPSILON);
        assertEquals(-0.07, camera.y, EPSILON);

        // camera x points towards increasing altitude
        var up = TelescopePointing.fromDirection(frame.toSky(0.1, 0));
        assertTrue(up.altitude() > pointing.altitude());
        assertEquals(pointing.azimuth(), up.azimuth(), 1e-9);
    }

    @Test
    public void testBehindCamera() {
        var pointing = TelescopePointing.ofDegrees(70, 15);
        var frame = new CameraFrame(pointing, 17.0);
        var behind = pointing.direction();
        behind.negate();
        assertThrows(IllegalArgumentException.class, () -> frame.toCamera(behind));
        assertThrows(IllegalArgumentException.class, () -> new CameraFrame(pointing, 0.0));
    }
}
