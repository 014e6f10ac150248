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

import javax.vecmath.Point2d;
import javax.vecmath.Vector3d;
import java.util.Objects;

/**
 * Gnomonic projection between the camera plane of a telescope and directions on the sky. The camera x axis points
 * towards increasing altitude, the y axis completes a right handed frame with the pointing direction. Great circles on
 * the sky map to straight lines in the camera.
 *
 * @author hal.hildebrand
 */
public final class CameraFrame {

    private final TelescopePointing pointing;
    private final double            focalLength;
    private final Vector3d          axis;
    private final Vector3d          ex;
    private final Vector3d          ey;

    public CameraFrame(TelescopePointing pointing, double focalLength) {
        this.pointing = Objects.requireNonNull(pointing, "pointing cannot be null");
        if (!(focalLength > 0)) {
            throw new IllegalArgumentException("focalLength must be positive: " + focalLength);
        }
        this.focalLength = focalLength;
        axis = pointing.direction();
        ex = pointing.altitudeTangent();
        ey = new Vector3d();
        ey.cross(axis, ex);
    }

    public double focalLength() {
        return focalLength;
    }

    public TelescopePointing pointing() {
        return pointing;
    }

    /**
     * Project a sky direction onto the camera plane
     *
     * @throws IllegalArgumentException if the direction is not in front of the camera
     */
    public Point2d toCamera(Vector3d direction) {
        double depth = direction.dot(axis);
        if (!(depth > 0)) {
            throw new IllegalArgumentException("Direction is not in front of the camera: " + direction);
        }
        return new Point2d(focalLength * direction.dot(ex) / depth, focalLength * direction.dot(ey) / depth);
    }

    /**
     * @return the unit sky direction seen at the camera position
     */
    public Vector3d toSky(double x, double y) {
        var d = new Vector3d(axis);
        d.scaleAdd(x / focalLength, ex, d);
        d.scaleAdd(y / focalLength, ey, d);
        d.normalize();
        return d;
    }
}
