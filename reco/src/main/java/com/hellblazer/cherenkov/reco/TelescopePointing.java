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

import javax.vecmath.Vector3d;

/**
 * A direction on the sky in horizontal coordinates, in radians. The ground frame has x pointing north, y pointing west
 * and z pointing up; azimuth is measured from north towards east.
 *
 * @param altitude elevation above the horizon, in [-pi/2, pi/2]
 * @param azimuth  azimuth, any finite value
 * @author hal.hildebrand
 */
public record TelescopePointing(double altitude, double azimuth) {

    public TelescopePointing {
        if (!Double.isFinite(altitude) || Math.abs(altitude) > Math.PI / 2) {
            throw new IllegalArgumentException("Altitude must be within [-pi/2, pi/2]: " + altitude);
        }
        if (!Double.isFinite(azimuth)) {
            throw new IllegalArgumentException("Azimuth must be finite: " + azimuth);
        }
    }

    public static TelescopePointing ofDegrees(double altitude, double azimuth) {
        return new TelescopePointing(Math.toRadians(altitude), Math.toRadians(azimuth));
    }

    /**
     * Answer the horizontal coordinates of a direction, azimuth normalized to [0, 2pi)
     */
    public static TelescopePointing fromDirection(Vector3d direction) {
        var d = new Vector3d(direction);
        if (!(d.length() > 0)) {
            throw new IllegalArgumentException("Direction must be non zero: " + direction);
        }
        d.normalize();
        double altitude = Math.asin(Math.max(-1.0, Math.min(1.0, d.z)));
        double azimuth = Math.atan2(-d.y, d.x);
        if (azimuth < 0) {
            azimuth += 2 * Math.PI;
        }
        return new TelescopePointing(altitude, azimuth);
    }

    public double angularSeparation(TelescopePointing other) {
        return direction().angle(other.direction());
    }

    /**
     * @return the unit vector of this pointing in the ground frame
     */
    public Vector3d direction() {
        double cosAlt = Math.cos(altitude);
        return new Vector3d(cosAlt * Math.cos(azimuth), -cosAlt * Math.sin(azimuth), Math.sin(altitude));
    }

    /**
     * @return the unit vector of increasing altitude, tangent to the sky at this pointing
     */
    Vector3d altitudeTangent() {
        double sinAlt = Math.sin(altitude);
        return new Vector3d(-sinAlt * Math.cos(azimuth), sinAlt * Math.sin(azimuth), Math.cos(altitude));
    }

    public double altitudeDegrees() {
        return Math.toDegrees(altitude);
    }

    public double azimuthDegrees() {
        return Math.toDegrees(azimuth);
    }
}
