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
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A stereoscopic estimate of the shower geometry.
 *
 * @param altitude        altitude of the arrival direction, radians
 * @param azimuth         azimuth of the arrival direction, radians in [0, 2pi)
 * @param coreX           impact point on the ground plane z = 0, metres north
 * @param coreY           impact point on the ground plane z = 0, metres west
 * @param totalWeight     sum of the pair weights, a quality indicator
 * @param impactDistances distance in metres from each contributing telescope to the shower axis
 * @author hal.hildebrand
 */
public record StereoResult(double altitude, double azimuth, double coreX, double coreY, double totalWeight,
                           Map<Integer, Double> impactDistances) {

    public StereoResult {
        impactDistances = Collections.unmodifiableMap(new TreeMap<>(impactDistances));
    }

    /**
     * @return the unit vector towards the shower origin
     */
    public Vector3d direction() {
        return pointing().direction();
    }

    public int numTelescopes() {
        return impactDistances.size();
    }

    public TelescopePointing pointing() {
        return new TelescopePointing(altitude, azimuth);
    }
}
