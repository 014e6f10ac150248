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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The true parameters of a simulated shower, carried through to the output so reconstructions can be compared with
 * them.
 *
 * @param energy   primary energy, TeV
 * @param altitude arrival altitude, radians
 * @param azimuth  arrival azimuth, radians
 * @param coreX    impact point on the ground, metres
 * @param coreY    impact point on the ground, metres
 * @author hal.hildebrand
 */
public record SimulatedShower(@JsonProperty("energy") double energy, @JsonProperty("altitude") double altitude,
                              @JsonProperty("azimuth") double azimuth, @JsonProperty("coreX") double coreX,
                              @JsonProperty("coreY") double coreY) {
    public SimulatedShower {
        if (!(energy > 0) || Double.isInfinite(energy)) {
            throw new IllegalArgumentException("energy must be positive and finite: " + energy);
        }
        if (!Double.isFinite(altitude) || !Double.isFinite(azimuth)) {
            throw new IllegalArgumentException("Invalid arrival direction: " + altitude + ", " + azimuth);
        }
        if (!Double.isFinite(coreX) || !Double.isFinite(coreY)) {
            throw new IllegalArgumentException("Invalid core: " + coreX + ", " + coreY);
        }
    }
}
