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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hellblazer.cherenkov.reco.StereoResult;

import java.util.Map;

/**
 * A stereoscopic reconstruction of one event by one strategy, flattened for output. The simulated shower and trigger
 * time of the event are present only when the event carries them.
 *
 * @author hal.hildebrand
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StereoRecord(long observationId, long eventId, String method, double altitude, double azimuth,
                           double coreX, double coreY, double totalWeight, int numTelescopes,
                           Map<Integer, Double> impactDistances, SimulatedShower simulated, Double mjd) {

    public StereoRecord {
        impactDistances = Map.copyOf(impactDistances);
    }

    static StereoRecord of(ArrayEvent event, String method, StereoResult result) {
        return new StereoRecord(event.observationId(), event.eventId(), method, result.altitude(), result.azimuth(),
                                result.coreX(), result.coreY(), result.totalWeight(), result.numTelescopes(),
                                result.impactDistances(), event.simulated(), event.mjd());
    }
}
