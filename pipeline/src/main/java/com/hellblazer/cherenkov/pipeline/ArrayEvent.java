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

import java.util.List;

/**
 * One array trigger: the images of every telescope that took part.
 *
 * @param simulated the true shower of a simulated event, null for real data
 * @param mjd       the trigger time as a modified Julian date, null when unknown or simulated
 * @author hal.hildebrand
 */
public record ArrayEvent(long observationId, long eventId, List<TelescopeImage> telescopes,
                         SimulatedShower simulated, Double mjd) {
    public ArrayEvent {
        telescopes = List.copyOf(telescopes);
        for (int i = 0; i < telescopes.size(); i++) {
            for (int j = i + 1; j < telescopes.size(); j++) {
                if (telescopes.get(i).telescopeId() == telescopes.get(j).telescopeId()) {
                    throw new IllegalArgumentException(
                    "Event " + eventId + " has telescope " + telescopes.get(i).telescopeId() + " twice");
                }
            }
        }
        if (mjd != null && !Double.isFinite(mjd)) {
            throw new IllegalArgumentException("Event " + eventId + " has invalid MJD: " + mjd);
        }
    }

    public ArrayEvent(long observationId, long eventId, List<TelescopeImage> telescopes) {
        this(observationId, eventId, telescopes, null, null);
    }

    public static ArrayEvent simulated(long observationId, long eventId, SimulatedShower shower,
                                       List<TelescopeImage> telescopes) {
        return new ArrayEvent(observationId, eventId, telescopes, shower, null);
    }

    public static ArrayEvent observed(long observationId, long eventId, double mjd, List<TelescopeImage> telescopes) {
        return new ArrayEvent(observationId, eventId, telescopes, null, mjd);
    }
}
