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
import com.hellblazer.cherenkov.image.shape.ImageParameters;

/**
 * The monocular parameters of one telescope image, flattened for output. Lengths are metres in the camera plane,
 * angles radians. The simulated shower and trigger time of the event are present only when the event carries them.
 *
 * @author hal.hildebrand
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelescopeRecord(long observationId, long eventId, int telescopeId, String camera, double pointingAltitude,
                              double pointingAzimuth, int numPixels, int numIslands, double intensity, double x,
                              double y, double r, double phi, double length, double width, double psi,
                              double pixelsWidth1, double pixelsWidth2, double intensityWidth1,
                              double intensityWidth2, double timeGradient, double timeIntercept,
                              SimulatedShower simulated, Double mjd) {

    static TelescopeRecord of(ArrayEvent event, TelescopeImage telescope, String camera, int numPixels,
                              int numIslands, ImageParameters parameters) {
        var hillas = parameters.hillas();
        var leakage = parameters.leakage();
        var timing = parameters.timing();
        return new TelescopeRecord(event.observationId(), event.eventId(), telescope.telescopeId(), camera,
                                   telescope.pointing().altitude(), telescope.pointing().azimuth(), numPixels,
                                   numIslands, hillas.intensity(), hillas.x(), hillas.y(), hillas.r(), hillas.phi(),
                                   hillas.length(), hillas.width(), hillas.psi(), leakage.pixelsWidth1(),
                                   leakage.pixelsWidth2(), leakage.intensityWidth1(), leakage.intensityWidth2(),
                                   timing.slope(), timing.intercept(), event.simulated(), event.mjd());
    }
}
