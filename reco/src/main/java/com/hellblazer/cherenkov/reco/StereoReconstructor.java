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

import com.hellblazer.cherenkov.image.shape.ShowerEllipse;

import java.util.Map;

/**
 * Combines the monocular ellipses of one event into a stereoscopic estimate of the shower direction and impact point.
 * Every strategy declines degenerate input identically: fewer than two ellipses, then any ellipse of zero width, then
 * any ellipse of undefined width.
 *
 * @author hal.hildebrand
 */
public interface StereoReconstructor {

    /**
     * @param ellipses  the usable ellipse of each contributing telescope, by telescope id
     * @param pointings the pointing of each telescope, by telescope id
     * @param array     the array geometry
     * @return the reconstruction, or the reason it is unavailable
     * @throws IllegalArgumentException if a contributing telescope has no pointing or no array position
     */
    StereoOutcome combine(Map<Integer, ShowerEllipse> ellipses, Map<Integer, TelescopePointing> pointings,
                          ArrayGeometry array);

    String name();
}
