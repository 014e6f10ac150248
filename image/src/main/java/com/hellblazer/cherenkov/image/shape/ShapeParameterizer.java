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
package com.hellblazer.cherenkov.image.shape;

import com.hellblazer.cherenkov.image.CameraGeometry;
import com.hellblazer.cherenkov.image.CleaningMask;
import com.hellblazer.cherenkov.image.Image;
import com.hellblazer.cherenkov.image.PixelTopology;

/**
 * Reduces a cleaned image to shape statistics. Implementations must be safe to share between threads.
 *
 * @author hal.hildebrand
 */
public interface ShapeParameterizer {

    /**
     * @param geometry the camera
     * @param topology the camera adjacency, for the camera edge
     * @param raw      the uncleaned image
     * @param mask     the cleaning selection
     * @return the parameters of the cleaned image
     * @throws ShapeParameterizationException if the selection carries no usable signal
     */
    ImageParameters parameterize(CameraGeometry geometry, PixelTopology topology, Image raw, CleaningMask mask)
    throws ShapeParameterizationException;
}
