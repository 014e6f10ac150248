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

import com.hellblazer.cherenkov.image.CameraGeometry;
import com.hellblazer.cherenkov.image.ImageCleaner;
import com.hellblazer.cherenkov.image.PixelTopology;

import java.util.Objects;

/**
 * Everything shared by the telescopes of one kind: camera, pixel adjacency and the cleaning applied to their images.
 * Immutable and shared by all workers.
 *
 * @author hal.hildebrand
 */
public record TelescopeType(String name, CameraGeometry camera, PixelTopology topology, ImageCleaner cleaner) {

    public TelescopeType {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(camera, "camera cannot be null");
        Objects.requireNonNull(topology, "topology cannot be null");
        Objects.requireNonNull(cleaner, "cleaner cannot be null");
        if (camera.pixelCount() != topology.pixelCount()) {
            throw new IllegalArgumentException(
            "Type " + name + ": camera has " + camera.pixelCount() + " pixels, topology " + topology.pixelCount());
        }
    }

    public static TelescopeType of(String name, CameraGeometry camera, ImageCleaner cleaner) {
        return new TelescopeType(name, camera, PixelTopology.fromGeometry(camera), cleaner);
    }
}
