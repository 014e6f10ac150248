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
package com.hellblazer.cherenkov.image;

/**
 * Separates shower signal from noise at pixel granularity.
 * <p>
 * Implementations are stateless with respect to events and safe to share between threads. A pixel failing cleaning is
 * never an exception: non finite charges and times fail every threshold and are simply not selected. An image with no
 * surviving pixels yields an empty mask.
 *
 * @author hal.hildebrand
 */
public interface ImageCleaner {

    /**
     * @param image       the calibrated image
     * @param topology    the camera pixel adjacency
     * @param unsuitable  pixels excluded from cleaning (dead or noisy), may be null for none
     * @return the selected pixels; never includes an unsuitable pixel
     */
    CleaningMask clean(Image image, PixelTopology topology, boolean[] unsuitable);

    /**
     * Clean with no pixel excluded
     */
    default CleaningMask clean(Image image, PixelTopology topology) {
        return clean(image, topology, null);
    }

    /**
     * Threshold test shared by the cleaners: NaN and infinite charges fail every threshold
     */
    static boolean passes(double charge, double threshold) {
        return Double.isFinite(charge) && charge >= threshold;
    }

    /**
     * Answer the working exclusion array for the image, validating sizes
     */
    static boolean[] exclusions(Image image, PixelTopology topology, boolean[] unsuitable) {
        int n = topology.pixelCount();
        if (image.size() != n) {
            throw new IllegalArgumentException("Image has " + image.size() + " pixels, topology has " + n);
        }
        if (unsuitable == null) {
            return new boolean[n];
        }
        if (unsuitable.length != n) {
            throw new IllegalArgumentException("Unsuitable mask has " + unsuitable.length + " pixels, expected " + n);
        }
        return unsuitable.clone();
    }
}
