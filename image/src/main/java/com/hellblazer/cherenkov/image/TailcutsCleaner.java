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

import java.util.Objects;

/**
 * The standard two level tail cut, without timing. Picture pixels are pixels at or above the picture threshold with at
 * least {@code minNumberPictureNeighbors} picture neighbors; boundary pixels are pixels at or above the boundary
 * threshold adjacent to a picture pixel. Boundary pixels are added in a single ring, they do not recruit further
 * pixels. Unless {@code keepIsolatedPixels} is set, picture pixels without any neighbor above the boundary threshold
 * are dropped.
 *
 * @author hal.hildebrand
 */
public class TailcutsCleaner implements ImageCleaner {

    /**
     * @param pictureThreshold          minimum charge of a picture pixel
     * @param boundaryThreshold         minimum charge of a boundary pixel
     * @param keepIsolatedPixels        keep picture pixels with no boundary neighbor
     * @param minNumberPictureNeighbors picture neighbors a picture pixel requires, 0 for none
     */
    public record Configuration(double pictureThreshold, double boundaryThreshold, boolean keepIsolatedPixels,
                                int minNumberPictureNeighbors) {
        public Configuration {
            if (!(pictureThreshold >= 0)) {
                throw new IllegalArgumentException("pictureThreshold must be non-negative: " + pictureThreshold);
            }
            if (!(boundaryThreshold >= 0)) {
                throw new IllegalArgumentException("boundaryThreshold must be non-negative: " + boundaryThreshold);
            }
            if (boundaryThreshold > pictureThreshold) {
                throw new IllegalArgumentException(
                "boundaryThreshold " + boundaryThreshold + " exceeds pictureThreshold " + pictureThreshold);
            }
            if (minNumberPictureNeighbors < 0) {
                throw new IllegalArgumentException(
                "minNumberPictureNeighbors must be non-negative: " + minNumberPictureNeighbors);
            }
        }

        /**
         * Settings used for the large size telescope camera
         */
        public static Configuration defaultConfig() {
            return new Configuration(8.0, 4.0, true, 0);
        }
    }

    private final Configuration configuration;

    public TailcutsCleaner(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
    }

    @Override
    public CleaningMask clean(Image image, PixelTopology topology, boolean[] unsuitable) {
        var excluded = ImageCleaner.exclusions(image, topology, unsuitable);
        int n = excluded.length;

        var abovePicture = new boolean[n];
        var aboveBoundary = new boolean[n];
        for (int i = 0; i < n; i++) {
            abovePicture[i] = !excluded[i] && ImageCleaner.passes(image.charge(i), configuration.pictureThreshold());
            aboveBoundary[i] = !excluded[i] && ImageCleaner.passes(image.charge(i), configuration.boundaryThreshold());
        }

        boolean[] inPicture;
        if (configuration.keepIsolatedPixels() || configuration.minNumberPictureNeighbors() == 0) {
            inPicture = abovePicture;
        } else {
            inPicture = new boolean[n];
            for (int i = 0; i < n; i++) {
                inPicture[i] = abovePicture[i]
                && countNeighbors(topology, i, abovePicture) >= configuration.minNumberPictureNeighbors();
            }
        }

        var selected = new boolean[n];
        for (int i = 0; i < n; i++) {
            boolean boundaryPixel = aboveBoundary[i] && countNeighbors(topology, i, inPicture) > 0;
            boolean picturePixel = inPicture[i] && (configuration.keepIsolatedPixels()
                                                    || countNeighbors(topology, i, aboveBoundary) > 0);
            selected[i] = boundaryPixel || picturePixel;
        }
        return CleaningMask.adopt(selected);
    }

    public Configuration configuration() {
        return configuration;
    }

    @Override
    public String toString() {
        return "TailcutsCleaner[" + configuration + "]";
    }

    private static int countNeighbors(PixelTopology topology, int pixel, boolean[] set) {
        int count = 0;
        for (int k = 0; k < topology.degree(pixel); k++) {
            if (set[topology.neighbor(pixel, k)]) {
                count++;
            }
        }
        return count;
    }
}
