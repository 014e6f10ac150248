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

import java.util.Arrays;
import java.util.Objects;

/**
 * Static description of a telescope camera: the position of every pixel in the camera (focal) plane, the pixel area
 * and the focal length of the optics. Positions are in metres.
 * <p>
 * Immutable and shared by every event processed with this camera.
 *
 * @author hal.hildebrand
 */
public final class CameraGeometry {

    private static final double SQRT3 = Math.sqrt(3.0);

    // axial hex directions, walked in order around each ring
    private static final int[][] HEX_DIRECTIONS = { { 1, 0 }, { 1, -1 }, { 0, -1 }, { -1, 0 }, { -1, 1 }, { 0, 1 } };

    private final String   name;
    private final double[] pixelX;
    private final double[] pixelY;
    private final double   pixelArea;
    private final double   focalLength;

    public CameraGeometry(String name, double[] pixelX, double[] pixelY, double pixelArea, double focalLength) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(pixelX, "pixelX cannot be null");
        Objects.requireNonNull(pixelY, "pixelY cannot be null");
        if (pixelX.length != pixelY.length) {
            throw new IllegalArgumentException(
            "Pixel coordinate arrays differ in length: " + pixelX.length + " != " + pixelY.length);
        }
        if (pixelX.length == 0) {
            throw new IllegalArgumentException("Camera must have at least one pixel");
        }
        if (!(pixelArea > 0)) {
            throw new IllegalArgumentException("pixelArea must be positive: " + pixelArea);
        }
        if (!(focalLength > 0)) {
            throw new IllegalArgumentException("focalLength must be positive: " + focalLength);
        }
        this.name = name;
        this.pixelX = pixelX.clone();
        this.pixelY = pixelY.clone();
        this.pixelArea = pixelArea;
        this.focalLength = focalLength;
    }

    /**
     * Build a camera of hexagonal pixels arranged in concentric hexagonal rings. Ring 0 is the central pixel, ring k
     * holds 6k pixels, so a camera of r rings has 1 + 3r(r + 1) pixels, ordered ring by ring.
     *
     * @param name         the camera name
     * @param rings        number of rings around the central pixel
     * @param pixelSpacing centre to centre distance of adjacent pixels
     * @param focalLength  effective focal length of the telescope optics
     * @return the hexagonal camera
     */
    public static CameraGeometry hexagonal(String name, int rings, double pixelSpacing, double focalLength) {
        if (rings < 0) {
            throw new IllegalArgumentException("rings must be non-negative: " + rings);
        }
        if (!(pixelSpacing > 0)) {
            throw new IllegalArgumentException("pixelSpacing must be positive: " + pixelSpacing);
        }
        int count = 1 + 3 * rings * (rings + 1);
        var xs = new double[count];
        var ys = new double[count];
        int pixel = 1;
        for (int ring = 1; ring <= rings; ring++) {
            // start on the ring at direction 4 and walk the six sides
            int q = HEX_DIRECTIONS[4][0] * ring;
            int r = HEX_DIRECTIONS[4][1] * ring;
            for (var direction : HEX_DIRECTIONS) {
                for (int step = 0; step < ring; step++) {
                    xs[pixel] = pixelSpacing * (q + r / 2.0);
                    ys[pixel] = pixelSpacing * (r * SQRT3 / 2.0);
                    pixel++;
                    q += direction[0];
                    r += direction[1];
                }
            }
        }
        double area = SQRT3 / 2.0 * pixelSpacing * pixelSpacing;
        return new CameraGeometry(name, xs, ys, area, focalLength);
    }

    public double focalLength() {
        return focalLength;
    }

    public String name() {
        return name;
    }

    public double pixelArea() {
        return pixelArea;
    }

    public int pixelCount() {
        return pixelX.length;
    }

    public double pixelX(int pixel) {
        return pixelX[pixel];
    }

    public double[] pixelXs() {
        return pixelX.clone();
    }

    public double pixelY(int pixel) {
        return pixelY[pixel];
    }

    public double[] pixelYs() {
        return pixelY.clone();
    }

    /**
     * Answer a copy of this camera with all pixel positions (and areas) scaled by the factor. Used to correct the
     * camera plane for the optical aberration of the mirror before cleaning and parameterization.
     */
    public CameraGeometry scaled(double factor) {
        if (!(factor > 0)) {
            throw new IllegalArgumentException("Scale factor must be positive: " + factor);
        }
        var xs = pixelX.clone();
        var ys = pixelY.clone();
        for (int i = 0; i < xs.length; i++) {
            xs[i] *= factor;
            ys[i] *= factor;
        }
        return new CameraGeometry(name, xs, ys, pixelArea * factor * factor, focalLength);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CameraGeometry that)) {
            return false;
        }
        return Double.compare(pixelArea, that.pixelArea) == 0 && Double.compare(focalLength, that.focalLength) == 0
        && name.equals(that.name) && Arrays.equals(pixelX, that.pixelX) && Arrays.equals(pixelY, that.pixelY);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pixelArea, focalLength, Arrays.hashCode(pixelX), Arrays.hashCode(pixelY));
    }

    @Override
    public String toString() {
        return String.format("CameraGeometry[%s, pixels=%d, focalLength=%.2f]", name, pixelX.length, focalLength);
    }
}
