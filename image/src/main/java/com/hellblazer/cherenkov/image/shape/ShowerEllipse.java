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

/**
 * The shower image of one telescope reduced to an ellipse in the camera plane. Coordinates in metres, angles in
 * radians. An ellipse of zero or undefined width has no meaningful orientation and cannot take part in a stereo
 * reconstruction.
 *
 * @param x          centroid x
 * @param y          centroid y
 * @param length     semi-major extent (standard deviation along the major axis)
 * @param width      semi-minor extent (standard deviation along the minor axis)
 * @param psi        orientation of the major axis from the camera x axis
 * @param intensity  sum of the cleaned charge
 * @param numIslands number of islands of the cleaned image
 * @author hal.hildebrand
 */
public record ShowerEllipse(double x, double y, double length, double width, double psi, double intensity,
                            int numIslands) {

    public static ShowerEllipse of(HillasParameters hillas, int numIslands) {
        return new ShowerEllipse(hillas.x(), hillas.y(), hillas.length(), hillas.width(), hillas.psi(),
                                 hillas.intensity(), numIslands);
    }

    public boolean hasUndefinedWidth() {
        return Double.isNaN(width);
    }

    public boolean hasZeroWidth() {
        return width == 0.0;
    }
}
