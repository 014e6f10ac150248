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
 * Second moment (Hillas) parameters of a cleaned image. Lengths in metres of the camera plane, angles in radians.
 *
 * @param intensity total charge of the cleaned image
 * @param x         centroid x
 * @param y         centroid y
 * @param r         centroid distance from the camera centre
 * @param phi       centroid polar angle
 * @param length    standard deviation along the major axis
 * @param width     standard deviation along the minor axis
 * @param psi       orientation of the major axis, measured from the x axis
 * @author hal.hildebrand
 */
public record HillasParameters(double intensity, double x, double y, double r, double phi, double length,
                               double width, double psi) {
}
