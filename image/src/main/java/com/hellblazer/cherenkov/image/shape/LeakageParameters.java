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
 * Fractions of a cleaned image found on the camera edge, a measure of how truncated the image is.
 *
 * @param pixelsWidth1    fraction of selected pixels in the outermost pixel ring
 * @param pixelsWidth2    fraction of selected pixels in the two outermost pixel rings
 * @param intensityWidth1 fraction of the cleaned intensity in the outermost pixel ring
 * @param intensityWidth2 fraction of the cleaned intensity in the two outermost pixel rings
 * @author hal.hildebrand
 */
public record LeakageParameters(double pixelsWidth1, double pixelsWidth2, double intensityWidth1,
                                double intensityWidth2) {
}
