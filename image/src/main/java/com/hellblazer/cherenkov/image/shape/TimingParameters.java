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
 * Linear fit of the pixel arrival times against the longitudinal coordinate along the image major axis.
 *
 * @param slope     time gradient, time units per metre
 * @param intercept fitted time at the image centroid
 * @author hal.hildebrand
 */
public record TimingParameters(double slope, double intercept) {

    public static final TimingParameters UNDEFINED = new TimingParameters(Double.NaN, Double.NaN);
}
