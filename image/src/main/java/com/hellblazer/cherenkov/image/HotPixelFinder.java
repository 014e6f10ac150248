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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.FastMath;

/**
 * Finds pixels whose charge is statistically inconsistent with their neighbors, the signature of a pixel triggered by
 * a star or electronics noise rather than by a shower.
 * <p>
 * A pixel with at least two usable neighbors is hot when its charge exceeds the mean neighbor charge by more than
 * {@code sigma * max(neighborStdDev, minSpread)}. Every pixel is judged against the same input exclusions, so the
 * result does not depend on pixel order.
 *
 * @author hal.hildebrand
 */
public final class HotPixelFinder {

    private final double sigma;
    private final double minSpread;

    public HotPixelFinder(double sigma, double minSpread) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("sigma must be positive: " + sigma);
        }
        if (!(minSpread >= 0)) {
            throw new IllegalArgumentException("minSpread must be non-negative: " + minSpread);
        }
        this.sigma = sigma;
        this.minSpread = minSpread;
    }

    /**
     * @param image    the image
     * @param topology the camera adjacency
     * @param excluded pixels already excluded; neither judged nor used as neighbors
     * @return the hot pixels
     */
    public boolean[] find(Image image, PixelTopology topology, boolean[] excluded) {
        int n = topology.pixelCount();
        var hot = new boolean[n];
        var values = new double[maxDegree(topology)];
        for (int i = 0; i < n; i++) {
            double charge = image.charge(i);
            if (excluded[i] || !Double.isFinite(charge)) {
                continue;
            }
            int usable = 0;
            for (int k = 0; k < topology.degree(i); k++) {
                int j = topology.neighbor(i, k);
                double q = image.charge(j);
                if (!excluded[j] && Double.isFinite(q)) {
                    values[usable++] = q;
                }
            }
            if (usable < 2) {
                continue;
            }
            double mean = StatUtils.mean(values, 0, usable);
            double spread = FastMath.sqrt(StatUtils.variance(values, mean, 0, usable));
            hot[i] = charge - mean > sigma * Math.max(spread, minSpread);
        }
        return hot;
    }

    private static int maxDegree(PixelTopology topology) {
        int max = 0;
        for (int i = 0; i < topology.pixelCount(); i++) {
            max = Math.max(max, topology.degree(i));
        }
        return max;
    }
}
