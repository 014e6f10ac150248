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

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Supplies the pixels of a telescope that must not take part in cleaning for an event. Implementations are shared by
 * the workers of one processing run and must be thread safe.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface BadPixelCalculator {

    /**
     * No pixel is ever unsuitable
     */
    BadPixelCalculator NONE = (event, telescope, pixelCount) -> new boolean[pixelCount];

    /**
     * A fixed set of dead pixels per telescope, the same for every event
     */
    static BadPixelCalculator fixed(Map<Integer, Set<Integer>> deadPixels) {
        var copy = new TreeMap<Integer, Set<Integer>>();
        deadPixels.forEach((id, pixels) -> copy.put(id, Set.copyOf(pixels)));
        return (event, telescope, pixelCount) -> {
            var unsuitable = new boolean[pixelCount];
            for (int pixel : copy.getOrDefault(telescope.telescopeId(), Set.of())) {
                if (pixel < 0 || pixel >= pixelCount) {
                    throw new IllegalArgumentException(
                    "Dead pixel " + pixel + " outside camera of " + pixelCount + " pixels, telescope "
                    + telescope.telescopeId());
                }
                unsuitable[pixel] = true;
            }
            return unsuitable;
        };
    }

    /**
     * @return the unsuitable mask, one entry per camera pixel
     */
    boolean[] unsuitablePixels(ArrayEvent event, TelescopeImage telescope, int pixelCount);
}
