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

import com.hellblazer.cherenkov.common.IntArrayList;

import java.util.Arrays;

/**
 * Connected components of the selected pixels under the camera adjacency. A clean shower image is one island; more
 * islands indicate noise or a split image. The count is advisory and never rejects an image by itself.
 *
 * @author hal.hildebrand
 */
public final class IslandAnalyzer {

    public static final int UNSELECTED = -1;

    private IslandAnalyzer() {
    }

    public static int countIslands(PixelTopology topology, CleaningMask mask) {
        var labels = labelIslands(topology, mask);
        int max = UNSELECTED;
        for (var label : labels) {
            max = Math.max(max, label);
        }
        return max + 1;
    }

    /**
     * Label each selected pixel with its island, numbered from 0 in order of the lowest pixel index of the island.
     * Unselected pixels are labeled {@link #UNSELECTED}.
     */
    public static int[] labelIslands(PixelTopology topology, CleaningMask mask) {
        int n = topology.pixelCount();
        if (mask.size() != n) {
            throw new IllegalArgumentException("Mask has " + mask.size() + " pixels, topology has " + n);
        }
        var labels = new int[n];
        Arrays.fill(labels, UNSELECTED);
        var frontier = new IntArrayList();
        int island = 0;
        for (int seed = 0; seed < n; seed++) {
            if (!mask.isSelected(seed) || labels[seed] != UNSELECTED) {
                continue;
            }
            labels[seed] = island;
            frontier.clear();
            frontier.addInt(seed);
            while (!frontier.isEmpty()) {
                int pixel = frontier.poll();
                for (int k = 0; k < topology.degree(pixel); k++) {
                    int next = topology.neighbor(pixel, k);
                    if (mask.isSelected(next) && labels[next] == UNSELECTED) {
                        labels[next] = island;
                        frontier.addInt(next);
                    }
                }
            }
            island++;
        }
        return labels;
    }
}
