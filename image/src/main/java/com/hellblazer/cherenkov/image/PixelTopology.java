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

import com.hellblazer.cherenkov.common.KdTree;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * The undirected pixel adjacency graph of a camera, stored in compressed sparse row form. Adjacency is symmetric and
 * irreflexive; both are enforced at construction, so a malformed topology fails at startup rather than mid run.
 * <p>
 * Immutable; safely shared by all worker threads without locking.
 *
 * @author hal.hildebrand
 */
public final class PixelTopology {

    /** Pixels closer than this multiple of the minimum pixel spacing are neighbors */
    public static final double NEIGHBOR_DISTANCE_FACTOR = 1.4;

    private final int   pixelCount;
    private final int[] offsets;
    private final int[] neighbors;

    private PixelTopology(int pixelCount, BitSet[] adjacency) {
        this.pixelCount = pixelCount;
        offsets = new int[pixelCount + 1];
        for (int i = 0; i < pixelCount; i++) {
            offsets[i + 1] = offsets[i] + adjacency[i].cardinality();
        }
        neighbors = new int[offsets[pixelCount]];
        for (int i = 0; i < pixelCount; i++) {
            int k = offsets[i];
            for (int j = adjacency[i].nextSetBit(0); j >= 0; j = adjacency[i].nextSetBit(j + 1)) {
                neighbors[k++] = j;
            }
        }
    }

    /**
     * Build the topology from a square adjacency matrix
     *
     * @throws IllegalArgumentException if the matrix is not square, not symmetric or has a true diagonal entry
     */
    public static PixelTopology fromAdjacency(boolean[][] matrix) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        int n = matrix.length;
        var adjacency = newAdjacency(n);
        for (int i = 0; i < n; i++) {
            if (matrix[i].length != n) {
                throw new IllegalArgumentException(
                "Adjacency matrix is not square: row " + i + " has " + matrix[i].length + " columns, expected " + n);
            }
            if (matrix[i][i]) {
                throw new IllegalArgumentException("Pixel " + i + " is adjacent to itself");
            }
            for (int j = 0; j < n; j++) {
                if (matrix[i][j]) {
                    if (!matrix[j][i]) {
                        throw new IllegalArgumentException("Adjacency is not symmetric: " + i + " -> " + j);
                    }
                    adjacency[i].set(j);
                }
            }
        }
        return new PixelTopology(n, adjacency);
    }

    /**
     * Derive the topology from the pixel positions of a camera: two pixels are neighbors when their centres are closer
     * than {@link #NEIGHBOR_DISTANCE_FACTOR} times the minimum inter-pixel distance of the camera.
     */
    public static PixelTopology fromGeometry(CameraGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry cannot be null");
        int n = geometry.pixelCount();
        var xs = geometry.pixelXs();
        var ys = geometry.pixelYs();
        var tree = KdTree.of(xs, ys);

        double minDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            if (tree.findNearest(xs[i], ys[i], i) != null) {
                minDistance = Math.min(minDistance, tree.distance());
            }
        }
        var adjacency = newAdjacency(n);
        if (n < 2) {
            return new PixelTopology(n, adjacency);
        }
        if (!(minDistance > 0)) {
            throw new IllegalArgumentException("Camera " + geometry.name() + " has coincident pixels");
        }
        double radius = NEIGHBOR_DISTANCE_FACTOR * minDistance;
        for (int i = 0; i < n; i++) {
            final int pixel = i;
            tree.findWithin(xs[i], ys[i], radius).forEach(j -> {
                if (j != pixel) {
                    adjacency[pixel].set(j);
                    adjacency[j].set(pixel);
                }
            });
        }
        return new PixelTopology(n, adjacency);
    }

    /**
     * Build the topology from unordered neighbor pairs. Duplicate pairs are ignored.
     *
     * @throws IllegalArgumentException for pairs out of range, self pairs, or pairs that are not of length 2
     */
    public static PixelTopology fromPairs(int pixelCount, int[][] pairs) {
        if (pixelCount < 0) {
            throw new IllegalArgumentException("pixelCount must be non-negative: " + pixelCount);
        }
        Objects.requireNonNull(pairs, "pairs cannot be null");
        var adjacency = newAdjacency(pixelCount);
        for (var pair : pairs) {
            if (pair == null || pair.length != 2) {
                throw new IllegalArgumentException("Neighbor pair must have exactly two pixels: " + Arrays.toString(pair));
            }
            int a = pair[0];
            int b = pair[1];
            if (a < 0 || a >= pixelCount || b < 0 || b >= pixelCount) {
                throw new IllegalArgumentException(
                "Neighbor pair out of range [0, " + pixelCount + "): " + Arrays.toString(pair));
            }
            if (a == b) {
                throw new IllegalArgumentException("Pixel " + a + " is adjacent to itself");
            }
            adjacency[a].set(b);
            adjacency[b].set(a);
        }
        return new PixelTopology(pixelCount, adjacency);
    }

    private static BitSet[] newAdjacency(int n) {
        var adjacency = new BitSet[n];
        for (int i = 0; i < n; i++) {
            adjacency[i] = new BitSet(n);
        }
        return adjacency;
    }

    public boolean areNeighbors(int a, int b) {
        checkPixel(a);
        checkPixel(b);
        return Arrays.binarySearch(neighbors, offsets[a], offsets[a + 1], b) >= 0;
    }

    /**
     * Answer the pixels on the camera edge. Width 1 selects the pixels with fewer neighbors than the most connected
     * pixel of the camera; every further unit of width adds the neighbors of the previous border.
     */
    public boolean[] borderMask(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Border width must be at least 1: " + width);
        }
        int maxDegree = 0;
        for (int i = 0; i < pixelCount; i++) {
            maxDegree = Math.max(maxDegree, degree(i));
        }
        var border = new boolean[pixelCount];
        for (int i = 0; i < pixelCount; i++) {
            border[i] = degree(i) < maxDegree;
        }
        for (int w = 1; w < width; w++) {
            var grown = border.clone();
            for (int i = 0; i < pixelCount; i++) {
                if (border[i]) {
                    for (int k = offsets[i]; k < offsets[i + 1]; k++) {
                        grown[neighbors[k]] = true;
                    }
                }
            }
            border = grown;
        }
        return border;
    }

    public int degree(int pixel) {
        checkPixel(pixel);
        return offsets[pixel + 1] - offsets[pixel];
    }

    /**
     * Answer the k-th neighbor of the pixel, neighbors being ordered by index
     */
    public int neighbor(int pixel, int k) {
        if (k < 0 || k >= degree(pixel)) {
            throw new IndexOutOfBoundsException("Neighbor " + k + " of pixel " + pixel + " with degree " + degree(pixel));
        }
        return neighbors[offsets[pixel] + k];
    }

    public int[] neighborsOf(int pixel) {
        checkPixel(pixel);
        return Arrays.copyOfRange(neighbors, offsets[pixel], offsets[pixel + 1]);
    }

    public int pixelCount() {
        return pixelCount;
    }

    /**
     * Number of unordered neighbor pairs
     */
    public int pairCount() {
        return neighbors.length / 2;
    }

    @Override
    public String toString() {
        return String.format("PixelTopology[pixels=%d, pairs=%d]", pixelCount, pairCount());
    }

    private void checkPixel(int pixel) {
        if (pixel < 0 || pixel >= pixelCount) {
            throw new IndexOutOfBoundsException("Pixel " + pixel + " out of range [0, " + pixelCount + ")");
        }
    }
}
