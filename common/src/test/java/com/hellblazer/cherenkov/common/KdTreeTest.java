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
package com.hellblazer.cherenkov.common;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class KdTreeTest {

    @Test
    public void testNearestExcludesSelf() {
        var tree = KdTree.of(new double[] { 0, 1, 5 }, new double[] { 0, 0, 0 });
        var nearest = tree.findNearest(0, 0, 0);
        assertNotNull(nearest);
        assertEquals(1, nearest.index());
        assertEquals(1.0, tree.distance(), 1e-12);
    }

    @Test
    public void testNearestOfSinglePoint() {
        var tree = KdTree.of(new double[] { 3 }, new double[] { 4 });
        assertNull(tree.findNearest(3, 4, 0), "only point is excluded");
        assertEquals(0, tree.findNearest(0, 0, -1).index());
        assertEquals(5.0, tree.distance(), 1e-12);
    }

    @Test
    public void testRandomAgainstBruteForce() {
        var random = new Random(42);
        int count = 2000;
        var xs = new double[count];
        var ys = new double[count];
        for (int i = 0; i < count; i++) {
            xs[i] = random.nextDouble();
            ys[i] = random.nextDouble();
        }
        var tree = KdTree.of(xs, ys);
        assertEquals(count, tree.size());

        for (int trial = 0; trial < 50; trial++) {
            double x = random.nextDouble();
            double y = random.nextDouble();
            double radius = 0.05;

            var found = tree.findWithin(x, y, radius).toArray();
            Arrays.sort(found);
            var expected = java.util.stream.IntStream.range(0, count)
                                                     .filter(i -> Math.hypot(xs[i] - x, ys[i] - y) < radius)
                                                     .toArray();
            assertArrayEquals(expected, found);

            int best = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int i = 0; i < count; i++) {
                double d = Math.hypot(xs[i] - x, ys[i] - y);
                if (d < bestDistance) {
                    bestDistance = d;
                    best = i;
                }
            }
            assertEquals(best, tree.findNearest(x, y, -1).index());
            assertEquals(bestDistance, tree.distance(), 1e-12);
        }
    }

    @Test
    public void testMismatchedCoordinates() {
        assertThrows(IllegalArgumentException.class, () -> KdTree.of(new double[2], new double[3]));
    }
}
