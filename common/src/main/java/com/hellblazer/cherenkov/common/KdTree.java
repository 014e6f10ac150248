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

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Two dimensional kd-tree over indexed points, used to derive pixel neighborhoods from camera pixel positions.
 * <p>
 * Not thread safe: the nearest neighbor search keeps its state in the tree.
 *
 * @author hal.hildebrand
 */
public class KdTree {
    public static class Node {
        private final Point2d coords_;
        private final int     index_;
        private       Node    left_  = null;
        private       Node    right_ = null;

        public Node(int index, double x, double y) {
            index_ = index;
            coords_ = new Point2d(x, y);
        }

        public int index() {
            return index_;
        }

        @Override
        public String toString() {
            return index_ + ":" + coords_;
        }

        double distanceSquared(double x, double y) {
            double dx = coords_.x - x;
            double dy = coords_.y - y;
            return dx * dx + dy * dy;
        }

        double get(int axis) {
            return switch (axis) {
                case 0 -> coords_.x;
                case 1 -> coords_.y;
                default -> throw new IllegalArgumentException("Unexpected axis: " + axis);
            };
        }
    }

    //
    // Java implementation of quickselect algorithm.
    // See https://en.wikipedia.org/wiki/Quickselect
    //
    static class QuickSelect {
        private static final Random random = new Random(0x5eed);

        static <T> T select(List<T> list, int left, int right, int n, Comparator<? super T> cmp) {
            for (; ; ) {
                if (left == right) {
                    return list.get(left);
                }
                int pivot = left + random.nextInt(right - left + 1);
                pivot = partition(list, left, right, pivot, cmp);
                if (n == pivot) {
                    return list.get(n);
                } else if (n < pivot) {
                    right = pivot - 1;
                } else {
                    left = pivot + 1;
                }
            }
        }

        private static <T> int partition(List<T> list, int left, int right, int pivot, Comparator<? super T> cmp) {
            T pivotValue = list.get(pivot);
            swap(list, pivot, right);
            int store = left;
            for (int i = left; i < right; ++i) {
                if (cmp.compare(list.get(i), pivotValue) < 0) {
                    swap(list, store, i);
                    ++store;
                }
            }
            swap(list, right, store);
            return store;
        }

        private static <T> void swap(List<T> list, int i, int j) {
            T value = list.get(i);
            list.set(i, list.get(j));
            list.set(j, value);
        }
    }

    private final Node root_;
    private final int  size_;

    private Node   best_;
    private double bestDistance_;
    private int    excluded_;

    public KdTree(List<Node> nodes) {
        var working = new ArrayList<>(nodes);
        size_ = working.size();
        root_ = makeTree(working, 0, working.size(), 0);
    }

    /**
     * Build a tree over the points (xs[i], ys[i]), each node carrying its index i
     */
    public static KdTree of(double[] xs, double[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length: " + xs.length + " != " + ys.length);
        }
        var nodes = new ArrayList<Node>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            nodes.add(new Node(i, xs[i], ys[i]));
        }
        return new KdTree(nodes);
    }

    /**
     * Answer the distance to the last nearest neighbor found
     */
    public double distance() {
        return Math.sqrt(bestDistance_);
    }

    /**
     * Find the node nearest to (x, y), ignoring the node with the excluded index. Answer null if there is no such
     * node.
     */
    public Node findNearest(double x, double y, int excludedIndex) {
        best_ = null;
        bestDistance_ = Double.POSITIVE_INFINITY;
        excluded_ = excludedIndex;
        nearest(root_, x, y, 0);
        return best_;
    }

    /**
     * Answer the indices of all nodes strictly closer than radius to (x, y)
     */
    public IntArrayList findWithin(double x, double y, double radius) {
        var result = new IntArrayList();
        within(root_, x, y, radius, radius * radius, 0, result);
        return result;
    }

    public int size() {
        return size_;
    }

    private Node makeTree(List<Node> nodes, int begin, int end, int axis) {
        if (end <= begin) {
            return null;
        }
        int n = begin + (end - begin) / 2;
        final int splitAxis = axis;
        Node node = QuickSelect.select(nodes, begin, end - 1, n, Comparator.comparingDouble(e -> e.get(splitAxis)));
        axis = (axis + 1) % 2;
        node.left_ = makeTree(nodes, begin, n, axis);
        node.right_ = makeTree(nodes, n + 1, end, axis);
        return node;
    }

    private void nearest(Node root, double x, double y, int axis) {
        if (root == null) {
            return;
        }
        if (root.index_ != excluded_) {
            double d = root.distanceSquared(x, y);
            if (d < bestDistance_) {
                bestDistance_ = d;
                best_ = root;
            }
        }
        double dx = root.get(axis) - (axis == 0 ? x : y);
        int next = (axis + 1) % 2;
        nearest(dx > 0 ? root.left_ : root.right_, x, y, next);
        if (dx * dx >= bestDistance_) {
            return;
        }
        nearest(dx > 0 ? root.right_ : root.left_, x, y, next);
    }

    private void within(Node root, double x, double y, double radius, double radiusSquared, int axis,
                        IntArrayList result) {
        if (root == null) {
            return;
        }
        if (root.distanceSquared(x, y) < radiusSquared) {
            result.addInt(root.index_);
        }
        double dx = root.get(axis) - (axis == 0 ? x : y);
        int next = (axis + 1) % 2;
        if (dx > -radius) {
            within(root.left_, x, y, radius, radiusSquared, next, result);
        }
        if (dx < radius) {
            within(root.right_, x, y, radius, radiusSquared, next, result);
        }
    }
}
