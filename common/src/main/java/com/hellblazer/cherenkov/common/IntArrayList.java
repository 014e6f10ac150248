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

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.RandomAccess;
import java.util.function.IntConsumer;

/**
 * Unboxed, growable list of pixel indices. Doubles as a FIFO work queue for the breadth first traversals of the
 * camera adjacency graph: {@link #addInt(int)} appends at the tail, {@link #poll()} consumes from the head. Slots
 * freed by polling are reclaimed before the backing array grows, so a flood fill over an N pixel camera never holds
 * more than N live slots plus slack.
 *
 * @author hal.hildebrand
 */
public final class IntArrayList implements RandomAccess {

    private static final int MIN_CAPACITY = 8;

    private int[] elements;
    private int   head;
    private int   tail;

    public IntArrayList() {
        this(MIN_CAPACITY);
    }

    public IntArrayList(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Negative capacity: " + capacity);
        }
        elements = new int[Math.max(capacity, 1)];
    }

    public static IntArrayList of(int... values) {
        var list = new IntArrayList(values.length);
        for (int value : values) {
            list.addInt(value);
        }
        return list;
    }

    public void addInt(int value) {
        if (tail == elements.length) {
            makeRoom();
        }
        elements[tail++] = value;
    }

    public void clear() {
        head = tail = 0;
    }

    public boolean contains(int value) {
        for (int i = head; i < tail; i++) {
            if (elements[i] == value) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntArrayList other)) {
            return false;
        }
        return Arrays.equals(elements, head, tail, other.elements, other.head, other.tail);
    }

    public void forEach(IntConsumer action) {
        for (int i = head; i < tail; i++) {
            action.accept(elements[i]);
        }
    }

    public int getInt(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size());
        }
        return elements[head + index];
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (int i = head; i < tail; i++) {
            hash = 31 * hash + elements[i];
        }
        return hash;
    }

    public boolean isEmpty() {
        return head == tail;
    }

    /**
     * Remove and answer the element at the head of the list
     */
    public int poll() {
        if (head == tail) {
            throw new NoSuchElementException("List is empty");
        }
        int value = elements[head++];
        if (head == tail) {
            head = tail = 0;
        }
        return value;
    }

    public int size() {
        return tail - head;
    }

    public int[] toArray() {
        return Arrays.copyOfRange(elements, head, tail);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void makeRoom() {
        int live = size();
        if (head > 0 && head >= elements.length / 2) {
            // at least half the array is consumed head, slide the live elements down
            System.arraycopy(elements, head, elements, 0, live);
        } else {
            var grown = new int[Math.max(MIN_CAPACITY, elements.length * 2)];
            System.arraycopy(elements, head, grown, 0, live);
            elements = grown;
        }
        head = 0;
        tail = live;
    }
}
