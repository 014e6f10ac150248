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

import java.util.Arrays;
import java.util.Objects;

/**
 * The pixels an {@link ImageCleaner} selected as shower signal. The mask is a selection only; {@link #applyTo(Image)}
 * produces the cleaned image with every other pixel zeroed.
 *
 * @author hal.hildebrand
 */
public final class CleaningMask {

    private final boolean[] selected;
    private final int       count;

    private CleaningMask(boolean[] selected) {
        this.selected = selected;
        int c = 0;
        for (var s : selected) {
            if (s) {
                c++;
            }
        }
        count = c;
    }

    public static CleaningMask empty(int pixelCount) {
        return new CleaningMask(new boolean[pixelCount]);
    }

    public static CleaningMask of(boolean[] selected) {
        Objects.requireNonNull(selected, "selected cannot be null");
        return new CleaningMask(selected.clone());
    }

    /**
     * Wrap the array without copying; the caller relinquishes it
     */
    static CleaningMask adopt(boolean[] selected) {
        return new CleaningMask(selected);
    }

    /**
     * Answer a copy of the image with the charge and time of every unselected pixel set to zero
     */
    public Image applyTo(Image image) {
        if (image.size() != selected.length) {
            throw new IllegalArgumentException(
            "Image has " + image.size() + " pixels, mask has " + selected.length);
        }
        var charges = image.charges();
        var times = image.times();
        for (int i = 0; i < selected.length; i++) {
            if (!selected[i]) {
                charges[i] = 0;
                times[i] = 0;
            }
        }
        return new Image(charges, times);
    }

    public int count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean isSelected(int pixel) {
        return selected[pixel];
    }

    /**
     * Indices of the selected pixels, ascending
     */
    public int[] selectedPixels() {
        var result = new int[count];
        int k = 0;
        for (int i = 0; i < selected.length; i++) {
            if (selected[i]) {
                result[k++] = i;
            }
        }
        return result;
    }

    public int size() {
        return selected.length;
    }

    public boolean[] toArray() {
        return selected.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CleaningMask that && Arrays.equals(selected, that.selected);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(selected);
    }

    @Override
    public String toString() {
        return "CleaningMask" + Arrays.toString(selectedPixels());
    }
}
