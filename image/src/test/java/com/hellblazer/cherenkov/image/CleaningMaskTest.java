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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CleaningMaskTest {

    @Test
    public void testApplyZeroesUnselectedPixels() {
        var image = new Image(new double[] { 1, 2, 3 }, new double[] { 4, 5, 6 });
        var mask = CleaningMask.of(new boolean[] { true, false, true });
        var cleaned = mask.applyTo(image);
        assertArrayEquals(new double[] { 1, 0, 3 }, cleaned.charges());
        assertArrayEquals(new double[] { 4, 0, 6 }, cleaned.times());
        assertArrayEquals(new double[] { 1, 2, 3 }, image.charges(), "source image untouched");
        assertEquals(2, mask.count());
        assertArrayEquals(new int[] { 0, 2 }, mask.selectedPixels());
    }

    @Test
    public void testMaskOwnsItsSelection() {
        var selected = new boolean[] { true, false };
        var mask = CleaningMask.of(selected);
        selected[1] = true;
        assertFalse(mask.isSelected(1));
        mask.toArray()[1] = true;
        assertFalse(mask.isSelected(1));
    }

    @Test
    public void testEmpty() {
        var mask = CleaningMask.empty(4);
        assertTrue(mask.isEmpty());
        assertEquals(4, mask.size());
        assertThrows(IllegalArgumentException.class, () -> mask.applyTo(Image.ofCharges(1, 2)));
    }
}
