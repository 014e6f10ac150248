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
package com.hellblazer.cherenkov.reco;

import javax.vecmath.Point3d;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The ground positions and optics of the telescopes of an array. Positions are in metres in the ground frame (x north,
 * y west, z up) relative to the array centre.
 *
 * @author hal.hildebrand
 */
public final class ArrayGeometry {

    /**
     * @param id          telescope id
     * @param position    ground position in metres
     * @param focalLength effective focal length in metres
     */
    public record Telescope(int id, Point3d position, double focalLength) {
        public Telescope {
            Objects.requireNonNull(position, "position cannot be null");
            if (!(focalLength > 0)) {
                throw new IllegalArgumentException("Telescope " + id + " focal length must be positive: " + focalLength);
            }
            position = new Point3d(position);
        }

        @Override
        public Point3d position() {
            return new Point3d(position);
        }
    }

    private final TreeMap<Integer, Telescope> telescopes = new TreeMap<>();

    public ArrayGeometry(Collection<Telescope> telescopes) {
        for (var telescope : telescopes) {
            if (this.telescopes.put(telescope.id(), telescope) != null) {
                throw new IllegalArgumentException("Duplicate telescope id: " + telescope.id());
            }
        }
    }

    public static ArrayGeometry of(Telescope... telescopes) {
        return new ArrayGeometry(List.of(telescopes));
    }

    public boolean contains(int id) {
        return telescopes.containsKey(id);
    }

    public double focalLength(int id) {
        return telescope(id).focalLength();
    }

    public Point3d position(int id) {
        return telescope(id).position();
    }

    public int size() {
        return telescopes.size();
    }

    public Telescope telescope(int id) {
        var telescope = telescopes.get(id);
        if (telescope == null) {
            throw new IllegalArgumentException("Unknown telescope: " + id);
        }
        return telescope;
    }

    public NavigableSet<Integer> telescopeIds() {
        return Collections.unmodifiableNavigableSet(telescopes.navigableKeySet());
    }

    @Override
    public String toString() {
        return "ArrayGeometry" + telescopes.values();
    }
}
