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
import javax.vecmath.Vector3d;

/**
 * The plane containing a telescope and the shower axis it imaged.
 *
 * @param telescopeId the telescope
 * @param position    the telescope ground position
 * @param normal      unit normal of the plane
 * @param weight      the telescope weight, intensity * length / width
 * @author hal.hildebrand
 */
record ShowerPlane(int telescopeId, Point3d position, Vector3d normal, double weight) {

    /**
     * @return |sin| of the angle between the two planes
     */
    double sinAngle(ShowerPlane other) {
        var cross = new Vector3d();
        cross.cross(normal, other.normal);
        return cross.length();
    }

    /**
     * @return the right hand side of n . (x, y, 0) = n . position, the plane's trace on the ground
     */
    double offset() {
        return normal.x * position.x + normal.y * position.y + normal.z * position.z;
    }
}
