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

import javax.vecmath.Vector3d;
import java.util.List;

/**
 * Pairwise intersection of shower planes. Each pair of planes intersects in a candidate shower direction and their
 * ground traces intersect in a candidate impact point; the candidates are averaged with normalized pair weights.
 * Impact points are weighted by the squared sine between the ground traces, so a pair's contribution vanishes
 * continuously as its traces turn through parallel.
 *
 * @author hal.hildebrand
 */
public class HillasIntersectionReconstructor extends AbstractStereoReconstructor {

    public static final String NAME = "hillas-intersection";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    StereoOutcome reconstruct(List<ShowerPlane> planes, Vector3d meanPointing, double totalWeight) {
        var direction = new Vector3d();
        var candidate = new Vector3d();
        double coreX = 0;
        double coreY = 0;
        double coreWeight = 0;
        for (int i = 0; i < planes.size(); i++) {
            var a = planes.get(i);
            for (int j = i + 1; j < planes.size(); j++) {
                var b = planes.get(j);
                candidate.cross(a.normal(), b.normal());
                double sin = candidate.length();
                double weight = a.weight() * b.weight() * sin;
                if (!(weight > 0)) {
                    continue;
                }
                candidate.scale(1.0 / sin);
                if (candidate.dot(meanPointing) < 0) {
                    candidate.negate();
                }
                direction.scaleAdd(weight, candidate, direction);

                // ground traces: a.n . (x, y, 0) = a.offset, b likewise
                double ax = a.normal().x;
                double ay = a.normal().y;
                double bx = b.normal().x;
                double by = b.normal().y;
                double det = ax * by - ay * bx;
                double norms = Math.hypot(ax, ay) * Math.hypot(bx, by);
                if (!(norms > 0) || det == 0) {
                    continue;
                }
                double sinGround = det / norms;
                double groundWeight = a.weight() * b.weight() * sinGround * sinGround;
                // groundWeight / det stays finite as det goes to zero
                double scale = a.weight() * b.weight() * sinGround / norms;
                coreX += scale * (a.offset() * by - ay * b.offset());
                coreY += scale * (ax * b.offset() - bx * a.offset());
                coreWeight += groundWeight;
            }
        }
        if (!(coreWeight > 0)) {
            return StereoOutcome.unavailable(UnavailableReason.PARALLEL_GEOMETRY);
        }
        return result(direction, meanPointing, coreX / coreWeight, coreY / coreWeight, totalWeight, planes);
    }
}
