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

import com.hellblazer.cherenkov.image.shape.ShowerEllipse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Gating and shower plane construction shared by the stereo strategies.
 * <p>
 * Each usable ellipse defines a plane containing its telescope and the shower axis: the major axis of the ellipse,
 * deprojected through the telescope optics, is a great circle on the sky. The shower direction lies on every such plane
 * and the impact point on every plane's trace on the ground. Pairs of planes are weighted by the product of the
 * telescope weights and the sine of the angle between them, so nearly parallel planes fade out of the combination
 * continuously.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractStereoReconstructor implements StereoReconstructor {
    private static final Logger log = LoggerFactory.getLogger(AbstractStereoReconstructor.class);

    /**
     * Answer the first gating failure of the ellipses, or null if they may be combined
     */
    public static UnavailableReason gate(Map<Integer, ShowerEllipse> ellipses) {
        if (ellipses.size() < 2) {
            return UnavailableReason.INSUFFICIENT_TELESCOPES;
        }
        for (var ellipse : ellipses.values()) {
            if (ellipse.hasZeroWidth()) {
                return UnavailableReason.ZERO_WIDTH;
            }
        }
        for (var ellipse : ellipses.values()) {
            if (ellipse.hasUndefinedWidth()) {
                return UnavailableReason.UNDEFINED_WIDTH;
            }
        }
        return null;
    }

    static double pairWeight(List<ShowerPlane> planes) {
        double total = 0;
        for (int i = 0; i < planes.size(); i++) {
            for (int j = i + 1; j < planes.size(); j++) {
                var a = planes.get(i);
                var b = planes.get(j);
                total += a.weight() * b.weight() * a.sinAngle(b);
            }
        }
        return total;
    }

    static ShowerPlane plane(int telescopeId, ShowerEllipse ellipse, CameraFrame frame, Point3d position) {
        var centroid = frame.toSky(ellipse.x(), ellipse.y());
        var along = frame.toSky(ellipse.x() + ellipse.length() * Math.cos(ellipse.psi()),
                                ellipse.y() + ellipse.length() * Math.sin(ellipse.psi()));
        var normal = new Vector3d();
        normal.cross(centroid, along);
        double length = normal.length();
        if (!(length > 0)) {
            // no extent along the major axis, the plane is undetermined
            return new ShowerPlane(telescopeId, position, new Vector3d(), 0.0);
        }
        normal.scale(1.0 / length);
        return new ShowerPlane(telescopeId, position, normal, ellipse.intensity() * ellipse.length() / ellipse.width());
    }

    @Override
    public final StereoOutcome combine(Map<Integer, ShowerEllipse> ellipses, Map<Integer, TelescopePointing> pointings,
                                       ArrayGeometry array) {
        Objects.requireNonNull(ellipses, "ellipses cannot be null");
        Objects.requireNonNull(pointings, "pointings cannot be null");
        Objects.requireNonNull(array, "array cannot be null");

        var reason = gate(ellipses);
        if (reason != null) {
            log.debug("{}: stereo unavailable, {}", name(), reason.description());
            return StereoOutcome.unavailable(reason);
        }

        var planes = new ArrayList<ShowerPlane>(ellipses.size());
        var meanPointing = new Vector3d();
        for (var entry : new TreeMap<>(ellipses).entrySet()) {
            int id = entry.getKey();
            var pointing = pointings.get(id);
            if (pointing == null) {
                throw new IllegalArgumentException("No pointing for telescope " + id);
            }
            var telescope = array.telescope(id);
            var frame = new CameraFrame(pointing, telescope.focalLength());
            planes.add(plane(id, entry.getValue(), frame, telescope.position()));
            meanPointing.add(pointing.direction());
        }
        meanPointing.normalize();

        double total = pairWeight(planes);
        if (!(total > 0)) {
            log.debug("{}: stereo unavailable, total pair weight {}", name(), total);
            return StereoOutcome.unavailable(UnavailableReason.PARALLEL_GEOMETRY);
        }
        return reconstruct(planes, meanPointing, total);
    }

    @Override
    public String toString() {
        return name();
    }

    /**
     * Assemble the result, orienting the direction towards the sky the telescopes observe
     */
    StereoOutcome result(Vector3d direction, Vector3d meanPointing, double coreX, double coreY, double totalWeight,
                         List<ShowerPlane> planes) {
        var axis = new Vector3d(direction);
        axis.normalize();
        if (axis.dot(meanPointing) < 0) {
            axis.negate();
        }
        var distances = new TreeMap<Integer, Double>();
        var offset = new Vector3d();
        var cross = new Vector3d();
        for (var plane : planes) {
            var position = plane.position();
            offset.set(position.x - coreX, position.y - coreY, position.z);
            cross.cross(offset, axis);
            distances.put(plane.telescopeId(), cross.length());
        }
        var pointing = TelescopePointing.fromDirection(axis);
        return StereoOutcome.reconstructed(
        new StereoResult(pointing.altitude(), pointing.azimuth(), coreX, coreY, totalWeight, distances));
    }

    /**
     * @param planes       the shower planes in telescope id order
     * @param meanPointing the normalized mean pointing of the contributing telescopes
     * @param totalWeight  the sum of the pair weights, positive
     */
    abstract StereoOutcome reconstruct(List<ShowerPlane> planes, Vector3d meanPointing, double totalWeight);
}
