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
package com.hellblazer.cherenkov.image.shape;

import com.hellblazer.cherenkov.image.CameraGeometry;
import com.hellblazer.cherenkov.image.CleaningMask;
import com.hellblazer.cherenkov.image.Image;
import com.hellblazer.cherenkov.image.PixelTopology;
import org.apache.commons.math3.util.FastMath;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default shape parameterization: charge weighted second moments of the selected pixels, camera edge leakage, and the
 * arrival time gradient along the major axis.
 *
 * @author hal.hildebrand
 */
public class HillasParameterizer implements ShapeParameterizer {

    private record Borders(boolean[] width1, boolean[] width2) {
    }

    // topologies are shared, long lived instances; identity keyed
    private final Map<PixelTopology, Borders> borders = new ConcurrentHashMap<>();

    static HillasParameters hillas(CameraGeometry geometry, Image raw, CleaningMask mask)
    throws ShapeParameterizationException {
        double size = 0;
        double sumX = 0;
        double sumY = 0;
        for (int i = 0; i < mask.size(); i++) {
            double q = raw.charge(i);
            if (mask.isSelected(i) && Double.isFinite(q)) {
                size += q;
                sumX += q * geometry.pixelX(i);
                sumY += q * geometry.pixelY(i);
            }
        }
        if (!(size > 0)) {
            throw new ShapeParameterizationException("Cleaned image has no intensity: " + size);
        }
        double cx = sumX / size;
        double cy = sumY / size;

        double sxx = 0;
        double syy = 0;
        double sxy = 0;
        for (int i = 0; i < mask.size(); i++) {
            double q = raw.charge(i);
            if (mask.isSelected(i) && Double.isFinite(q)) {
                double dx = geometry.pixelX(i) - cx;
                double dy = geometry.pixelY(i) - cy;
                sxx += q * dx * dx;
                syy += q * dy * dy;
                sxy += q * dx * dy;
            }
        }
        sxx /= size;
        syy /= size;
        sxy /= size;

        // eigenvalues of the 2x2 covariance
        double halfTrace = (sxx + syy) / 2.0;
        double root = FastMath.hypot((sxx - syy) / 2.0, sxy);
        double major = halfTrace + root;
        double minor = Math.max(halfTrace - root, 0.0);
        double psi = 0.5 * FastMath.atan2(2.0 * sxy, sxx - syy);

        return new HillasParameters(size, cx, cy, FastMath.hypot(cx, cy), FastMath.atan2(cy, cx),
                                    FastMath.sqrt(major), FastMath.sqrt(minor), psi);
    }

    static TimingParameters timing(CameraGeometry geometry, Image raw, CleaningMask mask, HillasParameters hillas) {
        double cos = FastMath.cos(hillas.psi());
        double sin = FastMath.sin(hillas.psi());
        double w = 0;
        double wl = 0;
        double wt = 0;
        double wll = 0;
        double wlt = 0;
        int points = 0;
        for (int i = 0; i < mask.size(); i++) {
            double q = raw.charge(i);
            double t = raw.time(i);
            if (!mask.isSelected(i) || !(q > 0) || !Double.isFinite(t)) {
                continue;
            }
            double l = (geometry.pixelX(i) - hillas.x()) * cos + (geometry.pixelY(i) - hillas.y()) * sin;
            w += q;
            wl += q * l;
            wt += q * t;
            wll += q * l * l;
            wlt += q * l * t;
            points++;
        }
        double denominator = w * wll - wl * wl;
        if (points < 2 || !(denominator > 0)) {
            return TimingParameters.UNDEFINED;
        }
        double slope = (w * wlt - wl * wt) / denominator;
        double intercept = (wt - slope * wl) / w;
        return new TimingParameters(slope, intercept);
    }

    @Override
    public ImageParameters parameterize(CameraGeometry geometry, PixelTopology topology, Image raw,
                                        CleaningMask mask) throws ShapeParameterizationException {
        int n = geometry.pixelCount();
        if (raw.size() != n || mask.size() != n || topology.pixelCount() != n) {
            throw new IllegalArgumentException(
            "Pixel counts disagree: camera " + n + ", topology " + topology.pixelCount() + ", image " + raw.size()
            + ", mask " + mask.size());
        }
        if (mask.isEmpty()) {
            throw new ShapeParameterizationException("No pixels survived cleaning");
        }
        var hillas = hillas(geometry, raw, mask);
        return new ImageParameters(hillas, leakage(topology, raw, mask, hillas.intensity()),
                                   timing(geometry, raw, mask, hillas));
    }

    private LeakageParameters leakage(PixelTopology topology, Image raw, CleaningMask mask, double intensity) {
        var edge = borders.computeIfAbsent(topology, t -> new Borders(t.borderMask(1), t.borderMask(2)));
        int pixels1 = 0;
        int pixels2 = 0;
        double intensity1 = 0;
        double intensity2 = 0;
        for (int i = 0; i < mask.size(); i++) {
            double q = raw.charge(i);
            if (!mask.isSelected(i) || !Double.isFinite(q)) {
                continue;
            }
            if (edge.width1()[i]) {
                pixels1++;
                intensity1 += q;
            }
            if (edge.width2()[i]) {
                pixels2++;
                intensity2 += q;
            }
        }
        double total = topology.pixelCount();
        return new LeakageParameters(pixels1 / total, pixels2 / total, intensity1 / intensity,
                                     intensity2 / intensity);
    }
}
