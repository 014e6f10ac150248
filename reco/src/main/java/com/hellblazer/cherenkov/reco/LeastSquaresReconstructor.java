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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;

import javax.vecmath.Vector3d;
import java.util.List;

/**
 * Geometric consistency fit over all shower planes at once. The direction minimizes the weighted squared projections
 * onto the plane normals, the eigenvector of the smallest eigenvalue of sum(w n n^T); the impact point minimizes the
 * weighted squared residuals of the ground traces.
 *
 * @author hal.hildebrand
 */
public class LeastSquaresReconstructor extends AbstractStereoReconstructor {

    public static final String NAME = "least-squares";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    StereoOutcome reconstruct(List<ShowerPlane> planes, Vector3d meanPointing, double totalWeight) {
        var scatter = new Array2DRowRealMatrix(3, 3);
        var normal = new double[3];
        for (var plane : planes) {
            plane.normal().get(normal);
            for (int r = 0; r < 3; r++) {
                for (int c = r; c < 3; c++) {
                    double term = plane.weight() * normal[r] * normal[c];
                    scatter.addToEntry(r, c, term);
                    if (r != c) {
                        scatter.addToEntry(c, r, term);
                    }
                }
            }
        }
        var eigen = new EigenDecomposition(scatter);
        var values = eigen.getRealEigenvalues();
        int smallest = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[smallest]) {
                smallest = i;
            }
        }
        var vector = eigen.getEigenvector(smallest);
        var direction = new Vector3d(vector.getEntry(0), vector.getEntry(1), vector.getEntry(2));

        var traces = new Array2DRowRealMatrix(2, 2);
        var offsets = new ArrayRealVector(2);
        for (var plane : planes) {
            double w = plane.weight();
            double nx = plane.normal().x;
            double ny = plane.normal().y;
            double offset = plane.offset();
            traces.addToEntry(0, 0, w * nx * nx);
            traces.addToEntry(0, 1, w * nx * ny);
            traces.addToEntry(1, 1, w * ny * ny);
            offsets.addToEntry(0, w * nx * offset);
            offsets.addToEntry(1, w * ny * offset);
        }
        traces.setEntry(1, 0, traces.getEntry(0, 1));
        var solver = new LUDecomposition(traces).getSolver();
        if (!solver.isNonSingular()) {
            return StereoOutcome.unavailable(UnavailableReason.PARALLEL_GEOMETRY);
        }
        var core = solver.solve(offsets);
        return result(direction, meanPointing, core.getEntry(0), core.getEntry(1), totalWeight, planes);
    }
}
