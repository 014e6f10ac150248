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
package com.hellblazer.cherenkov.pipeline;

import com.hellblazer.cherenkov.reco.HillasIntersectionReconstructor;
import com.hellblazer.cherenkov.reco.LeastSquaresReconstructor;
import com.hellblazer.cherenkov.reco.StereoReconstructor;

import java.util.function.Supplier;

/**
 * The stereo reconstruction strategies a run may combine each event with.
 *
 * @author hal.hildebrand
 */
public enum StereoStrategy {
    HILLAS_INTERSECTION(HillasIntersectionReconstructor::new),
    LEAST_SQUARES(LeastSquaresReconstructor::new);

    private final Supplier<StereoReconstructor> factory;

    StereoStrategy(Supplier<StereoReconstructor> factory) {
        this.factory = factory;
    }

    public StereoReconstructor create() {
        return factory.get();
    }
}
