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

import java.util.Objects;

/**
 * The outcome of combining the telescope views of one event: either a reconstruction or the reason none was made.
 * Callers must never treat an unavailable outcome as a zero valued result.
 *
 * @author hal.hildebrand
 */
public sealed interface StereoOutcome {

    static StereoOutcome reconstructed(StereoResult result) {
        return new Reconstructed(result);
    }

    static StereoOutcome unavailable(UnavailableReason reason) {
        return new Unavailable(reason);
    }

    boolean isReconstructed();

    record Reconstructed(StereoResult result) implements StereoOutcome {
        public Reconstructed {
            Objects.requireNonNull(result, "result cannot be null");
        }

        @Override
        public boolean isReconstructed() {
            return true;
        }
    }

    record Unavailable(UnavailableReason reason) implements StereoOutcome {
        public Unavailable {
            Objects.requireNonNull(reason, "reason cannot be null");
        }

        @Override
        public boolean isReconstructed() {
            return false;
        }
    }
}
