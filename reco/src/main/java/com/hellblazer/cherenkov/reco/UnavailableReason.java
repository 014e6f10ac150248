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

/**
 * Why a stereo reconstruction was declined. The first three are checked in declaration order before any geometry is
 * computed.
 *
 * @author hal.hildebrand
 */
public enum UnavailableReason {
    INSUFFICIENT_TELESCOPES("fewer than two telescopes with a usable ellipse"),
    ZERO_WIDTH("degenerate ellipse (zero width)"),
    UNDEFINED_WIDTH("degenerate ellipse (undefined width)"),
    PARALLEL_GEOMETRY("shower planes are parallel");

    private final String description;

    UnavailableReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
