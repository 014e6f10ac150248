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

import com.hellblazer.cherenkov.image.Image;
import com.hellblazer.cherenkov.reco.TelescopePointing;

import java.util.Objects;

/**
 * The calibrated image of one triggered telescope and where it was pointing.
 *
 * @author hal.hildebrand
 */
public record TelescopeImage(int telescopeId, Image image, TelescopePointing pointing) {
    public TelescopeImage {
        Objects.requireNonNull(image, "image cannot be null");
        Objects.requireNonNull(pointing, "pointing cannot be null");
    }
}
