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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A unit of work that produced no output, with the reason. Stereo skips carry telescope id {@link #STEREO}.
 *
 * @author hal.hildebrand
 */
public record SkipRecord(long observationId, long eventId, int telescopeId, SkipReason reason, String detail) {

    public static final int STEREO = -1;

    public SkipRecord {
        Objects.requireNonNull(reason, "reason cannot be null");
        Objects.requireNonNull(detail, "detail cannot be null");
    }

    @JsonIgnore
    public boolean isStereo() {
        return telescopeId == STEREO;
    }
}
