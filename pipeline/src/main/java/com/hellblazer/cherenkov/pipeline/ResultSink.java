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

import java.io.Closeable;
import java.io.IOException;

/**
 * Receives the output of event processing. Records of one event are delivered together, from the thread driving the
 * processor, in telescope id order followed by the stereo records.
 *
 * @author hal.hildebrand
 */
public interface ResultSink extends Closeable {

    @Override
    default void close() throws IOException {
    }

    void skipped(SkipRecord record);

    void stereo(StereoRecord record);

    void telescope(TelescopeRecord record);
}
