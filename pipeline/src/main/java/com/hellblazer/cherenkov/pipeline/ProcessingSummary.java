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

/**
 * Counters of a processing run.
 *
 * @param events            events processed, duplicates excluded
 * @param duplicateEvents   events dropped for repeating the previous event id
 * @param telescopeImages   telescope images considered
 * @param telescopeRecords  telescope images parameterized
 * @param telescopeSkips    telescope images skipped
 * @param stereoRecords     stereo reconstructions emitted, over all strategies
 * @param stereoSkips       stereo reconstructions declined, over all strategies
 * @author hal.hildebrand
 */
public record ProcessingSummary(long events, long duplicateEvents, long telescopeImages, long telescopeRecords,
                                long telescopeSkips, long stereoRecords, long stereoSkips) {

    public static final ProcessingSummary EMPTY = new ProcessingSummary(0, 0, 0, 0, 0, 0, 0);

    public ProcessingSummary plus(ProcessingSummary other) {
        return new ProcessingSummary(events + other.events, duplicateEvents + other.duplicateEvents,
                                     telescopeImages + other.telescopeImages,
                                     telescopeRecords + other.telescopeRecords,
                                     telescopeSkips + other.telescopeSkips, stereoRecords + other.stereoRecords,
                                     stereoSkips + other.stereoSkips);
    }
}
