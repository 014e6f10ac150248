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
package com.hellblazer.cherenkov.image;

import com.hellblazer.cherenkov.common.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Two threshold image cleaning with time coincidence.
 * <p>
 * The cleaning proceeds in stages:
 * <ol>
 *   <li>Unsuitable pixels, and hot pixels when configured, are excluded from every later stage</li>
 *   <li>Pixels at or above the picture threshold are core candidates</li>
 *   <li>With time cleaning, a reference time is computed over the core candidates and candidates deviating from it by
 *   more than the maximum time offset are rejected; repeated until stable, at most
 *   {@link CleaningConfiguration#maxTimeReferencePasses()} times</li>
 *   <li>The accepted core pixels seed the mask</li>
 *   <li>Boundary pixels at or above the boundary threshold that neighbor an accepted pixel, and with time cleaning lie
 *   within the maximum time difference of that neighbor, are added. Accepted boundary pixels recruit further boundary
 *   pixels until the frontier is exhausted</li>
 * </ol>
 * Without time cleaning the result is the plain tail cut with flood fill boundary growth, and raising either threshold
 * never selects more pixels. With time cleaning this holds for the boundary threshold only: raising the picture
 * threshold removes candidates from the reference time, which can keep a core pixel that the lower threshold rejected.
 *
 * @author hal.hildebrand
 */
public class TimeCoincidenceCleaner implements ImageCleaner {
    private static final Logger log = LoggerFactory.getLogger(TimeCoincidenceCleaner.class);

    private final CleaningConfiguration configuration;
    private final HotPixelFinder        hotPixelFinder;

    public TimeCoincidenceCleaner(CleaningConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.hotPixelFinder = new HotPixelFinder(configuration.hotPixelSigma(), configuration.hotPixelMinSpread());
    }

    @Override
    public CleaningMask clean(Image image, PixelTopology topology, boolean[] unsuitable) {
        var excluded = ImageCleaner.exclusions(image, topology, unsuitable);
        if (configuration.findHotPixels()) {
            var hot = hotPixelFinder.find(image, topology, excluded);
            for (int i = 0; i < hot.length; i++) {
                excluded[i] |= hot[i];
            }
        }

        var core = coreCandidates(image, excluded);
        if (configuration.useTime()) {
            rejectTimeOutliers(image, core);
        }
        return CleaningMask.adopt(expand(image, topology, excluded, core));
    }

    public CleaningConfiguration configuration() {
        return configuration;
    }

    /**
     * Grow the seed by boundary expansion alone. A mask produced by {@link #clean} is a fixed point of this operation
     * when the same pixels are unsuitable and no hot pixels were excluded.
     */
    public CleaningMask grow(Image image, PixelTopology topology, boolean[] unsuitable, CleaningMask seed) {
        var excluded = ImageCleaner.exclusions(image, topology, unsuitable);
        if (seed.size() != excluded.length) {
            throw new IllegalArgumentException("Seed has " + seed.size() + " pixels, expected " + excluded.length);
        }
        var selected = seed.toArray();
        for (int i = 0; i < selected.length; i++) {
            selected[i] &= !excluded[i];
        }
        return CleaningMask.adopt(expand(image, topology, excluded, selected));
    }

    @Override
    public String toString() {
        return "TimeCoincidenceCleaner[" + configuration + "]";
    }

    private boolean[] coreCandidates(Image image, boolean[] excluded) {
        var core = new boolean[excluded.length];
        for (int i = 0; i < core.length; i++) {
            core[i] = !excluded[i] && ImageCleaner.passes(image.charge(i), configuration.pictureThreshold());
        }
        return core;
    }

    /**
     * Breadth first boundary growth from every selected pixel. Consumes and answers the selection array.
     */
    private boolean[] expand(Image image, PixelTopology topology, boolean[] excluded, boolean[] selected) {
        var frontier = new IntArrayList();
        for (int i = 0; i < selected.length; i++) {
            if (selected[i]) {
                frontier.addInt(i);
            }
        }
        double boundary = configuration.boundaryThreshold();
        double window = configuration.maxTimeDifference();
        boolean useTime = configuration.useTime();
        while (!frontier.isEmpty()) {
            int pixel = frontier.poll();
            double time = image.time(pixel);
            for (int k = 0; k < topology.degree(pixel); k++) {
                int next = topology.neighbor(pixel, k);
                if (selected[next] || excluded[next] || !ImageCleaner.passes(image.charge(next), boundary)) {
                    continue;
                }
                if (useTime && !(Math.abs(image.time(next) - time) <= window)) {
                    // may still join through another accepted neighbor
                    continue;
                }
                selected[next] = true;
                frontier.addInt(next);
            }
        }
        return selected;
    }

    /**
     * Answer the reference time of the core pixels with finite times, or NaN when there are none
     */
    private double referenceTime(Image image, boolean[] core) {
        boolean weighted = configuration.useSumTimeReference();
        double sum = 0;
        double norm = 0;
        for (int i = 0; i < core.length; i++) {
            if (!core[i] || !Double.isFinite(image.time(i))) {
                continue;
            }
            double w = weighted ? image.charge(i) : 1.0;
            sum += w * image.time(i);
            norm += w;
        }
        return norm > 0 ? sum / norm : Double.NaN;
    }

    private void rejectTimeOutliers(Image image, boolean[] core) {
        double maxOffset = configuration.maxTimeOffset();
        for (int pass = 0; pass < configuration.maxTimeReferencePasses(); pass++) {
            double reference = referenceTime(image, core);
            boolean changed = false;
            for (int i = 0; i < core.length; i++) {
                if (core[i] && !(Math.abs(image.time(i) - reference) <= maxOffset)) {
                    core[i] = false;
                    changed = true;
                }
            }
            if (!changed) {
                return;
            }
            if (log.isTraceEnabled()) {
                log.trace("Time reference pass {}: rejected core outliers of reference {}", pass, reference);
            }
        }
        log.debug("Core time rejection did not settle within {} passes", configuration.maxTimeReferencePasses());
    }
}
