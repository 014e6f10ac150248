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

/**
 * Settings of the {@link TimeCoincidenceCleaner}.
 *
 * <p>Charges are in photoelectrons, times in the units of the image arrival times (ns). Thread-safe and immutable.
 *
 * @param pictureThreshold      minimum charge of a core pixel
 * @param boundaryThreshold     minimum charge of a boundary pixel, at most the picture threshold
 * @param maxTimeOffset         maximum deviation of a core pixel time from the image reference time
 * @param maxTimeDifference     maximum time difference between a boundary pixel and an accepted neighbor
 * @param useTime               whether the time coincidence rules apply at all
 * @param useSumTimeReference   reference time is the charge weighted mean (true) or the plain mean (false) of the
 *                              core pixel times
 * @param findHotPixels         exclude pixels whose charge is inconsistent with their neighbors (real data only)
 * @param hotPixelSigma         number of neighbor standard deviations above the neighbor mean that makes a pixel hot
 * @param hotPixelMinSpread     floor of the neighbor standard deviation in the hot pixel test
 * @param maxTimeReferencePasses bound on the reference time / outlier rejection iterations
 * @author hal.hildebrand
 */
public record CleaningConfiguration(double pictureThreshold, double boundaryThreshold, double maxTimeOffset,
                                    double maxTimeDifference, boolean useTime, boolean useSumTimeReference,
                                    boolean findHotPixels, double hotPixelSigma, double hotPixelMinSpread,
                                    int maxTimeReferencePasses) {

    /** Photoelectrons */
    public static final double DEFAULT_PICTURE_THRESHOLD  = 6.0;
    public static final double DEFAULT_BOUNDARY_THRESHOLD = 3.5;

    /** Time windows in ns, scaled by the 1.64 sampling conversion of the camera readout */
    public static final double DEFAULT_MAX_TIME_OFFSET     = 4.5 * 1.64;
    public static final double DEFAULT_MAX_TIME_DIFFERENCE = 1.5 * 1.64;

    public static final double DEFAULT_HOT_PIXEL_SIGMA      = 5.0;
    public static final double DEFAULT_HOT_PIXEL_MIN_SPREAD = 1.0;

    public static final int DEFAULT_MAX_TIME_REFERENCE_PASSES = 5;

    public CleaningConfiguration {
        if (!(pictureThreshold >= 0)) {
            throw new IllegalArgumentException("pictureThreshold must be non-negative: " + pictureThreshold);
        }
        if (!(boundaryThreshold >= 0)) {
            throw new IllegalArgumentException("boundaryThreshold must be non-negative: " + boundaryThreshold);
        }
        if (boundaryThreshold > pictureThreshold) {
            throw new IllegalArgumentException(
            "boundaryThreshold " + boundaryThreshold + " exceeds pictureThreshold " + pictureThreshold);
        }
        if (!(maxTimeOffset > 0)) {
            throw new IllegalArgumentException("maxTimeOffset must be positive: " + maxTimeOffset);
        }
        if (!(maxTimeDifference > 0)) {
            throw new IllegalArgumentException("maxTimeDifference must be positive: " + maxTimeDifference);
        }
        if (!(hotPixelSigma > 0)) {
            throw new IllegalArgumentException("hotPixelSigma must be positive: " + hotPixelSigma);
        }
        if (!(hotPixelMinSpread >= 0)) {
            throw new IllegalArgumentException("hotPixelMinSpread must be non-negative: " + hotPixelMinSpread);
        }
        if (maxTimeReferencePasses < 1) {
            throw new IllegalArgumentException("maxTimeReferencePasses must be at least 1: " + maxTimeReferencePasses);
        }
    }

    /**
     * The standard settings for simulated data: time cleaning with the charge weighted reference, no hot pixel search
     */
    public static CleaningConfiguration defaultConfig() {
        return new CleaningConfiguration(DEFAULT_PICTURE_THRESHOLD, DEFAULT_BOUNDARY_THRESHOLD,
                                         DEFAULT_MAX_TIME_OFFSET, DEFAULT_MAX_TIME_DIFFERENCE, true, true, false,
                                         DEFAULT_HOT_PIXEL_SIGMA, DEFAULT_HOT_PIXEL_MIN_SPREAD,
                                         DEFAULT_MAX_TIME_REFERENCE_PASSES);
    }

    /**
     * The standard settings for real data, which additionally search for hot pixels
     */
    public static CleaningConfiguration realDataConfig() {
        return defaultConfig().withFindHotPixels(true);
    }

    public CleaningConfiguration withThresholds(double picture, double boundary) {
        return new CleaningConfiguration(picture, boundary, maxTimeOffset, maxTimeDifference, useTime,
                                         useSumTimeReference, findHotPixels, hotPixelSigma, hotPixelMinSpread,
                                         maxTimeReferencePasses);
    }

    public CleaningConfiguration withTimeWindows(double offset, double difference) {
        return new CleaningConfiguration(pictureThreshold, boundaryThreshold, offset, difference, useTime,
                                         useSumTimeReference, findHotPixels, hotPixelSigma, hotPixelMinSpread,
                                         maxTimeReferencePasses);
    }

    public CleaningConfiguration withUseTime(boolean newUseTime) {
        return new CleaningConfiguration(pictureThreshold, boundaryThreshold, maxTimeOffset, maxTimeDifference,
                                         newUseTime, useSumTimeReference, findHotPixels, hotPixelSigma,
                                         hotPixelMinSpread, maxTimeReferencePasses);
    }

    public CleaningConfiguration withUseSumTimeReference(boolean newUseSum) {
        return new CleaningConfiguration(pictureThreshold, boundaryThreshold, maxTimeOffset, maxTimeDifference,
                                         useTime, newUseSum, findHotPixels, hotPixelSigma, hotPixelMinSpread,
                                         maxTimeReferencePasses);
    }

    public CleaningConfiguration withFindHotPixels(boolean newFindHotPixels) {
        return new CleaningConfiguration(pictureThreshold, boundaryThreshold, maxTimeOffset, maxTimeDifference,
                                         useTime, useSumTimeReference, newFindHotPixels, hotPixelSigma,
                                         hotPixelMinSpread, maxTimeReferencePasses);
    }

    public CleaningConfiguration withHotPixelPolicy(double sigma, double minSpread) {
        return new CleaningConfiguration(pictureThreshold, boundaryThreshold, maxTimeOffset, maxTimeDifference,
                                         useTime, useSumTimeReference, findHotPixels, sigma, minSpread,
                                         maxTimeReferencePasses);
    }

    public CleaningConfiguration withMaxTimeReferencePasses(int passes) {
        return new CleaningConfiguration(pictureThreshold, boundaryThreshold, maxTimeOffset, maxTimeDifference,
                                         useTime, useSumTimeReference, findHotPixels, hotPixelSigma,
                                         hotPixelMinSpread, passes);
    }
}
