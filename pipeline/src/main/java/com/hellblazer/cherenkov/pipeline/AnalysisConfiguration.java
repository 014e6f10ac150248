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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hellblazer.cherenkov.image.CameraGeometry;
import com.hellblazer.cherenkov.image.CleaningConfiguration;
import com.hellblazer.cherenkov.image.ImageCleaner;
import com.hellblazer.cherenkov.image.TailcutsCleaner;
import com.hellblazer.cherenkov.image.TimeCoincidenceCleaner;
import com.hellblazer.cherenkov.reco.ArrayGeometry;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The settings of an analysis run, as read from JSON by {@link ConfigurationLoader}. Absent optional settings take
 * their defaults.
 *
 * @author hal.hildebrand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfiguration(@JsonProperty("telescopeTypes") Map<String, TypeSettings> telescopeTypes,
                                    @JsonProperty("telescopes") List<TelescopeSettings> telescopes,
                                    @JsonProperty("minPixels") Integer minPixels,
                                    @JsonProperty("maxIslands") Integer maxIslands,
                                    @JsonProperty("stereoStrategies") List<StereoStrategy> stereoStrategies,
                                    @JsonProperty("workerThreads") Integer workerThreads) {

    public static final String TIME_COINCIDENCE = "time-coincidence";
    public static final String TAILCUTS         = "tailcuts";

    public AnalysisConfiguration {
        telescopeTypes = telescopeTypes == null ? Map.of() : Map.copyOf(telescopeTypes);
        telescopes = telescopes == null ? List.of() : List.copyOf(telescopes);
        minPixels = minPixels == null ? EventProcessor.DEFAULT_MIN_PIXELS : minPixels;
        stereoStrategies = stereoStrategies == null ? List.of(StereoStrategy.values()) : List.copyOf(stereoStrategies);
        workerThreads = workerThreads == null ? Runtime.getRuntime().availableProcessors() : workerThreads;
    }

    public ArrayGeometry arrayGeometry() {
        var members = new ArrayList<ArrayGeometry.Telescope>(telescopes.size());
        for (var telescope : telescopes) {
            var type = type(telescope);
            members.add(new ArrayGeometry.Telescope(telescope.id(),
                                                    new Point3d(telescope.x(), telescope.y(), telescope.z()),
                                                    type.camera().focalLength()));
        }
        return new ArrayGeometry(members);
    }

    /**
     * Answer a processor builder with the telescopes, policies and strategies of this configuration. Telescopes of
     * one type share their camera, topology and cleaner.
     *
     * @throws IllegalArgumentException if the configuration is inconsistent
     */
    public EventProcessor.Builder processorBuilder() {
        validate();
        var builder = EventProcessor.builder().array(arrayGeometry()).minPixels(minPixels).workerThreads(
        workerThreads);
        if (maxIslands != null) {
            builder.maxIslands(maxIslands);
        }
        var types = new HashMap<String, TelescopeType>();
        var deadPixels = new TreeMap<Integer, Set<Integer>>();
        for (var telescope : telescopes) {
            var type = types.computeIfAbsent(telescope.type(), name -> type(telescope).toTelescopeType(name));
            builder.telescope(telescope.id(), type);
            if (telescope.deadPixels() != null && !telescope.deadPixels().isEmpty()) {
                deadPixels.put(telescope.id(), Set.copyOf(telescope.deadPixels()));
            }
        }
        if (!deadPixels.isEmpty()) {
            builder.badPixels(BadPixelCalculator.fixed(deadPixels));
        }
        for (var strategy : stereoStrategies) {
            builder.stereo(strategy);
        }
        return builder;
    }

    /**
     * Check the consistency of this configuration without deriving the pixel topologies of its cameras
     *
     * @throws IllegalArgumentException if the configuration is inconsistent
     */
    public void validate() {
        if (telescopes.isEmpty()) {
            throw new IllegalArgumentException("No telescopes configured");
        }
        if (minPixels < 1) {
            throw new IllegalArgumentException("minPixels must be at least 1: " + minPixels);
        }
        if (maxIslands != null && maxIslands < 1) {
            throw new IllegalArgumentException("maxIslands must be at least 1: " + maxIslands);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1: " + workerThreads);
        }
        arrayGeometry();
        var pixelCounts = new HashMap<String, Integer>();
        for (var telescope : telescopes) {
            int pixelCount = pixelCounts.computeIfAbsent(telescope.type(), name -> {
                var type = type(telescope);
                type.toCleaner();
                return type.camera().toGeometry().pixelCount();
            });
            if (telescope.deadPixels() == null) {
                continue;
            }
            for (int pixel : telescope.deadPixels()) {
                if (pixel < 0 || pixel >= pixelCount) {
                    throw new IllegalArgumentException(
                    "Telescope " + telescope.id() + " dead pixel " + pixel + " outside camera of " + pixelCount
                    + " pixels");
                }
            }
        }
    }

    private TypeSettings type(TelescopeSettings telescope) {
        var type = telescopeTypes.get(telescope.type());
        if (type == null) {
            throw new IllegalArgumentException(
            "Telescope " + telescope.id() + " has unknown type: " + telescope.type());
        }
        if (type.camera() == null) {
            throw new IllegalArgumentException("Telescope type " + telescope.type() + " has no camera");
        }
        return type;
    }

    /**
     * A hexagonal camera
     *
     * @param aberrationCorrection scale applied to the pixel positions, 1 when absent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CameraSettings(@JsonProperty("name") String name, @JsonProperty("rings") int rings,
                                 @JsonProperty("pixelSpacing") double pixelSpacing,
                                 @JsonProperty("focalLength") double focalLength,
                                 @JsonProperty("aberrationCorrection") Double aberrationCorrection) {

        public CameraGeometry toGeometry() {
            var camera = CameraGeometry.hexagonal(name, rings, pixelSpacing, focalLength);
            return aberrationCorrection == null ? camera : camera.scaled(aberrationCorrection);
        }
    }

    /**
     * The cleaning of a telescope type. {@code method} selects {@code time-coincidence} (the default) or
     * {@code tailcuts}; settings absent from the JSON take the defaults of the method.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CleaningSettings(@JsonProperty("method") String method,
                                   @JsonProperty("pictureThreshold") Double pictureThreshold,
                                   @JsonProperty("boundaryThreshold") Double boundaryThreshold,
                                   @JsonProperty("maxTimeOffset") Double maxTimeOffset,
                                   @JsonProperty("maxTimeDifference") Double maxTimeDifference,
                                   @JsonProperty("useTime") Boolean useTime,
                                   @JsonProperty("useSumTimeReference") Boolean useSumTimeReference,
                                   @JsonProperty("findHotPixels") Boolean findHotPixels,
                                   @JsonProperty("keepIsolatedPixels") Boolean keepIsolatedPixels,
                                   @JsonProperty("minNumberPictureNeighbors") Integer minNumberPictureNeighbors) {

        public ImageCleaner toCleaner() {
            var kind = method == null ? TIME_COINCIDENCE : method;
            switch (kind) {
                case TIME_COINCIDENCE -> {
                    var config = CleaningConfiguration.defaultConfig();
                    config = config.withThresholds(valueOr(pictureThreshold, config.pictureThreshold()),
                                                   valueOr(boundaryThreshold, config.boundaryThreshold()));
                    config = config.withTimeWindows(valueOr(maxTimeOffset, config.maxTimeOffset()),
                                                    valueOr(maxTimeDifference, config.maxTimeDifference()));
                    config = config.withUseTime(valueOr(useTime, config.useTime()))
                                   .withUseSumTimeReference(valueOr(useSumTimeReference, config.useSumTimeReference()))
                                   .withFindHotPixels(valueOr(findHotPixels, config.findHotPixels()));
                    return new TimeCoincidenceCleaner(config);
                }
                case TAILCUTS -> {
                    var defaults = TailcutsCleaner.Configuration.defaultConfig();
                    return new TailcutsCleaner(new TailcutsCleaner.Configuration(
                    valueOr(pictureThreshold, defaults.pictureThreshold()),
                    valueOr(boundaryThreshold, defaults.boundaryThreshold()),
                    valueOr(keepIsolatedPixels, defaults.keepIsolatedPixels()),
                    valueOr(minNumberPictureNeighbors, defaults.minNumberPictureNeighbors())));
                }
                default -> throw new IllegalArgumentException("Unknown cleaning method: " + kind);
            }
        }

        private static <T> T valueOr(T value, T fallback) {
            return value == null ? fallback : value;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TelescopeSettings(@JsonProperty("id") int id, @JsonProperty("type") String type,
                                    @JsonProperty("x") double x, @JsonProperty("y") double y,
                                    @JsonProperty("z") double z,
                                    @JsonProperty("deadPixels") List<Integer> deadPixels) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypeSettings(@JsonProperty("camera") CameraSettings camera,
                               @JsonProperty("cleaning") CleaningSettings cleaning) {

        public ImageCleaner toCleaner() {
            return cleaning == null ? new TimeCoincidenceCleaner(CleaningConfiguration.defaultConfig())
                                    : cleaning.toCleaner();
        }

        public TelescopeType toTelescopeType(String name) {
            if (camera == null) {
                throw new IllegalArgumentException("Telescope type " + name + " has no camera");
            }
            return TelescopeType.of(name, camera.toGeometry(), toCleaner());
        }
    }
}
