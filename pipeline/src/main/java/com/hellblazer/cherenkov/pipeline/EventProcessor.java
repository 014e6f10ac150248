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

import com.hellblazer.cherenkov.image.IslandAnalyzer;
import com.hellblazer.cherenkov.image.shape.HillasParameterizer;
import com.hellblazer.cherenkov.image.shape.ImageParameters;
import com.hellblazer.cherenkov.image.shape.ShapeParameterizationException;
import com.hellblazer.cherenkov.image.shape.ShapeParameterizer;
import com.hellblazer.cherenkov.image.shape.ShowerEllipse;
import com.hellblazer.cherenkov.reco.ArrayGeometry;
import com.hellblazer.cherenkov.reco.StereoOutcome;
import com.hellblazer.cherenkov.reco.StereoReconstructor;
import com.hellblazer.cherenkov.reco.TelescopePointing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the analysis of array events.
 * <p>
 * Per event, the images of the configured telescopes are cleaned, their islands counted and their shapes parameterized
 * in parallel on the worker pool. Once every telescope of the event has finished, the usable ellipses are combined by
 * each configured stereo strategy. Output reaches the sink from the calling thread only, in telescope id order followed
 * by the stereo records, so sinks need no synchronization.
 * <p>
 * Nothing about a single event aborts a run: telescopes and stereo combinations that cannot be computed are reported
 * as {@link SkipRecord}s and processing continues.
 *
 * @author hal.hildebrand
 */
public class EventProcessor implements AutoCloseable {
    public static final  int    DEFAULT_MIN_PIXELS = 5;
    private static final Logger log                = LoggerFactory.getLogger(EventProcessor.class);

    private final Map<Integer, TelescopeType> telescopes;
    private final ArrayGeometry               array;
    private final ShapeParameterizer          parameterizer;
    private final BadPixelCalculator          badPixels;
    private final List<StereoReconstructor>   reconstructors;
    private final int                         minPixels;
    private final int                         maxIslands;
    private final ExecutorService             executor;
    private final boolean                     ownsExecutor;

    private EventProcessor(Builder builder) {
        this.telescopes = Collections.unmodifiableMap(new TreeMap<>(builder.telescopes));
        this.array = builder.array;
        this.parameterizer = builder.parameterizer;
        this.badPixels = builder.badPixels;
        this.reconstructors = List.copyOf(builder.reconstructors);
        this.minPixels = builder.minPixels;
        this.maxIslands = builder.maxIslands;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            var count = new AtomicInteger();
            this.executor = Executors.newFixedThreadPool(builder.workerThreads, r -> {
                var thread = new Thread(r, "event-worker-" + count.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            this.ownsExecutor = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    /**
     * Process a single event, delivering its records to the sink
     *
     * @return the counters of this event
     * @throws InterruptedException if interrupted while waiting for the telescope workers; the event's outstanding
     *                              work is cancelled and nothing further is delivered for it
     */
    public ProcessingSummary process(ArrayEvent event, ResultSink sink) throws InterruptedException {
        var selected = new ArrayList<TelescopeImage>(event.telescopes().size());
        for (var telescope : event.telescopes()) {
            if (telescopes.containsKey(telescope.telescopeId())) {
                selected.add(telescope);
            } else {
                log.trace("Obs {} event {}: telescope {} not selected", event.observationId(), event.eventId(),
                          telescope.telescopeId());
            }
        }
        selected.sort(Comparator.comparingInt(TelescopeImage::telescopeId));

        var futures = new ArrayList<Future<TelescopeOutcome>>(selected.size());
        for (var telescope : selected) {
            futures.add(executor.submit(() -> analyze(event, telescope)));
        }

        var outcomes = new ArrayList<TelescopeOutcome>(selected.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    int id = selected.get(i).telescopeId();
                    log.warn("Obs {} event {} telescope {}: processing failed", event.observationId(),
                             event.eventId(), id, e.getCause());
                    outcomes.add(new Skipped(
                    new SkipRecord(event.observationId(), event.eventId(), id, SkipReason.PROCESSING_ERROR,
                                   String.valueOf(e.getCause()))));
                }
            }
        } catch (InterruptedException e) {
            for (var future : futures) {
                future.cancel(true);
            }
            throw e;
        }

        // barrier passed, every telescope of the event is done
        var ellipses = new TreeMap<Integer, ShowerEllipse>();
        var pointings = new HashMap<Integer, TelescopePointing>();
        long records = 0;
        long skips = 0;
        for (int i = 0; i < outcomes.size(); i++) {
            var outcome = outcomes.get(i);
            if (outcome instanceof Parameterized parameterized) {
                var telescope = selected.get(i);
                sink.telescope(parameterized.record());
                ellipses.put(telescope.telescopeId(), parameterized.ellipse());
                pointings.put(telescope.telescopeId(), telescope.pointing());
                records++;
            } else if (outcome instanceof Skipped skipped) {
                var skip = skipped.record();
                log.info("Obs {} event {} telescope {}: skipped, {}: {}", skip.observationId(), skip.eventId(),
                         skip.telescopeId(), skip.reason(), skip.detail());
                sink.skipped(skip);
                skips++;
            }
        }

        long stereo = 0;
        long stereoSkips = 0;
        for (var reconstructor : reconstructors) {
            var outcome = reconstructor.combine(ellipses, pointings, array);
            if (outcome instanceof StereoOutcome.Reconstructed reconstructed) {
                sink.stereo(StereoRecord.of(event, reconstructor.name(), reconstructed.result()));
                stereo++;
            } else if (outcome instanceof StereoOutcome.Unavailable unavailable) {
                var detail = reconstructor.name() + ": " + unavailable.reason().description();
                log.info("Obs {} event {}: stereo parameters calculation skipped, {}", event.observationId(),
                         event.eventId(), detail);
                sink.skipped(new SkipRecord(event.observationId(), event.eventId(), SkipRecord.STEREO,
                                            SkipReason.STEREO_UNAVAILABLE, detail));
                stereoSkips++;
            }
        }
        return new ProcessingSummary(1, 0, selected.size(), records, skips, stereo, stereoSkips);
    }

    /**
     * Process every event of the source. An event repeating the observation and event id of the event before it is
     * dropped.
     */
    public ProcessingSummary processAll(EventSource source, ResultSink sink) throws InterruptedException {
        var summary = ProcessingSummary.EMPTY;
        ArrayEvent previous = null;
        long duplicates = 0;
        for (var event : source) {
            if (previous != null && previous.eventId() == event.eventId()
            && previous.observationId() == event.observationId()) {
                log.info("Obs {} event {}: duplicate event id, skipped", event.observationId(), event.eventId());
                duplicates++;
                continue;
            }
            previous = event;
            summary = summary.plus(process(event, sink));
        }
        summary = summary.plus(new ProcessingSummary(0, duplicates, 0, 0, 0, 0, 0));
        log.info("Processed {} events ({} duplicates): {} telescope records, {} telescope skips, {} stereo records, {} "
                 + "stereo skips", summary.events(), summary.duplicateEvents(), summary.telescopeRecords(),
                 summary.telescopeSkips(), summary.stereoRecords(), summary.stereoSkips());
        return summary;
    }

    public List<StereoReconstructor> reconstructors() {
        return reconstructors;
    }

    public Map<Integer, TelescopeType> telescopes() {
        return telescopes;
    }

    private TelescopeOutcome analyze(ArrayEvent event, TelescopeImage telescope) {
        var type = telescopes.get(telescope.telescopeId());
        var image = telescope.image();
        var unsuitable = badPixels.unsuitablePixels(event, telescope, type.camera().pixelCount());
        var mask = type.cleaner().clean(image, type.topology(), unsuitable);

        int pixels = mask.count();
        if (pixels == 0) {
            return skip(event, telescope, SkipReason.EMPTY_CLEANING, "no pixels survived cleaning");
        }
        if (pixels < minPixels) {
            return skip(event, telescope, SkipReason.TOO_FEW_PIXELS,
                        pixels + " pixels after cleaning, " + minPixels + " required");
        }
        int islands = IslandAnalyzer.countIslands(type.topology(), mask);
        if (islands > maxIslands) {
            return skip(event, telescope, SkipReason.TOO_MANY_ISLANDS,
                        islands + " islands, at most " + maxIslands + " allowed");
        }

        ImageParameters parameters;
        try {
            parameters = parameterizer.parameterize(type.camera(), type.topology(), image, mask);
        } catch (ShapeParameterizationException e) {
            return skip(event, telescope, SkipReason.PARAMETERIZATION_FAILED, e.getMessage());
        }
        var record = TelescopeRecord.of(event, telescope, type.camera().name(), pixels, islands, parameters);
        return new Parameterized(record, ShowerEllipse.of(parameters.hillas(), islands));
    }

    private TelescopeOutcome skip(ArrayEvent event, TelescopeImage telescope, SkipReason reason, String detail) {
        return new Skipped(
        new SkipRecord(event.observationId(), event.eventId(), telescope.telescopeId(), reason, detail));
    }

    private sealed interface TelescopeOutcome {
    }

    private record Parameterized(TelescopeRecord record, ShowerEllipse ellipse) implements TelescopeOutcome {
    }

    private record Skipped(SkipRecord record) implements TelescopeOutcome {
    }

    public static class Builder {
        private final Map<Integer, TelescopeType>  telescopes     = new TreeMap<>();
        private final List<StereoReconstructor>    reconstructors = new ArrayList<>();
        private       ArrayGeometry                array;
        private       ShapeParameterizer           parameterizer  = new HillasParameterizer();
        private       BadPixelCalculator           badPixels      = BadPixelCalculator.NONE;
        private       int                          minPixels      = DEFAULT_MIN_PIXELS;
        private       int                          maxIslands     = Integer.MAX_VALUE;
        private       ExecutorService              executor;
        private       int                          workerThreads  = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        public Builder array(ArrayGeometry array) {
            this.array = Objects.requireNonNull(array, "array cannot be null");
            return this;
        }

        public Builder badPixels(BadPixelCalculator badPixels) {
            this.badPixels = Objects.requireNonNull(badPixels, "badPixels cannot be null");
            return this;
        }

        public EventProcessor build() {
            if (telescopes.isEmpty()) {
                throw new IllegalArgumentException("At least one telescope must be selected");
            }
            if (array == null) {
                throw new IllegalArgumentException("Array geometry is required");
            }
            for (var id : telescopes.keySet()) {
                if (!array.contains(id)) {
                    throw new IllegalArgumentException("Telescope " + id + " is not part of the array");
                }
            }
            if (reconstructors.isEmpty()) {
                for (var strategy : StereoStrategy.values()) {
                    reconstructors.add(strategy.create());
                }
            }
            return new EventProcessor(this);
        }

        /**
         * Use the supplied executor for the telescope workers. The processor does not shut it down.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor, "executor cannot be null");
            return this;
        }

        public Builder maxIslands(int maxIslands) {
            if (maxIslands < 1) {
                throw new IllegalArgumentException("maxIslands must be at least 1: " + maxIslands);
            }
            this.maxIslands = maxIslands;
            return this;
        }

        public Builder minPixels(int minPixels) {
            if (minPixels < 1) {
                throw new IllegalArgumentException("minPixels must be at least 1: " + minPixels);
            }
            this.minPixels = minPixels;
            return this;
        }

        public Builder parameterizer(ShapeParameterizer parameterizer) {
            this.parameterizer = Objects.requireNonNull(parameterizer, "parameterizer cannot be null");
            return this;
        }

        public Builder stereo(StereoReconstructor reconstructor) {
            reconstructors.add(Objects.requireNonNull(reconstructor, "reconstructor cannot be null"));
            return this;
        }

        public Builder stereo(StereoStrategy strategy) {
            return stereo(strategy.create());
        }

        public Builder telescope(int id, TelescopeType type) {
            if (telescopes.put(id, Objects.requireNonNull(type, "type cannot be null")) != null) {
                throw new IllegalArgumentException("Telescope " + id + " selected twice");
            }
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be at least 1: " + workerThreads);
            }
            this.workerThreads = workerThreads;
            return this;
        }
    }
}
