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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link AnalysisConfiguration}s from JSON files or classpath resources. A configuration is validated before it
 * is returned, so an inconsistent configuration fails at load time. Camera topologies are derived later, once, when
 * the processor is built.
 *
 * @author hal.hildebrand
 */
public class ConfigurationLoader {
    public static final  String DEFAULT_RESOURCE = "/analysis-config.json";
    private static final Logger log              = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigurationLoader() {
        this(new ObjectMapper());
    }

    public ConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load the configuration of the MAGIC and LST array bundled with the pipeline
     */
    public AnalysisConfiguration loadDefault() throws ConfigurationException {
        return loadResource(DEFAULT_RESOURCE);
    }

    public AnalysisConfiguration load(Path path) throws ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (var input = Files.newInputStream(path)) {
            return parse(input, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration " + path, e);
        }
    }

    public AnalysisConfiguration loadResource(String resource) throws ConfigurationException {
        try (var input = getClass().getResourceAsStream(resource)) {
            if (input == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            return parse(input, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration " + resource, e);
        }
    }

    /**
     * @param source describes where the input came from, for diagnostics
     */
    public AnalysisConfiguration parse(InputStream input, String source) throws ConfigurationException {
        AnalysisConfiguration configuration;
        try {
            configuration = objectMapper.readValue(input, AnalysisConfiguration.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration " + source + ": " + e.getMessage(), e);
        }
        try {
            configuration.validate();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration " + source + ": " + e.getMessage(), e);
        }
        log.info("Loaded configuration {}: {} telescope types, {} telescopes", source,
                 configuration.telescopeTypes().size(), configuration.telescopes().size());
        return configuration;
    }
}
