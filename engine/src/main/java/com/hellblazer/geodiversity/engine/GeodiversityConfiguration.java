/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Geodiversity.
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
package com.hellblazer.geodiversity.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.geodiversity.common.ConfigurationException;
import com.hellblazer.geodiversity.engine.metric.AngleUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Engine settings shared by every run. Immutable; created with {@link #builder()}, {@link #defaultConfig()} or loaded
 * from JSON.
 *
 * @author hal.hildebrand
 */
public final class GeodiversityConfiguration {
    public static final  String DEFAULTS_RESOURCE = "/geodiversity-defaults.json";
    private static final Logger log               = LoggerFactory.getLogger(GeodiversityConfiguration.class);

    private final Double    noDataSentinel;
    private final boolean   standardize;
    private final int       reliefScales;
    private final AngleUnit circularInputUnit;
    private final AngleUnit circularOutputUnit;
    private final int       maxFieldNameLength;
    private final int       layerPrefixLength;
    private final int       interruptCheckInterval;
    private final Path      workspaceRoot;
    private final int       minimumSamples;
    private final boolean   releaseOnShutdown;

    private GeodiversityConfiguration(Builder builder) {
        this.noDataSentinel = builder.noDataSentinel;
        this.standardize = builder.standardize;
        this.reliefScales = builder.reliefScales;
        this.circularInputUnit = builder.circularInputUnit;
        this.circularOutputUnit = builder.circularOutputUnit;
        this.maxFieldNameLength = builder.maxFieldNameLength;
        this.layerPrefixLength = builder.layerPrefixLength;
        this.interruptCheckInterval = builder.interruptCheckInterval;
        this.workspaceRoot = builder.workspaceRoot;
        this.minimumSamples = builder.minimumSamples;
        this.releaseOnShutdown = builder.releaseOnShutdown;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GeodiversityConfiguration defaultConfig() {
        return builder().build();
    }

    /**
     * Load the defaults bundled with the engine
     */
    public static GeodiversityConfiguration fromClasspath() throws ConfigurationException {
        return load(GeodiversityConfiguration.class.getResourceAsStream(DEFAULTS_RESOURCE));
    }

    public static GeodiversityConfiguration load(Path file) throws ConfigurationException {
        try {
            return load(Files.newInputStream(file));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot open configuration " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Read settings from JSON. Keys not present keep their defaults; unknown keys are rejected.
     */
    public static GeodiversityConfiguration load(InputStream input) throws ConfigurationException {
        if (input == null) {
            throw new ConfigurationException("Configuration resource not found: " + DEFAULTS_RESOURCE);
        }
        var mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        Settings settings;
        try (input) {
            settings = mapper.readValue(input, Settings.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
        if (settings == null) {
            throw new ConfigurationException("Empty configuration document");
        }
        try {
            var builder = builder().withNoDataSentinel(settings.noDataSentinel);
            if (settings.standardize != null) {
                builder.withStandardize(settings.standardize);
            }
            if (settings.reliefScales != null) {
                builder.withReliefScales(settings.reliefScales);
            }
            if (settings.circularInputUnit != null) {
                builder.withCircularInputUnit(settings.circularInputUnit);
            }
            if (settings.circularOutputUnit != null) {
                builder.withCircularOutputUnit(settings.circularOutputUnit);
            }
            if (settings.maxFieldNameLength != null) {
                builder.withMaxFieldNameLength(settings.maxFieldNameLength);
            }
            if (settings.layerPrefixLength != null) {
                builder.withLayerPrefixLength(settings.layerPrefixLength);
            }
            if (settings.interruptCheckInterval != null) {
                builder.withInterruptCheckInterval(settings.interruptCheckInterval);
            }
            if (settings.workspaceRoot != null) {
                builder.withWorkspaceRoot(Paths.get(settings.workspaceRoot));
            }
            if (settings.minimumSamples != null) {
                builder.withMinimumSamples(settings.minimumSamples);
            }
            if (settings.releaseOnShutdown != null) {
                builder.withReleaseOnShutdown(settings.releaseOnShutdown);
            }
            var config = builder.build();
            log.debug("Loaded {}", config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * The value written for zones without a result, null when such zones are written as NULL
     */
    public Double getNoDataSentinel() {
        return noDataSentinel;
    }

    public boolean isStandardize() {
        return standardize;
    }

    public int getReliefScales() {
        return reliefScales;
    }

    public AngleUnit getCircularInputUnit() {
        return circularInputUnit;
    }

    public AngleUnit getCircularOutputUnit() {
        return circularOutputUnit;
    }

    public int getMaxFieldNameLength() {
        return maxFieldNameLength;
    }

    public int getLayerPrefixLength() {
        return layerPrefixLength;
    }

    /**
     * Number of features or samples streamed between checks for thread interruption
     */
    public int getInterruptCheckInterval() {
        return interruptCheckInterval;
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public int getMinimumSamples() {
        return minimumSamples;
    }

    public boolean isReleaseOnShutdown() {
        return releaseOnShutdown;
    }

    public Builder toBuilder() {
        return builder().withNoDataSentinel(noDataSentinel)
                        .withStandardize(standardize)
                        .withReliefScales(reliefScales)
                        .withCircularInputUnit(circularInputUnit)
                        .withCircularOutputUnit(circularOutputUnit)
                        .withMaxFieldNameLength(maxFieldNameLength)
                        .withLayerPrefixLength(layerPrefixLength)
                        .withInterruptCheckInterval(interruptCheckInterval)
                        .withWorkspaceRoot(workspaceRoot)
                        .withMinimumSamples(minimumSamples)
                        .withReleaseOnShutdown(releaseOnShutdown);
    }

    @Override
    public String toString() {
        return String.format(
        "GeodiversityConfiguration[noData=%s, standardize=%s, reliefScales=%d, circular=%s->%s, maxField=%d, "
        + "prefix=%d, interruptEvery=%d, workspace=%s, minSamples=%d]", noDataSentinel == null ? "NULL"
                                                                                               : noDataSentinel,
        standardize, reliefScales, circularInputUnit, circularOutputUnit, maxFieldNameLength, layerPrefixLength,
        interruptCheckInterval, workspaceRoot, minimumSamples);
    }

    public static class Builder {
        private Double    noDataSentinel         = null;
        private boolean   standardize            = true;
        private int       reliefScales           = 2;
        private AngleUnit circularInputUnit      = AngleUnit.DEGREES;
        private AngleUnit circularOutputUnit     = AngleUnit.DEGREES;
        private int       maxFieldNameLength     = 64;
        private int       layerPrefixLength      = 3;
        private int       interruptCheckInterval = 1000;
        private Path      workspaceRoot          = Paths.get(System.getProperty("java.io.tmpdir"));
        private int       minimumSamples         = 2;
        private boolean   releaseOnShutdown      = true;

        private Builder() {
        }

        /**
         * @param sentinel numeric value for zones without a result, null to write NULL
         */
        public Builder withNoDataSentinel(Double sentinel) {
            if (sentinel != null && !Double.isFinite(sentinel)) {
                throw new IllegalArgumentException("No-data sentinel must be finite: " + sentinel);
            }
            this.noDataSentinel = sentinel;
            return this;
        }

        public Builder withStandardize(boolean standardize) {
            this.standardize = standardize;
            return this;
        }

        public Builder withReliefScales(int scales) {
            if (scales < 1 || scales > 8) {
                throw new IllegalArgumentException("Relief scales must be in [1, 8]: " + scales);
            }
            this.reliefScales = scales;
            return this;
        }

        public Builder withCircularInputUnit(AngleUnit unit) {
            if (unit == null) {
                throw new IllegalArgumentException("Circular input unit cannot be null");
            }
            this.circularInputUnit = unit;
            return this;
        }

        public Builder withCircularOutputUnit(AngleUnit unit) {
            if (unit == null) {
                throw new IllegalArgumentException("Circular output unit cannot be null");
            }
            this.circularOutputUnit = unit;
            return this;
        }

        public Builder withMaxFieldNameLength(int length) {
            if (length < 8) {
                throw new IllegalArgumentException("Maximum field name length must be at least 8: " + length);
            }
            this.maxFieldNameLength = length;
            return this;
        }

        public Builder withLayerPrefixLength(int length) {
            if (length < 1) {
                throw new IllegalArgumentException("Layer prefix length must be positive: " + length);
            }
            this.layerPrefixLength = length;
            return this;
        }

        public Builder withInterruptCheckInterval(int interval) {
            if (interval < 1) {
                throw new IllegalArgumentException("Interrupt check interval must be positive: " + interval);
            }
            this.interruptCheckInterval = interval;
            return this;
        }

        public Builder withWorkspaceRoot(Path root) {
            if (root == null) {
                throw new IllegalArgumentException("Workspace root cannot be null");
            }
            this.workspaceRoot = root;
            return this;
        }

        public Builder withMinimumSamples(int samples) {
            if (samples < 1) {
                throw new IllegalArgumentException("Minimum samples must be positive: " + samples);
            }
            this.minimumSamples = samples;
            return this;
        }

        public Builder withReleaseOnShutdown(boolean release) {
            this.releaseOnShutdown = release;
            return this;
        }

        public GeodiversityConfiguration build() {
            if (layerPrefixLength + 6 > maxFieldNameLength) {
                throw new IllegalArgumentException(
                "Layer prefix length " + layerPrefixLength + " leaves no room for a metric suffix in "
                + maxFieldNameLength + " characters");
            }
            return new GeodiversityConfiguration(this);
        }
    }

    /**
     * JSON form of the settings
     */
    static class Settings {
        public Double    noDataSentinel;
        public Boolean   standardize;
        public Integer   reliefScales;
        public AngleUnit circularInputUnit;
        public AngleUnit circularOutputUnit;
        public Integer   maxFieldNameLength;
        public Integer   layerPrefixLength;
        public Integer   interruptCheckInterval;
        public String    workspaceRoot;
        public Integer   minimumSamples;
        public Boolean   releaseOnShutdown;
    }
}
