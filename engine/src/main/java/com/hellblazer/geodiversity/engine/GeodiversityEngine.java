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

import com.hellblazer.geodiversity.common.CategoryCode;
import com.hellblazer.geodiversity.common.CategoryDomainException;
import com.hellblazer.geodiversity.common.ConfigurationException;
import com.hellblazer.geodiversity.common.GeodiversityException;
import com.hellblazer.geodiversity.engine.feature.FeatureAssigner;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import com.hellblazer.geodiversity.engine.host.RasterLayer;
import com.hellblazer.geodiversity.engine.host.RasterSample;
import com.hellblazer.geodiversity.engine.metric.AccumulatorTable;
import com.hellblazer.geodiversity.engine.metric.FeatureMetric;
import com.hellblazer.geodiversity.engine.metric.MetricCode;
import com.hellblazer.geodiversity.engine.metric.RasterMetric;
import com.hellblazer.geodiversity.engine.metric.ZoneAccumulator;
import com.hellblazer.geodiversity.engine.output.FieldNames;
import com.hellblazer.geodiversity.engine.output.FieldWriter;
import com.hellblazer.geodiversity.engine.output.LayerExporter;
import com.hellblazer.geodiversity.engine.output.StagedResult;
import com.hellblazer.geodiversity.engine.output.StagingTable;
import com.hellblazer.geodiversity.engine.validation.ExtentRelation;
import com.hellblazer.geodiversity.engine.validation.ExtentValidator;
import com.hellblazer.geodiversity.engine.validation.FormatGuard;
import com.hellblazer.geodiversity.engine.zone.ZoneCatalog;
import com.hellblazer.geodiversity.resource.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Runs one metric over one grid: validate, build the zone catalog, stream the landscape layer into per-zone
 * accumulators, reduce, stage the results in a temporary workspace and commit them to the zone table. Every fatal
 * check happens before the table is touched; every intermediate artifact is released on every exit path.
 * <p>
 * An engine instance holds no per-run state and may be shared by concurrent callers, each run getting its own catalog,
 * accumulators and workspace.
 *
 * @author hal.hildebrand
 */
public class GeodiversityEngine {
    private static final Logger log = LoggerFactory.getLogger(GeodiversityEngine.class);

    private final GeodiversityConfiguration config;
    private final FieldNames                fieldNames;

    public GeodiversityEngine() {
        this(GeodiversityConfiguration.defaultConfig());
    }

    public GeodiversityEngine(GeodiversityConfiguration config) {
        this.config = config;
        this.fieldNames = new FieldNames(config.getMaxFieldNameLength(), config.getLayerPrefixLength());
    }

    public GeodiversityConfiguration getConfiguration() {
        return config;
    }

    /**
     * Compute a metric and write it to the zone table
     *
     * @throws ConfigurationException   if the request is incomplete or inconsistent, or the zone layer is empty
     * @throws GeodiversityException    if an input is in a rejected format or does not overlap the grid
     * @throws RunInterruptedException  if the running thread is interrupted; resources are released first
     */
    public RunReport run(MetricRequest request) throws GeodiversityException {
        validate(request);
        var metric = request.getMetric();
        var layer = request.getLayerDescriptor();
        if (request.getSlopeRaster() != null) {
            FormatGuard.check(request.getZones().descriptor(), layer, request.getSlopeRaster().descriptor());
        } else {
            FormatGuard.check(request.getZones().descriptor(), layer);
        }

        var catalog = ZoneCatalog.build(request.getZones());
        var grid = request.getZones().descriptor().withExtent(catalog.getExtent());
        var relation = ExtentValidator.validate(grid, layer);
        if (request.getSlopeRaster() != null) {
            ExtentValidator.validate(grid, request.getSlopeRaster().descriptor());
        }
        warnDimensionality(layer);

        log.info("Computing {} of {} over {} zones of {}", metric.getCode(), layer.name(), catalog.size(),
                 grid.name());
        var resources = new ResourceManager(metric.getCode() + ":" + layer.name(), config.isReleaseOnShutdown());
        try {
            var diagnostics = new RunDiagnostics(metric);
            var assigner = new FeatureAssigner(catalog);
            var values = metric.getInput().isVector() ? aggregate(FeatureMetric.of(metric), request, catalog,
                                                                  assigner, diagnostics)
                                                      : aggregate(rasterMetric(metric), request.getRaster(),
                                                                  request.isIgnoreNoData(), catalog, assigner,
                                                                  diagnostics);
            if (request.getSlopeRaster() != null) {
                applySlopeMask(values, request, catalog, assigner);
            }
            diagnostics.summarize();

            var workspace = resources.allocateWorkspace(config.getWorkspaceRoot(), "geodiversity-");
            var staged = StagingTable.write(workspace, StagedResult.of(metric, layer.name(), values));
            var writer = new FieldWriter(fieldNames, config.getNoDataSentinel(), config.isStandardize());
            var written = writer.commit(request.getTable(), staged, request.getOutputField(), request.isOverwrite(),
                                        resources);
            if (request.getExport() != null) {
                var exportName = request.getExportName() == null ? grid.name() + "_" + written.plan().field()
                                                                 : request.getExportName();
                LayerExporter.export(request.getExport(), exportName, catalog, written);
            }

            resources.close();
            var report = new RunReport(metric, written.plan(), values, relation, diagnostics,
                                       resources.getCleanupFailures());
            log.info("Finished {}", report);
            return report;
        } catch (IOException e) {
            throw new ConfigurationException(
            "Cannot stage results under " + config.getWorkspaceRoot() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interrupted(metric, e);
        } finally {
            resources.close();
        }
    }

    private <A extends ZoneAccumulator> Map<Long, Double> aggregate(FeatureMetric<A> metric, MetricRequest request,
                                                                    ZoneCatalog catalog, FeatureAssigner assigner,
                                                                    RunDiagnostics diagnostics) {
        var accumulators = new AccumulatorTable<A>(metric::newAccumulator);
        var categorical = metric.getCode().isCategorical();
        var field = request.getCategoryField();
        long seen = 0;
        try (var features = request.getFeatures().features()) {
            var iterator = features.iterator();
            while (iterator.hasNext()) {
                checkInterrupt(++seen, metric.getCode());
                var feature = iterator.next();
                diagnostics.read();
                if (feature.geometry() == null || feature.geometry().isEmpty()) {
                    diagnostics.skipped(SkipReason.NULL_GEOMETRY);
                    continue;
                }
                CategoryCode category = null;
                if (categorical) {
                    try {
                        category = CategoryCode.of(feature.attribute(field));
                    } catch (CategoryDomainException e) {
                        diagnostics.rejected(feature.fid(), e);
                        continue;
                    }
                }
                var code = category;
                var zones = assigner.assign(feature.geometry(), metric.getRule(),
                                            (zone, weight) -> metric.accumulate(accumulators.entry(zone), code,
                                                                                weight));
                if (zones == 0) {
                    diagnostics.dropped();
                } else {
                    diagnostics.assigned();
                }
            }
        }
        return reduce(metric.getCode(), catalog, accumulators, metric::reduce, true, diagnostics);
    }

    private <A extends ZoneAccumulator> Map<Long, Double> aggregate(RasterMetric<A> metric, RasterLayer raster,
                                                                    boolean ignoreNoData, ZoneCatalog catalog,
                                                                    FeatureAssigner assigner,
                                                                    RunDiagnostics diagnostics) {
        var accumulators = new AccumulatorTable<A>(metric::newAccumulator);
        var noDataValue = raster.noDataValue();
        long seen = 0;
        try (var samples = raster.samples()) {
            var iterator = samples.iterator();
            while (iterator.hasNext()) {
                checkInterrupt(++seen, metric.getCode());
                RasterSample sample = iterator.next();
                diagnostics.read();
                var zone = assigner.assign(sample);
                if (zone.isEmpty()) {
                    diagnostics.dropped();
                    continue;
                }
                if (sample.noData() || Double.isNaN(sample.value()) || sample.value() == noDataValue) {
                    diagnostics.skipped(SkipReason.NO_DATA);
                    if (!ignoreNoData) {
                        accumulators.entry(zone.get()).markNoData();
                    }
                    continue;
                }
                metric.accumulate(accumulators.entry(zone.get()), sample);
                diagnostics.assigned();
            }
        }
        return reduce(metric.getCode(), catalog, accumulators, metric::reduce, ignoreNoData, diagnostics);
    }

    private <A extends ZoneAccumulator> Map<Long, Double> reduce(MetricCode metric, ZoneCatalog catalog,
                                                                 AccumulatorTable<A> accumulators,
                                                                 ToDoubleFunction<A> reduction, boolean ignoreNoData,
                                                                 RunDiagnostics diagnostics) {
        var values = new LinkedHashMap<Long, Double>(catalog.size() * 2);
        var required = config.getMinimumSamples();
        for (Long id : catalog.ids()) {
            var accumulator = accumulators.get(id);
            double value;
            if (accumulator == null) {
                value = metric.emptyValue();
            } else if (!ignoreNoData && accumulator.sawNoData()) {
                value = Double.NaN;
            } else if (metric.isSampleSensitive() && accumulator.sampleCount() < required) {
                diagnostics.sparse(id, accumulator.sampleCount(), required);
                value = Double.NaN;
            } else {
                value = reduction.applyAsDouble(accumulator);
            }
            values.put(id, value);
        }
        return values;
    }

    private void applySlopeMask(Map<Long, Double> values, MetricRequest request, ZoneCatalog catalog,
                                FeatureAssigner assigner) {
        var slope = new RunDiagnostics(MetricCode.R_SDC);
        var means = aggregate(RasterMetric.mean(), request.getSlopeRaster(), true, catalog, assigner, slope);
        int flattened = 0;
        for (Map.Entry<Long, Double> entry : values.entrySet()) {
            var mean = means.get(entry.getKey());
            if (!Double.isNaN(entry.getValue()) && mean != null && !Double.isNaN(mean)
            && mean < request.getSlopeThreshold()) {
                entry.setValue(0.0);
                flattened++;
            }
        }
        log.info("Slope mask below {} degrees set {} zones to 0", request.getSlopeThreshold(), flattened);
    }

    private RasterMetric<?> rasterMetric(MetricCode metric) {
        return RasterMetric.of(metric, config.getCircularInputUnit(), config.getCircularOutputUnit(),
                               config.getReliefScales());
    }

    private void checkInterrupt(long seen, MetricCode metric) {
        if (seen % config.getInterruptCheckInterval() == 0 && Thread.currentThread().isInterrupted()) {
            throw interrupted(metric, null);
        }
    }

    private static RunInterruptedException interrupted(MetricCode metric, Throwable cause) {
        log.warn("{} run interrupted, releasing resources", metric.getCode());
        return new RunInterruptedException(metric.getCode() + " run interrupted", cause);
    }

    private static void warnDimensionality(LayerDescriptor layer) {
        if (layer.hasZ() || layer.hasM()) {
            log.info("{} carries Z/M values; computing and writing in 2D only", layer.name());
        }
    }

    private static void validate(MetricRequest request) throws ConfigurationException {
        var metric = request.getMetric();
        if (metric == null) {
            throw new ConfigurationException("No metric requested");
        }
        if (request.getZones() == null || request.getTable() == null) {
            throw new ConfigurationException(metric.getCode() + " requires a zone layer and its attribute table");
        }
        if (metric.getInput().isVector()) {
            if (request.getFeatures() == null) {
                throw new ConfigurationException(metric.getCode() + " requires a " + metric.getInput() + " layer");
            }
            if (request.getFeatures().descriptor().kind() != metric.getInput()) {
                throw new ConfigurationException(
                metric.getCode() + " requires a " + metric.getInput() + " layer, "
                + request.getFeatures().descriptor().name() + " is " + request.getFeatures().descriptor().kind());
            }
        } else if (request.getRaster() == null) {
            throw new ConfigurationException(metric.getCode() + " requires a raster layer");
        }
        if (metric.isCategorical()) {
            var field = request.getCategoryField();
            if (field == null || field.isBlank()) {
                throw new ConfigurationException(metric.getCode() + " requires a category field");
            }
            if (!request.getFeatures().fieldNames().contains(field)) {
                throw new ConfigurationException(
                "Category field " + field + " not found in " + request.getFeatures().descriptor().name());
            }
        } else if (request.getCategoryField() != null) {
            throw new ConfigurationException(metric.getCode() + " does not take a category field");
        }
        if (request.getSlopeRaster() != null) {
            if (metric != MetricCode.R_SDC) {
                throw new ConfigurationException("A slope mask applies to R_SDc only");
            }
            var threshold = request.getSlopeThreshold();
            if (!(threshold >= 0.0 && threshold <= 90.0)) {
                throw new ConfigurationException("Slope threshold must be in [0, 90] degrees: " + threshold);
            }
        }
    }
}
