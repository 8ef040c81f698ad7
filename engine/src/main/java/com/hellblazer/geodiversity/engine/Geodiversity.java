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

import com.hellblazer.geodiversity.common.GeodiversityException;
import com.hellblazer.geodiversity.engine.host.AttributeTable;
import com.hellblazer.geodiversity.engine.host.FeatureLayer;
import com.hellblazer.geodiversity.engine.host.RasterLayer;
import com.hellblazer.geodiversity.engine.host.ZoneLayer;
import com.hellblazer.geodiversity.engine.metric.MetricCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The toolbox surface: one operation per geodiversity index. Operations never throw for data or configuration
 * problems; they return a failed {@link ToolResult} carrying the error kind instead.
 *
 * @author hal.hildebrand
 */
public class Geodiversity {
    private static final Logger log = LoggerFactory.getLogger(Geodiversity.class);

    private final GeodiversityEngine engine;

    public Geodiversity() {
        this(new GeodiversityEngine());
    }

    public Geodiversity(GeodiversityConfiguration config) {
        this(new GeodiversityEngine(config));
    }

    public Geodiversity(GeodiversityEngine engine) {
        this.engine = engine;
    }

    /**
     * A_Ne: number of single-part polygon elements per zone
     */
    public ToolResult polygonElementCount(ZoneLayer zones, AttributeTable table, FeatureLayer polygons,
                                          String outputField) {
        return run(vector(MetricCode.A_NE, zones, table, polygons, null, outputField));
    }

    /**
     * A_Nc: number of polygon categories per zone
     */
    public ToolResult polygonCategoryCount(ZoneLayer zones, AttributeTable table, FeatureLayer polygons,
                                           String categoryField, String outputField) {
        return run(vector(MetricCode.A_NC, zones, table, polygons, categoryField, outputField));
    }

    /**
     * A_SHDI: Shannon diversity of polygon categories, weighted by covered area
     */
    public ToolResult polygonShannonDiversity(ZoneLayer zones, AttributeTable table, FeatureLayer polygons,
                                              String categoryField, String outputField) {
        return run(vector(MetricCode.A_SHDI, zones, table, polygons, categoryField, outputField));
    }

    /**
     * L_Tl: total line length per zone
     */
    public ToolResult lineTotalLength(ZoneLayer zones, AttributeTable table, FeatureLayer lines, String outputField) {
        return run(vector(MetricCode.L_TL, zones, table, lines, null, outputField));
    }

    public ToolResult pointElementCount(ZoneLayer zones, AttributeTable table, FeatureLayer points,
                                        String outputField) {
        return run(vector(MetricCode.P_NE, zones, table, points, null, outputField));
    }

    public ToolResult pointCategoryCount(ZoneLayer zones, AttributeTable table, FeatureLayer points,
                                         String categoryField, String outputField) {
        return run(vector(MetricCode.P_NC, zones, table, points, categoryField, outputField));
    }

    /**
     * P_Hu: Shannon entropy of point categories over point counts
     */
    public ToolResult pointUnitEntropy(ZoneLayer zones, AttributeTable table, FeatureLayer points,
                                       String categoryField, String outputField) {
        return run(vector(MetricCode.P_HU, zones, table, points, categoryField, outputField));
    }

    public ToolResult rasterStandardDeviation(ZoneLayer zones, AttributeTable table, RasterLayer raster,
                                              String outputField, boolean ignoreNoData) {
        return run(raster(MetricCode.R_SD, zones, table, raster, outputField, ignoreNoData).build());
    }

    /**
     * R_SDc: circular standard deviation of an aspect raster
     */
    public ToolResult rasterCircularStandardDeviation(ZoneLayer zones, AttributeTable table, RasterLayer aspect,
                                                      String outputField, boolean ignoreNoData) {
        return run(raster(MetricCode.R_SDC, zones, table, aspect, outputField, ignoreNoData).build());
    }

    /**
     * R_SDc with flat zones masked out: zones whose mean slope is below the threshold receive 0
     */
    public ToolResult rasterCircularStandardDeviation(ZoneLayer zones, AttributeTable table, RasterLayer aspect,
                                                      RasterLayer slope, double slopeThreshold, String outputField,
                                                      boolean ignoreNoData) {
        var builder = raster(MetricCode.R_SDC, zones, table, aspect, outputField, ignoreNoData);
        return run(builder.withSlopeMask(slope, slopeThreshold).build());
    }

    /**
     * R_M: multiscale relief index of an elevation raster
     */
    public ToolResult rasterReliefIndex(ZoneLayer zones, AttributeTable table, RasterLayer elevation,
                                        String outputField, boolean ignoreNoData) {
        return run(raster(MetricCode.R_M, zones, table, elevation, outputField, ignoreNoData).build());
    }

    public ToolResult run(MetricRequest request) {
        try {
            return ToolResult.success(engine.run(request));
        } catch (GeodiversityException e) {
            log.error("{} failed: {}", request.getMetric() == null ? "Run" : request.getMetric().getCode(),
                      e.getMessage());
            return ToolResult.failure(e.getKind(), e.getMessage());
        } catch (RunInterruptedException e) {
            return ToolResult.failure(e.getKind(), e.getMessage());
        }
    }

    private static MetricRequest vector(MetricCode metric, ZoneLayer zones, AttributeTable table,
                                        FeatureLayer features, String categoryField, String outputField) {
        return MetricRequest.builder(metric)
                            .withZones(zones, table)
                            .withFeatures(features)
                            .withCategoryField(categoryField)
                            .withOutputField(outputField)
                            .build();
    }

    private static MetricRequest.Builder raster(MetricCode metric, ZoneLayer zones, AttributeTable table,
                                                RasterLayer raster, String outputField, boolean ignoreNoData) {
        return MetricRequest.builder(metric)
                            .withZones(zones, table)
                            .withRaster(raster)
                            .withOutputField(outputField)
                            .withIgnoreNoData(ignoreNoData);
    }
}
