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

import com.hellblazer.geodiversity.engine.host.AttributeTable;
import com.hellblazer.geodiversity.engine.host.FeatureLayer;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import com.hellblazer.geodiversity.engine.host.OutputLayerSink;
import com.hellblazer.geodiversity.engine.host.RasterLayer;
import com.hellblazer.geodiversity.engine.host.ZoneLayer;
import com.hellblazer.geodiversity.engine.metric.MetricCode;

/**
 * One (grid, landscape layer, metric) run and its options
 *
 * @author hal.hildebrand
 */
public final class MetricRequest {

    private final MetricCode      metric;
    private final ZoneLayer       zones;
    private final AttributeTable  table;
    private final FeatureLayer    features;
    private final RasterLayer     raster;
    private final String          categoryField;
    private final String          outputField;
    private final boolean         overwrite;
    private final boolean         ignoreNoData;
    private final RasterLayer     slopeRaster;
    private final double          slopeThreshold;
    private final OutputLayerSink export;
    private final String          exportName;

    private MetricRequest(Builder builder) {
        this.metric = builder.metric;
        this.zones = builder.zones;
        this.table = builder.table;
        this.features = builder.features;
        this.raster = builder.raster;
        this.categoryField = builder.categoryField;
        this.outputField = builder.outputField;
        this.overwrite = builder.overwrite;
        this.ignoreNoData = builder.ignoreNoData;
        this.slopeRaster = builder.slopeRaster;
        this.slopeThreshold = builder.slopeThreshold;
        this.export = builder.export;
        this.exportName = builder.exportName;
    }

    public static Builder builder(MetricCode metric) {
        return new Builder(metric);
    }

    public MetricCode getMetric() {
        return metric;
    }

    public ZoneLayer getZones() {
        return zones;
    }

    public AttributeTable getTable() {
        return table;
    }

    public FeatureLayer getFeatures() {
        return features;
    }

    public RasterLayer getRaster() {
        return raster;
    }

    /**
     * The descriptor of whichever landscape layer the request carries
     */
    public LayerDescriptor getLayerDescriptor() {
        return metric.getInput().isVector() ? features.descriptor() : raster.descriptor();
    }

    public String getCategoryField() {
        return categoryField;
    }

    /**
     * Caller supplied output field name, null to derive one
     */
    public String getOutputField() {
        return outputField;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public boolean isIgnoreNoData() {
        return ignoreNoData;
    }

    public RasterLayer getSlopeRaster() {
        return slopeRaster;
    }

    /**
     * Zones whose mean slope, in degrees, is below this receive a circular deviation of 0
     */
    public double getSlopeThreshold() {
        return slopeThreshold;
    }

    public OutputLayerSink getExport() {
        return export;
    }

    public String getExportName() {
        return exportName;
    }

    public static class Builder {
        private final MetricCode      metric;
        private       ZoneLayer       zones;
        private       AttributeTable  table;
        private       FeatureLayer    features;
        private       RasterLayer     raster;
        private       String          categoryField;
        private       String          outputField;
        private       boolean         overwrite      = false;
        private       boolean         ignoreNoData   = true;
        private       RasterLayer     slopeRaster;
        private       double          slopeThreshold = Double.NaN;
        private       OutputLayerSink export;
        private       String          exportName;

        private Builder(MetricCode metric) {
            this.metric = metric;
        }

        public Builder withZones(ZoneLayer zones, AttributeTable table) {
            this.zones = zones;
            this.table = table;
            return this;
        }

        public Builder withFeatures(FeatureLayer features) {
            this.features = features;
            return this;
        }

        public Builder withRaster(RasterLayer raster) {
            this.raster = raster;
            return this;
        }

        public Builder withCategoryField(String field) {
            this.categoryField = field;
            return this;
        }

        public Builder withOutputField(String field) {
            this.outputField = field;
            return this;
        }

        /**
         * Overwrite an existing field of the derived name rather than adding a numbered one
         */
        public Builder withOverwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder withIgnoreNoData(boolean ignoreNoData) {
            this.ignoreNoData = ignoreNoData;
            return this;
        }

        public Builder withSlopeMask(RasterLayer slope, double thresholdDegrees) {
            this.slopeRaster = slope;
            this.slopeThreshold = thresholdDegrees;
            return this;
        }

        public Builder withExport(OutputLayerSink sink, String layerName) {
            this.export = sink;
            this.exportName = layerName;
            return this;
        }

        public MetricRequest build() {
            return new MetricRequest(this);
        }
    }
}
