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
package com.hellblazer.geodiversity.engine.host.memory;

import com.hellblazer.geodiversity.engine.host.ContainerFormat;
import com.hellblazer.geodiversity.engine.host.FeatureLayer;
import com.hellblazer.geodiversity.engine.host.FeatureRecord;
import com.hellblazer.geodiversity.engine.host.GeometryKind;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Vector feature layer held in memory
 *
 * @author hal.hildebrand
 */
public class MemoryFeatureLayer implements FeatureLayer {

    private final LayerDescriptor     descriptor;
    private final List<FeatureRecord> features;
    private final Set<String>         fieldNames;

    public MemoryFeatureLayer(LayerDescriptor descriptor, List<FeatureRecord> features) {
        this.descriptor = descriptor;
        this.features = List.copyOf(features);
        var names = new LinkedHashSet<String>();
        for (FeatureRecord feature : features) {
            names.addAll(feature.attributes().keySet());
        }
        this.fieldNames = Collections.unmodifiableSet(names);
    }

    public static Builder builder(String name, GeometryKind kind) {
        return new Builder(name, kind);
    }

    @Override
    public LayerDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Set<String> fieldNames() {
        return fieldNames;
    }

    @Override
    public Stream<FeatureRecord> features() {
        return features.stream();
    }

    public int size() {
        return features.size();
    }

    public static class Builder {
        private final String              name;
        private final GeometryKind        kind;
        private final List<FeatureRecord> features = new ArrayList<>();
        private       String              crs;
        private       String              path;
        private       ContainerFormat     format   = ContainerFormat.MEMORY;
        private       Envelope            extent;
        private       long                nextFid  = 1;

        private Builder(String name, GeometryKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder add(Geometry geometry) {
            return add(geometry, Map.of());
        }

        public Builder add(Geometry geometry, Map<String, Object> attributes) {
            features.add(new FeatureRecord(nextFid++, geometry, attributes));
            return this;
        }

        public Builder crs(String crs) {
            this.crs = crs;
            return this;
        }

        /**
         * Report a container other than memory
         */
        public Builder container(ContainerFormat format, String path) {
            this.format = format;
            this.path = path;
            return this;
        }

        /**
         * Override the extent computed from the features
         */
        public Builder extent(Envelope extent) {
            this.extent = extent;
            return this;
        }

        public MemoryFeatureLayer build() {
            var bounds = extent;
            boolean hasZ = false;
            if (bounds == null) {
                var computed = new Envelope();
                for (FeatureRecord feature : features) {
                    if (feature.geometry() != null && !feature.geometry().isEmpty()) {
                        computed.expandToInclude(feature.geometry().getEnvelopeInternal());
                    }
                }
                bounds = computed.isNull() ? null : computed;
            }
            for (FeatureRecord feature : features) {
                if (feature.geometry() != null && !Geometries.isStrictly2D(feature.geometry())) {
                    hasZ = true;
                    break;
                }
            }
            var descriptor = new LayerDescriptor(name, path, format, bounds, crs, kind, hasZ, false);
            return new MemoryFeatureLayer(descriptor, features);
        }
    }
}
