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
package com.hellblazer.geodiversity.engine.host;

import org.locationtech.jts.geom.Envelope;

import java.util.Objects;

/**
 * Metadata the host environment reports for a layer
 *
 * @param name   layer base name, used to derive output field names
 * @param path   catalog path, may be null for in-memory layers
 * @param format declared container format
 * @param extent bounding extent, null when the layer holds no data
 * @param crs    coordinate reference identifier, null when undeclared
 * @param kind   kind of data the layer holds
 * @param hasZ   true if the source geometry carries Z values
 * @param hasM   true if the source geometry carries M values
 * @author hal.hildebrand
 */
public record LayerDescriptor(String name, String path, ContainerFormat format, Envelope extent, String crs,
                              GeometryKind kind, boolean hasZ, boolean hasM) {

    public LayerDescriptor {
        Objects.requireNonNull(name, "Layer name cannot be null");
        Objects.requireNonNull(kind, "Geometry kind cannot be null");
        extent = extent == null ? null : new Envelope(extent);
    }

    /**
     * In-memory, strictly 2D layer descriptor
     */
    public static LayerDescriptor memory(String name, GeometryKind kind, Envelope extent, String crs) {
        return new LayerDescriptor(name, null, ContainerFormat.MEMORY, extent, crs, kind, false, false);
    }

    /**
     * The container the layer actually lives in, taking the path into account
     */
    public ContainerFormat effectiveFormat() {
        return ContainerFormat.resolve(path, format);
    }

    @Override
    public Envelope extent() {
        return extent == null ? null : new Envelope(extent);
    }

    public LayerDescriptor withExtent(Envelope newExtent) {
        return new LayerDescriptor(name, path, format, newExtent, crs, kind, hasZ, hasM);
    }
}
