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
import com.hellblazer.geodiversity.engine.host.GeometryKind;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import com.hellblazer.geodiversity.engine.host.ZoneLayer;
import com.hellblazer.geodiversity.engine.host.ZoneRecord;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Zone layer held in memory
 *
 * @author hal.hildebrand
 */
public class MemoryZoneLayer implements ZoneLayer {

    private final LayerDescriptor  descriptor;
    private final List<ZoneRecord> zones;

    public MemoryZoneLayer(LayerDescriptor descriptor, List<ZoneRecord> zones) {
        this.descriptor = descriptor;
        this.zones = List.copyOf(zones);
    }

    public MemoryZoneLayer(String name, String crs, List<ZoneRecord> zones) {
        this(LayerDescriptor.memory(name, GeometryKind.POLYGON, extentOf(zones), crs), zones);
    }

    /**
     * A regular grid of square zones. Ids start at 1 in the lower left cell and increase along each row.
     */
    public static MemoryZoneLayer grid(String name, double minX, double minY, double cellSize, int columns, int rows,
                                       String crs) {
        var factory = new GeometryFactory();
        var zones = new ArrayList<ZoneRecord>(columns * rows);
        long id = 1;
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                var x = minX + column * cellSize;
                var y = minY + row * cellSize;
                var cell = factory.toGeometry(new Envelope(x, x + cellSize, y, y + cellSize));
                zones.add(new ZoneRecord(id++, cell));
            }
        }
        return new MemoryZoneLayer(name, crs, zones);
    }

    static Envelope extentOf(List<ZoneRecord> zones) {
        var extent = new Envelope();
        for (ZoneRecord zone : zones) {
            if (zone.geometry() != null) {
                extent.expandToInclude(zone.geometry().getEnvelopeInternal());
            }
        }
        return extent.isNull() ? null : extent;
    }

    @Override
    public LayerDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Answer a copy of this layer that reports a different container
     */
    public MemoryZoneLayer in(ContainerFormat format, String path) {
        return new MemoryZoneLayer(
        new LayerDescriptor(descriptor.name(), path, format, descriptor.extent(), descriptor.crs(), descriptor.kind(),
                            descriptor.hasZ(), descriptor.hasM()), zones);
    }

    @Override
    public Stream<ZoneRecord> zones() {
        return zones.stream();
    }

    public int size() {
        return zones.size();
    }
}
