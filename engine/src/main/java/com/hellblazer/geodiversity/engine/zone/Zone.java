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
package com.hellblazer.geodiversity.engine.zone;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

/**
 * One cell of the analytical grid. Geometry is strictly 2D and prepared for repeated predicate evaluation.
 *
 * @author hal.hildebrand
 */
public final class Zone implements Comparable<Zone> {

    private final long             id;
    private final Geometry         geometry;
    private final Envelope         extent;
    private final PreparedGeometry prepared;
    private       Geometry         boundary;

    Zone(long id, Geometry geometry) {
        this.id = id;
        this.geometry = geometry;
        this.extent = geometry.getEnvelopeInternal();
        this.prepared = PreparedGeometryFactory.prepare(geometry);
    }

    public long getId() {
        return id;
    }

    public Geometry getGeometry() {
        return geometry;
    }

    public Envelope getExtent() {
        return new Envelope(extent);
    }

    /**
     * True if the coordinate lies in the interior of the zone
     */
    public boolean contains(Coordinate coordinate) {
        return extent.contains(coordinate) && prepared.contains(point(coordinate));
    }

    /**
     * True if the coordinate lies in the interior or on the boundary of the zone
     */
    public boolean covers(Coordinate coordinate) {
        return extent.covers(coordinate) && prepared.covers(point(coordinate));
    }

    public boolean intersects(Geometry other) {
        return prepared.intersects(other);
    }

    /**
     * True if the other geometry lies entirely in the zone's interior
     */
    public boolean containsProperly(Geometry other) {
        return prepared.containsProperly(other);
    }

    public synchronized Geometry getBoundary() {
        if (boundary == null) {
            boundary = geometry.getBoundary();
        }
        return boundary;
    }

    private Geometry point(Coordinate coordinate) {
        return geometry.getFactory().createPoint(coordinate);
    }

    @Override
    public int compareTo(Zone other) {
        return Long.compare(id, other.id);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Zone other && other.id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Zone[" + id + "]";
    }
}
