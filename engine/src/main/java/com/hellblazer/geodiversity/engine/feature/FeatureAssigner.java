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
package com.hellblazer.geodiversity.engine.feature;

import com.hellblazer.geodiversity.engine.host.RasterSample;
import com.hellblazer.geodiversity.engine.zone.Zone;
import com.hellblazer.geodiversity.engine.zone.ZoneCatalog;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;

import java.util.Optional;
import java.util.TreeMap;

/**
 * Routes features and raster samples to the zones that own them.
 * <p>
 * Points and cell centers belong to the single zone whose interior contains them; on a shared boundary the lowest zone
 * id wins. A multipoint feature counts once in each zone holding at least one of its parts. Lines and polygons contribute to every zone whose interior they overlap, measured according to the
 * {@link AssignmentRule}. A line or polygon that overlaps no zone interior, only touching zone boundaries, goes wholly
 * to the zone owning its representative point.
 * <p>
 * Each candidate zone is found through the catalog's extent index and confirmed with a prepared geometry predicate
 * before any overlay is computed.
 *
 * @author hal.hildebrand
 */
public final class FeatureAssigner {

    private final ZoneCatalog catalog;

    public FeatureAssigner(ZoneCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Route a feature geometry
     *
     * @return the number of zones that received a contribution, 0 if the feature falls outside the grid
     */
    public int assign(Geometry geometry, AssignmentRule rule, ContributionSink sink) {
        if (geometry == null || geometry.isEmpty()) {
            return 0;
        }
        var flat = Geometries.isStrictly2D(geometry) ? geometry : Geometries.force2D(geometry);
        if (rule == AssignmentRule.POINT) {
            return assignPoints(flat, sink);
        }
        return assignOverlap(flat, rule, sink);
    }

    /**
     * The zone owning a raster cell, by its center
     */
    public Optional<Zone> assign(RasterSample sample) {
        return catalog.locate(new Coordinate(sample.x(), sample.y()));
    }

    private int assignPoints(Geometry geometry, ContributionSink sink) {
        var owners = new TreeMap<Long, Zone>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            var part = geometry.getGeometryN(i);
            var location = part instanceof Point ? part.getCoordinate() : Geometries.representativePoint(part);
            catalog.locate(location).ifPresent(zone -> owners.putIfAbsent(zone.getId(), zone));
        }
        // a multipoint feature is one element, however many of its parts share a zone
        owners.values().forEach(zone -> sink.accept(zone, 1.0));
        return owners.size();
    }

    private int assignOverlap(Geometry geometry, AssignmentRule rule, ContributionSink sink) {
        int assigned = 0;
        for (Zone zone : catalog.candidates(geometry)) {
            if (!zone.intersects(geometry)) {
                continue;
            }
            var weight = zone.containsProperly(geometry) ? wholeMeasure(geometry, rule) : measure(zone, geometry, rule);
            if (weight > 0.0) {
                sink.accept(zone, weight);
                assigned++;
            }
        }
        if (assigned > 0) {
            return assigned;
        }
        var owner = catalog.locate(Geometries.representativePoint(geometry));
        if (owner.isEmpty()) {
            return 0;
        }
        sink.accept(owner.get(), wholeMeasure(geometry, rule));
        return 1;
    }

    private double measure(Zone zone, Geometry geometry, AssignmentRule rule) {
        var piece = Geometries.intersection(zone.getGeometry(), geometry);
        switch (rule) {
            case LENGTH:
                if (piece.isEmpty()) {
                    return 0.0;
                }
                // linework running along the zone boundary is not inside the zone
                var inside = OverlayNGRobust.overlay(piece, zone.getBoundary(), OverlayNG.DIFFERENCE);
                var length = inside.getLength();
                return length > Geometries.AREA_EPSILON ? length : 0.0;
            case AREA:
                var area = piece.getArea();
                return area > Geometries.AREA_EPSILON ? area : 0.0;
            case SINGLE_PARTS:
                return Geometries.singlePartCount(piece);
            case PRESENCE:
                return piece.getArea() > Geometries.AREA_EPSILON ? 1.0 : 0.0;
            default:
                throw new IllegalArgumentException("Not an overlap rule: " + rule);
        }
    }

    private static double wholeMeasure(Geometry geometry, AssignmentRule rule) {
        switch (rule) {
            case LENGTH:
                return geometry.getLength();
            case AREA:
                return geometry.getArea();
            case SINGLE_PARTS:
                return Math.max(1, Geometries.singlePartCount(geometry));
            case PRESENCE:
                return 1.0;
            default:
                throw new IllegalArgumentException("Not an overlap rule: " + rule);
        }
    }
}
