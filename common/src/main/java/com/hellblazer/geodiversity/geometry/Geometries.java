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
package com.hellblazer.geodiversity.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.Puntal;
import org.locationtech.jts.geom.util.GeometryTransformer;
import org.locationtech.jts.linearref.LengthIndexedLine;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;

/**
 * Planar geometry helpers shared by the zone catalog, the feature assigner and the field writer. Everything here
 * works in the XY plane; Z and M ordinates are ignored on input and never produced on output.
 *
 * @author hal.hildebrand
 */
public final class Geometries {

    /**
     * Areas below this are treated as boundary contact rather than overlap
     */
    public static final double AREA_EPSILON = 1e-12;

    private Geometries() {
    }

    /**
     * Answer a copy of the geometry whose coordinates carry only X and Y.
     */
    public static Geometry force2D(Geometry geometry) {
        if (geometry == null) {
            return null;
        }
        return new XYTransformer().transform(geometry);
    }

    /**
     * Answer true if no coordinate of the geometry carries a Z or M ordinate
     */
    public static boolean isStrictly2D(Geometry geometry) {
        for (Coordinate c : geometry.getCoordinates()) {
            if (!Double.isNaN(c.getZ()) || !Double.isNaN(c.getM())) {
                return false;
            }
        }
        return true;
    }

    /**
     * The point that stands in for a whole feature when it must be owned by exactly one zone: the feature itself for
     * points, the midpoint along the length for lines, an interior point for polygons.
     */
    public static Coordinate representativePoint(Geometry geometry) {
        if (geometry instanceof Point point) {
            return point.getCoordinate();
        }
        if (geometry instanceof Puntal) {
            return geometry.getGeometryN(0).getCoordinate();
        }
        if (geometry instanceof Lineal) {
            var line = new LengthIndexedLine(geometry);
            return line.extractPoint(geometry.getLength() / 2.0);
        }
        if (geometry instanceof Polygonal) {
            return geometry.getInteriorPoint().getCoordinate();
        }
        return geometry.getCentroid().getCoordinate();
    }

    /**
     * Robust planar intersection of two geometries
     */
    public static Geometry intersection(Geometry a, Geometry b) {
        return OverlayNGRobust.overlay(a, b, OverlayNG.INTERSECTION);
    }

    /**
     * Count the single-part polygons of positive area in a (possibly heterogeneous) geometry, the way a multipart to
     * singlepart explode would report them.
     */
    public static int singlePartCount(Geometry geometry) {
        if (geometry == null || geometry.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            var part = geometry.getGeometryN(i);
            if (part == geometry) {
                if (part instanceof Polygon && part.getArea() > AREA_EPSILON) {
                    count++;
                }
            } else {
                count += singlePartCount(part);
            }
        }
        return count;
    }

    /**
     * Area of the rectangle shared by two envelopes, 0 if they are disjoint or only touch
     */
    public static double sharedArea(Envelope a, Envelope b) {
        var shared = a.intersection(b);
        return shared.isNull() ? 0.0 : shared.getArea();
    }

    private static final class XYTransformer extends GeometryTransformer {
        @Override
        protected CoordinateSequence transformCoordinates(CoordinateSequence coords, Geometry parent) {
            var xy = new Coordinate[coords.size()];
            for (int i = 0; i < xy.length; i++) {
                xy[i] = new CoordinateXY(coords.getX(i), coords.getY(i));
            }
            return factory.getCoordinateSequenceFactory().create(xy);
        }
    }
}
