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
package com.hellblazer.geodiversity.engine.validation;

import com.hellblazer.geodiversity.common.SpatialMismatchException;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Confirms that a landscape layer and the grid are spatially compatible before any aggregation starts. Layers whose
 * extent shares no area with the grid are rejected; partial overlap is accepted with a warning. When both layers
 * declare a coordinate reference the declarations must agree.
 *
 * @author hal.hildebrand
 */
public final class ExtentValidator {
    private static final Logger log = LoggerFactory.getLogger(ExtentValidator.class);

    private ExtentValidator() {
    }

    public static ExtentRelation validate(LayerDescriptor grid, LayerDescriptor layer)
    throws SpatialMismatchException {
        checkReference(grid, layer);
        var relation = relate(grid.extent(), layer.extent(), layer.name());
        if (relation == ExtentRelation.PARTIAL) {
            log.warn("Layer {} only partially overlaps grid {}; zones outside the layer extent receive no data",
                     layer.name(), grid.name());
        } else {
            log.debug("Layer {} is contained in grid {}", layer.name(), grid.name());
        }
        return relation;
    }

    /**
     * Relate two extents
     *
     * @throws SpatialMismatchException if either extent is missing or the extents share no area
     */
    public static ExtentRelation relate(Envelope grid, Envelope layer, String layerName)
    throws SpatialMismatchException {
        if (grid == null || grid.isNull()) {
            throw new SpatialMismatchException("Grid has no extent");
        }
        if (layer == null || layer.isNull()) {
            throw new SpatialMismatchException("Layer " + layerName + " has no extent");
        }
        if (!overlaps(grid, layer)) {
            throw new SpatialMismatchException(
            "Extent of " + layerName + " " + layer + " does not overlap the grid extent " + grid);
        }
        return grid.covers(layer) ? ExtentRelation.CONTAINED : ExtentRelation.PARTIAL;
    }

    private static boolean overlaps(Envelope grid, Envelope layer) {
        if (isDegenerate(grid) || isDegenerate(layer)) {
            // a point layer with one feature, or features on a line, has no area of its own
            return grid.intersects(layer);
        }
        return Geometries.sharedArea(grid, layer) > 0.0;
    }

    private static boolean isDegenerate(Envelope envelope) {
        return envelope.getWidth() == 0.0 || envelope.getHeight() == 0.0;
    }

    private static void checkReference(LayerDescriptor grid, LayerDescriptor layer) throws SpatialMismatchException {
        if (grid.crs() == null || layer.crs() == null) {
            if (grid.crs() != layer.crs()) {
                log.warn("Coordinate reference undeclared for {}; assuming it matches {}",
                         grid.crs() == null ? grid.name() : layer.name(),
                         grid.crs() == null ? layer.crs() : grid.crs());
            }
            return;
        }
        if (!grid.crs().trim().equalsIgnoreCase(layer.crs().trim())) {
            throw new SpatialMismatchException(
            "Coordinate reference of " + layer.name() + " (" + layer.crs() + ") differs from grid " + grid.name()
            + " (" + grid.crs() + ")");
        }
    }
}
