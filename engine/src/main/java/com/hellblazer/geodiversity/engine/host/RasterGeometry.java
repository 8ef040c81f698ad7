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

/**
 * Georeferencing of a north-up raster. Rows run from the top edge downwards.
 *
 * @param originX    x of the upper left corner
 * @param originY    y of the upper left corner
 * @param cellWidth  cell size along x
 * @param cellHeight cell size along y, positive
 * @param columns    number of columns
 * @param rows       number of rows
 * @author hal.hildebrand
 */
public record RasterGeometry(double originX, double originY, double cellWidth, double cellHeight, int columns,
                             int rows) {

    public RasterGeometry {
        if (cellWidth <= 0 || cellHeight <= 0) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellWidth + " x " + cellHeight);
        }
        if (columns < 0 || rows < 0) {
            throw new IllegalArgumentException("Raster dimensions cannot be negative: " + columns + " x " + rows);
        }
    }

    public double cellCenterX(int column) {
        return originX + (column + 0.5) * cellWidth;
    }

    public double cellCenterY(int row) {
        return originY - (row + 0.5) * cellHeight;
    }

    public Envelope envelope() {
        return new Envelope(originX, originX + columns * cellWidth, originY - rows * cellHeight, originY);
    }

    public long cellCount() {
        return (long) columns * rows;
    }
}
