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

import com.hellblazer.geodiversity.engine.host.GeometryKind;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import com.hellblazer.geodiversity.engine.host.RasterGeometry;
import com.hellblazer.geodiversity.engine.host.RasterLayer;
import com.hellblazer.geodiversity.engine.host.RasterSample;

import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Single band raster held in memory as rows of values, the first row at the top edge
 *
 * @author hal.hildebrand
 */
public class MemoryRasterLayer implements RasterLayer {

    private final LayerDescriptor descriptor;
    private final RasterGeometry  geometry;
    private final double[][]      values;
    private final double          noDataValue;

    public MemoryRasterLayer(LayerDescriptor descriptor, RasterGeometry geometry, double[][] values,
                             double noDataValue) {
        if (values.length != geometry.rows()) {
            throw new IllegalArgumentException("Expected " + geometry.rows() + " rows, got " + values.length);
        }
        for (double[] row : values) {
            if (row.length != geometry.columns()) {
                throw new IllegalArgumentException("Expected " + geometry.columns() + " columns, got " + row.length);
            }
        }
        this.descriptor = descriptor;
        this.geometry = geometry;
        this.values = values;
        this.noDataValue = noDataValue;
    }

    /**
     * Raster whose upper left corner is at (originX, originY) with square cells
     */
    public static MemoryRasterLayer of(String name, double originX, double originY, double cellSize,
                                       double[][] values, double noDataValue, String crs) {
        int columns = values.length == 0 ? 0 : values[0].length;
        var geometry = new RasterGeometry(originX, originY, cellSize, cellSize, columns, values.length);
        var descriptor = LayerDescriptor.memory(name, GeometryKind.RASTER, geometry.envelope(), crs);
        return new MemoryRasterLayer(descriptor, geometry, values, noDataValue);
    }

    @Override
    public LayerDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public RasterGeometry geometry() {
        return geometry;
    }

    @Override
    public double noDataValue() {
        return noDataValue;
    }

    @Override
    public Stream<RasterSample> samples() {
        return IntStream.range(0, geometry.rows()).boxed().flatMap(row -> IntStream.range(0, geometry.columns())
                                                                                     .mapToObj(
                                                                                     column -> sample(row, column)));
    }

    private RasterSample sample(int row, int column) {
        var x = geometry.cellCenterX(column);
        var y = geometry.cellCenterY(row);
        var value = values[row][column];
        if (Double.isNaN(value) || value == noDataValue) {
            return RasterSample.missing(x, y);
        }
        return RasterSample.of(x, y, value);
    }
}
