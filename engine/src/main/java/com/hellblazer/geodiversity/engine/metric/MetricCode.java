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
package com.hellblazer.geodiversity.engine.metric;

import com.hellblazer.geodiversity.engine.host.GeometryKind;

import java.util.Locale;

/**
 * The nine geodiversity indices
 *
 * @author hal.hildebrand
 */
public enum MetricCode {
    A_NE("A_Ne", "ANe", GeometryKind.POLYGON, false, "Number of polygon elements"),
    A_NC("A_Nc", "ANc", GeometryKind.POLYGON, true, "Number of polygon categories"),
    A_SHDI("A_SHDI", "SHDI", GeometryKind.POLYGON, true, "Shannon diversity of polygon categories"),
    L_TL("L_Tl", "Tl", GeometryKind.LINE, false, "Total length of lines"),
    P_NE("P_Ne", "PNe", GeometryKind.POINT, false, "Number of point elements"),
    P_NC("P_Nc", "PNc", GeometryKind.POINT, true, "Number of point categories"),
    P_HU("P_Hu", "Hu", GeometryKind.POINT, true, "Unit entropy of point categories"),
    R_SD("R_SD", "RSD", GeometryKind.RASTER, false, "Standard deviation of raster values"),
    R_SDC("R_SDc", "RSDc", GeometryKind.RASTER, false, "Circular standard deviation of raster values"),
    R_M("R_M", "RM", GeometryKind.RASTER, false, "Multiscale relief index");

    private final String       code;
    private final String       suffix;
    private final GeometryKind input;
    private final boolean      categorical;
    private final String       description;

    MetricCode(String code, String suffix, GeometryKind input, boolean categorical, String description) {
        this.code = code;
        this.suffix = suffix;
        this.input = input;
        this.categorical = categorical;
        this.description = description;
    }

    /**
     * Look a metric up by its code, ignoring case
     */
    public static MetricCode fromCode(String code) {
        var key = code.trim().toUpperCase(Locale.ROOT);
        for (MetricCode metric : values()) {
            if (metric.code.toUpperCase(Locale.ROOT).equals(key)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + code);
    }

    public String getCode() {
        return code;
    }

    /**
     * Suffix of the default output field name
     */
    public String getSuffix() {
        return suffix;
    }

    public GeometryKind getInput() {
        return input;
    }

    public boolean isCategorical() {
        return categorical;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Count metrics report zero, not no-data, for zones nothing falls into
     */
    public boolean isCount() {
        return this == A_NE || this == P_NE;
    }

    /**
     * Metrics that need several samples in a zone before they mean anything
     */
    public boolean isSampleSensitive() {
        return this == R_SDC || this == R_M;
    }

    public double emptyValue() {
        return isCount() ? 0.0 : Double.NaN;
    }
}
