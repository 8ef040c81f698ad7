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
package com.hellblazer.geodiversity.engine.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rescales a metric column to [0, 1] with (v - min) / (max - min) over the zones that have a finite value, so that
 * indices can be compared across grids. No-data stays no-data; infinite values map to 1.
 *
 * @author hal.hildebrand
 */
public final class MinMaxStandardizer {
    private static final Logger log = LoggerFactory.getLogger(MinMaxStandardizer.class);

    private MinMaxStandardizer() {
    }

    public static Map<Long, Double> standardize(String field, Map<Long, Double> values) {
        var min = Double.POSITIVE_INFINITY;
        var max = Double.NEGATIVE_INFINITY;
        for (Double value : values.values()) {
            if (value != null && Double.isFinite(value)) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }
        var range = max - min;
        if (min <= max && range == 0.0) {
            log.warn("All values of {} are {}; standardized values set to 0", field, min);
        }

        var standardized = new LinkedHashMap<Long, Double>();
        for (Map.Entry<Long, Double> entry : values.entrySet()) {
            var value = entry.getValue();
            double result;
            if (value == null || Double.isNaN(value)) {
                result = Double.NaN;
            } else if (Double.isInfinite(value)) {
                result = 1.0;
            } else if (range == 0.0) {
                result = 0.0;
            } else {
                result = (value - min) / range;
            }
            standardized.put(entry.getKey(), result);
        }
        return standardized;
    }
}
