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

import com.hellblazer.geodiversity.common.CategoryCode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Summed weight per category: covered area for polygons, point count for points
 *
 * @author hal.hildebrand
 */
public class CategoryWeightAccumulator extends ZoneAccumulator {

    private final Map<CategoryCode, Double> weights = new HashMap<>();
    private       double                    total;
    private       long                      samples;

    public void add(CategoryCode category, double weight) {
        weights.merge(category, weight, Double::sum);
        total += weight;
        samples++;
    }

    public Map<CategoryCode, Double> getWeights() {
        return Collections.unmodifiableMap(weights);
    }

    public double getTotal() {
        return total;
    }

    @Override
    public long sampleCount() {
        return samples;
    }
}
