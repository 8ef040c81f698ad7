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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.hellblazer.geodiversity.engine.metric.MetricCode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete result set of a run, as staged in the run's workspace before commit
 *
 * @param metric  the computed metric
 * @param layer   name of the landscape layer, used to derive default field names
 * @param results one entry per zone, in ascending zone id order
 * @author hal.hildebrand
 */
public record StagedResult(MetricCode metric, String layer, List<MetricResult> results) {

    public StagedResult {
        results = List.copyOf(results);
    }

    public static StagedResult of(MetricCode metric, String layer, Map<Long, Double> values) {
        return new StagedResult(metric, layer, values.entrySet()
                                                     .stream()
                                                     .map(e -> new MetricResult(e.getKey(), e.getValue()))
                                                     .toList());
    }

    @JsonIgnore
    public Map<Long, Double> values() {
        var values = new LinkedHashMap<Long, Double>();
        for (MetricResult result : results) {
            values.put(result.zoneId(), result.value());
        }
        return values;
    }
}
