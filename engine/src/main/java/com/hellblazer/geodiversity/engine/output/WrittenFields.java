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

import java.util.Map;

/**
 * What a commit wrote
 *
 * @param plan         the field names used
 * @param values       metric value per zone, NaN for no data
 * @param standardized standardized value per zone, empty when no companion was written
 * @author hal.hildebrand
 */
public record WrittenFields(FieldPlan plan, Map<Long, Double> values, Map<Long, Double> standardized) {

    public WrittenFields {
        values = Map.copyOf(values);
        standardized = Map.copyOf(standardized);
    }
}
