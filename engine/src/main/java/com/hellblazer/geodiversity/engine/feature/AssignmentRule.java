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

/**
 * How a feature's contribution to a zone is measured
 *
 * @author hal.hildebrand
 */
public enum AssignmentRule {
    /**
     * Weight 1 for every zone containing at least one of the feature's points
     */
    POINT,
    /**
     * Weight is the length of the line inside the zone
     */
    LENGTH,
    /**
     * Weight is the area of the polygon inside the zone
     */
    AREA,
    /**
     * Weight is the number of single-part polygons the feature leaves in the zone
     */
    SINGLE_PARTS,
    /**
     * Weight 1 for every zone whose interior the feature overlaps
     */
    PRESENCE
}
