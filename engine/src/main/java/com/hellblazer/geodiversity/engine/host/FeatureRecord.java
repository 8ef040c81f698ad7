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

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.Map;

/**
 * A vector landscape element: its geometry and the attribute values the host read with it
 *
 * @author hal.hildebrand
 */
public record FeatureRecord(long fid, Geometry geometry, Map<String, Object> attributes) {

    public FeatureRecord {
        attributes = attributes == null ? Collections.emptyMap() : Collections.unmodifiableMap(attributes);
    }

    public FeatureRecord(long fid, Geometry geometry) {
        this(fid, geometry, null);
    }

    /**
     * Answer the value of the named attribute, or null if the feature does not carry it
     */
    public Object attribute(String field) {
        return attributes.get(field);
    }
}
