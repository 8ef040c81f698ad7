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

import java.util.Locale;

/**
 * Storage container of a layer. Only transactional, geodatabase-style containers carry the long field names and the
 * concurrent access guarantees the engine relies on.
 *
 * @author hal.hildebrand
 */
public enum ContainerFormat {
    FILE_GEODATABASE(true),
    MOBILE_GEODATABASE(true),
    ENTERPRISE_GEODATABASE(true),
    MEMORY(true),
    SHAPEFILE(false);

    private final boolean transactional;

    ContainerFormat(boolean transactional) {
        this.transactional = transactional;
    }

    /**
     * Determine the container from a catalog path, falling back to the declared format
     */
    public static ContainerFormat resolve(String path, ContainerFormat declared) {
        if (path != null) {
            var lower = path.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".shp")) {
                return SHAPEFILE;
            }
            if (lower.contains(".gdb/") || lower.contains(".gdb\\") || lower.endsWith(".gdb")) {
                return declared == null ? FILE_GEODATABASE : declared;
            }
            if (lower.endsWith(".geodatabase") || lower.contains(".geodatabase/")) {
                return declared == null ? MOBILE_GEODATABASE : declared;
            }
        }
        return declared;
    }

    public boolean isTransactional() {
        return transactional;
    }
}
