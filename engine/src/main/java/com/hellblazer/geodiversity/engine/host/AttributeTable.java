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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The zone attribute table the computed fields are written to. Field names compare case-insensitively, as they do in
 * geodatabase tables.
 *
 * @author hal.hildebrand
 */
public interface AttributeTable {

    String name();

    List<FieldDefinition> fields();

    default Optional<FieldDefinition> field(String name) {
        var key = name.toUpperCase(Locale.ROOT);
        return fields().stream().filter(f -> f.name().toUpperCase(Locale.ROOT).equals(key)).findFirst();
    }

    default boolean hasField(String name) {
        return field(name).isPresent();
    }

    /**
     * Add a field. Adding a field that already exists with the same type is a no-op.
     *
     * @throws IllegalStateException if a field of that name exists with a different type
     */
    void addField(FieldDefinition field);

    /**
     * Write one column. Zones absent from the map, and null values, are written as NULL.
     */
    void writeColumn(String field, Map<Long, Double> values);

    /**
     * Acquire exclusive write access, blocking until it is available
     *
     * @throws InterruptedException if interrupted while waiting
     */
    TableLock lock() throws InterruptedException;
}
