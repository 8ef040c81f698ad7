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

import java.util.Objects;

/**
 * @author hal.hildebrand
 */
public record FieldDefinition(String name, String alias, FieldType type) {

    public FieldDefinition {
        Objects.requireNonNull(name, "Field name cannot be null");
        Objects.requireNonNull(type, "Field type cannot be null");
        if (alias == null || alias.isBlank()) {
            alias = name;
        }
    }

    public static FieldDefinition doubleField(String name, String alias) {
        return new FieldDefinition(name, alias, FieldType.DOUBLE);
    }
}
