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
package com.hellblazer.geodiversity.engine.host.memory;

import com.hellblazer.geodiversity.engine.host.FieldDefinition;
import com.hellblazer.geodiversity.engine.host.OutputLayerSink;
import com.hellblazer.geodiversity.engine.host.OutputRow;

import java.util.List;

/**
 * Collects an exported layer in memory
 *
 * @author hal.hildebrand
 */
public class MemoryOutputLayer implements OutputLayerSink {

    private volatile String                name;
    private volatile List<FieldDefinition> fields = List.of();
    private volatile List<OutputRow>       rows   = List.of();

    @Override
    public void write(String layerName, List<FieldDefinition> fields, List<OutputRow> rows) {
        this.name = layerName;
        this.fields = List.copyOf(fields);
        this.rows = List.copyOf(rows);
    }

    public String getName() {
        return name;
    }

    public List<FieldDefinition> getFields() {
        return fields;
    }

    public List<OutputRow> getRows() {
        return rows;
    }
}
