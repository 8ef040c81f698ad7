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

import com.hellblazer.geodiversity.engine.host.FieldDefinition;
import com.hellblazer.geodiversity.engine.host.OutputLayerSink;
import com.hellblazer.geodiversity.engine.host.OutputRow;
import com.hellblazer.geodiversity.engine.zone.Zone;
import com.hellblazer.geodiversity.engine.zone.ZoneCatalog;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Exports a strictly 2D copy of the grid carrying the fields written by a commit
 *
 * @author hal.hildebrand
 */
public final class LayerExporter {
    private static final Logger log = LoggerFactory.getLogger(LayerExporter.class);

    private LayerExporter() {
    }

    public static void export(OutputLayerSink sink, String layerName, ZoneCatalog catalog, WrittenFields written) {
        var plan = written.plan();
        var fields = new ArrayList<FieldDefinition>();
        fields.add(FieldDefinition.doubleField(plan.field(), plan.alias()));
        if (plan.companion() != null) {
            fields.add(FieldDefinition.doubleField(plan.companion(), plan.companionAlias()));
        }
        var rows = new ArrayList<OutputRow>(catalog.size());
        for (Zone zone : catalog) {
            var values = new HashMap<String, Double>();
            values.put(plan.field(), written.values().getOrDefault(zone.getId(), Double.NaN));
            if (plan.companion() != null) {
                values.put(plan.companion(), written.standardized().getOrDefault(zone.getId(), Double.NaN));
            }
            rows.add(new OutputRow(zone.getId(), Geometries.force2D(zone.getGeometry()), values));
        }
        sink.write(layerName, List.copyOf(fields), rows);
        log.info("Exported {} zones to {}", rows.size(), layerName);
    }
}
