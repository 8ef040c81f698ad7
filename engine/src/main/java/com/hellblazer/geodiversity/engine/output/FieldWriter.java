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

import com.hellblazer.geodiversity.common.ConfigurationException;
import com.hellblazer.geodiversity.engine.host.AttributeTable;
import com.hellblazer.geodiversity.engine.host.FieldDefinition;
import com.hellblazer.geodiversity.engine.host.FieldType;
import com.hellblazer.geodiversity.engine.host.TableLock;
import com.hellblazer.geodiversity.resource.ResourceHandle;
import com.hellblazer.geodiversity.resource.ResourceManager;
import com.hellblazer.geodiversity.resource.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Commits a staged result set onto the zone attribute table. Name resolution and all writes happen while the table
 * lock is held, so concurrent runs against the same table cannot pick the same new field name. Rerunning with the
 * same explicit name overwrites the field in place.
 *
 * @author hal.hildebrand
 */
public final class FieldWriter {
    private static final Logger log = LoggerFactory.getLogger(FieldWriter.class);

    private final FieldNames names;
    private final Double     noDataSentinel;
    private final boolean    standardize;

    /**
     * @param names          field naming rules
     * @param noDataSentinel value written for zones without a result, null for NULL
     * @param standardize    whether to write the standardized companion field
     */
    public FieldWriter(FieldNames names, Double noDataSentinel, boolean standardize) {
        this.names = names;
        this.noDataSentinel = noDataSentinel;
        this.standardize = standardize;
    }

    /**
     * Commit staged results
     *
     * @param table     the zone attribute table
     * @param staged    the staged result file
     * @param requested caller supplied field name, null to derive one from the layer name
     * @param overwrite overwrite an existing field of the derived name instead of adding a numbered one
     * @param resources the run's resource manager, which owns the table lock while it is held
     * @throws ConfigurationException if an existing field of the chosen name is not numeric
     * @throws InterruptedException   if interrupted while waiting for the table lock
     */
    public WrittenFields commit(AttributeTable table, Path staged, String requested, boolean overwrite,
                                ResourceManager resources)
    throws ConfigurationException, IOException, InterruptedException {
        var result = StagingTable.read(staged);
        var values = result.values();
        var standardized = standardize ? MinMaxStandardizer.standardize(result.metric().getCode(), values)
                                       : Map.<Long, Double>of();

        var explicit = requested != null && !requested.isBlank();
        var base = explicit ? names.sanitize(requested) : names.defaultName(result.layer(), result.metric());
        var alias = names.alias(result.layer(), result.metric());

        var tableLock = table.lock();
        ResourceHandle<TableLock> lock;
        try {
            lock = resources.manage(tableLock, ResourceType.TABLE_LOCK, "write lock on " + table.name(),
                                    TableLock::close);
        } catch (IllegalStateException e) {
            tableLock.close();
            throw e;
        }
        try {
            var plan = names.resolve(table, base, alias, explicit || overwrite, standardize);
            checkType(table, plan.field());
            if (plan.companion() != null) {
                checkType(table, plan.companion());
            }
            write(table, plan.field(), plan.alias(), values);
            if (plan.companion() != null) {
                write(table, plan.companion(), plan.companionAlias(), standardized);
            }
            log.info("{} {} on {} for {} zones{}", plan.overwriting() ? "Overwrote" : "Added", plan.field(),
                     table.name(), values.size(), plan.companion() == null ? "" : " with " + plan.companion());
            return new WrittenFields(plan, values, standardized);
        } finally {
            resources.release(lock);
        }
    }

    private static void checkType(AttributeTable table, String field) throws ConfigurationException {
        var existing = table.field(field);
        if (existing.isPresent() && existing.get().type() != FieldType.DOUBLE) {
            throw new ConfigurationException(
            "Field " + field + " exists on " + table.name() + " as " + existing.get().type()
            + " and cannot hold metric values");
        }
    }

    private void write(AttributeTable table, String field, String alias, Map<Long, Double> values) {
        if (!table.hasField(field)) {
            table.addField(FieldDefinition.doubleField(field, alias));
        }
        var column = new HashMap<Long, Double>(values.size());
        for (Map.Entry<Long, Double> entry : values.entrySet()) {
            var value = entry.getValue();
            column.put(entry.getKey(), value == null || Double.isNaN(value) ? noDataSentinel : value);
        }
        table.writeColumn(field, column);
    }
}
