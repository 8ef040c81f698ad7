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

import com.hellblazer.geodiversity.engine.host.AttributeTable;
import com.hellblazer.geodiversity.engine.host.FieldDefinition;
import com.hellblazer.geodiversity.engine.host.TableLock;
import com.hellblazer.geodiversity.engine.host.ZoneLayer;
import com.hellblazer.geodiversity.engine.host.ZoneRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Attribute table held in memory, one row per zone id. Writes are guarded by a re-entrant lock.
 *
 * @author hal.hildebrand
 */
public class MemoryAttributeTable implements AttributeTable {

    private final String                         name;
    private final Set<Long>                      rows;
    private final Map<String, FieldDefinition>   fields       = new LinkedHashMap<>();
    private final Map<String, Map<Long, Double>> columns      = new HashMap<>();
    private final ReentrantLock                  lock         = new ReentrantLock();
    private final AtomicInteger                  columnWrites = new AtomicInteger();

    public MemoryAttributeTable(String name, Collection<Long> rows) {
        this.name = name;
        this.rows = Collections.unmodifiableSet(new LinkedHashSet<>(rows));
    }

    public static MemoryAttributeTable forZones(ZoneLayer zones) {
        return new MemoryAttributeTable(zones.descriptor().name(),
                                        zones.zones().map(ZoneRecord::id).collect(Collectors.toList()));
    }

    private static String key(String field) {
        return field.toUpperCase(Locale.ROOT);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized List<FieldDefinition> fields() {
        return new ArrayList<>(fields.values());
    }

    @Override
    public synchronized void addField(FieldDefinition field) {
        var existing = fields.get(key(field.name()));
        if (existing != null) {
            if (existing.type() != field.type()) {
                throw new IllegalStateException(
                "Field " + existing.name() + " exists as " + existing.type() + ", cannot add as " + field.type());
            }
            return;
        }
        fields.put(key(field.name()), field);
        columns.put(key(field.name()), new HashMap<>());
    }

    @Override
    public synchronized void writeColumn(String field, Map<Long, Double> values) {
        var column = columns.get(key(field));
        if (column == null) {
            throw new IllegalStateException("No such field: " + field + " in " + name);
        }
        column.clear();
        for (Long row : rows) {
            var value = values.get(row);
            if (value != null) {
                column.put(row, value);
            }
        }
        columnWrites.incrementAndGet();
    }

    @Override
    public TableLock lock() throws InterruptedException {
        lock.lockInterruptibly();
        return lock::unlock;
    }

    /**
     * Answer the stored value, null when the cell is NULL
     */
    public synchronized Double value(long row, String field) {
        var column = columns.get(key(field));
        if (column == null) {
            throw new IllegalStateException("No such field: " + field + " in " + name);
        }
        return column.get(row);
    }

    public synchronized Map<Long, Double> column(String field) {
        var column = columns.get(key(field));
        if (column == null) {
            throw new IllegalStateException("No such field: " + field + " in " + name);
        }
        return Collections.unmodifiableMap(new HashMap<>(column));
    }

    public Set<Long> rows() {
        return rows;
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    /**
     * True while another thread is blocked waiting for the write lock
     */
    public boolean hasWaiters() {
        return lock.hasQueuedThreads();
    }

    public int getColumnWrites() {
        return columnWrites.get();
    }
}
