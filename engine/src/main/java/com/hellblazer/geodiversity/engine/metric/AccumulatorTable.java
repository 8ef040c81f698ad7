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
package com.hellblazer.geodiversity.engine.metric;

import com.hellblazer.geodiversity.engine.zone.Zone;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Per-run associative store of zone accumulators, keyed by zone id. An entry is created when the zone receives its
 * first contribution, so absence at reduction time means nothing fell into the zone. Confined to the thread running
 * the streaming pass.
 *
 * @author hal.hildebrand
 */
public final class AccumulatorTable<A extends ZoneAccumulator> {

    private final Map<Long, A>      entries = new HashMap<>();
    private final Function<Zone, A> factory;

    public AccumulatorTable(Function<Zone, A> factory) {
        this.factory = factory;
    }

    /**
     * The zone's accumulator, created on first use
     */
    public A entry(Zone zone) {
        return entries.computeIfAbsent(zone.getId(), id -> factory.apply(zone));
    }

    /**
     * The zone's accumulator, or null if the zone has received nothing
     */
    public A get(long zoneId) {
        return entries.get(zoneId);
    }

    public boolean contains(long zoneId) {
        return entries.containsKey(zoneId);
    }

    public int size() {
        return entries.size();
    }

    public Map<Long, A> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
