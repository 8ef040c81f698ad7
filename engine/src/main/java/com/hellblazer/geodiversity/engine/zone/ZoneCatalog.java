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
package com.hellblazer.geodiversity.engine.zone;

import com.hellblazer.geodiversity.common.ConfigurationException;
import com.hellblazer.geodiversity.engine.host.ZoneLayer;
import com.hellblazer.geodiversity.engine.host.ZoneRecord;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory mapping from zone id to zone geometry and extent, with an STR-packed R-tree over the zone extents. The
 * catalog is loaded once per run from the zone layer and is read-only afterwards; every lookup in the aggregation loop
 * is served from it.
 *
 * @author hal.hildebrand
 */
public final class ZoneCatalog implements Iterable<Zone> {
    private static final Logger log = LoggerFactory.getLogger(ZoneCatalog.class);

    private final NavigableMap<Long, Zone> zones;
    private final STRtree                  index;
    private final Envelope                 extent;

    private ZoneCatalog(NavigableMap<Long, Zone> zones, STRtree index, Envelope extent) {
        this.zones = Collections.unmodifiableNavigableMap(zones);
        this.index = index;
        this.extent = extent;
    }

    /**
     * Load the zones of a layer
     *
     * @throws ConfigurationException if the layer holds no zones, a zone id repeats, or a zone geometry is missing,
     *                                empty or not polygonal
     */
    public static ZoneCatalog build(ZoneLayer layer) throws ConfigurationException {
        var zones = new TreeMap<Long, Zone>();
        var extent = new Envelope();
        var records = layer.zones().iterator();
        while (records.hasNext()) {
            ZoneRecord record = records.next();
            var geometry = record.geometry();
            if (geometry == null || geometry.isEmpty()) {
                throw new ConfigurationException("Zone " + record.id() + " has no geometry");
            }
            if (!(geometry instanceof Polygonal)) {
                throw new ConfigurationException(
                "Zone " + record.id() + " is not polygonal: " + geometry.getGeometryType());
            }
            var zone = new Zone(record.id(), Geometries.force2D(geometry));
            if (zones.putIfAbsent(zone.getId(), zone) != null) {
                throw new ConfigurationException("Duplicate zone id: " + record.id());
            }
            extent.expandToInclude(zone.getExtent());
        }
        if (zones.isEmpty()) {
            throw new ConfigurationException("Zone layer " + layer.descriptor().name() + " holds no zones");
        }

        var index = new STRtree();
        for (Zone zone : zones.values()) {
            index.insert(zone.getExtent(), zone);
        }
        index.build();
        log.info("Zone catalog built: {} zones from {}, extent {}", zones.size(), layer.descriptor().name(), extent);
        return new ZoneCatalog(zones, index, extent);
    }

    public int size() {
        return zones.size();
    }

    public Zone get(long id) {
        return zones.get(id);
    }

    public Set<Long> ids() {
        return zones.keySet();
    }

    public Collection<Zone> zones() {
        return zones.values();
    }

    public Envelope getExtent() {
        return new Envelope(extent);
    }

    /**
     * Zones whose extent intersects the envelope, in ascending id order
     */
    public List<Zone> candidates(Envelope envelope) {
        @SuppressWarnings("unchecked")
        List<Zone> hits = new ArrayList<>(index.query(envelope));
        Collections.sort(hits);
        return hits;
    }

    public List<Zone> candidates(Geometry geometry) {
        return candidates(geometry.getEnvelopeInternal());
    }

    /**
     * The zone owning a location: the zone whose interior contains it, or, for a location on a shared boundary, the
     * lowest id zone covering it.
     */
    public Optional<Zone> locate(Coordinate coordinate) {
        if (!extent.covers(coordinate)) {
            return Optional.empty();
        }
        var candidates = candidates(new Envelope(coordinate));
        for (Zone zone : candidates) {
            if (zone.contains(coordinate)) {
                return Optional.of(zone);
            }
        }
        for (Zone zone : candidates) {
            if (zone.covers(coordinate)) {
                return Optional.of(zone);
            }
        }
        return Optional.empty();
    }

    @Override
    public Iterator<Zone> iterator() {
        return zones.values().iterator();
    }
}
