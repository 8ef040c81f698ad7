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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.geodiversity.common.ConfigurationException;
import com.hellblazer.geodiversity.engine.host.ContainerFormat;
import com.hellblazer.geodiversity.engine.host.FeatureRecord;
import com.hellblazer.geodiversity.engine.host.GeometryKind;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import com.hellblazer.geodiversity.engine.host.ZoneRecord;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads vector layers from JSON documents whose features carry WKT geometry:
 *
 * <pre>
 * {"name": "geology", "format": "FILE_GEODATABASE", "path": "data.gdb/geology", "crs": "EPSG:2180",
 *  "kind": "POLYGON", "features": [{"id": 1, "wkt": "POLYGON ((...))", "attributes": {"code": 3}}]}
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class LayerDocuments {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LayerDocuments() {
    }

    public static MemoryFeatureLayer readFeatures(InputStream input) throws ConfigurationException {
        var document = parse(input);
        var records = new ArrayList<FeatureRecord>(document.features.size());
        var geometries = new ArrayList<Geometry>(document.features.size());
        var reader = new WKTReader();
        for (Entry entry : document.features) {
            var geometry = read(reader, entry);
            geometries.add(geometry);
            records.add(new FeatureRecord(entry.id, geometry, entry.attributes));
        }
        return new MemoryFeatureLayer(descriptor(document, geometries), records);
    }

    public static MemoryZoneLayer readZones(InputStream input) throws ConfigurationException {
        var document = parse(input);
        var records = new ArrayList<ZoneRecord>(document.features.size());
        var geometries = new ArrayList<Geometry>(document.features.size());
        var reader = new WKTReader();
        for (Entry entry : document.features) {
            var geometry = read(reader, entry);
            geometries.add(geometry);
            records.add(new ZoneRecord(entry.id, geometry));
        }
        return new MemoryZoneLayer(descriptor(document, geometries), records);
    }

    private static Document parse(InputStream input) throws ConfigurationException {
        if (input == null) {
            throw new ConfigurationException("Layer document not found");
        }
        try (input) {
            var document = MAPPER.readValue(input, Document.class);
            if (document.name == null || document.kind == null) {
                throw new ConfigurationException("Layer document requires a name and a kind");
            }
            return document;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read layer document: " + e.getMessage(), e);
        }
    }

    private static Geometry read(WKTReader reader, Entry entry) throws ConfigurationException {
        if (entry.wkt == null) {
            return null;
        }
        try {
            return reader.read(entry.wkt);
        } catch (ParseException e) {
            throw new ConfigurationException("Invalid geometry for feature " + entry.id + ": " + e.getMessage(), e);
        }
    }

    private static LayerDescriptor descriptor(Document document, List<Geometry> geometries) {
        var extent = new Envelope();
        boolean hasZ = false;
        for (Geometry geometry : geometries) {
            if (geometry != null && !geometry.isEmpty()) {
                extent.expandToInclude(geometry.getEnvelopeInternal());
                hasZ |= !Geometries.isStrictly2D(geometry);
            }
        }
        var format = document.format == null ? ContainerFormat.MEMORY : document.format;
        return new LayerDescriptor(document.name, document.path, format, extent.isNull() ? null : extent,
                                   document.crs, document.kind, hasZ, false);
    }

    static class Document {
        public String          name;
        public String          path;
        public ContainerFormat format;
        public String          crs;
        public GeometryKind    kind;
        public List<Entry>     features = new ArrayList<>();
    }

    static class Entry {
        public long                id;
        public String              wkt;
        public Map<String, Object> attributes;
    }
}
