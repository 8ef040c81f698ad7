package com.hellblazer.geodiversity.engine.zone;

import com.hellblazer.geodiversity.common.ConfigurationException;
import com.hellblazer.geodiversity.common.ErrorKind;
import com.hellblazer.geodiversity.engine.host.ZoneRecord;
import com.hellblazer.geodiversity.engine.host.memory.MemoryZoneLayer;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.WKTReader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ZoneCatalog
 */
public class ZoneCatalogTest {

    private final GeometryFactory factory = new GeometryFactory();

    @Test
    void testBuildGrid() throws ConfigurationException {
        var catalog = ZoneCatalog.build(MemoryZoneLayer.grid("grid", 0, 0, 10, 3, 3, null));
        assertEquals(9, catalog.size());
        assertEquals(new Envelope(0, 30, 0, 30), catalog.getExtent());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L), List.copyOf(catalog.ids()));
        assertEquals(new Envelope(10, 20, 10, 20), catalog.get(5).getExtent());
    }

    @Test
    void testEmptyZoneLayerIsFatal() {
        var e = assertThrows(ConfigurationException.class,
                             () -> ZoneCatalog.build(new MemoryZoneLayer("empty", null, List.of())));
        assertEquals(ErrorKind.CONFIGURATION, e.getKind());
        assertTrue(e.getKind().isFatal());
    }

    @Test
    void testDuplicateIdRejected() {
        var cell = factory.toGeometry(new Envelope(0, 1, 0, 1));
        var layer = new MemoryZoneLayer("dup", null, List.of(new ZoneRecord(7, cell), new ZoneRecord(7, cell)));
        var e = assertThrows(ConfigurationException.class, () -> ZoneCatalog.build(layer));
        assertTrue(e.getMessage().contains("7"));
    }

    @Test
    void testNonPolygonalZoneRejected() {
        var layer = new MemoryZoneLayer("points", null,
                                        List.of(new ZoneRecord(1, factory.createPoint(new Coordinate(1, 1)))));
        assertThrows(ConfigurationException.class, () -> ZoneCatalog.build(layer));
    }

    @Test
    void testMissingGeometryRejected() {
        var layer = new MemoryZoneLayer("nulls", null, List.of(new ZoneRecord(1, null)));
        assertThrows(ConfigurationException.class, () -> ZoneCatalog.build(layer));
    }

    @Test
    void testLocateInterior() throws ConfigurationException {
        var catalog = ZoneCatalog.build(MemoryZoneLayer.grid("grid", 0, 0, 10, 3, 3, null));
        assertEquals(5, catalog.locate(new Coordinate(15, 15)).orElseThrow().getId());
        assertEquals(3, catalog.locate(new Coordinate(29, 1)).orElseThrow().getId());
    }

    @Test
    void testLocateOnSharedBoundaryPicksLowestId() throws ConfigurationException {
        var catalog = ZoneCatalog.build(MemoryZoneLayer.grid("grid", 0, 0, 10, 3, 3, null));
        // edge between zones 1 and 2
        assertEquals(1, catalog.locate(new Coordinate(10, 5)).orElseThrow().getId());
        // corner shared by zones 1, 2, 4 and 5
        assertEquals(1, catalog.locate(new Coordinate(10, 10)).orElseThrow().getId());
        // outer edge of the grid belongs to the only zone covering it
        assertEquals(9, catalog.locate(new Coordinate(30, 25)).orElseThrow().getId());
    }

    @Test
    void testLocateOutside() throws ConfigurationException {
        var catalog = ZoneCatalog.build(MemoryZoneLayer.grid("grid", 0, 0, 10, 3, 3, null));
        assertTrue(catalog.locate(new Coordinate(-1, 5)).isEmpty());
        assertTrue(catalog.locate(new Coordinate(31, 31)).isEmpty());
    }

    @Test
    void testZoneWithHoleDoesNotOwnHole() throws Exception {
        var donut = new WKTReader().read(
        "POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0), (4 4, 6 4, 6 6, 4 6, 4 4))");
        var catalog = ZoneCatalog.build(new MemoryZoneLayer("donut", null, List.of(new ZoneRecord(1, donut))));
        assertTrue(catalog.locate(new Coordinate(5, 5)).isEmpty());
        assertEquals(1, catalog.locate(new Coordinate(2, 2)).orElseThrow().getId());
    }

    @Test
    void testZoneGeometryForcedTo2D() throws Exception {
        var withZ = new WKTReader().read("POLYGON Z ((0 0 5, 10 0 5, 10 10 5, 0 10 5, 0 0 5))");
        var catalog = ZoneCatalog.build(new MemoryZoneLayer("z", null, List.of(new ZoneRecord(1, withZ))));
        assertTrue(Geometries.isStrictly2D(catalog.get(1).getGeometry()));
    }

    @Test
    void testCandidatesSortedById() throws ConfigurationException {
        var catalog = ZoneCatalog.build(MemoryZoneLayer.grid("grid", 0, 0, 10, 3, 3, null));
        var hits = catalog.candidates(new Envelope(5, 15, 5, 15));
        assertEquals(List.of(1L, 2L, 4L, 5L), hits.stream().map(Zone::getId).toList());
    }
}
