package com.hellblazer.geodiversity.engine.feature;

import com.hellblazer.geodiversity.engine.host.RasterSample;
import com.hellblazer.geodiversity.engine.host.memory.MemoryZoneLayer;
import com.hellblazer.geodiversity.engine.zone.ZoneCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FeatureAssigner. The grid is 3 x 3 cells of 10 x 10 units, zone 1 in the lower left corner.
 */
public class FeatureAssignerTest {

    private final WKTReader       reader = new WKTReader();
    private       FeatureAssigner assigner;

    @BeforeEach
    void setUp() throws Exception {
        assigner = new FeatureAssigner(ZoneCatalog.build(MemoryZoneLayer.grid("grid", 0, 0, 10, 3, 3, null)));
    }

    private TreeMap<Long, Double> assign(String wkt, AssignmentRule rule) throws ParseException {
        return assign(reader.read(wkt), rule);
    }

    private TreeMap<Long, Double> assign(Geometry geometry, AssignmentRule rule) {
        var received = new TreeMap<Long, Double>();
        assigner.assign(geometry, rule, (zone, weight) -> received.merge(zone.getId(), weight, Double::sum));
        return received;
    }

    @Test
    void testPointInInterior() throws ParseException {
        assertEquals(Map.of(5L, 1.0), assign("POINT (15 15)", AssignmentRule.POINT));
    }

    @Test
    void testPointOnSharedBoundaryCountedOnce() throws ParseException {
        var received = assign("POINT (20 15)", AssignmentRule.POINT);
        assertEquals(Map.of(5L, 1.0), received);
    }

    @Test
    void testPointOutsideDropped() throws ParseException {
        assertTrue(assign("POINT (45 5)", AssignmentRule.POINT).isEmpty());
    }

    @Test
    void testMultiPointCountedOncePerZone() throws ParseException {
        var received = assign("MULTIPOINT ((1 1), (2 2), (25 25))", AssignmentRule.POINT);
        assertEquals(Map.of(1L, 1.0, 9L, 1.0), received);
        assertEquals(Map.of(1L, 1.0), assign("MULTIPOINT ((1 1), (2 2), (3 3))", AssignmentRule.POINT));
    }

    @Test
    void testReturnsNumberOfContributions() throws ParseException {
        assertEquals(2, assigner.assign(reader.read("MULTIPOINT ((1 1), (2 2), (15 5), (45 5))"), AssignmentRule.POINT,
                                        (zone, weight) -> {
                                        }));
        assertEquals(3, assigner.assign(reader.read("LINESTRING (5 5, 25 5)"), AssignmentRule.LENGTH,
                                        (zone, weight) -> {
                                        }));
    }

    @Test
    void testLineLengthSplitAcrossZones() throws ParseException {
        var received = assign("LINESTRING (5 5, 25 5)", AssignmentRule.LENGTH);
        assertEquals(3, received.size());
        assertEquals(5.0, received.get(1L), 1e-9);
        assertEquals(10.0, received.get(2L), 1e-9);
        assertEquals(5.0, received.get(3L), 1e-9);
    }

    @Test
    void testLineAlongSharedBoundaryNotDoubleCounted() throws ParseException {
        // runs along the edge between zones 1 and 2, midpoint (10, 5)
        var received = assign("LINESTRING (10 0, 10 10)", AssignmentRule.LENGTH);
        assertEquals(Map.of(1L, 10.0), received);
    }

    @Test
    void testLinePartlyOnBoundary() throws ParseException {
        // 5 units inside zone 1, then 10 units along the edge between zones 1 and 4
        var received = assign("LINESTRING (5 5, 5 10, 15 10)", AssignmentRule.LENGTH);
        assertEquals(Map.of(1L, 5.0), received);
    }

    @Test
    void testLineOutsideGridDropped() throws ParseException {
        assertTrue(assign("LINESTRING (40 0, 40 30)", AssignmentRule.LENGTH).isEmpty());
    }

    @Test
    void testPolygonAreaSplit() throws ParseException {
        var received = assign("POLYGON ((5 5, 15 5, 15 15, 5 15, 5 5))", AssignmentRule.AREA);
        assertEquals(4, received.size());
        for (long zone : new long[] { 1, 2, 4, 5 }) {
            assertEquals(25.0, received.get(zone), 1e-9);
        }
    }

    @Test
    void testPolygonTouchingNeighbourContributesOnlyToOverlappedZone() throws ParseException {
        var received = assign("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))", AssignmentRule.PRESENCE);
        assertEquals(Map.of(1L, 1.0), received);
    }

    @Test
    void testSinglePartsCountsPiecesPerZone() throws ParseException {
        // a U dipping into zone 1 twice, joined in zone 4 above it
        var u = "POLYGON ((1 5, 3 5, 3 12, 7 12, 7 5, 9 5, 9 15, 1 15, 1 5))";
        var received = assign(u, AssignmentRule.SINGLE_PARTS);
        assertEquals(2.0, received.get(1L));
        assertEquals(1.0, received.get(4L));
        var presence = assign(u, AssignmentRule.PRESENCE);
        assertEquals(1.0, presence.get(1L));
    }

    @Test
    void testPolygonWithZUsesPlanarArea() throws ParseException {
        var received = assign("POLYGON Z ((1 1 100, 4 1 200, 4 4 300, 1 4 400, 1 1 100))", AssignmentRule.AREA);
        assertEquals(Map.of(1L, 9.0), received);
    }

    @Test
    void testEmptyGeometryIgnored() throws ParseException {
        assertTrue(assign("POLYGON EMPTY", AssignmentRule.AREA).isEmpty());
    }

    @Test
    void testRasterSampleByCellCenter() {
        assertEquals(9, assigner.assign(RasterSample.of(25.5, 29.5, 3.0)).orElseThrow().getId());
        assertTrue(assigner.assign(RasterSample.of(30.5, 29.5, 3.0)).isEmpty());
    }
}
