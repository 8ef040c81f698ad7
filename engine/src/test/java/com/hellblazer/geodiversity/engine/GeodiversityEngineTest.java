package com.hellblazer.geodiversity.engine;

import com.hellblazer.geodiversity.common.ConfigurationException;
import com.hellblazer.geodiversity.common.FormatRejectedException;
import com.hellblazer.geodiversity.common.GeodiversityException;
import com.hellblazer.geodiversity.common.SpatialMismatchException;
import com.hellblazer.geodiversity.engine.host.ContainerFormat;
import com.hellblazer.geodiversity.engine.host.GeometryKind;
import com.hellblazer.geodiversity.engine.host.OutputRow;
import com.hellblazer.geodiversity.engine.host.memory.MemoryAttributeTable;
import com.hellblazer.geodiversity.engine.host.memory.MemoryFeatureLayer;
import com.hellblazer.geodiversity.engine.host.memory.MemoryOutputLayer;
import com.hellblazer.geodiversity.engine.host.memory.MemoryRasterLayer;
import com.hellblazer.geodiversity.engine.host.memory.MemoryZoneLayer;
import com.hellblazer.geodiversity.engine.metric.AngleUnit;
import com.hellblazer.geodiversity.engine.metric.MetricCode;
import com.hellblazer.geodiversity.engine.validation.ExtentRelation;
import com.hellblazer.geodiversity.geometry.Geometries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GeodiversityEngine, end to end over in-memory layers
 */
public class GeodiversityEngineTest {
    private static final String CRS             = "EPSG:2180";
    private static final int[]  POINTS_PER_ZONE = { 12, 10, 8, 7, 6, 5, 4, 2, 0 };
    private static final double TOLERANCE       = 1e-9;

    private final GeometryFactory factory = new GeometryFactory();

    @TempDir
    Path workspaceRoot;

    private GeodiversityEngine   engine;
    private MemoryZoneLayer      grid;
    private MemoryAttributeTable table;

    @BeforeEach
    void setUp() {
        engine = new GeodiversityEngine(config().build());
        grid = MemoryZoneLayer.grid("grid", 0, 0, 10, 3, 3, CRS);
        table = MemoryAttributeTable.forZones(grid);
    }

    private GeodiversityConfiguration.Builder config() {
        return GeodiversityConfiguration.builder().withWorkspaceRoot(workspaceRoot).withReleaseOnShutdown(false);
    }

    /**
     * Points laid out row by row inside each 10 x 10 zone, category cycling 1..5
     */
    private MemoryFeatureLayer points(boolean reversed) {
        var records = new ArrayList<Object[]>();
        for (int zone = 0; zone < POINTS_PER_ZONE.length; zone++) {
            var column = zone % 3;
            var row = zone / 3;
            for (int j = 0; j < POINTS_PER_ZONE[zone]; j++) {
                var x = column * 10 + 1 + (j % 8);
                var y = row * 10 + 1 + j / 8;
                records.add(new Object[] { x, y, (j % 5) + 1 });
            }
        }
        if (reversed) {
            Collections.reverse(records);
        }
        var builder = MemoryFeatureLayer.builder("poi", GeometryKind.POINT).crs(CRS);
        for (Object[] r : records) {
            builder.add(factory.createPoint(new Coordinate((int) r[0], (int) r[1])), Map.of("cat", r[2]));
        }
        return builder.build();
    }

    private MemoryFeatureLayer polygons() {
        return MemoryFeatureLayer.builder("geology", GeometryKind.POLYGON)
                                 .crs(CRS)
                                 .add(box(0, 0, 10, 10), Map.of("unit", 1))
                                 .add(box(10, 0, 30, 10), Map.of("unit", 2))
                                 .add(box(0, 10, 15, 20), Map.of("unit", 3))
                                 .add(box(15, 10, 30, 20), Map.of("unit", 4))
                                 .add(box(0, 20, 10, 25), Map.of("unit", 1))
                                 .add(box(0, 25, 10, 30), Map.of("unit", 2))
                                 .add(box(20, 20, 30, 30), Map.of("unit", 3))
                                 .build();
    }

    private Geometry box(double minX, double minY, double maxX, double maxY) {
        return factory.toGeometry(new Envelope(minX, maxX, minY, maxY));
    }

    private static double entropyOfCycle(int n) {
        var counts = new int[5];
        for (int j = 0; j < n; j++) {
            counts[j % 5]++;
        }
        double h = 0.0;
        for (int c : counts) {
            if (c > 0) {
                var p = (double) c / n;
                h -= p * Math.log(p);
            }
        }
        return h;
    }

    private MetricRequest.Builder pointRequest(MetricCode metric) {
        var request = MetricRequest.builder(metric).withZones(grid, table).withFeatures(points(false));
        return metric.isCategorical() ? request.withCategoryField("cat") : request;
    }

    @Test
    void testPointElementCountAndCompanion() throws GeodiversityException {
        var report = engine.run(pointRequest(MetricCode.P_NE).build());

        assertEquals(List.of("POI_PNe", "POI_PNe_MM"), report.getFieldNames());
        for (int zone = 1; zone <= 9; zone++) {
            assertEquals(POINTS_PER_ZONE[zone - 1], report.getResult(zone));
            assertEquals((double) POINTS_PER_ZONE[zone - 1], table.value(zone, "POI_PNe"));
            assertEquals(POINTS_PER_ZONE[zone - 1] / 12.0, table.value(zone, "POI_PNe_MM"), TOLERANCE);
        }
        assertEquals("POI_P_Ne", table.field("POI_PNe").orElseThrow().alias());
        assertEquals("Std_POI_P_Ne", table.field("POI_PNe_MM").orElseThrow().alias());
        assertEquals(54, report.getRead());
        assertEquals(54, report.getAssigned());
        assertEquals(0, report.getDropped());
        assertEquals(ExtentRelation.CONTAINED, report.getExtentRelation());
        assertFalse(table.isLocked());
    }

    @Test
    void testMultiPointFeatureCountsAsOneElement() throws GeodiversityException {
        var cluster = factory.createMultiPointFromCoords(
        new Coordinate[] { new Coordinate(1, 1), new Coordinate(2, 2), new Coordinate(3, 3) });
        var layer = MemoryFeatureLayer.builder("springs", GeometryKind.POINT)
                                      .crs(CRS)
                                      .add(cluster, Map.of("cat", 1))
                                      .add(factory.createPoint(new Coordinate(15, 5)), Map.of("cat", 2))
                                      .build();

        var report = engine.run(MetricRequest.builder(MetricCode.P_NE).withZones(grid, table).withFeatures(layer)
                                             .build());

        assertEquals(1.0, report.getResult(1));
        assertEquals(1.0, report.getResult(2));
        assertEquals(0.0, report.getResult(3));
        assertEquals(2, report.getRead());
        assertEquals(2, report.getAssigned());

        var entropy = engine.run(MetricRequest.builder(MetricCode.P_HU).withZones(grid, table).withFeatures(layer)
                                              .withCategoryField("cat").build());
        assertEquals(0.0, entropy.getResult(1), TOLERANCE);
    }

    @Test
    void testPointCategoryCountAndEntropy() throws GeodiversityException {
        var richness = engine.run(pointRequest(MetricCode.P_NC).build());
        var entropy = engine.run(pointRequest(MetricCode.P_HU).build());

        for (int zone = 1; zone <= 8; zone++) {
            var n = POINTS_PER_ZONE[zone - 1];
            assertEquals(Math.min(n, 5), richness.getResult(zone));
            assertEquals(entropyOfCycle(n), entropy.getResult(zone), TOLERANCE);
        }
        assertEquals(Math.log(2), entropy.getResult(8), TOLERANCE);
        assertTrue(Double.isNaN(richness.getResult(9)));
        assertTrue(Double.isNaN(entropy.getResult(9)));
        assertNull(table.value(9, entropy.getFields().field()));
    }

    @Test
    void testCategoryCountIndependentOfFeatureOrder() throws GeodiversityException {
        var forward = engine.run(pointRequest(MetricCode.P_NC).build());
        var other = MemoryAttributeTable.forZones(grid);
        var backward = engine.run(MetricRequest.builder(MetricCode.P_NC)
                                               .withZones(grid, other)
                                               .withFeatures(points(true))
                                               .withCategoryField("cat")
                                               .build());
        assertEquals(forward.getResults(), backward.getResults());
    }

    @Test
    void testPolygonShannonDiversity() throws GeodiversityException {
        var report = engine.run(MetricRequest.builder(MetricCode.A_SHDI)
                                             .withZones(grid, table)
                                             .withFeatures(polygons())
                                             .withCategoryField("unit")
                                             .build());

        assertEquals("GEO_SHDI", report.getFields().field());
        var expected = new double[] { 0, 0, 0, 0, Math.log(2), 0, Math.log(2), Double.NaN, 0 };
        for (int zone = 1; zone <= 9; zone++) {
            assertEquals(expected[zone - 1], report.getResult(zone), TOLERANCE, "zone " + zone);
        }
        assertNull(table.value(8, "GEO_SHDI"));
        assertEquals(1.0, table.value(5, "GEO_SHDI_MM"), TOLERANCE);
        assertEquals(0.0, table.value(1, "GEO_SHDI_MM"), TOLERANCE);
    }

    @Test
    void testPolygonElementAndCategoryCounts() throws GeodiversityException {
        var elements = engine.run(MetricRequest.builder(MetricCode.A_NE)
                                               .withZones(grid, table)
                                               .withFeatures(polygons())
                                               .build());
        var categories = engine.run(MetricRequest.builder(MetricCode.A_NC)
                                                 .withZones(grid, table)
                                                 .withFeatures(polygons())
                                                 .withCategoryField("unit")
                                                 .build());

        var expected = new double[] { 1, 1, 1, 1, 2, 1, 2, 0, 1 };
        for (int zone = 1; zone <= 9; zone++) {
            assertEquals(expected[zone - 1], elements.getResult(zone), "zone " + zone);
        }
        assertEquals(2.0, categories.getResult(5));
        assertEquals(2.0, categories.getResult(7));
        assertEquals(1.0, categories.getResult(3));
    }

    @Test
    void testLineTotalLength() throws GeodiversityException {
        var rivers = MemoryFeatureLayer.builder("rivers", GeometryKind.LINE)
                                       .crs(CRS)
                                       .add(factory.createLineString(
                                       new Coordinate[] { new Coordinate(5, 5), new Coordinate(25, 5) }))
                                       .add(factory.createLineString(
                                       new Coordinate[] { new Coordinate(12, 22), new Coordinate(18, 22) }))
                                       .build();
        var report = engine.run(
        MetricRequest.builder(MetricCode.L_TL).withZones(grid, table).withFeatures(rivers).build());

        assertEquals("RIV_Tl", report.getFields().field());
        assertEquals(5.0, report.getResult(1), TOLERANCE);
        assertEquals(10.0, report.getResult(2), TOLERANCE);
        assertEquals(10.0, report.getResult(3), TOLERANCE);
        assertEquals(6.0, report.getResult(8), TOLERANCE);
        assertTrue(Double.isNaN(report.getResult(4)));
    }

    @Test
    void testNullGeometryAndBadCategorySkipped() throws GeodiversityException {
        var layer = MemoryFeatureLayer.builder("poi", GeometryKind.POINT)
                                      .crs(CRS)
                                      .add(factory.createPoint(new Coordinate(1, 1)), Map.of("cat", 1))
                                      .add(factory.createPoint(new Coordinate(2, 1)), Map.of("cat", 2.5))
                                      .add(factory.createPoint(new Coordinate(3, 1)), Map.of())
                                      .add(null, Map.of("cat", 1))
                                      .build();
        var report = engine.run(MetricRequest.builder(MetricCode.P_NC)
                                             .withZones(grid, table)
                                             .withFeatures(layer)
                                             .withCategoryField("cat")
                                             .build());

        assertEquals(1.0, report.getResult(1));
        assertEquals(2, report.getSkipped(SkipReason.CATEGORY_DOMAIN));
        assertEquals(1, report.getSkipped(SkipReason.NULL_GEOMETRY));
        assertEquals(4, report.getRead());
    }

    @Test
    void testReliefIndexOverTwoScales() throws GeodiversityException {
        var strip = MemoryZoneLayer.grid("relief", 0, 0, 4, 2, 1, CRS);
        var stripTable = MemoryAttributeTable.forZones(strip);
        var values = new double[4][4];
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 4; column++) {
                values[row][column] = 100.0 * column / 3.0;
            }
        }
        var dem = MemoryRasterLayer.of("dem", 0, 4, 1, values, -9999, CRS);

        var report = engine.run(MetricRequest.builder(MetricCode.R_M).withZones(strip, stripTable).withRaster(dem)
                                             .build());

        assertEquals("DEM_RM", report.getFields().field());
        assertEquals((100.0 + 100.0 / 3.0) / 4.0, report.getResult(1), TOLERANCE);
        assertTrue(Double.isNaN(report.getResult(2)));
        assertTrue(report.getSparseZones().isEmpty());
        assertEquals(ExtentRelation.CONTAINED, report.getExtentRelation());
    }

    @Test
    void testReliefIndexComparableAcrossZoneSizes() throws GeodiversityException {
        var ramp = new double[4][4];
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 4; column++) {
                ramp[row][column] = 10.0 * column;
            }
        }
        var small = MemoryZoneLayer.grid("small", 0, 0, 4, 1, 1, CRS);
        var large = MemoryZoneLayer.grid("large", 0, 0, 8, 1, 1, CRS);
        var fine = MemoryRasterLayer.of("dem", 0, 4, 1, ramp, -9999, CRS);
        var coarse = MemoryRasterLayer.of("dem", 0, 8, 2, ramp, -9999, CRS);
        var steepRamp = new double[4][4];
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 4; column++) {
                steepRamp[row][column] = 20.0 * column;
            }
        }
        var steep = MemoryRasterLayer.of("dem", 0, 8, 2, steepRamp, -9999, CRS);

        var smallIndex = engine.run(MetricRequest.builder(MetricCode.R_M)
                                                 .withZones(small, MemoryAttributeTable.forZones(small))
                                                 .withRaster(fine)
                                                 .build()).getResult(1);
        // the same 10 units per unit slope over a zone twice as wide
        var largeIndex = engine.run(MetricRequest.builder(MetricCode.R_M)
                                                 .withZones(large, MemoryAttributeTable.forZones(large))
                                                 .withRaster(steep)
                                                 .build()).getResult(1);
        // half the slope over the wider zone
        var gentleIndex = engine.run(MetricRequest.builder(MetricCode.R_M)
                                                  .withZones(large, MemoryAttributeTable.forZones(large))
                                                  .withRaster(coarse)
                                                  .build()).getResult(1);

        assertEquals(10.0, smallIndex, TOLERANCE);
        assertEquals(smallIndex, largeIndex, TOLERANCE);
        assertEquals(smallIndex / 2.0, gentleIndex, TOLERANCE);
    }

    private static double[][] stripValues(double left, double right) {
        var values = new double[4][8];
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 8; column++) {
                values[row][column] = column < 4 ? left + column : right;
            }
        }
        return values;
    }

    @Test
    void testRasterStandardDeviationAndNoDataHandling() throws GeodiversityException {
        var strip = MemoryZoneLayer.grid("strip", 0, 0, 4, 2, 1, CRS);
        var values = stripValues(10, 5);
        values[0][7] = -9999;
        var raster = MemoryRasterLayer.of("slope", 0, 4, 1, values, -9999, CRS);

        var ignoring = engine.run(MetricRequest.builder(MetricCode.R_SD)
                                               .withZones(strip, MemoryAttributeTable.forZones(strip))
                                               .withRaster(raster)
                                               .build());
        // population deviation of 0, 1, 2, 3
        assertEquals(Math.sqrt(1.25), ignoring.getResult(1), TOLERANCE);
        assertEquals(0.0, ignoring.getResult(2), TOLERANCE);
        assertEquals(1, ignoring.getSkipped(SkipReason.NO_DATA));

        var strict = engine.run(MetricRequest.builder(MetricCode.R_SD)
                                             .withZones(strip, MemoryAttributeTable.forZones(strip))
                                             .withRaster(raster)
                                             .withIgnoreNoData(false)
                                             .build());
        assertEquals(Math.sqrt(1.25), strict.getResult(1), TOLERANCE);
        assertTrue(Double.isNaN(strict.getResult(2)));
    }

    @Test
    void testSparseZoneReportedAsNoData() throws GeodiversityException {
        var strip = MemoryZoneLayer.grid("strip", 0, 0, 4, 2, 1, CRS);
        var values = stripValues(0, Double.NaN);
        values[2][5] = 40.0;
        var dem = MemoryRasterLayer.of("dem", 0, 4, 1, values, -9999, CRS);
        var stripTable = MemoryAttributeTable.forZones(strip);

        var report = engine.run(MetricRequest.builder(MetricCode.R_M).withZones(strip, stripTable).withRaster(dem)
                                             .build());

        assertTrue(Double.isNaN(report.getResult(2)));
        assertEquals(1, report.getSparseZones().size());
        var warning = report.getSparseZones().get(0);
        assertEquals(2L, warning.zoneId());
        assertEquals(1L, warning.samples());
        assertEquals(2, warning.required());
        assertNull(stripTable.value(2, "DEM_RM"));
    }

    @Test
    void testNoDataSentinelWritten() throws GeodiversityException {
        var sentinel = new GeodiversityEngine(config().withNoDataSentinel(-1.0).build());
        sentinel.run(MetricRequest.builder(MetricCode.P_HU)
                                  .withZones(grid, table)
                                  .withFeatures(points(false))
                                  .withCategoryField("cat")
                                  .build());
        assertEquals(-1.0, table.value(9, "POI_Hu"));
    }

    @Test
    void testCircularDeviationWithSlopeMask() throws GeodiversityException {
        var strip = MemoryZoneLayer.grid("strip", 0, 0, 4, 2, 1, CRS);
        var aspect = new double[4][8];
        var slope = new double[4][8];
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 8; column++) {
                aspect[row][column] = column % 2 == 0 ? 10.0 : 50.0;
                slope[row][column] = column < 4 ? 2.0 : 20.0;
            }
        }
        var aspectLayer = MemoryRasterLayer.of("aspect", 0, 4, 1, aspect, -9999, CRS);
        var slopeLayer = MemoryRasterLayer.of("slope", 0, 4, 1, slope, -9999, CRS);
        var radians = Math.sqrt(-2.0 * Math.log(Math.cos(Math.toRadians(20.0))));
        var expected = Math.toDegrees(radians);

        var plain = engine.run(MetricRequest.builder(MetricCode.R_SDC)
                                            .withZones(strip, MemoryAttributeTable.forZones(strip))
                                            .withRaster(aspectLayer)
                                            .build());
        assertEquals(expected, plain.getResult(1), TOLERANCE);
        assertEquals(expected, plain.getResult(2), TOLERANCE);
        assertEquals("ASP_RSDc", plain.getFields().field());

        var masked = engine.run(MetricRequest.builder(MetricCode.R_SDC)
                                             .withZones(strip, MemoryAttributeTable.forZones(strip))
                                             .withRaster(aspectLayer)
                                             .withSlopeMask(slopeLayer, 5.0)
                                             .build());
        assertEquals(0.0, masked.getResult(1));
        assertEquals(expected, masked.getResult(2), TOLERANCE);
    }

    @Test
    void testCircularDeviationOutputUnit() throws GeodiversityException {
        var strip = MemoryZoneLayer.grid("strip", 0, 0, 4, 2, 1, CRS);
        var aspect = new double[4][8];
        for (int row = 0; row < 4; row++) {
            for (int column = 0; column < 8; column++) {
                aspect[row][column] = column % 2 == 0 ? 10.0 : 50.0;
            }
        }
        var aspectLayer = MemoryRasterLayer.of("aspect", 0, 4, 1, aspect, -9999, CRS);
        var radians = Math.sqrt(-2.0 * Math.log(Math.cos(Math.toRadians(20.0))));

        var degrees = engine.run(MetricRequest.builder(MetricCode.R_SDC)
                                              .withZones(strip, MemoryAttributeTable.forZones(strip))
                                              .withRaster(aspectLayer)
                                              .build());
        // about 20.2 degrees for two directions 40 degrees apart
        assertEquals(Math.toDegrees(radians), degrees.getResult(1), TOLERANCE);
        assertTrue(degrees.getResult(1) > 20.0 && degrees.getResult(1) < 21.0);

        var inRadians = new GeodiversityEngine(config().withCircularOutputUnit(AngleUnit.RADIANS).build());
        var report = inRadians.run(MetricRequest.builder(MetricCode.R_SDC)
                                                .withZones(strip, MemoryAttributeTable.forZones(strip))
                                                .withRaster(aspectLayer)
                                                .build());
        assertEquals(radians, report.getResult(1), TOLERANCE);
    }

    @Test
    void testSlopeMaskValidation() {
        var strip = MemoryZoneLayer.grid("strip", 0, 0, 4, 2, 1, CRS);
        var raster = MemoryRasterLayer.of("aspect", 0, 4, 1, stripValues(0, 0), -9999, CRS);
        var stripTable = MemoryAttributeTable.forZones(strip);

        assertThrows(ConfigurationException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.R_SD).withZones(strip, stripTable).withRaster(raster)
                     .withSlopeMask(raster, 5.0).build()));
        assertThrows(ConfigurationException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.R_SDC).withZones(strip, stripTable).withRaster(raster)
                     .withSlopeMask(raster, 95.0).build()));
        assertTrue(stripTable.fields().isEmpty());
    }

    @Test
    void testExportWritesTwoDimensionalLayer() throws GeodiversityException {
        var sink = new MemoryOutputLayer();
        var report = engine.run(pointRequest(MetricCode.P_NE).withExport(sink, null).build());

        assertEquals("grid_POI_PNe", sink.getName());
        assertEquals(List.of("POI_PNe", "POI_PNe_MM"),
                     sink.getFields().stream().map(f -> f.name()).collect(Collectors.toList()));
        assertEquals(9, sink.getRows().size());
        for (OutputRow row : sink.getRows()) {
            assertTrue(Geometries.isStrictly2D(row.geometry()));
            assertEquals(report.getResult(row.zoneId()), row.values().get("POI_PNe"));
        }
    }

    @Test
    void testPartialExtentWarnsAndDropsOutsideFeatures() throws GeodiversityException {
        var layer = MemoryFeatureLayer.builder("poi", GeometryKind.POINT)
                                      .crs(CRS)
                                      .add(factory.createPoint(new Coordinate(5, 5)))
                                      .add(factory.createPoint(new Coordinate(45, 8)))
                                      .build();
        var report = engine.run(MetricRequest.builder(MetricCode.P_NE).withZones(grid, table).withFeatures(layer)
                                             .build());

        assertEquals(ExtentRelation.PARTIAL, report.getExtentRelation());
        assertEquals(1.0, report.getResult(1));
        assertEquals(1, report.getDropped());
        assertEquals(1, report.getAssigned());
    }

    @Test
    void testDisjointOrMismatchedLayerRejected() {
        var far = MemoryFeatureLayer.builder("poi", GeometryKind.POINT)
                                    .crs(CRS)
                                    .add(factory.createPoint(new Coordinate(500, 500)))
                                    .add(factory.createPoint(new Coordinate(510, 510)))
                                    .build();
        assertThrows(SpatialMismatchException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NE).withZones(grid, table).withFeatures(far).build()));

        var other = MemoryFeatureLayer.builder("poi", GeometryKind.POINT)
                                      .crs("EPSG:4326")
                                      .add(factory.createPoint(new Coordinate(5, 5)))
                                      .build();
        assertThrows(SpatialMismatchException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NE).withZones(grid, table).withFeatures(other).build()));
        assertTrue(table.fields().isEmpty());
    }

    @Test
    void testShapefileRejectedBeforeAnyWrite() {
        var shapefile = MemoryFeatureLayer.builder("poi", GeometryKind.POINT)
                                          .crs(CRS)
                                          .container(ContainerFormat.FILE_GEODATABASE, "data/poi.shp")
                                          .add(factory.createPoint(new Coordinate(5, 5)))
                                          .build();
        assertThrows(FormatRejectedException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NE).withZones(grid, table).withFeatures(shapefile).build()));

        var shapeGrid = grid.in(ContainerFormat.SHAPEFILE, "zones/grid.shp");
        assertThrows(FormatRejectedException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NE).withZones(shapeGrid, table).withFeatures(points(false)).build()));

        assertEquals(0, table.getColumnWrites());
        assertTrue(table.fields().isEmpty());
    }

    @Test
    void testRequestValidation() {
        assertThrows(ConfigurationException.class,
                     () -> engine.run(MetricRequest.builder(MetricCode.P_NE).withZones(grid, table).build()));
        assertThrows(ConfigurationException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.A_NE).withZones(grid, table).withFeatures(points(false)).build()));
        assertThrows(ConfigurationException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NC).withZones(grid, table).withFeatures(points(false)).build()));
        assertThrows(ConfigurationException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NC).withZones(grid, table).withFeatures(points(false))
                     .withCategoryField("missing").build()));
        assertThrows(ConfigurationException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NE).withZones(grid, table).withFeatures(points(false))
                     .withCategoryField("cat").build()));
        assertThrows(ConfigurationException.class,
                     () -> engine.run(MetricRequest.builder(MetricCode.R_SD).withZones(grid, table).build()));
        assertTrue(table.fields().isEmpty());
    }

    @Test
    void testEmptyZoneLayerRejected() {
        var empty = new MemoryZoneLayer("empty", CRS, List.of());
        var emptyTable = MemoryAttributeTable.forZones(empty);
        assertThrows(ConfigurationException.class, () -> engine.run(
        MetricRequest.builder(MetricCode.P_NE).withZones(empty, emptyTable).withFeatures(points(false)).build()));
    }

    @Test
    void testExplicitNameOverwritesExistingField() throws GeodiversityException {
        engine.run(pointRequest(MetricCode.P_NE).withOutputField("points").build());
        var report = engine.run(pointRequest(MetricCode.P_NC).withOutputField("points").build());

        assertEquals("points", report.getFields().field());
        assertTrue(report.getFields().overwriting());
        assertEquals(5.0, table.value(1, "points"));
        assertEquals(2, table.fields().size());
    }

    @Test
    void testInterruptDuringStreamingLeavesTableUntouched() throws IOException {
        var interruptible = new GeodiversityEngine(config().withInterruptCheckInterval(1).build());
        Thread.currentThread().interrupt();
        try {
            assertThrows(RunInterruptedException.class, () -> interruptible.run(pointRequest(MetricCode.P_NE).build()));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals(0, table.getColumnWrites());
        try (var entries = Files.list(workspaceRoot)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    void testInterruptWhileWaitingForTableLockReleasesWorkspace() throws Exception {
        var failure = new AtomicReference<Throwable>();
        var finished = new CountDownLatch(1);
        var worker = new Thread(() -> {
            try {
                engine.run(pointRequest(MetricCode.P_NE).build());
            } catch (Throwable t) {
                failure.set(t);
            } finally {
                finished.countDown();
            }
        });
        try (var held = table.lock()) {
            worker.start();
            var deadline = System.currentTimeMillis() + 10_000;
            while (!table.hasWaiters() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertTrue(table.hasWaiters());
            try (var entries = Files.list(workspaceRoot)) {
                assertEquals(1, entries.count());
            }
            worker.interrupt();
            assertTrue(finished.await(10, TimeUnit.SECONDS));
        }

        assertInstanceOf(RunInterruptedException.class, failure.get());
        assertEquals(0, table.getColumnWrites());
        try (var entries = Files.list(workspaceRoot)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    void testConcurrentRunsOnOneTableGetDistinctFields() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            var start = new CountDownLatch(1);
            var futures = new ArrayList<Future<RunReport>>();
            for (int i = 0; i < 2; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return engine.run(pointRequest(MetricCode.P_NE).build());
                }));
            }
            start.countDown();
            Set<String> written = new HashSet<>();
            for (Future<RunReport> future : futures) {
                written.addAll(future.get(30, TimeUnit.SECONDS).getFieldNames());
            }

            assertEquals(Set.of("POI_PNe", "POI_PNe_MM", "POI_PNe_1", "POI_PNe_1_MM"), written);
            assertEquals(12.0, table.value(1, "POI_PNe"));
            assertEquals(12.0, table.value(1, "POI_PNe_1"));
        } finally {
            executor.shutdownNow();
        }
    }
}
