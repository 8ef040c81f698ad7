package com.hellblazer.geodiversity.engine.output;

import com.hellblazer.geodiversity.engine.host.FieldDefinition;
import com.hellblazer.geodiversity.engine.host.memory.MemoryAttributeTable;
import com.hellblazer.geodiversity.engine.metric.MetricCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FieldNames
 */
public class FieldNamesTest {

    private final FieldNames names = new FieldNames(64, 3);

    private static MemoryAttributeTable table(String... fields) {
        var table = new MemoryAttributeTable("grid", List.of(1L, 2L));
        for (String field : fields) {
            table.addField(FieldDefinition.doubleField(field, field));
        }
        return table;
    }

    @Test
    void testDefaultNames() {
        assertEquals("GEO_SHDI", names.defaultName("geology", MetricCode.A_SHDI));
        assertEquals("GEO_A_SHDI", names.alias("geology", MetricCode.A_SHDI));
        assertEquals("RIV_Tl", names.defaultName("rivers", MetricCode.L_TL));
        assertEquals("ASP_RSDc", names.defaultName("aspect", MetricCode.R_SDC));
        assertEquals("DE_RM", names.defaultName("de", MetricCode.R_M));
    }

    @Test
    void testSanitize() {
        assertEquals("slope_class", names.sanitize("slope class"));
        assertEquals("F3D_relief", names.sanitize("3D relief"));
        assertEquals("F", names.sanitize(""));
        assertEquals("a_b_c", names.sanitize(" a.b-c "));
        assertEquals(64, names.sanitize("x".repeat(100)).length());
    }

    @Test
    void testLeadingDigitLayerName() {
        assertEquals("F2ND_PNe", names.defaultName("2nd survey", MetricCode.P_NE));
    }

    @Test
    void testFreeNameUsedAsIs() {
        var plan = names.resolve(table(), "GEO_SHDI", "GEO_A_SHDI", false, true);
        assertEquals("GEO_SHDI", plan.field());
        assertEquals("GEO_SHDI_MM", plan.companion());
        assertEquals("Std_GEO_A_SHDI", plan.companionAlias());
        assertFalse(plan.overwriting());
    }

    @Test
    void testCollisionAppendsSuffix() {
        var plan = names.resolve(table("GEO_SHDI", "geo_shdi_1"), "GEO_SHDI", "GEO_A_SHDI", false, false);
        assertEquals("GEO_SHDI_2", plan.field());
        assertNull(plan.companion());
        assertEquals("GEO_A_SHDI_2", plan.alias());
    }

    @Test
    void testCompanionCollisionAlsoAvoided() {
        var plan = names.resolve(table("GEO_SHDI_MM"), "GEO_SHDI", "GEO_A_SHDI", false, true);
        assertEquals("GEO_SHDI_1", plan.field());
        assertEquals("GEO_SHDI_1_MM", plan.companion());
    }

    @Test
    void testOverwriteKeepsName() {
        var plan = names.resolve(table("GEO_SHDI", "GEO_SHDI_MM"), "GEO_SHDI", "GEO_A_SHDI", true, true);
        assertEquals("GEO_SHDI", plan.field());
        assertTrue(plan.overwriting());
    }

    @Test
    void testSuffixRespectsMaximumLength() {
        var shortNames = new FieldNames(10, 3);
        var plan = shortNames.resolve(table("ABCDEFGHIJ"), "ABCDEFGHIJ", "alias", false, true);
        assertEquals("ABCDEFGH_1", plan.field());
        assertEquals(10, plan.companion().length());
        assertTrue(plan.companion().matches("AB_[0-9A-F]{4}_MM"), plan.companion());
    }

    @Test
    void testShortCompanionKeepsWholeName() {
        assertEquals("GEO_SHDI_MM", names.companion("GEO_SHDI"));
        var fits = "x".repeat(61);
        assertEquals(fits + "_MM", names.companion(fits));
    }

    @Test
    void testLongNamesSharingPrefixGetDistinctCompanions() {
        var shared = "relief_index_of_the_northern_escarpment_survey_area_window";
        assertEquals(58, shared.length());
        var first = shared + "_v01_a";
        var second = shared + "_v01_b";
        assertEquals(64, first.length());

        var firstCompanion = names.companion(first);
        var secondCompanion = names.companion(second);
        assertNotEquals(firstCompanion, secondCompanion);
        assertEquals(64, firstCompanion.length());
        assertTrue(firstCompanion.startsWith(shared.substring(0, 56) + "_"));
        assertTrue(firstCompanion.endsWith("_MM"));
        // field names compare case-insensitively, so their companions must too
        assertTrue(firstCompanion.equalsIgnoreCase(names.companion(first.toUpperCase())));
    }

    @Test
    void testOverwriteNeverTakesAnotherFieldsCompanion() {
        var shared = "x".repeat(61);
        var first = shared + "AAA";
        var second = shared + "BBB";
        var table = table(first);
        table.addField(FieldDefinition.doubleField(names.companion(first), "Std_first"));

        var plan = names.resolve(table, second, "second", true, true);

        assertEquals(second, plan.field());
        assertFalse(plan.overwriting());
        assertFalse(table.hasField(plan.companion()));
        assertNotEquals(names.companion(first), plan.companion());
    }

    @Test
    void testNewFieldPassesOverHeldCompanionName() {
        var table = table("SLOPE_MM");
        var plan = names.resolve(table, "SLOPE", "DEM_R_SD", true, true);
        assertEquals("SLOPE", plan.field());
        assertEquals("SLOPE_1_MM", plan.companion());

        table.addField(FieldDefinition.doubleField(plan.field(), plan.alias()));
        table.addField(FieldDefinition.doubleField(plan.companion(), plan.companionAlias()));
        var rerun = names.resolve(table, "SLOPE", "DEM_R_SD", true, true);
        assertTrue(rerun.overwriting());
        assertEquals("SLOPE_1_MM", rerun.companion());
    }
}
