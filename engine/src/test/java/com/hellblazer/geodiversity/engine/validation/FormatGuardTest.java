package com.hellblazer.geodiversity.engine.validation;

import com.hellblazer.geodiversity.common.ErrorKind;
import com.hellblazer.geodiversity.common.FormatRejectedException;
import com.hellblazer.geodiversity.engine.host.ContainerFormat;
import com.hellblazer.geodiversity.engine.host.GeometryKind;
import com.hellblazer.geodiversity.engine.host.LayerDescriptor;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormatGuard
 */
public class FormatGuardTest {

    private static LayerDescriptor layer(String path, ContainerFormat format) {
        return new LayerDescriptor("rivers", path, format, new Envelope(0, 1, 0, 1), null, GeometryKind.LINE, false,
                                   false);
    }

    @Test
    void testGeodatabaseAccepted() {
        assertDoesNotThrow(() -> FormatGuard.check(layer("C:/data/survey.gdb/rivers", null),
                                                   layer(null, ContainerFormat.MEMORY),
                                                   layer("/data/field.geodatabase/main.rivers",
                                                         ContainerFormat.MOBILE_GEODATABASE)));
    }

    @Test
    void testShapefileRejectedByPath() {
        var e = assertThrows(FormatRejectedException.class,
                             () -> FormatGuard.check(layer("/data/rivers.SHP", ContainerFormat.FILE_GEODATABASE)));
        assertEquals(ErrorKind.FORMAT_REJECTED, e.getKind());
        assertTrue(e.getMessage().contains("rivers.SHP"));
    }

    @Test
    void testShapefileRejectedByFormat() {
        assertThrows(FormatRejectedException.class, () -> FormatGuard.check(layer(null, ContainerFormat.SHAPEFILE)));
    }

    @Test
    void testUnknownFormatRejected() {
        assertThrows(FormatRejectedException.class, () -> FormatGuard.check(layer("/data/rivers", null)));
    }
}
