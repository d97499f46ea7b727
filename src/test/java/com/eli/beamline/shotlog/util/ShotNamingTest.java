package com.eli.beamline.shotlog.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ShotNamingTest {

    private static final LocalDateTime TS = LocalDateTime.of(2024, 1, 1, 9, 5, 3);

    @Test
    void shouldBuildCanonicalName() {
        assertEquals("SideView_20240101_090503_shot001.png",
                ShotNaming.canonicalName("SideView", TS, 1, "IMG_4711.PNG"));
        assertEquals("SideView_20240101_090503_shot1234.tif",
                ShotNaming.canonicalName("SideView", TS, 1234, "x.tif"));
    }

    @Test
    void shouldFallBackToDatExtension() {
        assertEquals(".dat", ShotNaming.extensionOf("noext"));
        assertEquals(".dat", ShotNaming.extensionOf("trailingdot."));
        assertEquals(".dat", ShotNaming.extensionOf(".hidden"));
        assertEquals(".gz", ShotNaming.extensionOf("data.tar.GZ"));
    }

    @Test
    void shouldParseShotNumberFromArchivedName() {
        assertEquals(OptionalInt.of(7), ShotNaming.shotNumberOf("Lanex1_20240101_101500_shot007.tif"));
        assertEquals(OptionalInt.of(7), ShotNaming.shotNumberOf("Lanex1_20240101_101500_shot007_2.tif"));
        assertEquals(OptionalInt.empty(), ShotNaming.shotNumberOf("Lanex1_0001.tif"));
    }
}
