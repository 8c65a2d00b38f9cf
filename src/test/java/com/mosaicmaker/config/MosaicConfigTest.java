package com.mosaicmaker.config;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MosaicConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        MosaicConfig config = MosaicConfig.defaults();

        assertEquals(32, config.getIntermediateWidth());
        assertEquals(32, config.getIntermediateHeight());
        assertTrue(config.isPrioritizeUnique());
        assertEquals(100, config.getUniqueThreshold());
        assertEquals(16, config.getSubpixelSize());
        assertTrue(config.getInputPath().isEmpty());
        assertTrue(config.getLibraryPath().isEmpty());
    }

    @Test
    void writesCamelCaseJsonWithNullPaths() {
        JSONObject json = MosaicConfig.defaults().toBuilder().libraryPath(Path.of("/tiles")).build().toJson();

        assertEquals(32, json.getInt("intermediateWidth"));
        assertTrue(json.getBoolean("prioritizeUnique"));
        assertTrue(json.isNull("inputPath"));
        assertEquals(Path.of("/tiles").toString(), json.getString("libraryPath"));
    }

    @Test
    void readsPartialJsonOverDefaults() {
        MosaicConfig config = MosaicConfig.fromJson(
            "{\"subpixelSize\": 8, \"prioritizeUnique\": false, \"libraryPath\": \"/data/tiles\", \"inputPath\": null}");

        assertEquals(8, config.getSubpixelSize());
        assertFalse(config.isPrioritizeUnique());
        assertEquals(100, config.getUniqueThreshold());
        assertEquals(Path.of("/data/tiles"), config.getLibraryPath().orElseThrow());
        assertTrue(config.getInputPath().isEmpty());
    }

    @Test
    void jsonFormSurvivesARoundTrip() {
        MosaicConfig original = MosaicConfig.builder()
            .intermediateWidth(64)
            .intermediateHeight(48)
            .prioritizeUnique(false)
            .uniqueThreshold(0)
            .subpixelSize(10)
            .inputPath(Path.of("in.png"))
            .build();

        assertEquals(original, MosaicConfig.fromJson(original.toJson().toString()));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> MosaicConfig.builder().intermediateWidth(0).build());
        assertThrows(IllegalArgumentException.class, () -> MosaicConfig.builder().subpixelSize(-2).build());
        assertThrows(IllegalArgumentException.class, () -> MosaicConfig.builder().uniqueThreshold(-1).build());
        assertThrows(IllegalArgumentException.class, () -> MosaicConfig.fromJson("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> MosaicConfig.fromJson("{\"subpixelSize\": \"big\"}"));
    }
}
