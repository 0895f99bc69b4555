package org.terrain.core.model.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GeneratorSettingsTest {

    @Test
    void overridesParseableValuesOnly() {
        GeneratorSettings s = GeneratorSettings.defaults();
        Map<String, String> values = Map.of(
                "seaLevel", "0.25",
                "minSeaSize", " 40 ",
                "riverDensity", "lots",
                "mpBridge", "");
        s.applyOverrides(values::get);

        assertEquals(0.25, s.seaLevel);
        assertEquals(40, s.minSeaSize);
        assertEquals(0.025, s.riverDensity);
        assertEquals(5.0, s.mpBridge);
    }

    @Test
    void documentedDefaults() {
        GeneratorSettings s = GeneratorSettings.defaults();
        assertEquals(16, s.minSeaSize);
        assertEquals(8, s.minBiomeSize);
        assertEquals(2, s.forestWaterReach);
        assertEquals(0.55, s.plainsCeiling);
    }

    @Test
    void copyIsIndependent() {
        GeneratorSettings s = GeneratorSettings.defaults();
        GeneratorSettings c = s.copy();
        c.minCities = 9;
        c.plainsCeiling = 0.1;
        assertEquals(2, s.minCities);
        assertEquals(0.55, s.plainsCeiling);
        assertEquals(s.mountainLevel, c.mountainLevel);
    }

    @Test
    void systemPropertiesOverride() {
        System.setProperty("terrain.maxRiverSources", "12");
        try {
            GeneratorSettings s = GeneratorSettings.defaults();
            s.applyOverridesFromSystem();
            assertEquals(12, s.maxRiverSources);
        } finally {
            System.clearProperty("terrain.maxRiverSources");
        }
    }

    @Test
    void localFileUsesPrefixedKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("terrain.local.properties");
        Files.writeString(file, "terrain.cityDensity=0.05\nterrain.minCities=3\ncityClosenessFactor=99\n",
                StandardCharsets.UTF_8);

        GeneratorSettings s = GeneratorSettings.defaults();
        LocalSettingsLoader.apply(s, file);
        assertEquals(0.05, s.cityDensity);
        assertEquals(3, s.minCities);
        assertEquals(8, s.cityClosenessFactor);
    }

    @Test
    void unreadableLocalFileFails(@TempDir Path dir) {
        assertThrows(IllegalStateException.class,
                () -> LocalSettingsLoader.apply(GeneratorSettings.defaults(), dir.resolve("missing.properties")));
    }
}
