package com.tradingassistant.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void getString_shouldFallBackToBuiltInDefaults() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of());
        assertEquals("2.0", config.getString("filters.minPrice"));
        assertEquals("XLK", config.getString("sector.default"));
        assertEquals("", config.getString("no.such.key"));
        assertEquals("fallback", config.getString("no.such.key", "fallback"));
        assertEquals("default", config.sourceOf("filters.minPrice"));
    }

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMaps() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "filters", Map.of("minPrice", 5),
                "signals", Map.of("catalystKeywords", List.of("fda", "merger"))
        ));
        assertEquals(5.0, config.requireDouble("filters.minPrice"));
        assertEquals(List.of("fda", "merger"), config.getList("signals.catalystKeywords"));
        assertEquals("override", config.sourceOf("filters.minPrice"));
    }

    @Test
    void requireDouble_shouldRejectNonNumericValue() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of("filters", Map.of("minPrice", "cheap")));
        IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> config.requireDouble("filters.minPrice")
        );
        assertEquals("invalid numeric config: filters.minPrice=cheap", e.getMessage());
    }

    @Test
    void requireInt_shouldRejectMissingKey() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> config.requireInt("x.y"));
        assertEquals("missing required config: x.y", e.getMessage());
    }

    @Test
    void load_shouldLayerExplicitFileOverDefaults() throws IOException {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "filters.minPrice=7.5\npipeline.threads=4\n", StandardCharsets.UTF_8);

        Config config = Config.load(tempDir, file);
        assertEquals(7.5, config.requireDouble("filters.minPrice"));
        assertEquals(4, config.requireInt("pipeline.threads"));
        assertEquals("override", config.sourceOf("pipeline.threads"));
        assertEquals("500.0", config.getString("filters.maxPrice"));
    }

    @Test
    void load_shouldReadClasspathResourceWithoutOverrides() throws IOException {
        Config config = Config.load(tempDir);
        assertEquals("resource", config.sourceOf("filters.minPrice"));
        assertEquals(2.0, config.requireDouble("filters.minPrice"));
    }

    @Test
    void load_shouldFailWhenExplicitFileMissing() {
        assertThrows(IOException.class, () -> Config.load(tempDir, Path.of("missing.properties")));
    }

    @Test
    void getPath_shouldResolveAgainstWorkingDir() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of());
        assertEquals(tempDir.resolve("data/market_snapshot.json").normalize(), config.getPath("input.snapshot"));
    }

    @Test
    void snapshot_shouldIncludeDefaultsInSortedOrder() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of("extra", Map.of("key", "v")));
        Map<String, String> all = config.snapshot();
        assertEquals("v", all.get("extra.key"));
        assertTrue(all.containsKey("weights.catalyst"));
        assertEquals("extra.key", all.keySet().iterator().next());
    }
}
