package com.stocktracker.kr.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigTest {

    @Test
    void defaults_shouldCoverEngineKeys() {
        Config config = Config.defaults();

        assertEquals(10, config.getInt("portfolio.max_size"));
        assertEquals(8.0, config.getDouble("gate.base_min_score"), 1e-9);
        assertEquals("memory", config.getString("store.type"));
        assertEquals("NEUTRAL", config.getString("market.condition"));
        assertEquals("default", config.sourceOf("portfolio.max_size"));
    }

    @Test
    void load_shouldLetWorkingDirFileOverrideResource(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("config.properties"),
                "portfolio.max_size=4\nschedule.times=09:00 , 14:30\n", StandardCharsets.UTF_8);

        Config config = Config.load(dir);

        assertEquals(4, config.getInt("portfolio.max_size"));
        assertEquals("override", config.sourceOf("portfolio.max_size"));
        assertEquals(List.of("09:00", "14:30"), config.getList("schedule.times"));
        assertEquals(dir.resolve("replay/prices").normalize(), config.getPath("replay.prices_dir"));
    }

    @Test
    void fromConfigurationProperties_shouldFlattenNestedMaps() {
        Config config = Config.fromConfigurationProperties(Path.of("."), Map.of(
                "portfolio", Map.of("max_size", 6),
                "schedule", Map.of("times", List.of("09:30", "15:00"), "zone", "Not/AZone")
        ));

        assertEquals(6, config.getInt("portfolio.max_size"));
        assertEquals("09:30,15:00", config.getString("schedule.times"));
        assertEquals(ZoneId.of("Asia/Seoul"), config.getZone("schedule.zone"));
    }

    @Test
    void getters_shouldFallBackOnUnparseableValues() {
        Config config = Config.fromConfigurationProperties(Path.of("."),
                Map.of("cycle", Map.of("threads", "many"), "exit", Map.of("rules", Map.of("enabled", "false"))));

        assertEquals(3, config.getInt("cycle.threads", 3));
        assertFalse(config.getBoolean("exit.rules.enabled", true));
    }

    @Test
    void requireString_shouldFailOnMissingKey() {
        assertThrows(IllegalArgumentException.class, () -> Config.defaults().requireString("no.such.key"));
    }
}
