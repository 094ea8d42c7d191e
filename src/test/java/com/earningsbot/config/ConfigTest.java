package com.earningsbot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigTest {

    @Test
    void defaultsShouldApplyWhenNothingIsConfigured(@TempDir Path dir) {
        Config config = Config.fromConfigurationProperties(dir, Map.of());

        assertEquals("https://financialmodelingprep.com/stable", config.getString("fmp.base_url"));
        assertEquals(3, config.getInt("fmp.retry.max_attempts"));
        assertEquals(10000L, config.getLong("fmp.retry.cap_ms", 0L));
        assertEquals("", config.getString("fmp.api_key"));
    }

    @Test
    void workingDirFileShouldOverrideBoundProperties(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"), "fmp.lookback_bars=7\nfmp.api_key= abc \n");
        Map<String, Object> bound = Map.of("fmp", Map.of("lookback_bars", "20", "retry", Map.of("max_attempts", 5)));

        Config config = Config.fromConfigurationProperties(dir, bound);

        assertEquals(7, config.getInt("fmp.lookback_bars"));
        assertEquals("abc", config.getString("fmp.api_key"));
        assertEquals(5, config.getInt("fmp.retry.max_attempts"));
    }

    @Test
    void boundPropertiesShouldBeFlattenedIntoDottedKeys(@TempDir Path dir) {
        Map<String, Object> raw = Map.of(
                "fmp", Map.of("base_url", "http://localhost:9000"),
                "symbols", List.of("AAPL", "MSFT")
        );

        Config config = Config.fromConfigurationProperties(dir, raw);

        assertEquals("http://localhost:9000", config.getString("fmp.base_url"));
        assertEquals("AAPL,MSFT", config.getString("symbols"));
    }

    @Test
    void blankOrInvalidValuesShouldFallBack(@TempDir Path dir) {
        Config config = Config.fromConfigurationProperties(dir, Map.of(
                "fmp", Map.of("lookback_bars", " ", "retry", Map.of("base_ms", "soon"))
        ));

        assertEquals(20, config.getInt("fmp.lookback_bars"));
        assertEquals(1500L, config.getLong("fmp.retry.base_ms", 1500L));
        assertEquals(42, config.getInt("missing.key", 42));
    }
}
