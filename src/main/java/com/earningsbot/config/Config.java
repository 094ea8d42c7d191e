package com.earningsbot.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Flat key/value configuration.
 * Precedence, lowest first: built-in defaults, Spring-bound properties, classpath
 * {@code config.properties}, {@code config.properties} in the working directory.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();

    private Config() {
    }

    /**
     * Build Config from Spring-bound configuration properties, then apply the
     * {@code config.properties} files on top. Nested maps are flattened into dotted keys,
     * lists into comma separated values.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config();
        flattenInto(config, "", rawProperties);
        config.overlayClasspathFile();
        config.overlayFile(workingDir.resolve("config.properties"));
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private void overlayClasspathFile() {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties: {}", e.getMessage());
        }
    }

    private void overlayFile(Path file) {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            Properties override = new Properties();
            override.load(in);
            props.putAll(override);
            LOG.info("Applied config overrides from {} ({} keys)", file, override.size());
        } catch (IOException e) {
            LOG.warn("failed to read {}: {}", file, e.getMessage());
        }
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(item == null ? "" : String.valueOf(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, String.valueOf(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        config.props.setProperty(key.trim(), value == null ? "" : value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("fmp.base_url", "https://financialmodelingprep.com/stable");
        defaults.put("fmp.request_timeout_sec", "30");
        defaults.put("fmp.connect_timeout_sec", "20");
        defaults.put("fmp.retry.max_attempts", "3");
        defaults.put("fmp.retry.base_ms", "2000");
        defaults.put("fmp.retry.cap_ms", "10000");
        defaults.put("fmp.lookback_bars", "20");
        return defaults;
    }
}
