package com.groomsafe.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration: built-in defaults, then the classpath
 * {@code config.properties}, then a {@code config.properties} in the working directory,
 * then programmatic overrides.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    public static final String RESOURCE_NAME = "config.properties";

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();

    private Config() {
    }

    public static Config load(Path workingDir) {
        Config config = new Config();

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath {}: {}", RESOURCE_NAME, e.getMessage());
        }

        if (workingDir != null) {
            Path local = workingDir.resolve(RESOURCE_NAME);
            if (Files.exists(local)) {
                try (InputStream in = Files.newInputStream(local)) {
                    config.overrideProps.load(in);
                    config.props.putAll(config.overrideProps);
                } catch (IOException e) {
                    LOG.warn("failed to read {}: {}", local, e.getMessage());
                }
            }
        }

        LOG.debug("config loaded: resource_keys={} override_keys={}",
                config.resourceProps.size(), config.overrideProps.size());
        return config;
    }

    /**
     * Defaults only, no file lookups.
     */
    public static Config defaults() {
        return new Config();
    }

    /**
     * Defaults plus the given overrides. Nested maps are flattened with dotted keys.
     */
    public static Config fromMap(Map<String, ?> overrides) {
        Config config = new Config();
        flattenInto(config, "", overrides);
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

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
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
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("features.zone", "UTC");
        defaults.put("features.phrase_table", "phrase-table.tsv");

        defaults.put("risk.weight.contact_frequency_score", "0.10");
        defaults.put("risk.weight.persistence_after_nonresponse", "0.13");
        defaults.put("risk.weight.time_of_day_irregularity", "0.08");
        defaults.put("risk.weight.emotional_dependency_indicators", "0.22");
        defaults.put("risk.weight.isolation_pressure", "0.20");
        defaults.put("risk.weight.secrecy_pressure", "0.18");
        defaults.put("risk.weight.platform_migration_attempts", "0.06");
        defaults.put("risk.weight.tone_shift_score", "0.03");

        defaults.put("risk.synergy.threshold", "0.5");
        defaults.put("risk.synergy.boost", "0.15");
        defaults.put("risk.review.threshold", "60");
        defaults.put("risk.review.critical_threshold", "80");
        defaults.put("risk.review.isolation_min_confidence", "0.5");

        defaults.put("stage.initial_contact.mean_ceiling", "0.2");
        defaults.put("stage.min_winner_score", "0.15");
        defaults.put("stage.min_confidence", "0.1");

        defaults.put("shield.max_cases_per_session", "20");
        defaults.put("shield.max_high_risk_per_session", "5");
        defaults.put("shield.max_session_minutes", "120");
        defaults.put("shield.mandatory_break_minutes", "15");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
