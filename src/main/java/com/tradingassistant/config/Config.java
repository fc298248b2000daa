package com.tradingassistant.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Flat key/value configuration layered as built-in defaults, classpath
 * {@code config.properties}, working-directory {@code config.properties} and an
 * optional explicit file.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) throws IOException {
        return load(workingDir, null);
    }

    /**
     * Loads the layered configuration. A missing explicit file is an error; a
     * missing classpath or local file is not.
     */
    public static Config load(Path workingDir, Path explicitFile) throws IOException {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            }
        }

        if (explicitFile != null) {
            Path resolved = workingDir.resolve(explicitFile).normalize();
            if (!Files.exists(resolved)) {
                throw new IOException("config file not found: " + resolved);
            }
            try (InputStream in = Files.newInputStream(resolved)) {
                Properties explicit = new Properties();
                explicit.load(in);
                config.overrideProps.putAll(explicit);
                config.props.putAll(explicit);
            }
        }

        return config;
    }

    /**
     * Build Config from nested maps, e.g. {@code Map.of("filters", Map.of("minPrice", 5))}.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
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

    /**
     * Returns the numeric value for {@code key}, failing when it is absent or not a number.
     */
    public double requireDouble(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        try {
            double parsed = Double.parseDouble(value);
            if (!Double.isFinite(parsed)) {
                throw new IllegalArgumentException("invalid numeric config: " + key + "=" + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid numeric config: " + key + "=" + value, e);
        }
    }

    public int requireInt(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer config: " + key + "=" + value, e);
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
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

    /**
     * Every key known to this config, defaults included, in sorted order.
     */
    public Map<String, String> snapshot() {
        Map<String, String> out = new TreeMap<>(DEFAULTS);
        for (String name : props.stringPropertyNames()) {
            String value = nonBlank(props.getProperty(name));
            if (!value.isEmpty()) {
                out.put(name, value);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
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
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
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

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();

        defaults.put("filters.minPrice", "2.0");
        defaults.put("filters.maxPrice", "500.0");
        defaults.put("filters.minAvgVolume", "500000");
        defaults.put("filters.minMarketCapMillions", "100");
        defaults.put("filters.maxFloatMillions", "250");

        defaults.put("signals.minCompositeScore", "50");
        defaults.put("signals.maxAcceptableRiskScore", "75");
        defaults.put("signals.maxSignalsPerRun", "10");
        defaults.put("signals.volumeSurgeThresholdPct", "150");
        defaults.put("signals.relativeStrengthThresholdPct", "5.0");
        defaults.put("signals.catalystKeywords", "beat,launch,expansion,partnership,acquisition");

        defaults.put("weights.momentum", "0.25");
        defaults.put("weights.volumeSurge", "0.20");
        defaults.put("weights.relativeStrength", "0.20");
        defaults.put("weights.newsSentiment", "0.20");
        defaults.put("weights.catalyst", "0.15");

        defaults.put("sector.default", "XLK");
        defaults.put("sector.overrides", "");
        defaults.put("pipeline.threads", "1");

        defaults.put("input.snapshot", "data/market_snapshot.json");
        defaults.put("output.excelFile", "outputs/trading_signals.xlsx");
        defaults.put("outputs.dir", "outputs");

        return Collections.unmodifiableMap(defaults);
    }
}
