package com.tickerlink.config;

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
 * Layered key/value configuration.
 * Lookup order: working-dir {@code config.properties}, classpath {@code config.properties}, built-in defaults.
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

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a Config from explicit overrides on top of the defaults. Nested maps are flattened with dots.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> overrides) {
        Config config = new Config(workingDir);
        flattenInto(config, "", overrides);
        return config;
    }

    public static Config defaultsOnly() {
        return fromMap(Path.of("."), Map.of());
    }

    /**
     * Copy of this config with {@code overrides} applied on top, used for command-line flags.
     */
    public Config withOverrides(Map<String, ?> overrides) {
        Config copy = new Config(workingDir);
        copy.resourceProps.putAll(resourceProps);
        copy.overrideProps.putAll(overrideProps);
        copy.props.putAll(props);
        flattenInto(copy, "", overrides);
        return copy;
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

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
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
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
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
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /**
     * Where the effective value of {@code key} came from: override, resource or default.
     */
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

    private String nonBlank(String raw) {
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
            putValue(config, prefix, String.join(",", parts));
            return;
        }
        putValue(config, prefix, String.valueOf(value));
    }

    private static void putValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("channels.analysis", "");
        defaults.put("channels.discussion", "");
        defaults.put("channels.notices", "");
        defaults.put("discussion.manager_id", "");

        defaults.put("extract.headline_only", "true");
        defaults.put("extract.max_candidates", "25");
        defaults.put("lexicon.allowlist", "");
        defaults.put("lexicon.disallow", "");
        defaults.put("allowlist.learned_ttl_days", "7");

        defaults.put("relevance.gate", "0.7");

        defaults.put("index.history_cap", "20");
        defaults.put("index.freshness_days", "7");
        defaults.put("index.sweep_interval_minutes", "60");

        defaults.put("corroborate.enabled", "false");
        defaults.put("corroborate.limit", "50");
        defaults.put("corroborate.pace_ms", "100");

        defaults.put("reconcile.days", "7");
        defaults.put("reconcile.page_size", "100");
        defaults.put("reconcile.max_batches", "50");
        defaults.put("reconcile.pace_ms", "100");
        defaults.put("reconcile.quality_margin", "0.1");
        defaults.put("reconcile.min_score", "0.0");

        defaults.put("link.base_url", "https://discord.com");
        defaults.put("discord.api.base_url", "https://discord.com/api/v10");
        defaults.put("discord.token", "");
        defaults.put("discord.guild_id", "");
        defaults.put("discord.timeout_sec", "20");

        return Collections.unmodifiableMap(defaults);
    }
}
