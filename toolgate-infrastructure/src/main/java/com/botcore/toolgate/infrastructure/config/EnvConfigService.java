package com.botcore.toolgate.infrastructure.config;

import com.botcore.toolgate.application.ports.ConfigPort;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * File + env configuration for the tool gateway.
 *
 * Load order (low -> high priority):
 *  1) config/toolgate.properties (optional)
 *  2) config/.env (optional)
 *  3) OS environment variables (highest priority)
 *
 * A key is looked up under several names, e.g. rustApiUrl:
 *  - TOOLGATE_RUST_API_URL
 *  - RUST_API_URL
 *  - rustApiUrl
 * Secrets such as BOTCORE_EMAIL are simply found under their literal name.
 */
public final class EnvConfigService implements ConfigPort {

    public static final String PROPERTIES_FILE = "toolgate.properties";
    public static final String ENV_FILE = ".env";

    private final Map<String, String> fileValues;
    private final Map<String, String> env;

    public EnvConfigService(Map<String, String> fileValues, Map<String, String> env) {
        this.fileValues = Map.copyOf(fileValues == null ? Map.of() : fileValues);
        this.env = Map.copyOf(env == null ? Map.of() : env);
    }

    public static EnvConfigService defaultFromWorkingDir() throws IOException {
        return fromDirectory(Path.of(System.getProperty("user.dir")).resolve("config"), System.getenv());
    }

    public static EnvConfigService fromDirectory(Path configDir, Map<String, String> env) throws IOException {
        Map<String, String> values = new LinkedHashMap<>();
        if (configDir != null) {
            Path props = configDir.resolve(PROPERTIES_FILE);
            if (Files.exists(props)) {
                Properties p = new Properties();
                try (InputStream in = Files.newInputStream(props)) {
                    p.load(in);
                }
                for (String name : p.stringPropertyNames()) {
                    values.put(name, p.getProperty(name));
                }
            }
            values.putAll(DotEnv.loadIfExists(configDir.resolve(ENV_FILE)));
        }
        return new EnvConfigService(values, env);
    }

    /**
     * Maps a Java-properties key into an env-var key.
     *
     * Examples:
     * - rustApiUrl     -> TOOLGATE_RUST_API_URL
     * - confirmTtlMs   -> TOOLGATE_CONFIRM_TTL_MS
     */
    static String toEnvKey(String key) {
        return "TOOLGATE_" + toSnake(key);
    }

    static String toSnake(String key) {
        String s = key.replace('.', '_').replace('-', '_');
        s = s.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return s.toUpperCase();
    }

    private static List<String> candidates(String key) {
        List<String> names = new ArrayList<>(3);
        names.add(toEnvKey(key));
        String snake = toSnake(key);
        if (!names.contains(snake)) names.add(snake);
        if (!names.contains(key)) names.add(key);
        return names;
    }

    private String lookup(String key) {
        if (key == null || key.isBlank()) return null;
        List<String> names = candidates(key);
        for (String n : names) {
            String v = env.get(n);
            if (v != null && !v.isBlank()) return v;
        }
        for (String n : names) {
            String v = fileValues.get(n);
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    @Override
    public String get(String key) {
        return get(key, null);
    }

    @Override
    public String get(String key, String defaultValue) {
        String v = lookup(key);
        return v == null ? defaultValue : v.trim();
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String v = lookup(key);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Config key " + key + " is not an integer: " + v, e);
        }
    }

    @Override
    public long getLong(String key, long defaultValue) {
        String v = lookup(key);
        if (v == null) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Config key " + key + " is not a number: " + v, e);
        }
    }

    @Override
    public String getSecret(String key) {
        // secrets are returned verbatim, no trimming
        return lookup(key);
    }
}
