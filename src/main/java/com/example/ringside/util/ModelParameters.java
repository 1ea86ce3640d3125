package com.example.ringside.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named parameter table for the scoring, recovery and stoppage formulas.
 *
 * Values are looked up by dot path, e.g. {@code scoring.thresholds.clearRound}.
 * A path missing from the YAML falls back to the default passed in by the caller,
 * so an empty table still runs with the built-in constants.
 */
public class ModelParameters {
    private static final Logger logger = LoggerFactory.getLogger(ModelParameters.class);

    public static final String DEFAULT_RESOURCE = "/params/model-parameters.yaml";

    private final Map<String, Object> root;
    private final Map<String, Object> overrides = new HashMap<>();

    public ModelParameters(Map<String, Object> root) {
        this.root = root == null ? Collections.emptyMap() : root;
    }

    public static ModelParameters empty() {
        return new ModelParameters(Collections.emptyMap());
    }

    public static ModelParameters loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load from a classpath resource. A missing or unreadable resource logs a
     * warning and yields an empty table.
     */
    public static ModelParameters fromResource(String resourcePath) {
        try (InputStream is = ModelParameters.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[ModelParameters] Resource not found: {}, using built-in defaults", resourcePath);
                return empty();
            }
            Object data = new Yaml().load(is);
            return new ModelParameters(asMap(data));
        } catch (Exception e) {
            logger.warn("[ModelParameters] Failed to load {}: {}", resourcePath, e.getMessage(), e);
            return empty();
        }
    }

    public static ModelParameters fromYaml(String yamlText) {
        Object data = new Yaml().load(yamlText);
        return new ModelParameters(asMap(data));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object data) {
        if (data instanceof Map) {
            Map<String, Object> out = new LinkedHashMap<>();
            ((Map<Object, Object>) data).forEach((k, v) -> out.put(String.valueOf(k), v));
            return out;
        }
        return Collections.emptyMap();
    }

    /**
     * Raw value at a dot path, or null.
     */
    public Object get(String path) {
        if (overrides.containsKey(path)) return overrides.get(path);
        Object current = root;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) return null;
            current = ((Map<?, ?>) current).get(part);
            if (current == null) return null;
        }
        return current;
    }

    public double getDouble(String path, double defaultValue) {
        Object v = get(path);
        if (v instanceof Number) return ((Number) v).doubleValue();
        if (v != null) {
            try {
                return Double.parseDouble(v.toString().trim());
            } catch (NumberFormatException e) {
                logger.warn("[ModelParameters] Non-numeric value at {}: {}", path, v);
            }
        }
        return defaultValue;
    }

    public int getInt(String path, int defaultValue) {
        return (int) Math.round(getDouble(path, defaultValue));
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        Object v = get(path);
        if (v instanceof Boolean) return (Boolean) v;
        if (v != null) return Boolean.parseBoolean(v.toString().trim());
        return defaultValue;
    }

    public String getString(String path, String defaultValue) {
        Object v = get(path);
        return v == null ? defaultValue : v.toString();
    }

    /** Pin a value for this instance only. */
    public ModelParameters override(String path, Object value) {
        overrides.put(path, value);
        return this;
    }

    public String getVersion() {
        return getString("version", "builtin");
    }
}
