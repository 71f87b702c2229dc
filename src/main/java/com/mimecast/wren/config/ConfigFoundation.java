package com.mimecast.wren.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 * <p>Map backed configuration with typed accessors.
 * <p>Files are JSON5 and parsed leniently so comments and unquoted keys are allowed.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        try (Reader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)) {
            Map<String, Object> parsed = new Gson().fromJson(reader, Map.class);
            if (parsed != null) {
                this.map = parsed;
            }
        } catch (JsonParseException e) {
            throw new IOException("Unable to parse config file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name) && map.get(name) != null;
    }

    /**
     * Gets string property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        return hasProperty(name) ? map.get(name).toString() : defaultValue;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets long property.
     * <p>Gson reads all numbers as doubles so any Number is accepted, as are numeric strings.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        if (hasProperty(name)) {
            Object value = map.get(name);
            if (value instanceof Number) {
                return ((Number) value).longValue();
            } else if (value instanceof String) {
                try {
                    return Long.parseLong((String) value);
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        if (hasProperty(name)) {
            Object value = map.get(name);
            if (value instanceof Boolean) {
                return (Boolean) value;
            } else if (value instanceof String) {
                return Boolean.parseBoolean((String) value);
            }
        }
        return defaultValue;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }

    /**
     * Gets list property as strings.
     * <p>A single value is returned as a list of one.
     *
     * @param name Property name.
     * @return List of strings, empty if missing.
     */
    public List<String> getListProperty(String name) {
        List<String> result = new ArrayList<>();
        Object value = map.get(name);
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }
}
