package com.mimecast.courier.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Basic configuration container.
 *
 * <p>Provides type safe accessors over a configuration map as parsed from JSON5.
 * <p>Gson parses all numbers as doubles so numeric accessors accept any {@link Number}.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map;

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Gets string property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        if (value == null) {
            return def;
        }
        if (value instanceof Double && (Double) value == Math.rint((Double) value)) {
            return String.valueOf(((Double) value).longValue());
        }
        return String.valueOf(value);
    }

    /**
     * Gets long property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String && !((String) value).isEmpty()) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    /**
     * Gets map property.
     * <p>Returns an empty map if the property is missing or not a map.
     *
     * @param name Property name.
     * @return Map of String, Object.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }
}
