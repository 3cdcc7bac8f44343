package com.mimecast.courier.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.mimecast.courier.util.SecretDecoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Loads a JSON5 file into the configuration map.
 * <p>Gson reads leniently so comments, unquoted keys and single quoted strings are accepted.
 * <p>String values carrying the {@code ENC:} prefix are decrypted while loading.
 *
 * @see SecretDecoder
 */
public class ConfigFoundation extends BasicConfig {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() {
    }.getType();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path    Path to configuration file.
     * @param decoder Secret decoder for encrypted values.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path, SecretDecoder decoder) throws IOException {
        super(load(Paths.get(path), decoder));
    }

    /**
     * Reads and parses a JSON5 file.
     *
     * @param path    File path.
     * @param decoder Secret decoder.
     * @return Map of String, Object.
     * @throws IOException Unable to read or parse file.
     */
    static Map<String, Object> load(Path path, SecretDecoder decoder) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);

        Map<String, Object> parsed;
        try {
            parsed = new Gson().fromJson(content, MAP_TYPE);
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }

        if (parsed == null) {
            throw new IOException("Empty configuration file " + path);
        }

        try {
            decryptValues(parsed, decoder);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unable to decrypt value in " + path + ": " + e.getMessage(), e);
        }

        log.debug("Loaded configuration file: {}", path);
        return parsed;
    }

    /**
     * Decrypts encrypted string values in place, descending into maps and lists.
     *
     * @param map     Configuration map.
     * @param decoder Secret decoder.
     */
    @SuppressWarnings("unchecked")
    private static void decryptValues(Map<String, Object> map, SecretDecoder decoder) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String && SecretDecoder.isEncrypted((String) value)) {
                entry.setValue(decoder.decode((String) value));
            } else if (value instanceof Map) {
                decryptValues((Map<String, Object>) value, decoder);
            } else if (value instanceof List) {
                List<Object> list = new ArrayList<>((List<Object>) value);
                for (int i = 0; i < list.size(); i++) {
                    Object item = list.get(i);
                    if (item instanceof String && SecretDecoder.isEncrypted((String) item)) {
                        list.set(i, decoder.decode((String) item));
                    } else if (item instanceof Map) {
                        decryptValues((Map<String, Object>) item, decoder);
                    }
                }
                entry.setValue(list);
            }
        }
    }
}
