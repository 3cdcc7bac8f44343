package com.mimecast.courier.form;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;

import java.util.Optional;

/**
 * Helpers for reading weakly typed JSON values.
 *
 * <p>Form documents and their nested encoded values are parsed strictly so that
 * <br>plain text such as a bare URL is never mistaken for a JSON literal.
 */
public final class JsonValues {

    private static final Gson STRICT = new GsonBuilder()
            .setStrictness(Strictness.STRICT)
            .create();

    /**
     * Private constructor for utility class.
     */
    private JsonValues() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses JSON text strictly.
     *
     * @param text JSON text.
     * @return Optional of JsonElement, empty if text is null, blank or not valid JSON.
     */
    public static Optional<JsonElement> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(STRICT.fromJson(text, JsonElement.class));
        } catch (JsonParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Renders a value as text.
     * <p>Primitives yield their string form, nested structures their JSON text.
     *
     * @param element JSON value, may be null.
     * @return Text, empty if null or JSON null.
     */
    public static String text(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return "";
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        return element.toString();
    }

    /**
     * Gets the first non-empty text value among the given keys.
     *
     * @param object JSON object.
     * @param keys   Keys in priority order.
     * @return Optional of String.
     */
    public static Optional<String> firstText(JsonObject object, String... keys) {
        for (String key : keys) {
            String value = text(object.get(key));
            if (!value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Is the value absent or empty.
     * <p>Covers null, JSON null, empty strings, empty arrays and empty objects.
     *
     * @param element JSON value, may be null.
     * @return Boolean.
     */
    public static boolean isEmpty(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return true;
        }
        if (element.isJsonPrimitive()) {
            return element.getAsJsonPrimitive().isString() && element.getAsString().isEmpty();
        }
        if (element.isJsonArray()) {
            return element.getAsJsonArray().isEmpty();
        }
        return element.getAsJsonObject().size() == 0;
    }
}
