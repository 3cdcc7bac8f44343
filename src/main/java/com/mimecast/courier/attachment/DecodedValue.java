package com.mimecast.courier.attachment;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

/**
 * Outcome of decoding the raw value of an attachment control.
 *
 * <p>Text values may hold nested JSON, a bare URL or junk.
 * <br>This keeps the decision explicit until the resolver collapses it into descriptors.
 *
 * @param kind    Decoding outcome.
 * @param element Structured value for {@link Kind#STRUCTURED}, URL string for {@link Kind#DIRECT_URL}, else JSON null.
 */
public record DecodedValue(Kind kind, JsonElement element) {

    /**
     * Decoding outcomes.
     */
    public enum Kind {
        EMPTY,
        STRUCTURED,
        DIRECT_URL,
        DISCARDED
    }

    /**
     * Constructs a new DecodedValue.
     */
    public DecodedValue {
        element = element == null ? JsonNull.INSTANCE : element;
    }

    /**
     * Gets an empty outcome.
     *
     * @return DecodedValue instance.
     */
    public static DecodedValue empty() {
        return new DecodedValue(Kind.EMPTY, JsonNull.INSTANCE);
    }

    /**
     * Gets a discarded outcome.
     *
     * @return DecodedValue instance.
     */
    public static DecodedValue discarded() {
        return new DecodedValue(Kind.DISCARDED, JsonNull.INSTANCE);
    }
}
