package com.mimecast.courier.form;

import java.util.Arrays;

/**
 * Declared approval form control types.
 */
public enum ControlType {
    INPUT("input"),
    AMOUNT("amount"),
    FIELD_LIST("fieldList"),
    ATTACHMENT("attachment"),
    ATTACHMENT_V2("attachmentV2"),
    SELECT("select"),
    OTHER("");

    private final String key;

    ControlType(String key) {
        this.key = key;
    }

    /**
     * Gets the type key as it appears in form JSON.
     *
     * @return Key string, empty for {@link #OTHER}.
     */
    public String getKey() {
        return key;
    }

    /**
     * Is this an attachment bearing type.
     *
     * @return Boolean.
     */
    public boolean isAttachment() {
        return this == ATTACHMENT || this == ATTACHMENT_V2;
    }

    /**
     * Resolves a type key, case sensitive.
     *
     * @param key Type key from form JSON.
     * @return ControlType, {@link #OTHER} if unknown.
     */
    public static ControlType fromKey(String key) {
        if (key == null || key.isEmpty()) {
            return OTHER;
        }
        return Arrays.stream(values())
                .filter(type -> type.key.equals(key))
                .findFirst()
                .orElse(OTHER);
    }
}
