package com.mimecast.courier.form;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

/**
 * Attachment bearing control.
 *
 * <p>Value and side-data keep their raw JSON shape, which varies between templates.
 * <br>Both are deep copies.
 *
 * @param name  Control label.
 * @param type  {@link ControlType#ATTACHMENT} or {@link ControlType#ATTACHMENT_V2}.
 * @param value Raw value, {@link JsonNull} if absent.
 * @param ext   Raw side-data, {@link JsonNull} if absent.
 * @see com.mimecast.courier.attachment.AttachmentResolver
 */
public record AttachmentControl(String name, ControlType type, JsonElement value, JsonElement ext)
        implements FormControl {

    /**
     * Constructs a new AttachmentControl.
     */
    public AttachmentControl {
        if (!type.isAttachment()) {
            throw new IllegalArgumentException("Not an attachment type: " + type);
        }
        value = value == null ? JsonNull.INSTANCE : value.deepCopy();
        ext = ext == null ? JsonNull.INSTANCE : ext.deepCopy();
    }

    @Override
    public JsonElement value() {
        return value.deepCopy();
    }

    @Override
    public JsonElement ext() {
        return ext.deepCopy();
    }
}
