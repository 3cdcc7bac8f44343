package com.mimecast.courier.approval;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.mimecast.courier.form.JsonValues;

/**
 * Approval webhook event.
 *
 * <p>Reads v2 envelopes ({@code header.event_type}) and v1 envelopes ({@code event.type}).
 * <br>Status and instance code may sit in several places depending on the event version.
 *
 * @param eventType    Event type, empty if absent.
 * @param status       Instance status, empty if absent.
 * @param instanceCode Instance code, empty if absent.
 */
public record ApprovalEvent(String eventType, String status, String instanceCode) {

    static final String INSTANCE_EVENT = "approval_instance";
    static final String APPROVED = "APPROVED";

    /**
     * Parses an event envelope.
     *
     * @param envelope Envelope JSON object.
     * @return ApprovalEvent instance.
     */
    public static ApprovalEvent fromEnvelope(JsonObject envelope) {
        JsonObject header = object(envelope, "header");
        JsonObject event = object(envelope, "event");
        JsonObject nested = object(event, "object");

        String eventType = JsonValues.firstText(header, "event_type")
                .or(() -> JsonValues.firstText(event, "type"))
                .orElse("");
        String status = JsonValues.firstText(event, "status", "instance_status")
                .or(() -> JsonValues.firstText(nested, "status"))
                .orElse("");
        String instanceCode = JsonValues.firstText(event, "instance_code", "approval_code")
                .or(() -> JsonValues.firstText(nested, "instance_code"))
                .orElse("");

        return new ApprovalEvent(eventType, status, instanceCode);
    }

    /**
     * Is this an approval instance event.
     *
     * @return Boolean.
     */
    public boolean isInstanceEvent() {
        return eventType.contains(INSTANCE_EVENT);
    }

    /**
     * Is the instance approved.
     *
     * @return Boolean.
     */
    public boolean isApproved() {
        return APPROVED.equals(status);
    }

    /**
     * Has an instance code.
     *
     * @return Boolean.
     */
    public boolean hasInstanceCode() {
        return !instanceCode.isEmpty();
    }

    private static JsonObject object(JsonObject parent, String key) {
        JsonElement element = parent.get(key);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
    }
}
