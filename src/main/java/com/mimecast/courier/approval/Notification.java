package com.mimecast.courier.approval;

import com.mimecast.courier.attachment.AttachmentDescriptor;

import java.util.List;

/**
 * Outgoing approval notification.
 *
 * @param to          Destination address.
 * @param subject     Subject line.
 * @param body        Plain text body.
 * @param attachments Downloaded attachments.
 */
public record Notification(String to, String subject, String body, List<AttachmentDescriptor> attachments) {

    /**
     * Constructs a new Notification with an immutable attachment list.
     */
    public Notification {
        attachments = List.copyOf(attachments);
    }
}
