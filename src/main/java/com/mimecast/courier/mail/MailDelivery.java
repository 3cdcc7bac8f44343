package com.mimecast.courier.mail;

import com.mimecast.courier.attachment.AttachmentDescriptor;
import jakarta.mail.MessagingException;

import java.util.List;

/**
 * Notification mail delivery.
 */
public interface MailDelivery {

    /**
     * Sends a notification with attachments.
     *
     * @param to          Destination address.
     * @param subject     Subject line.
     * @param body        Plain text body.
     * @param attachments Attachments with downloaded content.
     * @throws MessagingException If the message cannot be built or sent.
     */
    void sendNotification(String to, String subject, String body, List<AttachmentDescriptor> attachments) throws MessagingException;
}
