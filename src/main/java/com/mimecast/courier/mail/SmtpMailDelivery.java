package com.mimecast.courier.mail;

import com.mimecast.courier.attachment.AttachmentDescriptor;
import com.mimecast.courier.config.server.SmtpConfig;
import jakarta.activation.DataHandler;
import jakarta.mail.*;
import jakarta.mail.internet.*;
import jakarta.mail.util.ByteArrayDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * SMTP mail delivery.
 *
 * <p>Sends a multipart message with a UTF-8 plain text body and one base64 part per attachment.
 * <br>Port 587 negotiates STARTTLS, any other port uses implicit TLS.
 */
public class SmtpMailDelivery implements MailDelivery {
    private static final Logger log = LogManager.getLogger(SmtpMailDelivery.class);

    static final String ATTACHMENT_TYPE = "application/octet-stream";

    private final SmtpConfig config;
    private final Session session;

    /**
     * Constructs a new SmtpMailDelivery instance.
     *
     * @param config SmtpConfig instance.
     */
    public SmtpMailDelivery(SmtpConfig config) {
        this.config = config;
        this.session = Session.getInstance(sessionProperties(config));
    }

    /**
     * Builds session properties for the configured server.
     *
     * @param config SmtpConfig instance.
     * @return Properties instance.
     */
    static Properties sessionProperties(SmtpConfig config) {
        String timeout = String.valueOf(config.getTimeoutMillis());

        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", config.getHost());
        props.put("mail.smtp.port", String.valueOf(config.getPort()));
        props.put("mail.smtp.auth", String.valueOf(!config.getUsername().isEmpty()));
        props.put("mail.smtp.connectiontimeout", timeout);
        props.put("mail.smtp.timeout", timeout);
        props.put("mail.smtp.writetimeout", timeout);

        if (config.isStartTls()) {
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.starttls.required", "true");
        } else {
            props.put("mail.smtp.ssl.enable", "true");
        }

        return props;
    }

    /**
     * Gets the mail session.
     *
     * @return Session instance.
     */
    public Session getSession() {
        return session;
    }

    @Override
    public void sendNotification(String to, String subject, String body, List<AttachmentDescriptor> attachments) throws MessagingException {
        MimeMessage message = buildMessage(to, subject, body, attachments);

        log.info("Sending mail to {} via {}:{} with {} attachments", to, config.getHost(), config.getPort(), attachments.size());
        if (config.getUsername().isEmpty()) {
            Transport.send(message);
        } else {
            Transport.send(message, config.getUsername(), config.getPassword());
        }
        log.info("Mail sent to {}", to);
    }

    /**
     * Builds the notification message.
     *
     * @param to          Destination address.
     * @param subject     Subject line.
     * @param body        Plain text body.
     * @param attachments Attachments with downloaded content.
     * @return MimeMessage instance.
     * @throws MessagingException If the message cannot be built.
     */
    public MimeMessage buildMessage(String to, String subject, String body, List<AttachmentDescriptor> attachments) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(config.getFrom()));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to));
        message.setSubject(subject, StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());

        MimeMultipart multipart = new MimeMultipart();

        MimeBodyPart text = new MimeBodyPart();
        text.setText(body, StandardCharsets.UTF_8.name(), "plain");
        multipart.addBodyPart(text);

        for (AttachmentDescriptor attachment : attachments) {
            multipart.addBodyPart(attachmentPart(attachment));
        }

        message.setContent(multipart);
        message.saveChanges();
        return message;
    }

    /**
     * Builds an attachment part.
     *
     * @param attachment Attachment with content.
     * @return MimeBodyPart instance.
     * @throws MessagingException If the part cannot be built.
     */
    private MimeBodyPart attachmentPart(AttachmentDescriptor attachment) throws MessagingException {
        byte[] content = attachment.getContent().orElse(new byte[0]);

        MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(new ByteArrayDataSource(content, ATTACHMENT_TYPE)));
        part.setDisposition(Part.ATTACHMENT);
        part.setHeader("Content-Transfer-Encoding", "base64");

        try {
            part.setFileName(MimeUtility.encodeText(attachment.getName(), StandardCharsets.UTF_8.name(), "B"));
        } catch (UnsupportedEncodingException e) {
            throw new MessagingException("Unable to encode file name: " + attachment.getName(), e);
        }

        return part;
    }
}
