package com.mimecast.courier.mail;

import com.mimecast.courier.attachment.AttachmentDescriptor;
import com.mimecast.courier.config.server.SmtpConfig;
import jakarta.mail.BodyPart;
import jakarta.mail.Message;
import jakarta.mail.Part;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimeUtility;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SmtpMailDelivery.
 */
class SmtpMailDeliveryTest {

    @Test
    void testImplicitTlsProperties() {
        Properties props = SmtpMailDelivery.sessionProperties(new SmtpConfig(Map.of(
                "host", "smtp.example.com",
                "port", 465.0,
                "username", "robot@example.com"
        )));

        assertEquals("smtp.example.com", props.getProperty("mail.smtp.host"));
        assertEquals("465", props.getProperty("mail.smtp.port"));
        assertEquals("true", props.getProperty("mail.smtp.ssl.enable"));
        assertNull(props.getProperty("mail.smtp.starttls.enable"));
        assertEquals("true", props.getProperty("mail.smtp.auth"));
        assertEquals("30000", props.getProperty("mail.smtp.timeout"));
    }

    @Test
    void testStartTlsProperties() {
        Properties props = SmtpMailDelivery.sessionProperties(new SmtpConfig(Map.of(
                "port", 587.0,
                "timeoutMillis", 5000.0
        )));

        assertEquals("true", props.getProperty("mail.smtp.starttls.enable"));
        assertEquals("true", props.getProperty("mail.smtp.starttls.required"));
        assertNull(props.getProperty("mail.smtp.ssl.enable"));
        assertEquals("false", props.getProperty("mail.smtp.auth"));
        assertEquals("5000", props.getProperty("mail.smtp.connectiontimeout"));
    }

    @Test
    void testBuildMessage() throws Exception {
        SmtpMailDelivery delivery = new SmtpMailDelivery(new SmtpConfig(Map.of(
                "username", "robot@example.com",
                "from", "approvals@example.com"
        )));

        AttachmentDescriptor invoice = new AttachmentDescriptor("tok", "发票.pdf", "", "http://x/1")
                .setContent("%PDF-1.4".getBytes(StandardCharsets.UTF_8));
        AttachmentDescriptor image = new AttachmentDescriptor("", "scan.png", "", "http://x/2")
                .setContent(new byte[]{1, 2, 3});

        MimeMessage built = delivery.buildMessage("finance@example.com", "[费用报销]-出租车",
                "审批已通过\n\n附件数量: 2\n", List.of(invoice, image));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        built.writeTo(out);
        String raw = out.toString(StandardCharsets.US_ASCII);
        assertTrue(raw.contains("Subject: =?UTF-8?"));
        assertTrue(raw.contains("Content-Transfer-Encoding: base64"));

        MimeMessage parsed = new MimeMessage(delivery.getSession(), new ByteArrayInputStream(out.toByteArray()));
        assertEquals("[费用报销]-出租车", parsed.getSubject());
        assertEquals("approvals@example.com", parsed.getFrom()[0].toString());
        assertEquals("finance@example.com", parsed.getRecipients(Message.RecipientType.TO)[0].toString());

        MimeMultipart multipart = (MimeMultipart) parsed.getContent();
        assertEquals(3, multipart.getCount());

        BodyPart text = multipart.getBodyPart(0);
        assertTrue(text.isMimeType("text/plain"));
        assertEquals("审批已通过\n\n附件数量: 2\n", text.getContent().toString().replace("\r\n", "\n"));

        BodyPart first = multipart.getBodyPart(1);
        assertTrue(first.isMimeType("application/octet-stream"));
        assertEquals(Part.ATTACHMENT, first.getDisposition());
        assertEquals("发票.pdf", MimeUtility.decodeText(first.getFileName()));
        assertArrayEquals("%PDF-1.4".getBytes(StandardCharsets.UTF_8), bytes(first));

        BodyPart second = multipart.getBodyPart(2);
        assertEquals("scan.png", MimeUtility.decodeText(second.getFileName()));
        assertArrayEquals(new byte[]{1, 2, 3}, bytes(second));
    }

    @Test
    void testFromDefaultsToUsername() throws Exception {
        SmtpMailDelivery delivery = new SmtpMailDelivery(new SmtpConfig(Map.of("username", "robot@example.com")));

        MimeMessage message = delivery.buildMessage("a@example.com", "s", "b", List.of());
        assertEquals("robot@example.com", message.getFrom()[0].toString());
    }

    private static byte[] bytes(BodyPart part) throws Exception {
        try (InputStream is = part.getInputStream()) {
            return is.readAllBytes();
        }
    }
}
