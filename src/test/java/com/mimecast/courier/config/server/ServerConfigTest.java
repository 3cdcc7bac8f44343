package com.mimecast.courier.config.server;

import com.mimecast.courier.util.SecretDecoder;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    private static final SecretDecoder decoder = new SecretDecoder("test-key");
    private static ServerConfig config;

    @BeforeAll
    static void before() throws IOException {
        config = ServerConfig.fromDirectory("src/test/resources/cfg", decoder);
    }

    @Test
    void testFeishu() {
        FeishuConfig feishu = config.getFeishu();
        assertEquals("http://localhost:9999/open-apis", feishu.getBaseUrl());
        assertEquals("cli_test", feishu.getAppId());
        assertEquals("secret", feishu.getAppSecret());
        assertEquals(5, feishu.getTimeoutSeconds());
    }

    @Test
    void testSmtp() {
        SmtpConfig smtp = config.getSmtp();
        assertEquals("127.0.0.1", smtp.getHost());
        assertEquals(587, smtp.getPort());
        assertTrue(smtp.isStartTls());
        assertEquals("robot@example.com", smtp.getUsername());
        assertEquals("password", smtp.getPassword());
        assertEquals("robot@example.com", smtp.getFrom());
        assertEquals(2000, smtp.getTimeoutMillis());
    }

    @Test
    void testWebhook() {
        EndpointConfig webhook = config.getWebhook();
        assertEquals("127.0.0.1", webhook.getBind());
        assertEquals(0, webhook.getPort(8080));
        assertEquals("/hooks/approval", webhook.getPath());
        assertEquals(10, webhook.getBacklog());
    }

    @Test
    void testForm() {
        FormConfig form = config.getForm();
        assertEquals("Title", form.getTitleField());
        assertEquals("金额", form.getAmountField());
        assertEquals("SEK", form.getDefaultCurrency());
        assertEquals(8, form.getMaxDepth());
    }

    @Test
    void testCategories() {
        Map<String, String> mappings = config.getCategories().getMappings();
        assertEquals(2, mappings.size());
        assertEquals("finance@example.com", mappings.get("Expense"));
        assertEquals("", mappings.get("Disabled"));
        assertFalse(mappings.containsKey("Numeric"));
        assertThrows(UnsupportedOperationException.class, () -> mappings.put("x", "y"));
    }

    @Test
    void testWorkers() {
        assertEquals(2, config.getEventWorkers());
        assertEquals(3, config.getDownloadWorkers());
    }

    @Test
    void testDefaults() {
        ServerConfig empty = new ServerConfig();
        assertEquals("https://open.feishu.cn/open-apis", empty.getFeishu().getBaseUrl());
        assertEquals(30, empty.getFeishu().getTimeoutSeconds());
        assertEquals("localhost", empty.getSmtp().getHost());
        assertEquals(465, empty.getSmtp().getPort());
        assertFalse(empty.getSmtp().isStartTls());
        assertEquals("0.0.0.0", empty.getWebhook().getBind());
        assertEquals(8080, empty.getWebhook().getPort(8080));
        assertEquals("/webhook/event", empty.getWebhook().getPath());
        assertEquals("名称", empty.getForm().getTitleField());
        assertEquals(64, empty.getForm().getMaxDepth());
        assertTrue(empty.getCategories().getMappings().isEmpty());
        assertEquals(4, empty.getEventWorkers());
        assertEquals(4, empty.getDownloadWorkers());
    }

    @Test
    void testEncryptedValues(@TempDir Path dir) throws IOException {
        String secret = "ENC:" + encrypt("s3cr3t", "test-key");
        Files.writeString(dir.resolve(ServerConfig.FILENAME),
                "{ feishu: { appSecret: \"" + secret + "\" }, smtp: { password: \"" + secret + "\" } }",
                StandardCharsets.UTF_8);

        ServerConfig encrypted = ServerConfig.fromDirectory(dir.toString(), decoder);
        assertEquals("s3cr3t", encrypted.getFeishu().getAppSecret());
        assertEquals("s3cr3t", encrypted.getSmtp().getPassword());
    }

    @Test
    void testInvalidEncryptedValue(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(ServerConfig.FILENAME), "{ smtp: { password: \"ENC:@@@\" } }", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> ServerConfig.fromDirectory(dir.toString(), decoder));
    }

    @Test
    void testEncryptedValueWithWrongKey(@TempDir Path dir) throws IOException {
        String secret = "ENC:" + encrypt("smtp-password", "key");
        Files.writeString(dir.resolve(ServerConfig.FILENAME), "{ smtp: { password: \"" + secret + "\" } }", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> ServerConfig.fromDirectory(dir.toString(), new SecretDecoder("wrong-key")));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> ServerConfig.fromDirectory(dir.toString(), decoder));
    }

    @Test
    void testEmptyFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve(ServerConfig.FILENAME), "", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> ServerConfig.fromDirectory(dir.toString(), decoder));
    }

    private static String encrypt(String plain, String key) {
        byte[] digest = DigestUtils.sha256(key.getBytes(StandardCharsets.UTF_8));
        byte[] input = plain.getBytes(StandardCharsets.UTF_8);
        byte[] output = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            output[i] = (byte) (input[i] ^ digest[i % digest.length]);
        }
        return Base64.encodeBase64String(output);
    }
}
