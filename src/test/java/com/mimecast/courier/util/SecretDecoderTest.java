package com.mimecast.courier.util;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecretDecoderTest {

    @Test
    void testIsEncrypted() {
        assertTrue(SecretDecoder.isEncrypted("ENC:abc"));
        assertFalse(SecretDecoder.isEncrypted("abc"));
        assertFalse(SecretDecoder.isEncrypted("enc:abc"));
        assertFalse(SecretDecoder.isEncrypted(null));
    }

    @Test
    void testPlainPassthrough() {
        SecretDecoder decoder = new SecretDecoder("key");
        assertEquals("plain", decoder.decode("plain"));
        assertEquals("", decoder.decode(""));
        assertNull(decoder.decode(null));
    }

    @Test
    void testDecode() {
        SecretDecoder decoder = new SecretDecoder("key");
        assertEquals("password", decoder.decode("ENC:" + encrypt("password", "key")));
        assertEquals("密码", decoder.decode("ENC:" + encrypt("密码", "key")));
    }

    @Test
    void testDecodeLongerThanKey() {
        String plain = "a secret value that is longer than thirty two bytes";
        assertEquals(plain, new SecretDecoder("key").decode("ENC:" + encrypt(plain, "key")));
    }

    @Test
    void testWrongKey() {
        String encrypted = "ENC:" + encrypt("smtp-password", "key");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new SecretDecoder("wrong-key").decode(encrypted));
        assertTrue(e.getMessage().contains("encryption key"));
    }

    @Test
    void testFallbackHost() {
        assertEquals("node-1", SecretDecoder.fallbackHost(Map.of("HOSTNAME", "node-1")));
        assertEquals("node-1", SecretDecoder.fallbackHost(Map.of("HOSTNAME", " node-1\n")));
        assertEquals("localhost", SecretDecoder.fallbackHost(Map.of("HOSTNAME", " ")));
        assertEquals("localhost", SecretDecoder.fallbackHost(Map.of()));
    }

    @Test
    void testInvalidPayload() {
        assertThrows(IllegalArgumentException.class, () -> new SecretDecoder("key").decode("ENC:not base64!"));
    }

    @Test
    void testFromEnvironment() {
        assertNotNull(SecretDecoder.fromEnvironment());
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
