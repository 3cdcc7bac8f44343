package com.mimecast.courier.util;

import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Decoder for secrets stored at rest in configuration files.
 *
 * <p>Encrypted values carry the {@code ENC:} prefix followed by a base64 payload.
 * <br>The payload is XOR-ed with the SHA-256 digest of a key.
 * <p>The key is taken from the {@code ENCRYPTION_KEY} environment variable when set,
 * <br>otherwise it is derived from the current user and hostname as {@code user@hostname}.
 *
 * <p>Example usage:
 * <pre>
 * SecretDecoder decoder = SecretDecoder.fromEnvironment();
 * String password = decoder.decode("ENC:q83vAQ==");
 * </pre>
 */
public class SecretDecoder {
    private static final Logger log = LogManager.getLogger(SecretDecoder.class);

    /**
     * Encrypted value prefix.
     */
    public static final String PREFIX = "ENC:";

    private final byte[] key;

    /**
     * Constructs a new SecretDecoder with the given key material.
     *
     * @param keyMaterial Key material, hashed with SHA-256 before use.
     */
    public SecretDecoder(String keyMaterial) {
        this.key = DigestUtils.sha256(keyMaterial.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a decoder keyed from the process environment.
     *
     * @return SecretDecoder instance.
     */
    public static SecretDecoder fromEnvironment() {
        String envKey = System.getenv("ENCRYPTION_KEY");
        if (envKey != null && !envKey.isEmpty()) {
            return new SecretDecoder(envKey);
        }

        String user = System.getenv().getOrDefault("USER", "default");
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = fallbackHost(System.getenv());
            log.warn("Unable to resolve hostname for secret key derivation, using {}: {}", host, e.getMessage());
        }
        log.debug("ENCRYPTION_KEY not set, deriving secret key from user and hostname");
        return new SecretDecoder(user + "@" + host);
    }

    /**
     * Gets the host name to use when the local host cannot be resolved.
     * <p>The {@code HOSTNAME} variable carries the node name on most systems.
     *
     * @param env Environment variables.
     * @return Host name, {@code localhost} as a last resort.
     */
    static String fallbackHost(Map<String, String> env) {
        String host = env.get("HOSTNAME");
        return host != null && !host.isBlank() ? host.trim() : "localhost";
    }

    /**
     * Checks if value is encrypted.
     *
     * @param value Value string.
     * @return Boolean.
     */
    public static boolean isEncrypted(String value) {
        return value != null && value.startsWith(PREFIX);
    }

    /**
     * Decodes the given value.
     * <p>Values without the {@code ENC:} prefix are returned as-is.
     *
     * @param value Possibly encrypted value.
     * @return Plain text value.
     * @throws IllegalArgumentException If the payload is not valid base64 or does not decrypt to UTF-8 text.
     */
    public String decode(String value) {
        if (!isEncrypted(value)) {
            return value;
        }

        String payload = value.substring(PREFIX.length());
        if (!Base64.isBase64(payload)) {
            throw new IllegalArgumentException("Encrypted value payload is not valid base64");
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(xor(Base64.decodeBase64(payload))))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Encrypted value does not decrypt to text, check the encryption key", e);
        }
    }

    private byte[] xor(byte[] input) {
        byte[] output = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            output[i] = (byte) (input[i] ^ key[i % key.length]);
        }
        return output;
    }
}
