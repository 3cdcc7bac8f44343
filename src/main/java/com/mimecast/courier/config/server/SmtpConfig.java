package com.mimecast.courier.config.server;

import com.mimecast.courier.config.BasicConfig;

import java.util.Map;

/**
 * SMTP delivery configuration.
 *
 * <p>Port 587 is treated as submission with STARTTLS.
 * <br>Any other port is treated as implicit TLS.
 */
public class SmtpConfig extends BasicConfig {

    /**
     * Constructs a new SmtpConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public SmtpConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets SMTP host.
     *
     * @return Host string.
     */
    public String getHost() {
        return getStringProperty("host", "localhost");
    }

    /**
     * Gets SMTP port.
     *
     * @return Port number.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 465L));
    }

    /**
     * Gets SMTP username.
     *
     * @return Username string.
     */
    public String getUsername() {
        return getStringProperty("username", "");
    }

    /**
     * Gets SMTP password.
     *
     * @return Password string.
     */
    public String getPassword() {
        return getStringProperty("password", "");
    }

    /**
     * Gets sender address.
     *
     * @return From address string.
     */
    public String getFrom() {
        return getStringProperty("from", getUsername());
    }

    /**
     * Gets connection and read timeout in milliseconds.
     *
     * @return Timeout value.
     */
    public int getTimeoutMillis() {
        return Math.toIntExact(getLongProperty("timeoutMillis", 30000L));
    }

    /**
     * Is STARTTLS used instead of implicit TLS.
     *
     * @return Boolean.
     */
    public boolean isStartTls() {
        return getPort() == 587;
    }
}
