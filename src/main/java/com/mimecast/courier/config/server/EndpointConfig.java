package com.mimecast.courier.config.server;

import com.mimecast.courier.config.BasicConfig;

import java.util.Map;

/**
 * Webhook endpoint configuration.
 *
 * <p>This class provides type safe access to the bind address, port and
 * <br>event path of the embedded HTTP server receiving platform events.
 */
public class EndpointConfig extends BasicConfig {

    /**
     * Constructs a new EndpointConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets bind address.
     *
     * @return Bind address string.
     */
    public String getBind() {
        return getStringProperty("bind", "0.0.0.0");
    }

    /**
     * Gets the port number for this endpoint.
     *
     * @param defaultPort Default port to use if not configured.
     * @return Port number.
     */
    public int getPort(int defaultPort) {
        return Math.toIntExact(getLongProperty("port", (long) defaultPort));
    }

    /**
     * Gets event callback path.
     *
     * @return Path string.
     */
    public String getPath() {
        return getStringProperty("path", "/webhook/event");
    }

    /**
     * Gets socket backlog.
     *
     * @return Backlog size.
     */
    public int getBacklog() {
        return Math.toIntExact(getLongProperty("backlog", 10L));
    }
}
