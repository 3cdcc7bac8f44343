package com.mimecast.courier.main;

import com.mimecast.courier.config.server.ServerConfig;
import com.mimecast.courier.util.SecretDecoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>Holds the loaded server configuration for the lifetime of the process.
 *
 * @see ServerConfig
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Server configuration.
     */
    private static ServerConfig server = new ServerConfig();

    /**
     * Init server configuration from a directory.
     *
     * @param dir     Configuration directory path.
     * @param decoder Secret decoder for encrypted values.
     * @throws IOException Unable to read file.
     */
    public static void initServer(String dir, SecretDecoder decoder) throws IOException {
        server = ServerConfig.fromDirectory(dir, decoder);
        log.info("Loaded server configuration from {}", dir);
    }

    /**
     * Gets server configuration.
     *
     * @return ServerConfig instance.
     */
    public static ServerConfig getServer() {
        return server;
    }

    /**
     * Sets server configuration.
     *
     * @param config ServerConfig instance.
     */
    public static void setServer(ServerConfig config) {
        server = config;
    }
}
