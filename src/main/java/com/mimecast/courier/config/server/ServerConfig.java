package com.mimecast.courier.config.server;

import com.mimecast.courier.config.BasicConfig;
import com.mimecast.courier.config.ConfigFoundation;
import com.mimecast.courier.util.SecretDecoder;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to server configuration.
 * <p>Each section of {@code server.json5} is mapped to a dedicated config object.
 *
 * @see FeishuConfig
 * @see SmtpConfig
 * @see EndpointConfig
 * @see FormConfig
 * @see CategoryConfig
 */
public class ServerConfig extends ConfigFoundation {

    /**
     * Configuration file name within the configuration directory.
     */
    public static final String FILENAME = "server.json5";

    /**
     * Constructs a new ServerConfig instance.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path    Path to configuration file.
     * @param decoder Secret decoder for encrypted values.
     * @throws IOException Unable to read file.
     */
    public ServerConfig(String path, SecretDecoder decoder) throws IOException {
        super(path, decoder);
    }

    /**
     * Loads server configuration from a configuration directory.
     *
     * @param dir     Configuration directory path.
     * @param decoder Secret decoder for encrypted values.
     * @return ServerConfig instance.
     * @throws IOException Unable to read file.
     */
    public static ServerConfig fromDirectory(String dir, SecretDecoder decoder) throws IOException {
        return new ServerConfig(dir + File.separator + FILENAME, decoder);
    }

    /**
     * Gets Feishu API configuration.
     *
     * @return FeishuConfig instance.
     */
    public FeishuConfig getFeishu() {
        return new FeishuConfig(getMapProperty("feishu"));
    }

    /**
     * Gets SMTP delivery configuration.
     *
     * @return SmtpConfig instance.
     */
    public SmtpConfig getSmtp() {
        return new SmtpConfig(getMapProperty("smtp"));
    }

    /**
     * Gets webhook endpoint configuration.
     *
     * @return EndpointConfig instance.
     */
    public EndpointConfig getWebhook() {
        return new EndpointConfig(getMapProperty("webhook"));
    }

    /**
     * Gets form extraction configuration.
     *
     * @return FormConfig instance.
     */
    public FormConfig getForm() {
        return new FormConfig(getMapProperty("form"));
    }

    /**
     * Gets approval category to mailbox mapping.
     *
     * @return CategoryConfig instance.
     */
    public CategoryConfig getCategories() {
        return new CategoryConfig(getMapProperty("categories"));
    }

    /**
     * Gets event worker pool size.
     *
     * @return Pool size.
     */
    public int getEventWorkers() {
        return Math.toIntExact(new BasicConfig(getMapProperty("workers")).getLongProperty("events", 4L));
    }

    /**
     * Gets attachment download pool size.
     *
     * @return Pool size.
     */
    public int getDownloadWorkers() {
        return Math.toIntExact(new BasicConfig(getMapProperty("workers")).getLongProperty("downloads", 4L));
    }
}
