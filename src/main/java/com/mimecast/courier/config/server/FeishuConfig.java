package com.mimecast.courier.config.server;

import com.mimecast.courier.config.BasicConfig;

import java.util.Map;

/**
 * Feishu open platform configuration.
 *
 * <p>Holds the application credentials used to obtain a tenant access token
 * <br>and the base URL of the open API.
 */
public class FeishuConfig extends BasicConfig {

    /**
     * Constructs a new FeishuConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public FeishuConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets open API base URL.
     *
     * @return URL string.
     */
    public String getBaseUrl() {
        return getStringProperty("baseUrl", "https://open.feishu.cn/open-apis");
    }

    /**
     * Gets application ID.
     *
     * @return App ID string.
     */
    public String getAppId() {
        return getStringProperty("appId", "");
    }

    /**
     * Gets application secret.
     *
     * @return App secret string.
     */
    public String getAppSecret() {
        return getStringProperty("appSecret", "");
    }

    /**
     * Gets HTTP timeout in seconds.
     *
     * @return Timeout value.
     */
    public int getTimeoutSeconds() {
        return Math.toIntExact(getLongProperty("timeoutSeconds", 30L));
    }
}
