package com.mimecast.courier.feishu;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.mimecast.courier.form.JsonValues;
import okhttp3.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Feishu open platform client.
 *
 * <p>Implements the approval, drive media and tenant token calls needed to forward approvals.
 * <br>Authenticated calls carry a tenant access token from the shared {@link TokenCache}.
 *
 * <p>Example usage:
 * <pre>
 * FeishuClient client = new FeishuClient.Builder()
 *     .withAppId("cli_a1b2c3")
 *     .withAppSecret("secret")
 *     .build();
 *
 * ApprovalInstance instance = client.getApprovalInstance("A1B2-C3D4");
 * </pre>
 */
public class FeishuClient implements ApprovalApi {
    private static final Logger log = LogManager.getLogger(FeishuClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String DEFAULT_BASE_URL = "https://open.feishu.cn/open-apis";
    private static final int DEFAULT_TIMEOUT = 30;

    private final String baseUrl;
    private final String appId;
    private final String appSecret;
    private final OkHttpClient httpClient;
    private final TokenCache tokenCache;
    private final Gson gson;

    /**
     * Constructs a new FeishuClient instance.
     *
     * @param builder Builder instance with configuration.
     */
    private FeishuClient(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.appId = builder.appId;
        this.appSecret = builder.appSecret;
        this.gson = new Gson();

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(builder.timeout, TimeUnit.SECONDS)
                .readTimeout(builder.timeout, TimeUnit.SECONDS)
                .writeTimeout(builder.timeout, TimeUnit.SECONDS)
                .followRedirects(true)
                .build();

        this.tokenCache = builder.tokenCache != null ? builder.tokenCache : new TokenCache(this::fetchTenantToken);
    }

    /**
     * Gets the token cache in use.
     *
     * @return TokenCache instance.
     */
    public TokenCache getTokenCache() {
        return tokenCache;
    }

    /**
     * Requests a new tenant access token.
     *
     * @return AccessToken instance.
     * @throws RemoteApiException If the request fails or is rejected.
     */
    public TokenCache.AccessToken fetchTenantToken() throws RemoteApiException {
        JsonObject payload = new JsonObject();
        payload.addProperty("app_id", appId);
        payload.addProperty("app_secret", appSecret);

        Request request = new Request.Builder()
                .url(url("auth/v3/tenant_access_token/internal").build())
                .post(RequestBody.create(gson.toJson(payload), JSON))
                .build();

        log.debug("Requesting tenant access token for app: {}", appId);
        JsonObject response = execute(request, "tenant access token");

        String token = JsonValues.text(response.get("tenant_access_token"));
        if (token.isEmpty()) {
            throw new RemoteApiException("Tenant access token missing from response");
        }

        JsonElement expire = response.get("expire");
        if (expire == null || !expire.isJsonPrimitive() || !expire.getAsJsonPrimitive().isNumber()) {
            throw new RemoteApiException("Tenant access token expiry missing from response");
        }

        return new TokenCache.AccessToken(token, expire.getAsLong());
    }

    @Override
    public ApprovalInstance getApprovalInstance(String instanceCode) throws RemoteApiException {
        Objects.requireNonNull(instanceCode, "instanceCode must not be null");

        Request request = authorized(url("approval/v4/instances").addPathSegment(instanceCode).build())
                .get()
                .build();

        log.debug("Fetching approval instance: {}", instanceCode);
        JsonObject data = data(execute(request, "approval instance"));

        return new ApprovalInstance(
                instanceCode,
                JsonValues.text(data.get("approval_name")),
                JsonValues.text(data.get("form")),
                JsonValues.text(data.get("serial_number")),
                JsonValues.text(data.get("status"))
        );
    }

    @Override
    public Map<String, String> getFileDownloadUrls(Set<String> fileTokens) throws RemoteApiException {
        Map<String, String> urls = new LinkedHashMap<>();
        if (fileTokens == null || fileTokens.isEmpty()) {
            return urls;
        }

        HttpUrl url = url("drive/v1/medias/batch_get_tmp_download_url")
                .addQueryParameter("file_tokens", String.join(",", fileTokens))
                .build();
        Request request = authorized(url).get().build();

        log.debug("Resolving download URLs for {} file tokens", fileTokens.size());
        JsonObject data = data(execute(request, "download URLs"));

        JsonElement items = data.get("tmp_download_urls");
        if (items != null && items.isJsonArray()) {
            for (JsonElement item : items.getAsJsonArray()) {
                if (item.isJsonObject()) {
                    String token = JsonValues.text(item.getAsJsonObject().get("file_token"));
                    String tmpUrl = JsonValues.text(item.getAsJsonObject().get("tmp_download_url"));
                    if (!token.isEmpty() && !tmpUrl.isEmpty()) {
                        urls.put(token, tmpUrl);
                    }
                }
            }
        }

        return urls;
    }

    @Override
    public byte[] downloadFile(String url) throws RemoteApiException {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new RemoteApiException("Invalid download URL: " + url);
        }

        Request request = new Request.Builder()
                .url(httpUrl)
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new RemoteApiException("Download failed with status: " + response.code());
            }
            ResponseBody body = response.body();
            return body != null ? body.bytes() : new byte[0];
        } catch (IOException e) {
            throw new RemoteApiException("Download failed: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a URL under the configured base URL.
     *
     * @param path Relative path segments.
     * @return HttpUrl.Builder instance.
     * @throws RemoteApiException If the base URL is invalid.
     */
    private HttpUrl.Builder url(String path) throws RemoteApiException {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new RemoteApiException("Invalid base URL: " + baseUrl);
        }
        return base.newBuilder().addPathSegments(path);
    }

    /**
     * Starts a request carrying the tenant access token.
     *
     * @param url Request URL.
     * @return Request.Builder instance.
     * @throws RemoteApiException If a token cannot be obtained.
     */
    private Request.Builder authorized(HttpUrl url) throws RemoteApiException {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + tokenCache.getToken());
    }

    /**
     * Executes a request and validates the platform response envelope.
     *
     * @param request Request instance.
     * @param what    Description for error messages.
     * @return Response JSON object.
     * @throws RemoteApiException On transport failure, non-2xx status or non-zero code.
     */
    private JsonObject execute(Request request, String what) throws RemoteApiException {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new RemoteApiException("Request for " + what + " failed with status: " + response.code() +
                        ", message: " + response.message());
            }

            String responseBody = response.body() != null ? response.body().string() : "{}";
            JsonObject json = gson.fromJson(responseBody, JsonObject.class);
            if (json == null) {
                throw new RemoteApiException("Empty response for " + what);
            }

            JsonElement code = json.get("code");
            if (code == null || !code.isJsonPrimitive() || !"0".equals(code.getAsString())) {
                throw new RemoteApiException("Failed to get " + what + ": code=" + JsonValues.text(code) +
                        ", msg=" + JsonValues.text(json.get("msg")));
            }

            return json;
        } catch (IOException e) {
            throw new RemoteApiException("Request for " + what + " failed: " + e.getMessage(), e);
        } catch (JsonParseException | IllegalStateException e) {
            throw new RemoteApiException("Unreadable response for " + what + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets the data object of a response.
     *
     * @param json Response JSON object.
     * @return Data JSON object, empty if absent.
     */
    private JsonObject data(JsonObject json) {
        JsonElement data = json.get("data");
        return data != null && data.isJsonObject() ? data.getAsJsonObject() : new JsonObject();
    }

    /**
     * Builder for FeishuClient.
     */
    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String appId;
        private String appSecret;
        private int timeout = DEFAULT_TIMEOUT;
        private TokenCache tokenCache;

        /**
         * Sets the API base URL.
         *
         * @param baseUrl Base URL (e.g., "https://open.feishu.cn/open-apis").
         * @return Builder instance.
         */
        public Builder withBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Sets the application id.
         *
         * @param appId Application id.
         * @return Builder instance.
         */
        public Builder withAppId(String appId) {
            this.appId = appId;
            return this;
        }

        /**
         * Sets the application secret.
         *
         * @param appSecret Application secret.
         * @return Builder instance.
         */
        public Builder withAppSecret(String appSecret) {
            this.appSecret = appSecret;
            return this;
        }

        /**
         * Sets connect, read and write timeout.
         *
         * @param timeout Timeout in seconds.
         * @return Builder instance.
         */
        public Builder withTimeout(int timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets a shared token cache.
         * <p>When unset the client creates its own, fetching through {@link FeishuClient#fetchTenantToken()}.
         *
         * @param tokenCache TokenCache instance.
         * @return Builder instance.
         */
        public Builder withTokenCache(TokenCache tokenCache) {
            this.tokenCache = tokenCache;
            return this;
        }

        /**
         * Builds the FeishuClient instance.
         *
         * @return FeishuClient instance.
         */
        public FeishuClient build() {
            Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            Objects.requireNonNull(appId, "appId must not be null");
            Objects.requireNonNull(appSecret, "appSecret must not be null");
            return new FeishuClient(this);
        }
    }
}
