package com.mimecast.courier.endpoints;

import com.mimecast.courier.config.server.EndpointConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Abstract base class for embedded HTTP endpoints.
 *
 * <p>Provides server lifecycle and response generation utilities for JSON and plain text.
 */
public abstract class HttpEndpoint {
    private static final Logger log = LogManager.getLogger(HttpEndpoint.class);

    /**
     * Embedded HTTP server instance.
     */
    protected HttpServer server;

    /**
     * Starts the HTTP endpoint with the given configuration.
     *
     * @param config EndpointConfig containing bind address, port and path settings.
     * @throws IOException If an I/O error occurs during server startup.
     */
    public abstract void start(EndpointConfig config) throws IOException;

    /**
     * Stops the HTTP endpoint if running.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            log.info("Endpoint stopped");
        }
    }

    /**
     * Gets the bound port.
     *
     * @return Port number, -1 if not running.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Creates the HTTP server.
     *
     * @param config      EndpointConfig instance.
     * @param defaultPort Port used when none is configured.
     * @return HttpServer instance, not yet started.
     * @throws IOException If the address cannot be bound.
     */
    protected HttpServer createServer(EndpointConfig config, int defaultPort) throws IOException {
        InetSocketAddress address = new InetSocketAddress(config.getBind(), config.getPort(defaultPort));
        return HttpServer.create(address, config.getBacklog());
    }

    /**
     * Reads the request body as UTF-8 text.
     *
     * @param exchange HTTP exchange.
     * @return Body string.
     * @throws IOException If an I/O error occurs.
     */
    protected String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Sends a JSON response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param json     JSON payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendJson(HttpExchange exchange, int code, String json) throws IOException {
        sendResponse(exchange, code, "application/json; charset=utf-8", json);
    }

    /**
     * Sends a plain text response with the specified HTTP status code.
     *
     * @param exchange HTTP exchange.
     * @param code     HTTP status code.
     * @param text     Plain text payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendText(HttpExchange exchange, int code, String text) throws IOException {
        sendResponse(exchange, code, "text/plain; charset=utf-8", text);
    }

    /**
     * Sends a response with the specified HTTP status code, content type, and payload.
     *
     * @param exchange    HTTP exchange.
     * @param code        HTTP status code.
     * @param contentType Content-Type header value.
     * @param response    Response payload.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, bytes.length);
    }
}
