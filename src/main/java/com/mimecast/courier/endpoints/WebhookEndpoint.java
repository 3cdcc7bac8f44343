package com.mimecast.courier.endpoints;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.mimecast.courier.approval.ApprovalEventHandler;
import com.mimecast.courier.config.server.EndpointConfig;
import com.mimecast.courier.form.JsonValues;
import com.mimecast.courier.metrics.CourierMetrics;
import com.mimecast.courier.metrics.MetricsRegistry;
import com.sun.net.httpserver.HttpExchange;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Approval event webhook endpoint.
 *
 * <p>Receives event envelopes from the approval platform.
 * <br>URL verification challenges are answered inline.
 * <br>Other events are acknowledged at once and processed on the worker pool.
 *
 * <p>Also serves {@code /health} and {@code /metrics/prometheus}.
 */
public class WebhookEndpoint extends HttpEndpoint {
    private static final Logger log = LogManager.getLogger(WebhookEndpoint.class);

    static final int DEFAULT_PORT = 8080;
    static final String URL_VERIFICATION = "url_verification";

    private final ApprovalEventHandler handler;
    private final ExecutorService workers;
    private final Gson gson = new Gson();
    private final long startTime = System.currentTimeMillis();
    private PrometheusMeterRegistry prometheusRegistry;

    /**
     * Constructs a new WebhookEndpoint instance.
     *
     * @param handler ApprovalEventHandler instance.
     * @param workers Executor processing events.
     */
    public WebhookEndpoint(ApprovalEventHandler handler, ExecutorService workers) {
        this.handler = handler;
        this.workers = workers;
    }

    /**
     * Starts the endpoint.
     * <p>Registers a Prometheus registry with JVM metrics unless one is already registered.
     *
     * @param config EndpointConfig instance.
     * @throws IOException If an I/O error occurs during server startup.
     */
    @Override
    public void start(EndpointConfig config) throws IOException {
        prometheusRegistry = MetricsRegistry.getPrometheusRegistry();
        if (prometheusRegistry == null) {
            prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
            new JvmMemoryMetrics().bindTo(prometheusRegistry);
            new JvmThreadMetrics().bindTo(prometheusRegistry);
            new ProcessorMetrics().bindTo(prometheusRegistry);
            MetricsRegistry.register(prometheusRegistry);
        }
        CourierMetrics.initialize();

        server = createServer(config, DEFAULT_PORT);
        int port = server.getAddress().getPort();

        server.createContext(config.getPath(), this::handleEvent);
        log.info("Webhook available at http://localhost:{}{}", port, config.getPath());

        server.createContext("/health", this::handleHealth);
        log.info("Health available at http://localhost:{}/health", port);

        server.createContext("/metrics/prometheus", this::handlePrometheus);
        log.info("Prometheus data available at http://localhost:{}/metrics/prometheus", port);

        server.start();
    }

    /**
     * Handles event callbacks.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handleEvent(HttpExchange exchange) throws IOException {
        log.debug("Handling event: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());

        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", "POST");
            sendText(exchange, 405, "Method Not Allowed");
            return;
        }

        Optional<JsonElement> body = JsonValues.parse(readBody(exchange));
        if (body.isEmpty() || !body.get().isJsonObject()) {
            log.warn("Rejecting event with invalid JSON body from {}", exchange.getRemoteAddress());
            sendJson(exchange, 400, "{\"code\":400,\"msg\":\"Invalid JSON\"}");
            return;
        }

        JsonObject envelope = body.get().getAsJsonObject();
        if (URL_VERIFICATION.equals(JsonValues.text(envelope.get("type")))) {
            JsonObject challenge = new JsonObject();
            challenge.addProperty("challenge", JsonValues.text(envelope.get("challenge")));
            log.info("Answering URL verification challenge");
            sendJson(exchange, 200, gson.toJson(challenge));
            return;
        }

        CourierMetrics.incrementEventsReceived();
        try {
            workers.execute(() -> dispatch(envelope));
        } catch (RejectedExecutionException e) {
            log.error("Event rejected, worker pool unavailable: {}", e.getMessage());
            sendJson(exchange, 503, "{\"code\":503,\"msg\":\"Unavailable\"}");
            return;
        }

        sendJson(exchange, 200, "{\"code\":0}");
    }

    /**
     * Processes an event on a worker thread.
     *
     * @param envelope Event envelope.
     */
    private void dispatch(JsonObject envelope) {
        try {
            handler.handle(envelope);
        } catch (Exception e) {
            log.error("Event processing failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handles requests for the application's health status.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handleHealth(HttpExchange exchange) throws IOException {
        log.debug("Handling /health: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());
        Duration uptime = Duration.ofMillis(System.currentTimeMillis() - startTime);
        String uptimeString = String.format("%dd %dh %dm %ds",
                uptime.toDays(),
                uptime.toHoursPart(),
                uptime.toMinutesPart(),
                uptime.toSecondsPart());

        sendJson(exchange, 200, String.format("{\"status\":\"UP\", \"uptime\":\"%s\"}", uptimeString));
    }

    /**
     * Handles requests for metrics in Prometheus exposition format.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handlePrometheus(HttpExchange exchange) throws IOException {
        log.trace("Handling /metrics/prometheus: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());
        sendText(exchange, 200, prometheusRegistry.scrape());
    }
}
