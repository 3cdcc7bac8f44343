package com.mimecast.courier.endpoints;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mimecast.courier.approval.ApprovalEventHandler;
import com.mimecast.courier.approval.ProcessingResult;
import com.mimecast.courier.config.server.EndpointConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookEndpointTest {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client = new OkHttpClient();
    private final List<JsonObject> handled = new CopyOnWriteArrayList<>();
    private CountDownLatch latch;
    private ExecutorService workers;
    private WebhookEndpoint endpoint;
    private String base;

    @BeforeEach
    void before() throws IOException {
        latch = new CountDownLatch(1);
        workers = Executors.newSingleThreadExecutor();
        endpoint = new WebhookEndpoint(new RecordingHandler(), workers);
        endpoint.start(new EndpointConfig(Map.of("bind", "127.0.0.1", "port", 0.0, "path", "/hooks/approval")));
        base = "http://127.0.0.1:" + endpoint.getPort();
    }

    @AfterEach
    void after() {
        endpoint.stop();
        workers.shutdownNow();
    }

    @Test
    void testUrlVerification() throws IOException {
        try (Response response = post("{\"type\":\"url_verification\",\"challenge\":\"abc123\",\"token\":\"t\"}")) {
            assertEquals(200, response.code());
            JsonObject json = JsonParser.parseString(response.body().string()).getAsJsonObject();
            assertEquals("abc123", json.get("challenge").getAsString());
            assertEquals(1, json.size());
        }
        assertTrue(handled.isEmpty());
    }

    @Test
    void testEventDispatched() throws Exception {
        String body = "{\"header\":{\"event_type\":\"approval_instance\"}," +
                "\"event\":{\"status\":\"APPROVED\",\"instance_code\":\"INST-1\"}}";

        try (Response response = post(body)) {
            assertEquals(200, response.code());
            assertEquals("{\"code\":0}", response.body().string());
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(1, handled.size());
        assertEquals("INST-1", handled.get(0).getAsJsonObject("event").get("instance_code").getAsString());
    }

    @Test
    void testHandlerFailureStillAcknowledged() throws Exception {
        try (Response response = post("{\"fail\":true}")) {
            assertEquals(200, response.code());
        }
        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testInvalidJson() throws IOException {
        try (Response response = post("{not json")) {
            assertEquals(400, response.code());
            assertEquals("{\"code\":400,\"msg\":\"Invalid JSON\"}", response.body().string());
        }
        try (Response response = post("[1,2]")) {
            assertEquals(400, response.code());
        }
        assertTrue(handled.isEmpty());
    }

    @Test
    void testMethodNotAllowed() throws IOException {
        Request request = new Request.Builder().url(base + "/hooks/approval").get().build();
        try (Response response = client.newCall(request).execute()) {
            assertEquals(405, response.code());
            assertEquals("POST", response.header("Allow"));
        }
    }

    @Test
    void testRejectedWhenWorkersUnavailable() throws IOException {
        workers.shutdownNow();
        try (Response response = post("{\"header\":{\"event_type\":\"approval_instance\"}}")) {
            assertEquals(503, response.code());
        }
    }

    @Test
    void testHealth() throws IOException {
        Request request = new Request.Builder().url(base + "/health").build();
        try (Response response = client.newCall(request).execute()) {
            assertEquals(200, response.code());
            String body = response.body().string();
            assertTrue(body.contains("\"status\":\"UP\""));
            assertTrue(body.contains("\"uptime\""));
        }
    }

    @Test
    void testPrometheus() throws IOException {
        post("{\"event\":{}}").close();

        Request request = new Request.Builder().url(base + "/metrics/prometheus").build();
        try (Response response = client.newCall(request).execute()) {
            assertEquals(200, response.code());
            String body = response.body().string();
            assertTrue(body.contains("courier_events_received_total"));
        }
    }

    @Test
    void testStop() {
        endpoint.stop();
        assertEquals(-1, endpoint.getPort());
    }

    private Response post(String body) throws IOException {
        Request request = new Request.Builder()
                .url(base + "/hooks/approval")
                .post(RequestBody.create(body, JSON))
                .build();
        return client.newCall(request).execute();
    }

    private class RecordingHandler extends ApprovalEventHandler {

        RecordingHandler() {
            super(null);
        }

        @Override
        public ProcessingResult handle(JsonObject envelope) {
            try {
                if (envelope.has("fail")) {
                    throw new IllegalStateException("Handler failure");
                }
                handled.add(envelope);
                return ProcessingResult.skipped(ProcessingResult.SkipReason.NOT_APPROVED);
            } finally {
                latch.countDown();
            }
        }
    }
}
