package io.fieldsync.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.Priority;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks for the admin HTTP surface.
 *
 * Focus:
 *  - POST /records: 202 on accept, 400 on bad input, 503 when the buffer is full.
 *  - GET /admin/status and /admin/health.
 *  - POST /admin/verify.
 */
class WebServerTest {

    private static final int PORT = 18481; // test-only port

    @TempDir Path dataDir;

    private final ObjectMapper json = new ObjectMapper();
    private NodeFixture node;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        node = new NodeFixture(dataDir);
        server = new WebServer(PORT, node.ingestor, node.admin);
        server.start();
        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) server.stop();
        node.close();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        var req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .timeout(Duration.ofSeconds(5))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        var req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static String submitBody(int priority, String type, String payload) {
        String b64 = Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));
        return "{\"priority\":" + priority + ",\"msgType\":\"" + type + "\",\"payloadBase64\":\"" + b64 + "\"}";
    }

    @Test
    void submit_is_accepted_with_an_id() throws Exception {
        var resp = post("/records", submitBody(1, "detection", "person@12,40"));

        assertEquals(202, resp.statusCode());
        JsonNode body = json.readTree(resp.body());
        assertTrue(body.get("accepted").asBoolean());
        UUID id = UUID.fromString(body.get("id").asText());
        assertEquals(7, id.version());
        assertEquals(1, node.ingestor.buffered());
    }

    @Test
    void invalid_json_is_400() throws Exception {
        var resp = post("/records", "{not json");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void missing_priority_is_400() throws Exception {
        var resp = post("/records", "{\"msgType\":\"health\",\"payloadBase64\":\"AA==\"}");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("priority is required"));
    }

    @Test
    void unknown_level_type_or_bad_base64_are_400() throws Exception {
        assertEquals(400, post("/records", submitBody(9, "health", "x")).statusCode());
        assertEquals(400, post("/records", submitBody(2, "no-such-type", "x")).statusCode());
        assertEquals(400, post("/records",
                "{\"priority\":2,\"msgType\":\"health\",\"payloadBase64\":\"%%%\"}").statusCode());
    }

    @Test
    void downlink_type_cannot_be_submitted() throws Exception {
        assertEquals(400, post("/records", submitBody(1, "config-change", "x")).statusCode());
    }

    @Test
    void full_ingest_buffer_is_503() throws Exception {
        for (int i = 0; i < 64; i++) {
            assertEquals(202, post("/records", submitBody(0, "evidence", "f" + i)).statusCode());
        }

        var resp = post("/records", submitBody(0, "evidence", "one-too-many"));

        assertEquals(503, resp.statusCode());
        assertFalse(json.readTree(resp.body()).get("accepted").asBoolean());
    }

    @Test
    void wrong_method_on_records_is_405_and_unknown_path_404() throws Exception {
        assertEquals(405, get("/records").statusCode());
        assertEquals(404, get("/nope").statusCode());
    }

    @Test
    void health_and_status() throws Exception {
        node.put(Priority.P2, "hb");

        var health = get("/admin/health");
        assertEquals(200, health.statusCode());
        assertEquals("ok", json.readTree(health.body()).get("status").asText());

        var status = get("/admin/status");
        assertEquals(200, status.statusCode());
        JsonNode s = json.readTree(status.body());
        assertEquals("edge-test", s.get("nodeId").asText());
        assertEquals("DISCONNECTED", s.get("connection").asText());
        assertEquals(1, s.get("queueDepths").get("P2").asInt());
        assertEquals(1, s.get("chainHeadSequence").asLong());
    }

    @Test
    void verify_is_200_on_an_intact_chain() throws Exception {
        node.put(Priority.P0, "a");
        node.put(Priority.P3, "b");

        var resp = post("/admin/verify", "");

        assertEquals(200, resp.statusCode());
        JsonNode v = json.readTree(resp.body());
        assertTrue(v.get("ok").asBoolean());
        assertEquals(2, v.get("verifiedRecords").asInt());
    }
}
