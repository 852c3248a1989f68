// file: node/src/main/java/io/fieldsync/node/WebServer.java
package io.fieldsync.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.node.dto.SubmitRequest;
import io.fieldsync.node.dto.SubmitResponse;
import io.fieldsync.node.dto.VerifyResponse;
import io.fieldsync.node.ingest.RecordIngestor;
import io.fieldsync.node.ingest.SubmitResult;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Thin HTTP adapter over the ingest boundary and {@link AdminService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Map Java exceptions to HTTP status codes.
 *  - Log every request through {@link RequestLogger}.
 *
 * Path layout:
 *   - POST /records         submit {priority, msgType, payloadBase64}; 202, 400 or 503
 *   - GET  /admin/health    basic health check
 *   - GET  /admin/status    connection, queues, store, counters
 *   - POST /admin/verify    full local chain verification
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final RecordIngestor ingestor;
    private final AdminService admin;

    public WebServer(int port, RecordIngestor ingestor, AdminService admin) {
        this.ingestor = ingestor;
        this.admin = admin;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/records".equals(path)) {
                        if ("POST".equals(method)) {
                            handleSubmit(exchange);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            RequestLogger.logRequest(method, path, 405, 0, null);
                        }
                    } else if ("/admin/health".equals(path) && "GET".equals(method)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, null);
                    } else if ("/admin/status".equals(path) && "GET".equals(method)) {
                        handleStatus(exchange);
                    } else if ("/admin/verify".equals(path) && "POST".equals(method)) {
                        handleVerify(exchange);
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        RequestLogger.logRequest(method, path, 404, 0, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** POST /records */
    private void handleSubmit(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;
                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, SubmitRequest.class);
                            if (req.priority == null) {
                                throw new IllegalArgumentException("priority is required");
                            }
                            if (req.payloadBase64 == null) {
                                throw new IllegalArgumentException("payloadBase64 is required");
                            }
                            Priority priority = Priority.fromLevel(req.priority);
                            MessageType type = MessageType.fromName(req.msgType);
                            byte[] payload = Base64.getDecoder().decode(req.payloadBase64);

                            SubmitResult result = ingestor.submit(priority, type, payload);
                            var dto = new SubmitResponse();
                            dto.id = result.id().toString();
                            dto.accepted = result.accepted();
                            dto.reason = result.reason();
                            status = result.accepted() ? 202 : 503;
                            send(exchange, status, dto);
                        }
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(),
                                "message", String.valueOf(e.getMessage())));
                    }
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), status, totalMs, error);
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, ioEx);
                }
        );
    }

    /** GET /admin/status */
    private void handleStatus(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        Throwable error = null;
        try {
            send(ex, status, admin.status());
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, error);
        }
    }

    /** POST /admin/verify; 200 when the chain verifies, 409 when it does not. */
    private void handleVerify(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status;
        Throwable error = null;
        try {
            VerifyResponse result = admin.verify();
            status = result.ok ? 200 : 409;
            send(ex, status, result);
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest("POST", ex.getRequestPath(), status, totalMs, error);
    }

    // ---------- helpers ----------

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
