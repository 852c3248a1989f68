// file: client/src/main/java/io/fieldsync/client/Cli.java
package io.fieldsync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;

/**
 * Operator CLI for a running edge node's admin HTTP API.
 *
 * Usage:
 *   fieldsync-cli [--base-url http://host:port] status
 *   fieldsync-cli [--base-url http://host:port] verify
 *   fieldsync-cli [--base-url http://host:port] health
 *   fieldsync-cli [--base-url http://host:port] submit <priority 0-5> <msgType> <text | @file>
 *
 * Examples:
 *   fieldsync-cli status
 *   fieldsync-cli submit 1 detection '{"label":"person","conf":0.91}'
 *   fieldsync-cli submit 0 evidence @frame-0001.jpg
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();
    private final PrintStream out;

    Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            Cli cli = new Cli(parsed.getKey(), System.out);
            String cmd = rest[0];
            switch (cmd) {
                case "status" -> cli.status();
                case "verify" -> {
                    if (!cli.verify()) System.exit(3);
                }
                case "health" -> cli.health();
                case "submit" -> {
                    if (rest.length != 4) {
                        usageAndExit("submit requires <priority> <msgType> <text | @file>");
                    }
                    cli.submit(parsePriority(rest[1]), rest[2], payloadOf(rest[3]));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    static int parsePriority(String raw) {
        try {
            int p = Integer.parseInt(raw.startsWith("P") || raw.startsWith("p") ? raw.substring(1) : raw);
            if (p < 0 || p > 5) throw new CliException("priority must be 0..5, got " + raw);
            return p;
        } catch (NumberFormatException e) {
            throw new CliException("priority must be 0..5, got " + raw);
        }
    }

    /** "@path" reads the file; anything else is sent as UTF-8 text. */
    static byte[] payloadOf(String arg) {
        if (arg.startsWith("@")) {
            Path file = Path.of(arg.substring(1));
            try {
                return Files.readAllBytes(file);
            } catch (IOException e) {
                throw new CliException("cannot read " + file + ": " + e.getMessage());
            }
        }
        return arg.getBytes(StandardCharsets.UTF_8);
    }

    /** GET /admin/status, printed as a short summary. */
    void status() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/admin/status")).GET().build());
        if (resp.statusCode() != 200) {
            throw new CliException("status failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode s = readJson(resp.body());

        out.printf("node        %s%n", s.path("nodeId").asText());
        String conn = s.path("connection").asText();
        if (s.hasNonNull("connectAttempts")) {
            conn += " (attempt " + s.get("connectAttempts").asInt() + ")";
        }
        out.printf("connection  %s, link quality %.2f%n", conn, s.path("linkQuality").asDouble());
        if (s.path("halted").asBoolean()) {
            out.printf("HALTED      %s%n", s.path("haltReason").asText());
        }
        out.printf("chain head  #%d %s%n", s.path("chainHeadSequence").asLong(), s.path("chainHeadHash").asText());
        out.printf("store       %d / %d bytes, %d pending%n",
                s.path("usedBytes").asLong(), s.path("quotaBytes").asLong(), s.path("pendingUnchained").asInt());
        out.printf("queued      %s%n", inline(s.path("queueDepths")));
        out.printf("engine      %s%n", inline(s.path("engine")));
        out.printf("ingest      %s%n", inline(s.path("ingest")));
        if (s.path("alerts").size() > 0) {
            out.printf("alerts      %s%n", inline(s.path("alerts")));
        }
        if (s.hasNonNull("clockDriftMillis")) {
            out.printf("clock drift %d ms%n", s.get("clockDriftMillis").asLong());
        }
    }

    /**
     * POST /admin/verify.
     *
     * @return true when the local chain verified
     */
    boolean verify() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/admin/verify"))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build());
        if (resp.statusCode() != 200 && resp.statusCode() != 409) {
            throw new CliException("verify failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode v = readJson(resp.body());
        if (v.path("ok").asBoolean()) {
            out.println("OK, " + v.path("verifiedRecords").asInt() + " record(s) verified");
            return true;
        }
        out.println("FAILED at sequence " + v.path("failedSequence").asLong() + ": "
                + v.path("reason").asText() + " " + v.path("message").asText());
        return false;
    }

    void health() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/admin/health")).GET().build());
        if (resp.statusCode() != 200) {
            throw new CliException("health failed (" + resp.statusCode() + "): " + resp.body());
        }
        out.println(readJson(resp.body()).path("status").asText());
    }

    /** POST /records; prints the assigned record id. */
    void submit(int priority, String msgType, byte[] payload) throws Exception {
        ObjectNode body = json.createObjectNode()
                .put("priority", priority)
                .put("msgType", msgType)
                .put("payloadBase64", Base64.getEncoder().encodeToString(payload));

        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/records"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                .build());
        JsonNode r = readJson(resp.body());
        if (resp.statusCode() == 202) {
            out.println(r.path("id").asText());
            return;
        }
        if (resp.statusCode() == 503) {
            throw new CliException("node refused record " + r.path("id").asText() + ": " + r.path("reason").asText());
        }
        throw new CliException("submit failed (" + resp.statusCode() + "): " + r.path("error").asText(resp.body()));
    }

    // ---------- helpers ----------

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException {
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode readJson(String body) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CliException("unexpected response: " + body);
        }
    }

    private static String inline(JsonNode obj) {
        StringBuilder sb = new StringBuilder();
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            var e = it.next();
            if (sb.length() > 0) sb.append(' ');
            sb.append(e.getKey()).append('=').append(e.getValue().asText());
        }
        return sb.toString();
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  fieldsync-cli [--base-url http://host:port] status
                  fieldsync-cli [--base-url http://host:port] verify
                  fieldsync-cli [--base-url http://host:port] health
                  fieldsync-cli [--base-url http://host:port] submit <priority 0-5> <msgType> <text | @file>
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
