// file: node/src/main/java/io/fieldsync/node/NodeConfig.java
package io.fieldsync.node;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.node.dto.NodeConfigJson;
import io.fieldsync.storage.DurableRecordStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Edge node configuration: defaults, then the optional JSON file, then CLI flags.
 *
 * Supports:
 *  - nodeId:          identity registered with the gateway
 *  - dataDir:         WAL, snapshots and node keys live under here
 *  - gatewayHost/Port: Cloud Sync Gateway endpoint
 *  - adminPort:       local admin HTTP API
 *  - quotaBytes:      store quota (default 5 GiB)
 *  - tickMillis, ackTimeoutMillis, degradedBudget: sync loop tuning
 *  - ingestCapacity:  bound of the producer handoff buffer
 *  - plaintext:       disable TLS to the gateway (local testing only)
 *  - gatewayKeyPath:  gateway public key used to verify downlink records (optional)
 */
public record NodeConfig(
        String nodeId,
        Path dataDir,
        String gatewayHost,
        int gatewayPort,
        int adminPort,
        long quotaBytes,
        long tickMillis,
        long ackTimeoutMillis,
        int degradedBudget,
        int ingestCapacity,
        boolean plaintext,
        Path gatewayKeyPath,
        long retentionSweepMillis,
        long clockDriftToleranceMillis,
        int authFailureAlertThreshold
) {

    public NodeConfig {
        if (nodeId == null || nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
        checkPort("gateway-port", gatewayPort);
        checkPort("admin-port", adminPort);
        if (quotaBytes <= 0) throw new IllegalArgumentException("quota-bytes must be > 0");
        if (tickMillis <= 0) throw new IllegalArgumentException("tick-millis must be > 0");
        if (ackTimeoutMillis <= 0) throw new IllegalArgumentException("ack-timeout-millis must be > 0");
        if (degradedBudget < 1) throw new IllegalArgumentException("degraded-budget must be >= 1");
        if (ingestCapacity < 1) throw new IllegalArgumentException("ingest-capacity must be >= 1");
        if (retentionSweepMillis <= 0) throw new IllegalArgumentException("retentionSweepMillis must be > 0");
        if (clockDriftToleranceMillis < 0) throw new IllegalArgumentException("clockDriftToleranceMillis must be >= 0");
        if (authFailureAlertThreshold < 1) throw new IllegalArgumentException("authFailureAlertThreshold must be >= 1");
    }

    public static NodeConfig defaults() {
        return new NodeConfig(
                "edge-01",
                Path.of("./data"),
                "localhost",
                7443,
                8080,
                DurableRecordStore.DEFAULT_QUOTA_BYTES,
                1_000L,
                5_000L,
                10,
                1_024,
                false,
                null,
                60_000L,
                5_000L,
                3
        );
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --node-id,      -n  <id>
     *   --data-dir,     -d  <path>
     *   --gateway-host      <host>
     *   --gateway-port      <port>
     *   --admin-port,   -p  <port>
     *   --quota-bytes       <bytes>
     *   --tick-millis       <ms>
     *   --ack-timeout-millis <ms>
     *   --degraded-budget   <records per tick>
     *   --ingest-capacity   <records>
     *   --plaintext
     *   --gateway-key       <path>
     *   --config,       -c  <path to JSON>
     *   --help,         -h
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a bad number
     */
    public static NodeConfig fromArgs(String[] args) {
        NodeConfig base = defaults();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                ensureValue(args, i);
                base = base.overlay(readJson(Path.of(args[i + 1])));
            }
        }

        String nodeId = base.nodeId;
        Path dataDir = base.dataDir;
        String gatewayHost = base.gatewayHost;
        int gatewayPort = base.gatewayPort;
        int adminPort = base.adminPort;
        long quotaBytes = base.quotaBytes;
        long tickMillis = base.tickMillis;
        long ackTimeoutMillis = base.ackTimeoutMillis;
        int degradedBudget = base.degradedBudget;
        int ingestCapacity = base.ingestCapacity;
        boolean plaintext = base.plaintext;
        Path gatewayKeyPath = base.gatewayKeyPath;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--config", "-c" -> i++; // applied above

                case "--node-id", "-n" -> {
                    ensureValue(args, i);
                    nodeId = args[++i];
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = Path.of(args[++i]);
                }

                case "--gateway-host" -> {
                    ensureValue(args, i);
                    gatewayHost = args[++i];
                }

                case "--gateway-port" -> {
                    ensureValue(args, i);
                    gatewayPort = parseInt(args[i], args[++i]);
                }

                case "--admin-port", "-p" -> {
                    ensureValue(args, i);
                    adminPort = parseInt(args[i], args[++i]);
                }

                case "--quota-bytes" -> {
                    ensureValue(args, i);
                    quotaBytes = parseLong(args[i], args[++i]);
                }

                case "--tick-millis" -> {
                    ensureValue(args, i);
                    tickMillis = parseLong(args[i], args[++i]);
                }

                case "--ack-timeout-millis" -> {
                    ensureValue(args, i);
                    ackTimeoutMillis = parseLong(args[i], args[++i]);
                }

                case "--degraded-budget" -> {
                    ensureValue(args, i);
                    degradedBudget = parseInt(args[i], args[++i]);
                }

                case "--ingest-capacity" -> {
                    ensureValue(args, i);
                    ingestCapacity = parseInt(args[i], args[++i]);
                }

                case "--plaintext" -> plaintext = true;

                case "--gateway-key" -> {
                    ensureValue(args, i);
                    gatewayKeyPath = Path.of(args[++i]);
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new NodeConfig(
                nodeId,
                dataDir,
                gatewayHost,
                gatewayPort,
                adminPort,
                quotaBytes,
                tickMillis,
                ackTimeoutMillis,
                degradedBudget,
                ingestCapacity,
                plaintext,
                gatewayKeyPath,
                base.retentionSweepMillis,
                base.clockDriftToleranceMillis,
                base.authFailureAlertThreshold
        );
    }

    /** Copy with every non-null field of {@code json} applied. */
    NodeConfig overlay(NodeConfigJson json) {
        return new NodeConfig(
                json.nodeId != null ? json.nodeId : nodeId,
                json.dataDir != null ? Path.of(json.dataDir) : dataDir,
                json.gatewayHost != null ? json.gatewayHost : gatewayHost,
                json.gatewayPort != null ? json.gatewayPort : gatewayPort,
                json.adminPort != null ? json.adminPort : adminPort,
                json.quotaBytes != null ? json.quotaBytes : quotaBytes,
                json.tickMillis != null ? json.tickMillis : tickMillis,
                json.ackTimeoutMillis != null ? json.ackTimeoutMillis : ackTimeoutMillis,
                json.degradedBudget != null ? json.degradedBudget : degradedBudget,
                json.ingestCapacity != null ? json.ingestCapacity : ingestCapacity,
                json.plaintext != null ? json.plaintext : plaintext,
                json.gatewayKey != null ? Path.of(json.gatewayKey) : gatewayKeyPath,
                json.retentionSweepMillis != null ? json.retentionSweepMillis : retentionSweepMillis,
                json.clockDriftToleranceMillis != null ? json.clockDriftToleranceMillis : clockDriftToleranceMillis,
                json.authFailureAlertThreshold != null ? json.authFailureAlertThreshold : authFailureAlertThreshold
        );
    }

    static NodeConfigJson readJson(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            return mapper.readValue(path.toFile(), NodeConfigJson.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load node config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static void checkPort(String name, int port) {
        if (port <= 0 || port > 65535) throw new IllegalArgumentException(name + " out of range: " + port);
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag.substring(2) + ": " + value, e);
        }
    }

    private static long parseLong(String flag, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag.substring(2) + ": " + value, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    static void printHelpAndExit() {
        System.out.println("""
            Usage: node [options]

            Options:
              --node-id,       -n   Node identifier (default: edge-01)
              --data-dir,      -d   Data directory for WAL, snapshots, keys (default: ./data)
              --gateway-host        Cloud Sync Gateway host (default: localhost)
              --gateway-port        Cloud Sync Gateway port (default: 7443)
              --admin-port,    -p   Admin HTTP port (default: 8080)
              --quota-bytes         Local store quota in bytes (default: 5 GiB)
              --tick-millis         Sync loop interval (default: 1000)
              --ack-timeout-millis  Per-record ack timeout (default: 5000)
              --degraded-budget     Records per tick on a degraded link (default: 10)
              --ingest-capacity     Producer handoff buffer size (default: 1024)
              --plaintext           Talk to the gateway without TLS (testing only)
              --gateway-key         Gateway public key (X.509) for downlink verification
              --config,        -c   JSON config file; flags override it
              --help,          -h   Show this help message
            """);
        System.exit(0);
    }
}
