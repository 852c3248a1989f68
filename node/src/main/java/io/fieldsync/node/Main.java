// file: node/src/main/java/io/fieldsync/node/Main.java
package io.fieldsync.node;

import io.fieldsync.core.RecordIds;
import io.fieldsync.core.chain.ChainVerifier;
import io.fieldsync.core.chain.IntegrityChain;
import io.fieldsync.core.chain.NodeKeys;
import io.fieldsync.core.queue.PriorityQueueManager;
import io.fieldsync.node.alert.LoggingAlerts;
import io.fieldsync.node.connection.BackoffPolicy;
import io.fieldsync.node.connection.ConnectionManager;
import io.fieldsync.node.connection.LinkQualityMonitor;
import io.fieldsync.node.downlink.ClockDriftMonitor;
import io.fieldsync.node.downlink.DownlinkDispatcher;
import io.fieldsync.node.ingest.IngestBuffer;
import io.fieldsync.node.ingest.RecordIngestor;
import io.fieldsync.node.sync.GrpcSyncTransport;
import io.fieldsync.node.sync.SyncEngine;
import io.fieldsync.storage.DurableRecordStore;

import java.io.IOException;
import java.io.InputStream;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for one edge node.
 *
 * Responsibilities:
 *  - Parse configuration (flags and optional JSON file).
 *  - Open the durable store and load (or create) the node's signing keys.
 *  - Wire chain builder, queues, ingest worker, connection manager and sync engine.
 *  - Recover: re-chain pending records, load chained records into the queues.
 *  - Start the ingest worker, the sync loop and the admin HTTP API.
 *  - Stop everything in reverse order on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();

        NodeConfig cfg;
        try {
            cfg = NodeConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Run with --help for usage.");
            System.exit(2);
            return;
        }

        Clock clock = Clock.systemUTC();
        var alerts = new LoggingAlerts();

        // ------ Storage + chain -------
        var store = DurableRecordStore.open(cfg.dataDir(), cfg.quotaBytes(), clock);
        var keys = NodeKeys.loadOrCreate(cfg.dataDir().resolve("keys"));
        var chain = new IntegrityChain(store, keys);
        var queue = new PriorityQueueManager();

        // ------ Producer boundary -------
        var ingestor = new RecordIngestor(new IngestBuffer(cfg.ingestCapacity()), store, chain, queue,
                new RecordIds(clock), alerts, clock);

        // ------ Link + sync -------
        var quality = new LinkQualityMonitor(0.3, 64, Math.max(1L, cfg.ackTimeoutMillis() / 5));
        var conn = new ConnectionManager(new BackoffPolicy(), quality, alerts, clock,
                ConnectionManager.DEFAULT_DEGRADE_THRESHOLD, ConnectionManager.DEFAULT_RECOVER_THRESHOLD,
                cfg.authFailureAlertThreshold());

        PublicKey gatewayKey = cfg.gatewayKeyPath() == null ? null : NodeKeys.readPublicKey(cfg.gatewayKeyPath());
        var drift = new ClockDriftMonitor(clock, Duration.ofMillis(cfg.clockDriftToleranceMillis()), alerts);
        var downlink = new DownlinkDispatcher(gatewayKey, drift, alerts);

        var transport = new GrpcSyncTransport(cfg.gatewayHost(), cfg.gatewayPort(), cfg.plaintext(),
                Duration.ofMillis(cfg.ackTimeoutMillis()));
        var settings = new SyncEngine.Settings(
                Duration.ofMillis(cfg.tickMillis()),
                Duration.ofMillis(cfg.ackTimeoutMillis()),
                cfg.degradedBudget(),
                Duration.ofMillis(cfg.retentionSweepMillis()),
                SyncEngine.Settings.defaults().downlinkBatch(),
                SyncEngine.Settings.defaults().persistentFailureThreshold());
        var engine = new SyncEngine(cfg.nodeId(), store, chain, queue, conn, transport, downlink, alerts, clock, settings);
        store.setEvictionListener(engine);

        // ------ Recovery -------
        int loaded = ingestor.recover();

        // ------ HTTP layer ------
        var admin = new AdminService(cfg.nodeId(), store, queue, conn, engine, ingestor, drift, alerts,
                new ChainVerifier(keys.publicKey()));
        var web = new WebServer(cfg.adminPort(), ingestor, admin);

        ingestor.start();
        engine.start();
        web.start();

        log.log(Level.INFO, "node {0} up: admin http://localhost:{1,number,#}, gateway {2}:{3,number,#}{4}, "
                        + "{5} record(s) queued",
                new Object[]{cfg.nodeId(), cfg.adminPort(), cfg.gatewayHost(), cfg.gatewayPort(),
                        cfg.plaintext() ? " (plaintext)" : "", loaded});

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            engine.stop();
            ingestor.close();
            transport.close();
            store.close();
        }, "node-shutdown"));
    }

    private static void configureLogging() throws IOException {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
