// file: node/src/main/java/io/fieldsync/node/AdminService.java
package io.fieldsync.node;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.ChainIntegrityViolation;
import io.fieldsync.core.chain.ChainState;
import io.fieldsync.core.chain.ChainVerifier;
import io.fieldsync.core.queue.PriorityQueueManager;
import io.fieldsync.node.alert.OperationalAlerts;
import io.fieldsync.node.connection.ConnectionManager;
import io.fieldsync.node.connection.ConnectionState;
import io.fieldsync.node.downlink.ClockDriftMonitor;
import io.fieldsync.node.dto.StatusResponse;
import io.fieldsync.node.dto.VerifyResponse;
import io.fieldsync.node.ingest.RecordIngestor;
import io.fieldsync.node.sync.SyncEngine;
import io.fieldsync.storage.LocalDataStore;
import io.fieldsync.storage.StoreStats;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-mostly view of the node for the admin API: status snapshot and a full
 * local chain verification.
 */
public final class AdminService {
    private static final Logger log = Logger.getLogger(AdminService.class.getName());

    private final String nodeId;
    private final LocalDataStore store;
    private final PriorityQueueManager queue;
    private final ConnectionManager conn;
    private final SyncEngine engine;
    private final RecordIngestor ingestor;
    private final ClockDriftMonitor drift;
    private final OperationalAlerts alerts;
    private final ChainVerifier verifier;

    public AdminService(String nodeId,
                        LocalDataStore store,
                        PriorityQueueManager queue,
                        ConnectionManager conn,
                        SyncEngine engine,
                        RecordIngestor ingestor,
                        ClockDriftMonitor drift,
                        OperationalAlerts alerts,
                        ChainVerifier verifier) {
        this.nodeId = nodeId;
        this.store = store;
        this.queue = queue;
        this.conn = conn;
        this.engine = engine;
        this.ingestor = ingestor;
        this.drift = drift;
        this.alerts = alerts;
        this.verifier = verifier;
    }

    public StatusResponse status() {
        var dto = new StatusResponse();
        dto.nodeId = nodeId;

        ConnectionState state = conn.state();
        dto.connection = state.label();
        if (state instanceof ConnectionState.Connecting c) {
            dto.connectAttempts = c.attempts();
        }
        dto.linkQuality = conn.quality().quality();
        dto.halted = engine.halted();
        dto.haltReason = engine.haltReason().orElse(null);

        dto.queueDepths = byName(queue.depths());
        StoreStats stats = store.stats();
        dto.storedByPriority = byName(stats.chainedByPriority());
        dto.pendingUnchained = stats.pending();
        dto.usedBytes = stats.usedBytes();
        dto.quotaBytes = stats.quotaBytes();
        dto.chainHeadSequence = stats.head().lastSequence();
        dto.chainHeadHash = Hashing.hex(stats.head().lastHash());

        SyncEngine.Counters c = engine.counters();
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("sent", c.sent());
        counters.put("acked", c.acked());
        counters.put("duplicates", c.duplicates());
        counters.put("rejected", c.rejected());
        counters.put("timeouts", c.timeouts());
        counters.put("failures", c.failures());
        counters.put("evicted", c.evicted());
        dto.engine = counters;

        Map<String, Long> ingest = new LinkedHashMap<>();
        ingest.put("submitted", ingestor.submittedCount());
        ingest.put("chained", ingestor.chainedCount());
        ingest.put("refused", ingestor.refusedCount());
        ingest.put("dropped", ingestor.droppedCount());
        ingest.put("buffered", (long) ingestor.buffered());
        dto.ingest = ingest;

        Map<String, Long> alertCounts = new LinkedHashMap<>();
        alerts.counts().forEach((k, v) -> alertCounts.put(k.name(), v));
        dto.alerts = alertCounts;
        dto.clockDriftMillis = drift.hasSample() ? drift.lastDriftMillis() : null;
        return dto;
    }

    /**
     * Verify every record still held (hash, signature, digest, links between
     * neighbours) and that the newest one agrees with the persisted chain head.
     */
    public VerifyResponse verify() {
        var dto = new VerifyResponse();
        List<SyncRecord> records = store.allChained();
        ChainState head = store.stats().head();
        try {
            dto.verifiedRecords = verifier.verifyRetained(records);
            if (!records.isEmpty()) {
                SyncRecord newest = records.get(records.size() - 1);
                if (newest.sequence() > head.lastSequence()) {
                    throw new ChainIntegrityViolation(ChainIntegrityViolation.Reason.SEQUENCE_GAP, newest.sequence(),
                            "record beyond chain head " + head.lastSequence());
                }
                if (newest.sequence() == head.lastSequence() && !Arrays.equals(newest.hash(), head.lastHash())) {
                    throw new ChainIntegrityViolation(ChainIntegrityViolation.Reason.BROKEN_LINK, newest.sequence(),
                            "newest record does not match the chain head");
                }
            }
            dto.ok = true;
        } catch (ChainIntegrityViolation v) {
            log.log(Level.SEVERE, "local chain verification failed", v);
            dto.ok = false;
            dto.failedSequence = v.sequence();
            dto.reason = v.reason().name();
            dto.message = v.getMessage();
        }
        return dto;
    }

    private static Map<String, Integer> byName(Map<Priority, Integer> in) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Priority p : Priority.values()) {
            out.put(p.name(), in.getOrDefault(p, 0));
        }
        return out;
    }
}
