// file: node/src/main/java/io/fieldsync/node/sync/SyncEngine.java
package io.fieldsync.node.sync;

import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.ChainIntegrityViolation;
import io.fieldsync.core.chain.ChainVerifier;
import io.fieldsync.core.chain.IntegrityChain;
import io.fieldsync.core.queue.PriorityQueueManager;
import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.OperationalAlerts;
import io.fieldsync.node.connection.ConnectionManager;
import io.fieldsync.node.connection.ConnectionState;
import io.fieldsync.node.downlink.DownlinkDispatcher;
import io.fieldsync.storage.EvictionListener;
import io.fieldsync.storage.LocalDataStore;
import io.fieldsync.storage.RemovalCause;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Control loop that drains the priority queues to the gateway.
 * <p>
 * One tick per interval on a single dedicated thread:
 *  - not Authenticated/Degraded: advance the connection (connect, handshake) and stop;
 *  - Authenticated: for P0..P5, send the head of the class until it is empty;
 *  - Degraded: the same, capped at {@code degradedBudget} records per tick;
 *  - then poll the gateway for downlink records.
 * A timeout, NACK or integrity rejection stops the tick; the record stays at the
 * front of its queue and is retried next tick. A record leaves the store only on
 * an ack (or a duplicate answer) for its exact id, or through retention.
 * <p>
 * A local chain-integrity failure halts the engine for good: no further sends
 * until the process is restarted by an operator.
 */
public final class SyncEngine implements EvictionListener {
    private static final Logger log = Logger.getLogger(SyncEngine.class.getName());

    /**
     * Loop tuning.
     *
     * @param persistentFailureThreshold consecutive failures of one record before warning
     */
    public record Settings(Duration tickInterval,
                           Duration ackTimeout,
                           int degradedBudget,
                           Duration retentionSweepInterval,
                           int downlinkBatch,
                           int persistentFailureThreshold) {

        public static Settings defaults() {
            return new Settings(Duration.ofSeconds(1), Duration.ofSeconds(5), 10,
                    Duration.ofMinutes(1), 32, 10);
        }

        public Settings {
            if (degradedBudget < 1) throw new IllegalArgumentException("degradedBudget must be >= 1");
            if (downlinkBatch < 1) throw new IllegalArgumentException("downlinkBatch must be >= 1");
            if (persistentFailureThreshold < 1) {
                throw new IllegalArgumentException("persistentFailureThreshold must be >= 1");
            }
        }
    }

    public record Counters(long sent,
                           long acked,
                           long duplicates,
                           long rejected,
                           long timeouts,
                           long failures,
                           long evicted) {}

    private final String nodeId;
    private final LocalDataStore store;
    private final IntegrityChain chain;
    private final PriorityQueueManager queue;
    private final ConnectionManager conn;
    private final SyncTransport transport;
    private final DownlinkDispatcher downlink;
    private final OperationalAlerts alerts;
    private final Clock clock;
    private final Settings settings;
    private final ChainVerifier selfCheck;
    private final ScheduledExecutorService scheduler;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong acked = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();

    private volatile boolean stopping;
    private volatile String haltReason;

    // touched only from the loop thread
    private long lastSweepMillis;
    private UUID failingId;
    private int failingCount;

    public SyncEngine(String nodeId,
                      LocalDataStore store,
                      IntegrityChain chain,
                      PriorityQueueManager queue,
                      ConnectionManager conn,
                      SyncTransport transport,
                      DownlinkDispatcher downlink,
                      OperationalAlerts alerts,
                      Clock clock,
                      Settings settings) {
        this.nodeId = nodeId;
        this.store = store;
        this.chain = chain;
        this.queue = queue;
        this.conn = conn;
        this.transport = transport;
        this.downlink = downlink;
        this.alerts = alerts;
        this.clock = clock;
        this.settings = settings;
        this.selfCheck = new ChainVerifier(chain.keys().publicKey());
        this.lastSweepMillis = clock.millis();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-engine");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(
                this::tickSafe,
                0L,
                settings.tickInterval().toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop ticking. An in-flight push finishes or times out; store and queues
     * are left as they are, which is restart-safe.
     */
    public void stop() {
        stopping = true;
        scheduler.shutdown();
        try {
            long waitMs = settings.ackTimeout().toMillis() + 1_000L;
            if (!scheduler.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean halted() {
        return haltReason != null;
    }

    public Optional<String> haltReason() {
        return Optional.ofNullable(haltReason);
    }

    public Counters counters() {
        return new Counters(sent.get(), acked.get(), duplicates.get(), rejected.get(),
                timeouts.get(), failures.get(), evicted.get());
    }

    /** Store eviction hook: expired or displaced records leave the queues too. */
    @Override
    public void evicted(UUID id, Priority priority, RemovalCause cause) {
        queue.remove(id);
        evicted.incrementAndGet();
        alerts.raise(AlertKind.DATA_EVICTED, priority + " record " + id + " evicted unsent (" + cause + ")");
    }

    // ---------- loop ----------

    private void tickSafe() {
        if (stopping) return;
        try {
            tick();
        } catch (Exception e) {
            log.log(Level.WARNING, "sync tick failed", e);
        }
    }

    /** One pass of the loop. Package-private so tests can drive the engine step by step. */
    void tick() {
        if (halted()) return;
        sweepRetentionIfDue();

        ConnectionState state = conn.state();
        if (!state.canSend()) {
            advanceConnection(state);
            return;
        }
        boolean keepGoing = drain(state);
        if (keepGoing && conn.state().canSend()) {
            pollDownlink(conn.state().session().orElseThrow());
        }
    }

    private void sweepRetentionIfDue() {
        long now = clock.millis();
        if (now - lastSweepMillis < settings.retentionSweepInterval().toMillis()) return;
        lastSweepMillis = now;
        store.evictExpired(); // evicted ids come back through evicted(...)
    }

    private void advanceConnection(ConnectionState state) {
        if (state instanceof ConnectionState.Disconnected) {
            conn.startConnecting();
        }
        if (conn.state() instanceof ConnectionState.Connecting) {
            if (!conn.attemptDue()) return;
            try {
                transport.connect();
            } catch (TransportException e) {
                conn.connectFailed(e.getMessage());
                return;
            }
            conn.connected();
        }
        if (conn.state() instanceof ConnectionState.Connected) {
            handshake();
        }
    }

    private void handshake() {
        HandshakeResult result;
        try {
            result = transport.handshake(nodeId, chain.keys(), clock.millis());
        } catch (TransportException e) {
            conn.handshakeFailed(e.getMessage());
            return;
        }
        if (!result.accepted()) {
            conn.authenticationFailed(result.reason());
            return;
        }
        conn.authenticated(result.sessionId());

        long localHead = chain.head().lastSequence();
        log.log(Level.INFO, "gateway holds up to sequence {0}, local head is {1}",
                new Object[]{result.lastSequence(), localHead});
        if (result.lastSequence() > localHead) {
            halt("gateway holds sequence " + result.lastSequence() + " beyond local head " + localHead
                    + "; the local chain was reset or replaced");
        }
    }

    /** @return false when the tick must stop here */
    private boolean drain(ConnectionState state) {
        String session = state.session().orElseThrow();
        int budget = state instanceof ConnectionState.Degraded ? settings.degradedBudget() : Integer.MAX_VALUE;
        int sentThisTick = 0;

        for (Priority p : Priority.values()) {
            while (!stopping) {
                if (sentThisTick >= budget) return true;
                Optional<SyncRecord> head = queue.peek(p);
                if (head.isEmpty()) break;
                SyncRecord r = head.get();

                try {
                    selfCheck.verifyRecord(r);
                } catch (ChainIntegrityViolation v) {
                    halt("local record " + r.id() + " failed self-check: " + v.getMessage());
                    return false;
                }

                sentThisTick++;
                sent.incrementAndGet();
                PushOutcome outcome = transport.push(session, r, settings.ackTimeout());
                if (!handle(r, outcome)) return false;
            }
        }
        return true;
    }

    /** @return true when draining may continue */
    private boolean handle(SyncRecord r, PushOutcome outcome) {
        if (outcome instanceof PushOutcome.Acked a) {
            conn.recordAck(a.latencyMillis());
            acked.incrementAndGet();
            acknowledged(r);
            return conn.state().canSend();
        }
        if (outcome instanceof PushOutcome.Rejected rej) {
            return handleRejection(r, rej);
        }
        if (outcome instanceof PushOutcome.TimedOut) {
            timeouts.incrementAndGet();
            conn.recordFailure();
            noteFailure(r, "ack timeout");
            return false;
        }
        PushOutcome.Failed f = (PushOutcome.Failed) outcome;
        failures.incrementAndGet();
        noteFailure(r, f.message());
        conn.transportLost(f.message());
        return false;
    }

    private boolean handleRejection(SyncRecord r, PushOutcome.Rejected rej) {
        switch (rej.reason()) {
            case DUPLICATE:
                // the gateway already holds this exact id
                duplicates.incrementAndGet();
                acknowledged(r);
                return true;
            case BAD_SIGNATURE:
            case SEQUENCE_GAP:
                rejected.incrementAndGet();
                alerts.raise(AlertKind.CHAIN_INTEGRITY, "gateway rejected sequence " + r.sequence()
                        + " (" + r.id() + "): " + rej.reason() + " " + rej.detail());
                noteFailure(r, rej.reason().name());
                return false;
            case UNAUTHENTICATED:
                conn.transportLost("gateway rejected session");
                return false;
            default:
                rejected.incrementAndGet();
                conn.recordFailure();
                noteFailure(r, rej.reason() + " " + rej.detail());
                return false;
        }
    }

    private void acknowledged(SyncRecord r) {
        store.remove(r.id());
        queue.remove(r.id());
        if (r.id().equals(failingId)) {
            failingId = null;
            failingCount = 0;
        }
    }

    private void noteFailure(SyncRecord r, String why) {
        if (r.id().equals(failingId)) {
            failingCount++;
        } else {
            failingId = r.id();
            failingCount = 1;
        }
        if (failingCount % settings.persistentFailureThreshold() == 0) {
            alerts.raise(AlertKind.PERSISTENT_SEND_FAILURE, r.priority() + " record " + r.id() + " (sequence "
                    + r.sequence() + ") failed " + failingCount + " consecutive times, last: " + why);
        }
    }

    private void pollDownlink(String session) {
        List<byte[]> batch;
        try {
            batch = transport.pollDownlink(session, settings.downlinkBatch());
        } catch (TransportException e) {
            conn.transportLost(e.sessionRejected() ? "gateway rejected session" : e.getMessage());
            return;
        }
        if (!batch.isEmpty()) {
            downlink.dispatch(batch);
        }
    }

    private void halt(String reason) {
        haltReason = reason;
        log.log(Level.SEVERE, "sync engine halted: {0}", reason);
        alerts.raise(AlertKind.CHAIN_INTEGRITY, "sync halted, operator intervention required: " + reason);
    }
}
