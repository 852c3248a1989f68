package io.fieldsync.node.sync;

import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.RecordIds;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.IntegrityChain;
import io.fieldsync.core.chain.NodeKeys;
import io.fieldsync.core.queue.PriorityQueueManager;
import io.fieldsync.node.TestClock;
import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.LoggingAlerts;
import io.fieldsync.node.connection.BackoffPolicy;
import io.fieldsync.node.connection.ConnectionManager;
import io.fieldsync.node.connection.ConnectionState;
import io.fieldsync.node.connection.LinkQualityMonitor;
import io.fieldsync.node.downlink.ClockDriftMonitor;
import io.fieldsync.node.downlink.DownlinkDispatcher;
import io.fieldsync.storage.DurableRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SyncEngineTest {

    @TempDir Path dataDir;

    private final TestClock clock = new TestClock(1_700_000_000_000L);
    private final RecordIds ids = new RecordIds(clock);
    private final LoggingAlerts alerts = new LoggingAlerts();
    private final PriorityQueueManager queue = new PriorityQueueManager();
    private final FakeTransport transport = new FakeTransport();

    private DurableRecordStore store;
    private IntegrityChain chain;
    private ConnectionManager conn;
    private DownlinkDispatcher downlink;
    private SyncEngine engine;

    @BeforeEach
    void setUp() {
        store = DurableRecordStore.open(dataDir, DurableRecordStore.DEFAULT_QUOTA_BYTES, clock);
        chain = new IntegrityChain(store, NodeKeys.generate());
        var noJitter = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.0, new Random());
        conn = new ConnectionManager(noJitter, new LinkQualityMonitor(0.3, 64, 1_000), alerts, clock);
        downlink = new DownlinkDispatcher(null, new ClockDriftMonitor(clock, Duration.ofSeconds(5), alerts), alerts);
        var settings = new SyncEngine.Settings(Duration.ofSeconds(1), Duration.ofSeconds(5), 10,
                Duration.ofMinutes(1), 32, 3);
        engine = new SyncEngine("edge-01", store, chain, queue, conn, transport, downlink, alerts, clock, settings);
        store.setEvictionListener(engine);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private SyncRecord put(Priority p) {
        UnchainedRecord u = UnchainedRecord.create(ids, p, MessageType.GENERIC,
                ("payload-" + p).getBytes(StandardCharsets.UTF_8), clock.millis());
        store.append(u);
        SyncRecord r = chain.chainAppend(u);
        queue.enqueue(r);
        return r;
    }

    private void authenticate() {
        engine.tick();
        assertInstanceOf(ConnectionState.Authenticated.class, conn.state());
    }

    private List<Priority> pushedPriorities() {
        return transport.pushed.stream().map(SyncRecord::priority).toList();
    }

    @Test
    void first_tick_connects_and_authenticates_without_sending() {
        put(Priority.P0);

        engine.tick();

        assertEquals(1, transport.connectCalls);
        assertEquals(1, transport.handshakeCalls);
        assertEquals(new ConnectionState.Authenticated("session-1"), conn.state());
        assertTrue(transport.pushed.isEmpty());
    }

    @Test
    void drains_in_strict_priority_order_and_removes_acked_records() {
        put(Priority.P5);
        put(Priority.P0);
        put(Priority.P3);
        put(Priority.P0);
        put(Priority.P1);
        authenticate();

        engine.tick();

        assertEquals(List.of(Priority.P0, Priority.P0, Priority.P1, Priority.P3, Priority.P5), pushedPriorities());
        assertEquals(0, queue.totalLen());
        assertTrue(store.allChained().isEmpty());
        assertEquals(5, engine.counters().acked());
        assertEquals(1, transport.pollCalls);
    }

    @Test
    void records_within_a_class_go_in_sequence_order() {
        var a = put(Priority.P2);
        var b = put(Priority.P2);
        authenticate();

        engine.tick();

        assertEquals(List.of(a.id(), b.id()), transport.pushed.stream().map(SyncRecord::id).toList());
    }

    @Test
    void timeout_stops_the_tick_and_keeps_the_record_at_the_front() {
        var first = put(Priority.P0);
        put(Priority.P1);
        authenticate();
        transport.outcome = r -> new PushOutcome.TimedOut();

        engine.tick();

        assertEquals(1, transport.pushed.size());
        assertTrue(queue.contains(first.id()));
        assertEquals(2, store.allChained().size());
        assertEquals(0, transport.pollCalls);

        transport.outcome = r -> new PushOutcome.Acked(5);
        engine.tick();

        assertEquals(first.id(), transport.pushed.get(1).id());
        assertEquals(0, queue.totalLen());
    }

    @Test
    void duplicate_answer_counts_as_delivered() {
        var r = put(Priority.P1);
        authenticate();
        transport.outcome = x -> new PushOutcome.Rejected(RejectReason.DUPLICATE, "");

        engine.tick();

        assertFalse(queue.contains(r.id()));
        assertTrue(store.allChained().isEmpty());
        assertEquals(1, engine.counters().duplicates());
    }

    @Test
    void integrity_rejection_raises_alert_and_keeps_record() {
        var r = put(Priority.P0);
        authenticate();
        transport.outcome = x -> new PushOutcome.Rejected(RejectReason.SEQUENCE_GAP, "gap");

        engine.tick();

        assertTrue(queue.contains(r.id()));
        assertEquals(1L, alerts.count(AlertKind.CHAIN_INTEGRITY));
        assertEquals(1, engine.counters().rejected());
        assertFalse(engine.halted());
    }

    @Test
    void unauthenticated_answer_drops_the_session() {
        put(Priority.P0);
        authenticate();
        transport.outcome = x -> new PushOutcome.Rejected(RejectReason.UNAUTHENTICATED, "");

        engine.tick();

        assertInstanceOf(ConnectionState.Disconnected.class, conn.state());
        assertEquals(1, queue.totalLen());
    }

    @Test
    void transport_failure_disconnects_and_next_tick_reconnects() {
        put(Priority.P0);
        authenticate();
        transport.outcome = x -> new PushOutcome.Failed("channel closed", null);

        engine.tick();
        assertInstanceOf(ConnectionState.Disconnected.class, conn.state());
        assertEquals(1, queue.totalLen());

        transport.outcome = x -> new PushOutcome.Acked(5);
        engine.tick();
        assertEquals(2, transport.handshakeCalls);
        engine.tick();
        assertEquals(0, queue.totalLen());
    }

    @Test
    void degraded_link_sends_at_most_the_budget_per_tick() {
        for (int i = 0; i < 15; i++) put(Priority.P4);
        authenticate();
        conn.reportQuality(0.1);
        assertInstanceOf(ConnectionState.Degraded.class, conn.state());

        engine.tick();

        assertEquals(10, transport.pushed.size());
        assertEquals(5, queue.totalLen());
    }

    @Test
    void record_failing_self_check_halts_the_engine() {
        put(Priority.P1);
        var good = put(Priority.P0);
        // same body and chain position, forged signature
        var forged = new SyncRecord(good.body(), good.sequence(), good.prevHash(), good.hash(), new byte[64]);
        queue.remove(good.id());
        queue.enqueue(forged);
        authenticate();

        engine.tick();
        engine.tick();

        assertTrue(engine.halted());
        assertTrue(engine.haltReason().orElseThrow().contains(good.id().toString()));
        assertTrue(transport.pushed.isEmpty());
        assertEquals(2, store.allChained().size());
        assertEquals(1L, alerts.count(AlertKind.CHAIN_INTEGRITY));
    }

    @Test
    void gateway_ahead_of_local_head_halts() {
        put(Priority.P0);
        transport.handshakeResult = new HandshakeResult(true, "session-1", null, clock.millis(), 42L);

        engine.tick();
        engine.tick();

        assertTrue(engine.halted());
        assertTrue(transport.pushed.isEmpty());
    }

    @Test
    void repeated_failures_of_one_record_raise_persistent_failure_alert() {
        put(Priority.P0);
        authenticate();
        transport.outcome = x -> new PushOutcome.Rejected(RejectReason.MALFORMED, "bad frame");

        for (int i = 0; i < 3; i++) {
            engine.tick();
        }

        assertEquals(1L, alerts.count(AlertKind.PERSISTENT_SEND_FAILURE));
        assertEquals(3, transport.pushed.size());
    }

    @Test
    void retention_sweep_evicts_expired_records_from_store_and_queue() {
        var debug = put(Priority.P5);
        var evidence = put(Priority.P0);
        clock.advance(Duration.ofHours(13));
        transport.connectFails = true;

        engine.tick();

        assertFalse(queue.contains(debug.id()));
        assertTrue(queue.contains(evidence.id()));
        assertEquals(1, engine.counters().evicted());
        assertEquals(1L, alerts.count(AlertKind.DATA_EVICTED));
    }

    @Test
    void failed_connects_wait_for_backoff() {
        transport.connectFails = true;

        engine.tick();
        assertEquals(new ConnectionState.Connecting(2), conn.state());

        engine.tick();
        assertEquals(1, transport.connectCalls);

        clock.advance(Duration.ofSeconds(1));
        engine.tick();
        assertEquals(2, transport.connectCalls);
        assertEquals(new ConnectionState.Connecting(3), conn.state());
    }

    @Test
    void refused_handshake_backs_off_and_retries() {
        transport.handshakeResult = HandshakeResult.refused("bad proof", clock.millis());

        engine.tick();

        assertEquals(new ConnectionState.Connecting(2), conn.state());
        assertEquals(1, conn.consecutiveAuthFailures());
    }

    @Test
    void failing_handshake_rpc_waits_for_backoff() {
        transport.handshakeFails = true;

        for (int i = 0; i < 30; i++) {
            engine.tick();
            clock.advance(Duration.ofSeconds(1));
        }

        // attempts at 0, 1, 3, 7 and 15 s; the next is due at 31 s
        assertEquals(5, transport.handshakeCalls);
        assertEquals(new ConnectionState.Connecting(6), conn.state());
        assertEquals(0, conn.consecutiveAuthFailures());
    }

    @Test
    void empty_payload_is_delivered_without_halting() {
        UnchainedRecord u = UnchainedRecord.create(ids, Priority.P2, MessageType.GENERIC, new byte[0], clock.millis());
        store.append(u);
        queue.enqueue(chain.chainAppend(u));
        authenticate();

        engine.tick();
        engine.tick();

        assertFalse(engine.halted());
        assertEquals(1, transport.pushed.size());
        assertEquals(0L, alerts.count(AlertKind.CHAIN_INTEGRITY));
        assertTrue(store.allChained().isEmpty());
    }

    @Test
    void downlink_is_polled_after_drain_and_dispatched() {
        authenticate();
        transport.downlink.add(new byte[]{0x01});

        engine.tick();

        assertEquals(1, transport.pollCalls);
        assertEquals(1, downlink.dropped());
        assertTrue(transport.downlink.isEmpty());
    }
}
