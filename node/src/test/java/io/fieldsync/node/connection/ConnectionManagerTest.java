package io.fieldsync.node.connection;

import io.fieldsync.node.TestClock;
import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.LoggingAlerts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private TestClock clock;
    private LoggingAlerts alerts;
    private ConnectionManager conn;
    private final List<String> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new TestClock(1_000_000L);
        alerts = new LoggingAlerts();
        // no jitter: nextDouble() == 0.5
        var backoff = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, new Random() {
            @Override
            public double nextDouble() {
                return 0.5;
            }
        });
        conn = new ConnectionManager(backoff, new LinkQualityMonitor(1.0, 4, 100), alerts, clock, 0.5, 0.7, 3);
        conn.addListener((from, to) -> transitions.add(from.label() + "->" + to.label()));
    }

    private void authenticate(String session) {
        conn.startConnecting();
        conn.connected();
        conn.authenticated(session);
    }

    @Test
    void starts_disconnected_and_first_attempt_is_due_immediately() {
        assertInstanceOf(ConnectionState.Disconnected.class, conn.state());

        conn.startConnecting();

        assertEquals(new ConnectionState.Connecting(1), conn.state());
        assertTrue(conn.attemptDue());
    }

    @Test
    void failed_attempts_count_up_and_wait_for_exponential_backoff() {
        conn.startConnecting();

        conn.connectFailed("refused");
        assertEquals(new ConnectionState.Connecting(2), conn.state());
        assertFalse(conn.attemptDue());
        clock.advance(Duration.ofMillis(999));
        assertFalse(conn.attemptDue());
        clock.advance(Duration.ofMillis(1));
        assertTrue(conn.attemptDue());

        conn.connectFailed("refused");
        assertEquals(new ConnectionState.Connecting(3), conn.state());
        assertEquals(clock.millis() + 2_000, conn.nextAttemptAtMillis());
    }

    @Test
    void happy_path_reaches_authenticated_with_session() {
        authenticate("s-1");

        assertEquals(new ConnectionState.Authenticated("s-1"), conn.state());
        assertEquals("s-1", conn.state().session().orElseThrow());
        assertTrue(conn.state().canSend());
        assertEquals(List.of("DISCONNECTED->CONNECTING", "CONNECTING->CONNECTED", "CONNECTED->AUTHENTICATED"),
                transitions);
    }

    @Test
    void quality_degrades_below_threshold_and_recovers_with_hysteresis() {
        authenticate("s-1");

        conn.reportQuality(0.4);
        assertInstanceOf(ConnectionState.Degraded.class, conn.state());
        assertTrue(conn.state().canSend());
        assertEquals("s-1", conn.state().session().orElseThrow());

        conn.reportQuality(0.6); // above degrade, below recover
        assertInstanceOf(ConnectionState.Degraded.class, conn.state());

        conn.reportQuality(0.7);
        assertEquals(new ConnectionState.Authenticated("s-1"), conn.state());
    }

    @Test
    void failed_pushes_feed_quality_into_the_state_machine() {
        authenticate("s-1");
        conn.recordAck(10);
        conn.recordFailure();
        conn.recordFailure();

        assertInstanceOf(ConnectionState.Degraded.class, conn.state());
    }

    @Test
    void transport_loss_from_authenticated_or_degraded_disconnects() {
        authenticate("s-1");
        conn.transportLost("reset");
        assertInstanceOf(ConnectionState.Disconnected.class, conn.state());

        authenticate("s-2");
        conn.reportQuality(0.1);
        conn.transportLost("reset");
        assertInstanceOf(ConnectionState.Disconnected.class, conn.state());
    }

    @Test
    void auth_failures_back_off_and_alert_at_threshold() {
        conn.startConnecting();
        for (int i = 1; i <= 3; i++) {
            conn.connected();
            conn.authenticationFailed("bad signature");
            assertEquals(new ConnectionState.Connecting(i + 1), conn.state());
            clock.advance(Duration.ofMinutes(2));
        }

        assertEquals(3, conn.consecutiveAuthFailures());
        assertEquals(1L, alerts.count(AlertKind.AUTHENTICATION_FAILED));

        conn.connected();
        conn.authenticated("s-ok");
        assertEquals(0, conn.consecutiveAuthFailures());
    }

    @Test
    void failed_handshake_rpc_backs_off_like_a_failed_connect() {
        conn.startConnecting();
        conn.connected();

        conn.handshakeFailed("UNAVAILABLE");

        assertEquals(new ConnectionState.Connecting(2), conn.state());
        assertFalse(conn.attemptDue());
        assertEquals(0, conn.consecutiveAuthFailures());
        clock.advance(Duration.ofSeconds(2));
        assertTrue(conn.attemptDue());
    }

    @Test
    void transitions_outside_the_table_are_refused() {
        assertThrows(IllegalStateException.class, () -> conn.connected());
        assertThrows(IllegalStateException.class, () -> conn.authenticated("x"));
        assertThrows(IllegalStateException.class, () -> conn.transportLost("x"));
        assertThrows(IllegalStateException.class, () -> conn.connectFailed("x"));

        conn.startConnecting();
        assertThrows(IllegalStateException.class, () -> conn.startConnecting());
        assertThrows(IllegalStateException.class, () -> conn.authenticationFailed("x"));
        assertThrows(IllegalStateException.class, () -> conn.handshakeFailed("x"));

        conn.connected();
        assertThrows(IllegalStateException.class, () -> conn.transportLost("x"));
    }

    @Test
    void quality_reports_are_ignored_without_a_session() {
        conn.reportQuality(0.0);
        assertInstanceOf(ConnectionState.Disconnected.class, conn.state());
        assertTrue(transitions.isEmpty());
    }
}
