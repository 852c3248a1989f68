// file: node/src/main/java/io/fieldsync/node/connection/ConnectionManager.java
package io.fieldsync.node.connection;

import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.OperationalAlerts;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owner of the link state machine.
 * <p>
 * Transitions:
 * <pre>
 *   Disconnected          -> Connecting{1}            startConnecting()
 *   Connecting{n}         -> Connecting{n+1}          connectFailed()       after backoff(n)
 *   Connecting{n}         -> Connected                connected()
 *   Connected             -> Authenticated{session}   authenticated()
 *   Connected             -> Connecting{n+1}          authenticationFailed() after backoff(n)
 *   Connected             -> Connecting{n+1}          handshakeFailed()     after backoff(n)
 *   Authenticated         -> Degraded                 quality below degradeThreshold
 *   Degraded              -> Authenticated            quality at or above recoverThreshold
 *   Authenticated | Degraded -> Disconnected        transportLost()
 * </pre>
 * Anything else throws IllegalStateException. Listeners are called after the
 * state has changed, outside the lock.
 */
public final class ConnectionManager {
    private static final Logger log = Logger.getLogger(ConnectionManager.class.getName());

    public static final double DEFAULT_DEGRADE_THRESHOLD = 0.5;
    public static final double DEFAULT_RECOVER_THRESHOLD = 0.7;
    public static final int DEFAULT_AUTH_FAILURE_ALERT_THRESHOLD = 3;

    @FunctionalInterface
    public interface Listener {
        void onTransition(ConnectionState from, ConnectionState to);
    }

    private final BackoffPolicy backoff;
    private final LinkQualityMonitor quality;
    private final OperationalAlerts alerts;
    private final Clock clock;
    private final double degradeThreshold;
    private final double recoverThreshold;
    private final int authFailureAlertThreshold;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    // guarded by this
    private ConnectionState state = new ConnectionState.Disconnected();
    private int attempts;            // attempt number of the current connect cycle
    private long nextAttemptAtMillis;
    private int consecutiveAuthFailures;

    public ConnectionManager(BackoffPolicy backoff,
                             LinkQualityMonitor quality,
                             OperationalAlerts alerts,
                             Clock clock) {
        this(backoff, quality, alerts, clock,
                DEFAULT_DEGRADE_THRESHOLD, DEFAULT_RECOVER_THRESHOLD, DEFAULT_AUTH_FAILURE_ALERT_THRESHOLD);
    }

    public ConnectionManager(BackoffPolicy backoff,
                             LinkQualityMonitor quality,
                             OperationalAlerts alerts,
                             Clock clock,
                             double degradeThreshold,
                             double recoverThreshold,
                             int authFailureAlertThreshold) {
        if (recoverThreshold < degradeThreshold) {
            throw new IllegalArgumentException("recoverThreshold must be >= degradeThreshold");
        }
        if (authFailureAlertThreshold < 1) {
            throw new IllegalArgumentException("authFailureAlertThreshold must be >= 1");
        }
        this.backoff = backoff;
        this.quality = quality;
        this.alerts = alerts;
        this.clock = clock;
        this.degradeThreshold = degradeThreshold;
        this.recoverThreshold = recoverThreshold;
        this.authFailureAlertThreshold = authFailureAlertThreshold;
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public synchronized ConnectionState state() {
        return state;
    }

    public LinkQualityMonitor quality() {
        return quality;
    }

    public synchronized int consecutiveAuthFailures() {
        return consecutiveAuthFailures;
    }

    /** Disconnected -> Connecting{1}; the first attempt is due immediately. */
    public void startConnecting() {
        ConnectionState from;
        ConnectionState to;
        synchronized (this) {
            require(state instanceof ConnectionState.Disconnected, "startConnecting");
            from = state;
            attempts = 1;
            nextAttemptAtMillis = clock.millis();
            to = state = new ConnectionState.Connecting(attempts);
        }
        fire(from, to);
    }

    /** True when in Connecting and the backoff for the current attempt has elapsed. */
    public synchronized boolean attemptDue() {
        return state instanceof ConnectionState.Connecting && clock.millis() >= nextAttemptAtMillis;
    }

    public synchronized long nextAttemptAtMillis() {
        return nextAttemptAtMillis;
    }

    /** Connecting{n} -> Connecting{n+1}, next attempt after backoff(n). */
    public void connectFailed(String reason) {
        ConnectionState from;
        ConnectionState to;
        Duration delay;
        int failed;
        synchronized (this) {
            require(state instanceof ConnectionState.Connecting, "connectFailed");
            from = state;
            failed = attempts;
            delay = scheduleRetry();
            to = state;
        }
        log.log(Level.INFO, "connect attempt {0} failed ({1}); retrying in {2} ms",
                new Object[]{failed, reason, delay.toMillis()});
        fire(from, to);
    }

    /** Connecting -> Connected. */
    public void connected() {
        ConnectionState from;
        ConnectionState to;
        synchronized (this) {
            require(state instanceof ConnectionState.Connecting, "connected");
            from = state;
            to = state = new ConnectionState.Connected();
        }
        fire(from, to);
    }

    /** Connected -> Authenticated{sessionId}; clears auth-failure count and quality history. */
    public void authenticated(String sessionId) {
        ConnectionState from;
        ConnectionState to;
        synchronized (this) {
            require(state instanceof ConnectionState.Connected, "authenticated");
            from = state;
            consecutiveAuthFailures = 0;
            quality.reset();
            to = state = new ConnectionState.Authenticated(sessionId);
        }
        fire(from, to);
    }

    /**
     * Connected -> Connecting{n+1} with backoff. Every {@code authFailureAlertThreshold}
     * consecutive failures raise an AUTHENTICATION_FAILED alert.
     */
    public void authenticationFailed(String reason) {
        ConnectionState from;
        ConnectionState to;
        int failures;
        synchronized (this) {
            require(state instanceof ConnectionState.Connected, "authenticationFailed");
            from = state;
            failures = ++consecutiveAuthFailures;
            scheduleRetry();
            to = state;
        }
        log.log(Level.WARNING, "handshake refused ({0}), consecutive failures={1}", new Object[]{reason, failures});
        if (failures % authFailureAlertThreshold == 0) {
            alerts.raise(AlertKind.AUTHENTICATION_FAILED,
                    failures + " consecutive handshake failures, last: " + reason);
        }
        fire(from, to);
    }

    /**
     * Connected -> Connecting{n+1} with backoff: the handshake RPC itself failed, so
     * this counts as a failed attempt rather than a refusal.
     */
    public void handshakeFailed(String reason) {
        ConnectionState from;
        ConnectionState to;
        Duration delay;
        synchronized (this) {
            require(state instanceof ConnectionState.Connected, "handshakeFailed");
            from = state;
            delay = scheduleRetry();
            to = state;
        }
        log.log(Level.WARNING, "handshake failed ({0}); retrying in {1} ms", new Object[]{reason, delay.toMillis()});
        fire(from, to);
    }

    /** Authenticated | Degraded -> Disconnected. */
    public void transportLost(String reason) {
        ConnectionState from;
        ConnectionState to;
        synchronized (this) {
            require(state.canSend(), "transportLost");
            from = state;
            to = state = new ConnectionState.Disconnected();
        }
        log.log(Level.WARNING, "connection lost from {0}: {1}", new Object[]{from.label(), reason});
        fire(from, to);
    }

    /** Feed one acknowledged push into the quality estimate. */
    public void recordAck(long latencyMillis) {
        quality.recordAck(latencyMillis);
        reportQuality(quality.quality());
    }

    /** Feed one failed or timed-out push into the quality estimate. */
    public void recordFailure() {
        quality.recordFailure();
        reportQuality(quality.quality());
    }

    /**
     * Apply the degrade/recover thresholds. Ignored outside Authenticated and
     * Degraded, where there is no session to degrade.
     */
    public void reportQuality(double q) {
        ConnectionState from;
        ConnectionState to;
        synchronized (this) {
            from = state;
            if (state instanceof ConnectionState.Authenticated a && q < degradeThreshold) {
                state = new ConnectionState.Degraded(a.sessionId(), q);
            } else if (state instanceof ConnectionState.Degraded d) {
                state = q >= recoverThreshold
                        ? new ConnectionState.Authenticated(d.sessionId())
                        : new ConnectionState.Degraded(d.sessionId(), q);
            }
            to = state;
        }
        if (!from.getClass().equals(to.getClass())) {
            log.log(Level.INFO, "link quality {0}", String.format("%.2f", q));
            fire(from, to);
        }
    }

    // ---------- internals ----------

    // caller holds the lock
    private Duration scheduleRetry() {
        Duration delay = backoff.delayAfter(attempts);
        attempts++;
        nextAttemptAtMillis = clock.millis() + delay.toMillis();
        state = new ConnectionState.Connecting(attempts);
        return delay;
    }

    private void require(boolean allowed, String transition) {
        if (!allowed) {
            throw new IllegalStateException(transition + " not allowed in state " + state);
        }
    }

    private void fire(ConnectionState from, ConnectionState to) {
        log.log(Level.INFO, "connection {0} -> {1}", new Object[]{from, to});
        for (Listener l : listeners) {
            try {
                l.onTransition(from, to);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "connection listener failed", e);
            }
        }
    }
}
