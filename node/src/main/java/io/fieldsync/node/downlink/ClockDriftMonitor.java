package io.fieldsync.node.downlink;

import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.OperationalAlerts;

import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compares the node clock with gateway time-sync samples.
 * Drift beyond the tolerance is non-fatal; it is alerted and reported in status.
 */
public final class ClockDriftMonitor {
    private static final Logger log = Logger.getLogger(ClockDriftMonitor.class.getName());

    public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(5);

    private final Clock clock;
    private final long toleranceMillis;
    private final OperationalAlerts alerts;

    private volatile long lastDriftMillis;
    private volatile boolean sampled;

    public ClockDriftMonitor(Clock clock, Duration tolerance, OperationalAlerts alerts) {
        this.clock = clock;
        this.toleranceMillis = tolerance.toMillis();
        this.alerts = alerts;
    }

    /**
     * Record one gateway time sample.
     *
     * @return node clock minus gateway clock, in milliseconds
     */
    public long observe(long gatewayMillis) {
        long drift = clock.millis() - gatewayMillis;
        lastDriftMillis = drift;
        sampled = true;
        if (Math.abs(drift) > toleranceMillis) {
            alerts.raise(AlertKind.CLOCK_DRIFT, "node clock is " + drift + "ms off gateway time (tolerance "
                    + toleranceMillis + "ms)");
        } else {
            log.log(Level.FINE, "clock drift {0}ms", drift);
        }
        return drift;
    }

    public boolean hasSample() {
        return sampled;
    }

    public long lastDriftMillis() {
        return lastDriftMillis;
    }

    public boolean withinTolerance() {
        return !sampled || Math.abs(lastDriftMillis) <= toleranceMillis;
    }
}
