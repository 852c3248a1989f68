package io.fieldsync.node.downlink;

import io.fieldsync.node.TestClock;
import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.LoggingAlerts;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ClockDriftMonitorTest {

    private final TestClock clock = new TestClock(1_700_000_000_000L);
    private final LoggingAlerts alerts = new LoggingAlerts();
    private final ClockDriftMonitor monitor = new ClockDriftMonitor(clock, Duration.ofSeconds(5), alerts);

    @Test
    void no_sample_counts_as_within_tolerance() {
        assertFalse(monitor.hasSample());
        assertTrue(monitor.withinTolerance());
    }

    @Test
    void small_drift_is_recorded_without_alert() {
        long drift = monitor.observe(clock.millis() - 4_000);

        assertEquals(4_000, drift);
        assertTrue(monitor.hasSample());
        assertTrue(monitor.withinTolerance());
        assertEquals(0L, alerts.count(AlertKind.CLOCK_DRIFT));
    }

    @Test
    void drift_beyond_tolerance_in_either_direction_alerts() {
        assertEquals(-6_000, monitor.observe(clock.millis() + 6_000));
        assertFalse(monitor.withinTolerance());
        assertEquals(-6_000, monitor.lastDriftMillis());

        monitor.observe(clock.millis() - 10_000);
        assertEquals(2L, alerts.count(AlertKind.CLOCK_DRIFT));
    }
}
