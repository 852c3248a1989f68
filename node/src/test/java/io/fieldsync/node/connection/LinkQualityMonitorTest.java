package io.fieldsync.node.connection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinkQualityMonitorTest {

    @Test
    void no_samples_means_a_good_link() {
        assertEquals(1.0, new LinkQualityMonitor(0.3, 10, 100).quality());
    }

    @Test
    void failures_lower_quality_by_success_rate() {
        var m = new LinkQualityMonitor(0.3, 4, 100);
        m.recordAck(10);
        m.recordAck(10);
        m.recordFailure();
        m.recordFailure();

        assertEquals(0.5, m.quality(), 1e-9);
    }

    @Test
    void slow_acks_lower_quality_by_latency_factor() {
        var m = new LinkQualityMonitor(1.0, 4, 100);
        m.recordAck(400);

        assertEquals(0.25, m.quality(), 1e-9);
        assertEquals(400.0, m.stats().ewmaMillis(), 1e-9);
    }

    @Test
    void window_forgets_old_outcomes() {
        var m = new LinkQualityMonitor(0.3, 3, 100);
        m.recordFailure();
        m.recordFailure();
        m.recordFailure();
        assertEquals(0.0, m.quality(), 1e-9);

        m.recordAck(5);
        m.recordAck(5);
        m.recordAck(5);
        assertEquals(1.0, m.quality(), 1e-9);
        assertEquals(3, m.stats().sampleCount());
    }

    @Test
    void reset_clears_history() {
        var m = new LinkQualityMonitor(0.3, 3, 100);
        m.recordFailure();
        m.reset();

        assertEquals(1.0, m.quality());
        assertEquals(0, m.stats().sampleCount());
    }
}
