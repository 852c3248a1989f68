package io.fieldsync.node.connection;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    /** Random that always returns the same value, to pin the jitter. */
    private static Random fixed(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }

    @Test
    void doubles_from_one_second_up_to_the_cap_without_jitter() {
        var policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, fixed(0.5));

        assertEquals(1_000, policy.delayAfter(1).toMillis());
        assertEquals(2_000, policy.delayAfter(2).toMillis());
        assertEquals(4_000, policy.delayAfter(3).toMillis());
        assertEquals(32_000, policy.delayAfter(6).toMillis());
        assertEquals(60_000, policy.delayAfter(7).toMillis());
        assertEquals(60_000, policy.delayAfter(500).toMillis());
    }

    @Test
    void jitter_stays_within_twenty_percent() {
        var low = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, fixed(0.0));
        var high = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, fixed(0.999999));

        assertEquals(3_200, low.delayAfter(3).toMillis());
        assertEquals(4_800, high.delayAfter(3).toMillis());
        assertEquals(48_000, low.delayAfter(10).toMillis());
    }

    @Test
    void random_delays_never_leave_the_band() {
        var policy = new BackoffPolicy();
        for (int attempt = 1; attempt < 12; attempt++) {
            long nominal = Math.min(60_000L, 1_000L << (attempt - 1));
            long d = policy.delayAfter(attempt).toMillis();
            assertTrue(d >= nominal * 0.8 - 1 && d <= nominal * 1.2 + 1, "attempt " + attempt + " -> " + d);
        }
    }

    @Test
    void rejects_bad_arguments() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy().delayAfter(0));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 0.2, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 1.5, new Random()));
    }
}
