package io.fieldsync.node.connection;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential reconnect backoff with symmetric jitter.
 * <p>
 * delay(n) = min(base * 2^(n-1), cap) * (1 +/- jitter), where n is the attempt
 * that just failed.
 */
public final class BackoffPolicy {
    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(60);
    public static final double DEFAULT_JITTER = 0.2;

    private final long baseMillis;
    private final long capMillis;
    private final double jitter;
    private final Random random;

    public BackoffPolicy() {
        this(DEFAULT_BASE, DEFAULT_CAP, DEFAULT_JITTER, new Random());
    }

    public BackoffPolicy(Duration base, Duration cap, double jitter, Random random) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be > 0");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must be >= base");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0,1), got " + jitter);
        }
        this.baseMillis = base.toMillis();
        this.capMillis = cap.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + failedAttempt);
        }
        long nominal = capMillis;
        // 2^31 already exceeds any sane cap
        if (failedAttempt <= 31) {
            nominal = Math.min(capMillis, baseMillis << (failedAttempt - 1));
            if (nominal <= 0) nominal = capMillis;
        }
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * jitter;
        return Duration.ofMillis(Math.round(nominal * factor));
    }
}
