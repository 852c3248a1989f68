// file: src/main/java/io/fieldsync/core/Priority.java
package io.fieldsync.core;

import java.time.Duration;

/**
 * The six fixed priority classes.
 * <p>
 * A class governs both transmission order (0 drains before 1, and so on) and
 * how long an unacknowledged record may stay on the node:
 * <pre>
 *   P0  critical evidence   immediate     indefinite
 *   P1  detections          1 min         30 days
 *   P2  health / alerts     5 min         7 days
 *   P3  track history       1 hour        7 days
 *   P4  telemetry/metrics   best effort   24 hours
 *   P5  debug logs          best effort   12 hours
 * </pre>
 * The table is not configurable per record.
 */
public enum Priority {
    P0(0, "critical evidence", "immediate", null),
    P1(1, "detections", "1 min", Duration.ofDays(30)),
    P2(2, "health/alerts", "5 min", Duration.ofDays(7)),
    P3(3, "track history", "1 hour", Duration.ofDays(7)),
    P4(4, "telemetry/metrics", "best effort", Duration.ofHours(24)),
    P5(5, "debug logs", "best effort", Duration.ofHours(12));

    private static final Priority[] BY_LEVEL = values();

    private final int level;
    private final String dataClass;
    private final String latencyTarget;
    private final Duration retention; // null = kept until acked

    Priority(int level, String dataClass, String latencyTarget, Duration retention) {
        this.level = level;
        this.dataClass = dataClass;
        this.latencyTarget = latencyTarget;
        this.retention = retention;
    }

    public int level() { return level; }

    public String dataClass() { return dataClass; }

    public String latencyTarget() { return latencyTarget; }

    /** True for P0: never evicted by retention or quota. */
    public boolean retainedIndefinitely() { return retention == null; }

    /**
     * @return retention window, or null when the class is kept indefinitely.
     */
    public Duration retention() { return retention; }

    /**
     * Whether a record captured at {@code timestampMillis} has outlived this class's
     * retention window at {@code nowMillis}.
     */
    public boolean isExpired(long timestampMillis, long nowMillis) {
        if (retention == null) return false;
        return nowMillis - timestampMillis > retention.toMillis();
    }

    public static Priority fromLevel(int level) {
        if (level < 0 || level >= BY_LEVEL.length) {
            throw new IllegalArgumentException("priority must be in 0..5, got " + level);
        }
        return BY_LEVEL[level];
    }
}
