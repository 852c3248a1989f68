// file: node/src/main/java/io/fieldsync/node/connection/LinkQualityMonitor.java
package io.fieldsync.node.connection;

/**
 * Link quality estimate from recent push outcomes.
 * <p>
 * Keeps:
 *  - EWMA of ack latency in milliseconds,
 *  - circular window of the last {@code windowSize} outcomes (ack or failure).
 * <p>
 * quality = successRate * latencyFactor, in [0,1], where latencyFactor is 1 up to
 * {@code goodLatencyMillis} and falls off as goodLatency / ewma beyond it.
 * With no samples the link is assumed good.
 */
public final class LinkQualityMonitor {

    public record Stats(double quality, double successRate, double ewmaMillis, int sampleCount) {}

    private final double alpha;
    private final long goodLatencyMillis;
    private final boolean[] outcomes;
    private int size;
    private int index;
    private double ewma;
    private boolean hasEwma;

    public LinkQualityMonitor(double alpha, int windowSize, long goodLatencyMillis) {
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0,1], got " + alpha);
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0");
        }
        if (goodLatencyMillis <= 0) {
            throw new IllegalArgumentException("goodLatencyMillis must be > 0");
        }
        this.alpha = alpha;
        this.goodLatencyMillis = goodLatencyMillis;
        this.outcomes = new boolean[windowSize];
    }

    public synchronized void recordAck(long latencyMillis) {
        if (latencyMillis < 0) latencyMillis = 0;
        if (!hasEwma) {
            ewma = latencyMillis;
            hasEwma = true;
        } else {
            ewma = (1.0 - alpha) * ewma + alpha * latencyMillis;
        }
        push(true);
    }

    public synchronized void recordFailure() {
        push(false);
    }

    public synchronized double quality() {
        return stats().quality();
    }

    public synchronized Stats stats() {
        if (size == 0) {
            return new Stats(1.0, 1.0, hasEwma ? ewma : Double.NaN, 0);
        }
        int ok = 0;
        for (int i = 0; i < size; i++) {
            if (outcomes[i]) ok++;
        }
        double successRate = (double) ok / size;
        double latencyFactor = 1.0;
        if (hasEwma && ewma > goodLatencyMillis) {
            latencyFactor = goodLatencyMillis / ewma;
        }
        return new Stats(successRate * latencyFactor, successRate, hasEwma ? ewma : Double.NaN, size);
    }

    /** Forget history; a fresh session starts from a clean slate. */
    public synchronized void reset() {
        size = 0;
        index = 0;
        hasEwma = false;
        ewma = 0.0;
    }

    private void push(boolean ok) {
        outcomes[index] = ok;
        index = (index + 1) % outcomes.length;
        if (size < outcomes.length) {
            size++;
        }
    }
}
