// file: src/main/java/io/fieldsync/storage/SnapshotPolicy.java
package io.fieldsync.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that asks for a compaction after every N WAL entries.
 * <p>
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - Keeps disk usage close to the live data, since acked and evicted records
 *    disappear from the log once a snapshot covers them.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each successful durable write.
     *
     * @return true when the threshold was hit; the counter restarts
     */
    public boolean recordWrite() {
        if (sinceLast.incrementAndGet() >= everyOps) {
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
