package io.fieldsync.storage;

import io.fieldsync.core.Priority;
import io.fieldsync.core.chain.ChainState;

import java.util.Map;

/**
 * Point-in-time counters for status reporting.
 *
 * @param chainedByPriority retained chained records per class
 * @param pending           appended records not yet chained
 * @param usedBytes         quota-accounted bytes
 */
public record StoreStats(Map<Priority, Integer> chainedByPriority,
                         int pending,
                         long usedBytes,
                         long quotaBytes,
                         ChainState head) {

    public StoreStats {
        chainedByPriority = Map.copyOf(chainedByPriority);
    }

    public int totalChained() {
        return chainedByPriority.values().stream().mapToInt(Integer::intValue).sum();
    }
}
