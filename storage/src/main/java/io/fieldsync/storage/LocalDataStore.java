// file: src/main/java/io/fieldsync/storage/LocalDataStore.java
package io.fieldsync.storage;

import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;

import java.util.List;
import java.util.UUID;

/**
 * Durable outbound record store of an edge node.
 * <p>
 * Semantics:
 *  - append() must be durable before returning (WAL+fsync).
 *  - Records only leave through remove() (positive ack), evictExpired()
 *    (retention) or quota eviction inside append().
 *  - Every mutation goes through this contract; it is the only resource shared
 *    between producers and the sync engine.
 */
public interface LocalDataStore {

    /**
     * Persist a producer record before it is chained.
     * May evict records of the same or lower priority (never P0) to stay under quota.
     *
     * @throws StorageFullException if the record cannot fit even after eviction
     * @throws StorageException     on I/O failure
     */
    void append(UnchainedRecord record);

    /**
     * Delete every record that outlived its class's retention window, acked or not.
     *
     * @return number of records evicted
     */
    int evictExpired();

    /** Retained chained records of one class, in chain (sequence) order. */
    List<SyncRecord> iterByPriority(Priority priority);

    /**
     * Delete a chained record after a positive ack for this exact id.
     *
     * @return true if the record was present; a repeated or unknown id is a no-op
     */
    boolean remove(UUID id);

    /** Records appended but never chained, in append order. */
    List<UnchainedRecord> pendingUnchained();

    /** All retained chained records in sequence order. */
    List<SyncRecord> allChained();

    StoreStats stats();
}
