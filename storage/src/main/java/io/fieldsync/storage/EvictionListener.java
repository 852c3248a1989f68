package io.fieldsync.storage;

import io.fieldsync.core.Priority;

import java.util.UUID;

/**
 * Notified after a record left the store without an ack. Called outside the
 * store's lock.
 */
@FunctionalInterface
public interface EvictionListener {

    EvictionListener NONE = (id, priority, cause) -> { };

    void evicted(UUID id, Priority priority, RemovalCause cause);
}
