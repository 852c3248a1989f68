package io.fieldsync.core.queue;

import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Six independent queues, one per priority class, each ordered by chain sequence.
 * <p>
 * Concurrency:
 *  - enqueue() may be called from any producer thread.
 *  - peek()/remove() are meant for the single sync-engine loop, but are safe
 *    to call concurrently as well.
 * <p>
 * Ordering is by sequence rather than arrival, so two producers racing to
 * enqueue still leave each class in chain order.
 * <p>
 * Draining policy lives in the sync engine: strict priority, P0 to exhaustion
 * before P1 and so on. There is no fairness override; sustained high-priority
 * traffic can starve P4/P5 while connected.
 */
public final class PriorityQueueManager {

    private final Map<Priority, ConcurrentSkipListMap<Long, SyncRecord>> queues = new EnumMap<>(Priority.class);
    private final Map<UUID, SyncRecord> byId = new ConcurrentHashMap<>();

    public PriorityQueueManager() {
        for (Priority p : Priority.values()) {
            queues.put(p, new ConcurrentSkipListMap<>());
        }
    }

    /**
     * Index a chained record into its class. Re-enqueueing an id that is already
     * present is ignored.
     */
    public void enqueue(SyncRecord record) {
        if (byId.putIfAbsent(record.id(), record) != null) {
            return;
        }
        queues.get(record.priority()).put(record.sequence(), record);
    }

    /** Front of class {@code priority}, i.e. its lowest sequence. */
    public Optional<SyncRecord> peek(Priority priority) {
        Map.Entry<Long, SyncRecord> first = queues.get(priority).firstEntry();
        return first == null ? Optional.empty() : Optional.of(first.getValue());
    }

    /**
     * @return true if the id was queued; false for unknown or already removed ids.
     */
    public boolean remove(UUID id) {
        SyncRecord r = byId.remove(id);
        if (r == null) {
            return false;
        }
        queues.get(r.priority()).remove(r.sequence(), r);
        return true;
    }

    public boolean contains(UUID id) {
        return byId.containsKey(id);
    }

    public int len(Priority priority) {
        return queues.get(priority).size();
    }

    public int totalLen() {
        return byId.size();
    }

    /** Per-class lengths, P0 first. */
    public Map<Priority, Integer> depths() {
        Map<Priority, Integer> out = new EnumMap<>(Priority.class);
        for (Priority p : Priority.values()) {
            out.put(p, queues.get(p).size());
        }
        return out;
    }
}
