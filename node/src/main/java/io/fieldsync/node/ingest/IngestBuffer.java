package io.fieldsync.node.ingest;

import io.fieldsync.core.Priority;
import io.fieldsync.core.UnchainedRecord;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded handoff between producers and the ingest worker.
 * <p>
 * {@link #offer} never blocks. When the buffer is full:
 *  - the oldest record of the least important non-P0 class present is dropped,
 *    provided that class is not more important than the incoming record;
 *  - otherwise the incoming record is refused.
 * The buffer never holds more than its capacity. {@link #take} hands out the most
 * important class first, FIFO within a class.
 */
public final class IngestBuffer {

    /**
     * Outcome of an offer.
     *
     * @param dropped buffered record displaced to make room, or null
     */
    public record Admission(boolean accepted, UnchainedRecord dropped) {
        static final Admission ACCEPTED = new Admission(true, null);
        static final Admission REFUSED = new Admission(false, null);
    }

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Map<Priority, ArrayDeque<UnchainedRecord>> byClass = new EnumMap<>(Priority.class);
    private int size;

    public IngestBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        for (Priority p : Priority.values()) {
            byClass.put(p, new ArrayDeque<>());
        }
    }

    public Admission offer(UnchainedRecord record) {
        lock.lock();
        try {
            Admission admission = Admission.ACCEPTED;
            if (size >= capacity) {
                Priority victimClass = leastImportantDroppable();
                if (victimClass == null || victimClass.level() < record.priority().level()) {
                    return Admission.REFUSED;
                }
                UnchainedRecord dropped = byClass.get(victimClass).pollFirst();
                size--;
                admission = new Admission(true, dropped);
            }
            byClass.get(record.priority()).addLast(record);
            size++;
            notEmpty.signal();
            return admission;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next record, most important class first; waits up to {@code timeout}.
     *
     * @return the record, or null on timeout
     */
    public UnchainedRecord take(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (size == 0) {
                if (nanos <= 0L) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            return pollLocked();
        } finally {
            lock.unlock();
        }
    }

    /** Non-blocking take; null when empty. */
    public UnchainedRecord poll() {
        lock.lock();
        try {
            return size == 0 ? null : pollLocked();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    // caller holds the lock, size > 0
    private UnchainedRecord pollLocked() {
        for (Priority p : Priority.values()) {
            UnchainedRecord r = byClass.get(p).pollFirst();
            if (r != null) {
                size--;
                return r;
            }
        }
        throw new IllegalStateException("size " + size + " but all classes empty");
    }

    // caller holds the lock
    private Priority leastImportantDroppable() {
        Priority[] all = Priority.values();
        for (int level = all.length - 1; level > 0; level--) {
            if (!byClass.get(all[level]).isEmpty()) return all[level];
        }
        return null;
    }
}
