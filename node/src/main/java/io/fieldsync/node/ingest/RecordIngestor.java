// file: node/src/main/java/io/fieldsync/node/ingest/RecordIngestor.java
package io.fieldsync.node.ingest;

import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.RecordIds;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.IntegrityChain;
import io.fieldsync.core.queue.PriorityQueueManager;
import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.OperationalAlerts;
import io.fieldsync.storage.LocalDataStore;
import io.fieldsync.storage.StorageFullException;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Producer boundary: store -> chain -> queue, off the producer's thread.
 * <p>
 * Responsibilities:
 *  - {@link #submit} builds the unchained record and hands it to the bounded
 *    buffer without blocking.
 *  - A single worker persists each record, chains it and indexes it for sending.
 *  - {@link #recover} re-chains records that were stored but never chained, then
 *    loads every chained record into the queues.
 * <p>
 * A record that fails to chain stays pending in the store and is re-chained
 * before the next record is processed.
 */
public final class RecordIngestor implements AutoCloseable {
    private static final Logger log = Logger.getLogger(RecordIngestor.class.getName());

    private static final long TAKE_TIMEOUT_MS = 200L;

    private final IngestBuffer buffer;
    private final LocalDataStore store;
    private final IntegrityChain chain;
    private final PriorityQueueManager queue;
    private final RecordIds ids;
    private final OperationalAlerts alerts;
    private final Clock clock;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong chained = new AtomicLong();
    private final AtomicLong refused = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean closing;
    private volatile boolean rechainNeeded;
    private Thread worker;

    public RecordIngestor(IngestBuffer buffer,
                          LocalDataStore store,
                          IntegrityChain chain,
                          PriorityQueueManager queue,
                          RecordIds ids,
                          OperationalAlerts alerts,
                          Clock clock) {
        this.buffer = buffer;
        this.store = store;
        this.chain = chain;
        this.queue = queue;
        this.ids = ids;
        this.alerts = alerts;
        this.clock = clock;
    }

    /**
     * Accept a producer payload. Never blocks; a refused record was not stored.
     */
    public SubmitResult submit(Priority priority, MessageType type, byte[] rawPayload) {
        if (type.isDownlink()) {
            throw new IllegalArgumentException(type + " is a downlink type and cannot be submitted");
        }
        UnchainedRecord record = UnchainedRecord.create(ids, priority, type, rawPayload, clock.millis());
        IngestBuffer.Admission admission = buffer.offer(record);
        if (!admission.accepted()) {
            refused.incrementAndGet();
            String msg = "ingest buffer full (" + buffer.capacity() + "), refused " + priority + " record " + record.id();
            if (priority == Priority.P0) {
                log.log(Level.SEVERE, msg);
            }
            alerts.raise(AlertKind.INGEST_OVERFLOW, msg);
            return SubmitResult.refused(record.id(), "ingest buffer full");
        }
        submitted.incrementAndGet();
        if (admission.dropped() != null) {
            UnchainedRecord d = admission.dropped();
            dropped.incrementAndGet();
            alerts.raise(AlertKind.INGEST_OVERFLOW, "ingest buffer full, dropped " + d.priority()
                    + " record " + d.id() + " for " + priority + " record " + record.id());
        }
        return SubmitResult.accepted(record.id());
    }

    /**
     * Startup recovery; call before {@link #start()} and before the sync engine runs.
     *
     * @return number of chained records loaded into the queues
     */
    public int recover() {
        int rechained = rechainPending();
        List<SyncRecord> all = store.allChained();
        for (SyncRecord r : all) {
            queue.enqueue(r);
        }
        log.log(Level.INFO, "recovered {0} chained record(s), re-chained {1} pending",
                new Object[]{all.size(), rechained});
        return all.size();
    }

    public void start() {
        worker = new Thread(this::runLoop, "ingest-worker");
        worker.setDaemon(true);
        worker.start();
    }

    /**
     * Stop the worker, then persist whatever is still buffered so nothing a
     * producer was told is accepted gets lost on a clean shutdown.
     */
    @Override
    public void close() {
        closing = true;
        if (worker != null) {
            // no interrupt: an interrupted FileChannel write closes the WAL channel
            try {
                worker.join(5_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (rechainNeeded) {
            tryRechain();
        }
        UnchainedRecord r;
        int flushed = 0;
        while ((r = buffer.poll()) != null) {
            process(r);
            flushed++;
        }
        if (flushed > 0) {
            log.log(Level.INFO, "flushed {0} buffered record(s) on shutdown", flushed);
        }
    }

    public long submittedCount() { return submitted.get(); }

    public long chainedCount() { return chained.get(); }

    public long refusedCount() { return refused.get(); }

    public long droppedCount() { return dropped.get(); }

    public int buffered() { return buffer.size(); }

    // ---------- internals ----------

    private void runLoop() {
        while (!closing) {
            try {
                workOnce(TAKE_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.log(Level.SEVERE, "ingest worker iteration failed", e);
            }
        }
    }

    /**
     * One worker step. Pending records are re-chained before anything new leaves
     * the buffer; while that keeps failing, buffered records stay where they are.
     * Package-private for tests.
     */
    void workOnce(long timeoutMillis) throws InterruptedException {
        if (rechainNeeded && !tryRechain()) {
            Thread.sleep(timeoutMillis);
            return;
        }
        UnchainedRecord r = buffer.take(timeoutMillis, TimeUnit.MILLISECONDS);
        if (r != null) {
            process(r);
        }
    }

    private boolean tryRechain() {
        try {
            rechainPending();
            return true;
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "re-chaining pending records failed; buffered records wait", e);
            return false;
        }
    }

    /** Store, chain, enqueue one record. Package-private for tests. */
    void process(UnchainedRecord r) {
        try {
            store.append(r);
        } catch (StorageFullException full) {
            refused.incrementAndGet();
            alerts.raise(AlertKind.STORAGE_FULL, r.priority() + " record " + r.id() + " rejected: "
                    + full.getMessage());
            return;
        }
        try {
            SyncRecord c = chain.chainAppend(r);
            chained.incrementAndGet();
            queue.enqueue(c);
        } catch (RuntimeException e) {
            rechainNeeded = true;
            log.log(Level.SEVERE, "chaining " + r.id() + " failed; it stays pending and will be re-chained", e);
        }
    }

    private int rechainPending() {
        List<UnchainedRecord> pending = store.pendingUnchained();
        int n = 0;
        for (UnchainedRecord u : pending) {
            SyncRecord c = chain.chainAppend(u);
            queue.enqueue(c);
            chained.incrementAndGet();
            n++;
        }
        rechainNeeded = false;
        if (n > 0) {
            log.log(Level.INFO, "re-chained {0} pending record(s)", n);
        }
        return n;
    }
}
