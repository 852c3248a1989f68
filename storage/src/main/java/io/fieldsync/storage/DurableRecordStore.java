// file: src/main/java/io/fieldsync/storage/DurableRecordStore.java
package io.fieldsync.storage;

import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.ChainState;
import io.fieldsync.core.chain.ChainStateStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable Local Data Store implementation.
 * <p>
 * Responsibilities:
 *  - Maintain in memory:
 *      - pending:  appended records not yet chained, in append order,
 *      - chained:  per class, sequence -> record,
 *      - head:     the chain head (also the {@link ChainStateStore} for the chain builder).
 *  - On write (append / commitChained / remove / eviction):
 *      1) Encode a WAL entry.
 *      2) Append+fsync to WAL.
 *      3) Apply to memory.
 *      4) Rotate WAL segment if needed.
 *      5) Compact (snapshot + drop covered segments) based on SnapshotPolicy.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL segments written after it.
 * <p>
 * A record and the chain head it produces are one CHAINED entry, so a crash can
 * never persist one without the other. A crash between append and chain leaves the
 * record in {@link #pendingUnchained()} for the caller to re-chain.
 * <p>
 * Quota: an incoming record may displace records of its own or lower classes,
 * lowest class first, oldest first within a class; never P0 and never a class
 * above the incoming one. A pending record is charged its chained footprint up
 * front, so chaining it never grows usage past the quota.
 */
public class DurableRecordStore implements LocalDataStore, ChainStateStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableRecordStore.class.getName());

    public static final long DEFAULT_QUOTA_BYTES = 5L * 1024 * 1024 * 1024;
    static final long SEGMENT_BYTES = 64L * 1024 * 1024;
    static final int SNAPSHOT_EVERY_OPS = 10_000;

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final long quotaBytes;
    private final Clock clock;
    private volatile EvictionListener evictionListener = EvictionListener.NONE;

    // guarded by this
    private final LinkedHashMap<UUID, UnchainedRecord> pending = new LinkedHashMap<>();
    private final Map<Priority, TreeMap<Long, SyncRecord>> chained = new EnumMap<>(Priority.class);
    private final Map<UUID, SyncRecord> chainedById = new HashMap<>();
    private ChainState head = ChainState.genesis();
    private long usedBytes;

    private record Evicted(UUID id, Priority priority, RemovalCause cause) {
    }

    public DurableRecordStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, long quotaBytes, Clock clock) {
        if (quotaBytes <= 0) throw new IllegalArgumentException("quotaBytes must be > 0");
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.quotaBytes = quotaBytes;
        this.clock = Objects.requireNonNull(clock, "clock");
        for (Priority p : Priority.values()) {
            chained.put(p, new TreeMap<>());
        }
        recover();
    }

    /** Store under {@code dataDir}/wal and {@code dataDir}/snapshots with default segment and snapshot sizes. */
    public static DurableRecordStore open(Path dataDir, long quotaBytes, Clock clock) {
        return new DurableRecordStore(
                new FileWal(dataDir.resolve("wal"), SEGMENT_BYTES),
                new FileSnapshotter(dataDir.resolve("snapshots")),
                new SnapshotPolicy(SNAPSHOT_EVERY_OPS),
                quotaBytes,
                clock);
    }

    public void setEvictionListener(EvictionListener listener) {
        this.evictionListener = Objects.requireNonNull(listener, "listener");
    }

    // ----------------- LocalDataStore -----------------

    @Override
    public void append(UnchainedRecord record) {
        Objects.requireNonNull(record, "record");
        List<Evicted> applied = new ArrayList<>();
        try {
            synchronized (this) {
                if (pending.containsKey(record.id()) || chainedById.containsKey(record.id())) {
                    return; // already stored
                }
                long need = reservedFootprint(record);
                for (Evicted e : planQuotaEviction(record.priority(), need)) {
                    writeEntry(RecordCodec.removed(e.id(), RemovalCause.QUOTA));
                    dropFromMemory(e.id());
                    applied.add(e);
                }
                writeEntry(RecordCodec.pending(record));
                pending.put(record.id(), record);
                usedBytes += need;
                afterWrite();
            }
        } finally {
            notifyEvicted(applied);
        }
    }

    @Override
    public int evictExpired() {
        long now = clock.millis();
        List<Evicted> applied = new ArrayList<>();
        try {
            synchronized (this) {
                List<Evicted> expired = new ArrayList<>();
                for (Priority p : Priority.values()) {
                    if (p.retainedIndefinitely()) continue;
                    for (SyncRecord r : chained.get(p).values()) {
                        if (p.isExpired(r.timestampMillis(), now)) {
                            expired.add(new Evicted(r.id(), p, RemovalCause.EXPIRED));
                        }
                    }
                }
                for (UnchainedRecord r : pending.values()) {
                    if (r.priority().isExpired(r.timestampMillis(), now)) {
                        expired.add(new Evicted(r.id(), r.priority(), RemovalCause.EXPIRED));
                    }
                }
                for (Evicted e : expired) {
                    writeEntry(RecordCodec.removed(e.id(), RemovalCause.EXPIRED));
                    dropFromMemory(e.id());
                    applied.add(e);
                    afterWrite();
                }
            }
            if (!applied.isEmpty()) {
                log.log(Level.INFO, "Retention sweep evicted {0} record(s)", applied.size());
            }
        } finally {
            notifyEvicted(applied);
        }
        return applied.size();
    }

    @Override
    public synchronized List<SyncRecord> iterByPriority(Priority priority) {
        return List.copyOf(chained.get(priority).values());
    }

    @Override
    public synchronized boolean remove(UUID id) {
        if (!chainedById.containsKey(id)) {
            return false;
        }
        writeEntry(RecordCodec.removed(id, RemovalCause.ACKED));
        dropFromMemory(id);
        afterWrite();
        return true;
    }

    @Override
    public synchronized List<UnchainedRecord> pendingUnchained() {
        return List.copyOf(pending.values());
    }

    @Override
    public synchronized List<SyncRecord> allChained() {
        List<SyncRecord> all = new ArrayList<>(chainedById.values());
        all.sort(Comparator.comparingLong(SyncRecord::sequence));
        return all;
    }

    @Override
    public synchronized StoreStats stats() {
        Map<Priority, Integer> counts = new EnumMap<>(Priority.class);
        for (Priority p : Priority.values()) {
            counts.put(p, chained.get(p).size());
        }
        return new StoreStats(counts, pending.size(), usedBytes, quotaBytes, head);
    }

    // ----------------- ChainStateStore -----------------

    @Override
    public synchronized ChainState load() {
        return head;
    }

    @Override
    public synchronized void commitChained(SyncRecord record) {
        if (record.sequence() != head.nextSequence()) {
            throw new IllegalStateException("commit of sequence " + record.sequence()
                    + " does not extend head " + head.lastSequence());
        }
        if (!pending.containsKey(record.id())) {
            throw new IllegalStateException("record " + record.id() + " is not pending; it was evicted or never stored");
        }
        writeEntry(RecordCodec.chained(record));
        applyChained(record);
        afterWrite();
    }

    @Override
    public void close() {
        wal.close();
    }

    // ----------------- internals -----------------

    /**
     * Pick victims so that {@code need} more bytes fit: classes from P5 up to
     * {@code incoming}, skipping P0; chained records (oldest sequence) before
     * pending ones within a class.
     */
    private List<Evicted> planQuotaEviction(Priority incoming, long need) {
        if (usedBytes + need <= quotaBytes) return List.of();

        List<Evicted> plan = new ArrayList<>();
        long freed = 0;
        Priority[] all = Priority.values();
        for (int level = all.length - 1; level >= incoming.level() && level > 0; level--) {
            Priority p = all[level];
            for (SyncRecord r : chained.get(p).values()) {
                if (usedBytes - freed + need <= quotaBytes) break;
                plan.add(new Evicted(r.id(), p, RemovalCause.QUOTA));
                freed += r.storageFootprint();
            }
            for (UnchainedRecord r : pending.values()) {
                if (usedBytes - freed + need <= quotaBytes) break;
                if (r.priority() != p) continue;
                plan.add(new Evicted(r.id(), p, RemovalCause.QUOTA));
                freed += reservedFootprint(r);
            }
            if (usedBytes - freed + need <= quotaBytes) return plan;
        }
        throw new StorageFullException(incoming, need, usedBytes, quotaBytes);
    }

    /** What a pending record is charged: its size once chained. */
    static long reservedFootprint(UnchainedRecord r) {
        return r.storageFootprint() + SyncRecord.CHAIN_OVERHEAD_BYTES;
    }

    private void writeEntry(byte[] framed) {
        wal.append(framed);
    }

    private void afterWrite() {
        wal.rotateIfNeeded();
        if (snapPolicy.recordWrite()) {
            compact();
        }
    }

    /**
     * Rotate, snapshot the live state with "replay from the new segment", then
     * drop segments the snapshot covers. A crash at any point leaves a snapshot and
     * the segments it needs.
     */
    private void compact() {
        long replayFrom = wal.rotate();
        List<SyncRecord> live = new ArrayList<>(chainedById.values());
        live.sort(Comparator.comparingLong(SyncRecord::sequence));
        String id = snaps.writeSnapshot(new StoreImage(replayFrom, head, new ArrayList<>(pending.values()), live));
        wal.deleteSegmentsBefore(replayFrom);
        log.log(Level.FINE, "Compacted store into {0}", id);
    }

    private void applyChained(SyncRecord record) {
        UnchainedRecord was = pending.remove(record.id());
        if (was != null) {
            usedBytes -= reservedFootprint(was);
        }
        if (chainedById.putIfAbsent(record.id(), record) == null) {
            chained.get(record.priority()).put(record.sequence(), record);
            usedBytes += record.storageFootprint();
        }
        if (record.sequence() > head.lastSequence()) {
            head = ChainState.after(record);
        }
    }

    private void dropFromMemory(UUID id) {
        UnchainedRecord p = pending.remove(id);
        if (p != null) {
            usedBytes -= reservedFootprint(p);
            return;
        }
        SyncRecord r = chainedById.remove(id);
        if (r != null) {
            chained.get(r.priority()).remove(r.sequence());
            usedBytes -= r.storageFootprint();
        }
    }

    private void notifyEvicted(List<Evicted> evicted) {
        EvictionListener listener = evictionListener;
        for (Evicted e : evicted) {
            listener.evicted(e.id(), e.priority(), e.cause());
        }
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL entries written after it, in order.
     */
    private synchronized void recover() {
        StoreImage image = snaps.loadLatest();
        long replayFrom = 1;
        if (image != null) {
            head = image.head();
            for (UnchainedRecord r : image.pending()) {
                pending.put(r.id(), r);
                usedBytes += reservedFootprint(r);
            }
            for (SyncRecord r : image.chained()) {
                applyChained(r);
            }
            replayFrom = image.replayFromSegment();
        }

        int entries = 0;
        try (Wal.WalReader reader = wal.openReader(replayFrom)) {
            for (byte[] payload; (payload = reader.next()) != null; ) {
                RecordCodec.LogEntry e = RecordCodec.decode(payload);
                switch (e.kind()) {
                    case PENDING:
                        if (!chainedById.containsKey(e.pending().id()) && !pending.containsKey(e.pending().id())) {
                            pending.put(e.pending().id(), e.pending());
                            usedBytes += reservedFootprint(e.pending());
                        }
                        break;
                    case CHAINED:
                        applyChained(e.chained());
                        break;
                    case REMOVED:
                        dropFromMemory(e.removedId());
                        break;
                    default:
                        throw new IllegalStateException("unhandled entry kind " + e.kind());
                }
                entries++;
            }
        }
        log.log(Level.INFO, "Recovered store: {0} chained, {1} pending, head at sequence {2} ({3} WAL entries replayed)",
                new Object[]{chainedById.size(), pending.size(), head.lastSequence(), entries});
    }
}
