// file: src/main/java/io/fieldsync/storage/Wal.java
package io.fieldsync.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "entry" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated entry).
 *  - append() must fsync the entry to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see it.
 *  - Segments are numbered from 1 and only ever grow; compaction deletes
 *    whole segments from the front.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed entry and fsync it.
     *
     * @param framedEntry header+payload bytes from RecordCodec
     */
    void append(byte[] framedEntry);

    /**
     * Rotate to a new segment if the current one reached its size threshold.
     * Called by the store after each write.
     */
    void rotateIfNeeded();

    /**
     * Close the current segment and start a new one unconditionally.
     *
     * @return index of the new (now current) segment
     */
    long rotate();

    /** Delete every segment whose index is lower than {@code segment}. */
    void deleteSegmentsBefore(long segment);

    /**
     * Open a sequential reader starting at segment {@code fromSegment} (or the
     * earliest segment after it). The reader walks segments in order and stops at:
     *  - first corrupt header or bad CRC,
     *  - first truncated payload, or
     *  - end of the last segment.
     */
    WalReader openReader(long fromSegment);

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null at the end of
         *         the log or at the first corrupt entry.
         */
        byte[] next();

        @Override
        void close();
    }

    @Override
    void close();
}
