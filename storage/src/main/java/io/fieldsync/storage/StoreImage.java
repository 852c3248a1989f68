package io.fieldsync.storage;

import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.ChainState;

import java.util.List;

/**
 * Full copy of the store's live state at a point in the log.
 *
 * @param replayFromSegment first WAL segment written after this image; recovery
 *                          replays from there
 * @param head              chain head at the time of the image
 * @param pending           appended but not yet chained, in append order
 * @param chained           retained chained records, in sequence order
 */
public record StoreImage(long replayFromSegment,
                         ChainState head,
                         List<UnchainedRecord> pending,
                         List<SyncRecord> chained) {

    public StoreImage {
        pending = List.copyOf(pending);
        chained = List.copyOf(chained);
    }
}
