package io.fieldsync.core.chain;

import io.fieldsync.core.SyncRecord;

/**
 * Persistence contract for the chain head.
 * <p>
 * Contract:
 *  - load() returns the head persisted by the last successful commitChained(),
 *    or {@link ChainState#genesis()} when nothing has ever been chained.
 *  - commitChained() durably stores the chained record and the new head as one
 *    atomic unit before returning. After a crash either both are visible or
 *    neither is.
 */
public interface ChainStateStore {

    ChainState load();

    void commitChained(SyncRecord record);
}
