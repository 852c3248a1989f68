package io.fieldsync.gateway;

import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.ChainState;
import io.fieldsync.core.chain.ChainStateStore;

/** Chain head kept in memory only; the reference gateway keeps no durable state. */
final class VolatileChainStateStore implements ChainStateStore {
    private ChainState head = ChainState.genesis();

    @Override
    public synchronized ChainState load() {
        return head;
    }

    @Override
    public synchronized void commitChained(SyncRecord record) {
        head = ChainState.after(record);
    }
}
