package io.fieldsync.node.downlink;

import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.RecordIds;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.ChainState;
import io.fieldsync.core.chain.ChainStateStore;
import io.fieldsync.core.chain.IntegrityChain;
import io.fieldsync.core.chain.NodeKeys;
import io.fieldsync.core.wire.WireCodec;

/** Builds wire-encoded records signed by a gateway key, in any shape a test needs. */
final class SignedRecords {
    final NodeKeys keys = NodeKeys.generate();
    private final RecordIds ids = new RecordIds();
    private final IntegrityChain chain = new IntegrityChain(new ChainStateStore() {
        private ChainState head = ChainState.genesis();

        @Override
        public synchronized ChainState load() {
            return head;
        }

        @Override
        public synchronized void commitChained(SyncRecord record) {
            head = ChainState.after(record);
        }
    }, keys);

    SyncRecord record(Priority p, MessageType type, byte[] raw) {
        return chain.chainAppend(UnchainedRecord.create(ids, p, type, raw, System.currentTimeMillis()));
    }

    byte[] encoded(Priority p, MessageType type, byte[] raw) {
        return WireCodec.encode(record(p, type, raw));
    }

    byte[] encoded(MessageType type, byte[] raw) {
        return encoded(type.downlinkPriority(), type, raw);
    }
}
