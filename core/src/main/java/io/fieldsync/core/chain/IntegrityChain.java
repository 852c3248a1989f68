// file: src/main/java/io/fieldsync/core/chain/IntegrityChain.java
package io.fieldsync.core.chain;

import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Integrity chain builder: the single serialization point of the pipeline.
 * <p>
 * chainAppend():
 *  1) takes the exclusive lock,
 *  2) assigns sequence = head.lastSequence + 1 and prevHash = head.lastHash,
 *  3) computes the record hash and signs it with the node key,
 *  4) hands the record to the {@link ChainStateStore}, which persists record and
 *     head atomically,
 *  5) only then advances the in-memory head.
 * <p>
 * If step 4 throws, the head is untouched and the same sequence is reused by the
 * next call, so a failed commit never leaves a gap.
 * <p>
 * The head is loaded from the store on construction, so a restarted node continues
 * its existing chain instead of starting a new one.
 */
public final class IntegrityChain {
    private static final Logger log = Logger.getLogger(IntegrityChain.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final ChainStateStore store;
    private final NodeKeys keys;

    // guarded by lock
    private ChainState head;

    public IntegrityChain(ChainStateStore store, NodeKeys keys) {
        this.store = Objects.requireNonNull(store, "store");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.head = Objects.requireNonNull(store.load(), "store.load()");
        log.log(Level.INFO, "chain resumed at sequence {0}", head.lastSequence());
    }

    public SyncRecord chainAppend(UnchainedRecord unchained) {
        Objects.requireNonNull(unchained, "unchained");
        lock.lock();
        try {
            ChainState current = head;
            long sequence = current.nextSequence();
            byte[] prevHash = current.lastHash();
            byte[] hash = ChainHasher.hash(prevHash, sequence, unchained);
            byte[] signature = keys.sign(hash);

            SyncRecord chained = new SyncRecord(unchained, sequence, prevHash, hash, signature);
            store.commitChained(chained);
            head = ChainState.after(chained);
            return chained;
        } finally {
            lock.unlock();
        }
    }

    public ChainState head() {
        lock.lock();
        try {
            return head;
        } finally {
            lock.unlock();
        }
    }

    public NodeKeys keys() {
        return keys;
    }
}
