package io.fieldsync.core.chain;

/**
 * The chain can no longer be trusted from {@link #sequence()} onward.
 * <p>
 * Never a soft warning: a local violation halts synchronization until an operator
 * intervenes, because the chain cannot be repaired automatically.
 */
public class ChainIntegrityViolation extends RuntimeException {

    public enum Reason {
        /** Stored hash differs from the hash recomputed over the record's fields. */
        HASH_MISMATCH,
        /** prev_hash does not equal the previous record's hash. */
        BROKEN_LINK,
        /** Sequence numbers are not contiguous, or a sequence was reused. */
        SEQUENCE_GAP,
        /** Signature does not verify against the node's public key. */
        BAD_SIGNATURE,
        /** Payload does not decompress to bytes matching the digest. */
        DIGEST_MISMATCH
    }

    private final Reason reason;
    private final long sequence;

    public ChainIntegrityViolation(Reason reason, long sequence, String message) {
        super("chain integrity violation at sequence " + sequence + " (" + reason + "): " + message);
        this.reason = reason;
        this.sequence = sequence;
    }

    public Reason reason() {
        return reason;
    }

    public long sequence() {
        return sequence;
    }
}
