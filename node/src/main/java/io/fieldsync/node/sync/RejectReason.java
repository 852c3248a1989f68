package io.fieldsync.node.sync;

/** Why the gateway refused a pushed record. */
public enum RejectReason {
    BAD_SIGNATURE,
    SEQUENCE_GAP,
    DUPLICATE,
    UNAUTHENTICATED,
    MALFORMED;

    /** Gateway-side chain verification failed for this record. */
    public boolean isIntegrityFailure() {
        return this == BAD_SIGNATURE || this == SEQUENCE_GAP;
    }
}
