package io.fieldsync.storage;

/** Why a record left the store. */
public enum RemovalCause {
    /** The gateway acknowledged this exact id. */
    ACKED,
    /** The record outlived its class's retention window without an ack. */
    EXPIRED,
    /** Evicted to make room under the storage quota. */
    QUOTA;

    static RemovalCause fromCode(byte code) {
        RemovalCause[] all = values();
        if (code < 0 || code >= all.length) {
            throw new IllegalArgumentException("unknown removal cause " + code);
        }
        return all[code];
    }
}
