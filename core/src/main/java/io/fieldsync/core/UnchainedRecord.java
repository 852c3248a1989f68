// file: src/main/java/io/fieldsync/core/UnchainedRecord.java
package io.fieldsync.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * A record as created by a producer, before the chain builder links it.
 * <p>
 * Fields:
 *  - id:        time-ordered UUIDv7, assigned at creation.
 *  - priority:  fixed at creation.
 *  - msgType:   routing tag, opaque here.
 *  - payload:   compressed producer bytes.
 *  - digest:    SHA-256 of the uncompressed payload.
 *  - timestamp: node-local capture time in epoch millis.
 * <p>
 * Invariants:
 *  - All fields are immutable; byte arrays are copied on the way in and out.
 *  - Has no sequence or hash: it cannot be transmitted until chained.
 */
public final class UnchainedRecord {
    private final UUID id;
    private final Priority priority;
    private final MessageType msgType;
    private final byte[] payload;
    private final byte[] digest;
    private final long timestampMillis;

    public UnchainedRecord(UUID id,
                           Priority priority,
                           MessageType msgType,
                           byte[] payload,
                           byte[] digest,
                           long timestampMillis) {
        this.id = Objects.requireNonNull(id, "id");
        this.priority = Objects.requireNonNull(priority, "priority");
        this.msgType = Objects.requireNonNull(msgType, "msgType");
        this.payload = Objects.requireNonNull(payload, "payload").clone();
        Objects.requireNonNull(digest, "digest");
        if (digest.length != Hashing.HASH_LEN) {
            throw new IllegalArgumentException("digest must be " + Hashing.HASH_LEN + " bytes");
        }
        this.digest = digest.clone();
        this.timestampMillis = timestampMillis;
    }

    /**
     * Create a record from raw producer bytes: compress, digest, stamp.
     */
    public static UnchainedRecord create(RecordIds ids,
                                         Priority priority,
                                         MessageType msgType,
                                         byte[] rawPayload,
                                         long timestampMillis) {
        Objects.requireNonNull(rawPayload, "rawPayload");
        return new UnchainedRecord(
                ids.next(),
                priority,
                msgType,
                PayloadCodec.compress(rawPayload),
                PayloadCodec.digest(rawPayload),
                timestampMillis
        );
    }

    public UUID id() { return id; }

    public Priority priority() { return priority; }

    public MessageType msgType() { return msgType; }

    public byte[] payload() { return payload.clone(); }

    public byte[] digest() { return digest.clone(); }

    public long timestampMillis() { return timestampMillis; }

    /** Bytes this record occupies for quota accounting (payload plus fixed header). */
    public long storageFootprint() {
        return payload.length + 96L;
    }

    byte[] payloadRef() { return payload; }

    byte[] digestRef() { return digest; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnchainedRecord other)) return false;
        return timestampMillis == other.timestampMillis
                && id.equals(other.id)
                && priority == other.priority
                && msgType == other.msgType
                && Arrays.equals(payload, other.payload)
                && Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "UnchainedRecord{id=" + id + ", priority=" + priority + ", type=" + msgType + "}";
    }
}
