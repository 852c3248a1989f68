// file: src/main/java/io/fieldsync/core/SyncRecord.java
package io.fieldsync.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, chained unit of synchronization.
 * <p>
 * Everything from {@link UnchainedRecord} plus the chain fields assigned by the
 * chain builder:
 *  - sequence:  per-node counter, +1 per chained record, starting at 1.
 *  - prevHash:  hash of record sequence-1 (all zeros for sequence 1).
 *  - hash:      SHA-256(prevHash || sequence || id || digest || timestamp).
 *  - signature: Ed25519 signature over hash.
 * <p>
 * Instances are only produced by the chain builder, the wire decoder and the
 * storage recovery path. A change to any field means a new record.
 */
public final class SyncRecord {
    public static final int SIGNATURE_LEN = 64; // Ed25519
    /** Bytes chaining adds on top of {@link UnchainedRecord#storageFootprint()}: sequence, two hashes, signature. */
    public static final long CHAIN_OVERHEAD_BYTES = Hashing.HASH_LEN * 2L + SIGNATURE_LEN + 8L;

    private final UnchainedRecord body;
    private final long sequence;
    private final byte[] prevHash;
    private final byte[] hash;
    private final byte[] signature;

    public SyncRecord(UnchainedRecord body, long sequence, byte[] prevHash, byte[] hash, byte[] signature) {
        this.body = Objects.requireNonNull(body, "body");
        if (sequence <= 0) throw new IllegalArgumentException("sequence must be > 0, got " + sequence);
        this.sequence = sequence;
        this.prevHash = requireLength(prevHash, Hashing.HASH_LEN, "prevHash").clone();
        this.hash = requireLength(hash, Hashing.HASH_LEN, "hash").clone();
        this.signature = requireLength(signature, SIGNATURE_LEN, "signature").clone();
    }

    public UUID id() { return body.id(); }

    public Priority priority() { return body.priority(); }

    public MessageType msgType() { return body.msgType(); }

    public byte[] payload() { return body.payload(); }

    public byte[] digest() { return body.digest(); }

    public long timestampMillis() { return body.timestampMillis(); }

    public long sequence() { return sequence; }

    public byte[] prevHash() { return prevHash.clone(); }

    public byte[] hash() { return hash.clone(); }

    public byte[] signature() { return signature.clone(); }

    /** The producer-side fields, without chain metadata. */
    public UnchainedRecord body() { return body; }

    public long storageFootprint() {
        return body.storageFootprint() + CHAIN_OVERHEAD_BYTES;
    }

    /** Decompress the payload. */
    public byte[] rawPayload() {
        return PayloadCodec.decompress(body.payloadRef());
    }

    /** True when {@code other} is the record this one links to. */
    public boolean linksTo(SyncRecord other) {
        return other.sequence + 1 == sequence && Arrays.equals(prevHash, other.hash);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyncRecord other)) return false;
        return sequence == other.sequence
                && body.equals(other.body)
                && Arrays.equals(prevHash, other.prevHash)
                && Arrays.equals(hash, other.hash)
                && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body.id(), sequence);
    }

    @Override
    public String toString() {
        return "SyncRecord{id=" + body.id() + ", seq=" + sequence + ", priority=" + body.priority()
                + ", type=" + body.msgType() + "}";
    }

    private static byte[] requireLength(byte[] bytes, int len, String name) {
        Objects.requireNonNull(bytes, name);
        if (bytes.length != len) {
            throw new IllegalArgumentException(name + " must be " + len + " bytes, got " + bytes.length);
        }
        return bytes;
    }
}
