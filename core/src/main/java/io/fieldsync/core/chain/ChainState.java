package io.fieldsync.core.chain;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.SyncRecord;

import java.util.Arrays;
import java.util.Objects;

/**
 * Head of a node's chain: the sequence and hash of the last chained record.
 * <p>
 * {@link #genesis()} (sequence 0, zero hash) is the head before anything has
 * been chained. Values are immutable; advancing the chain produces a new state.
 */
public record ChainState(long lastSequence, byte[] lastHash) {

    public ChainState {
        if (lastSequence < 0) throw new IllegalArgumentException("lastSequence must be >= 0");
        Objects.requireNonNull(lastHash, "lastHash");
        if (lastHash.length != Hashing.HASH_LEN) {
            throw new IllegalArgumentException("lastHash must be " + Hashing.HASH_LEN + " bytes");
        }
        lastHash = lastHash.clone();
    }

    public static ChainState genesis() {
        return new ChainState(0L, Hashing.zeroHash());
    }

    /** Head after {@code record} has been chained. */
    public static ChainState after(SyncRecord record) {
        return new ChainState(record.sequence(), record.hash());
    }

    public long nextSequence() {
        return lastSequence + 1;
    }

    @Override
    public byte[] lastHash() {
        return lastHash.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChainState other)) return false;
        return lastSequence == other.lastSequence && Arrays.equals(lastHash, other.lastHash);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(lastSequence) * 31 + Arrays.hashCode(lastHash);
    }

    @Override
    public String toString() {
        return "ChainState{lastSequence=" + lastSequence + ", lastHash=" + Hashing.hex(lastHash) + "}";
    }
}
