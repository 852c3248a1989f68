package io.fieldsync.core.chain;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.UnchainedRecord;

import java.util.UUID;

/**
 * Deterministic record hash.
 * <p>
 *   hash = SHA-256( prevHash (32B)
 *                || sequence (8B, big-endian)
 *                || id       (16B)
 *                || digest   (32B)
 *                || timestamp(8B, big-endian epoch millis) )
 * <p>
 * Node and gateway must agree on this byte layout exactly.
 */
public final class ChainHasher {

    private ChainHasher() {
    }

    public static byte[] hash(byte[] prevHash, long sequence, UUID id, byte[] digest, long timestampMillis) {
        return Hashing.sha256(
                prevHash,
                Hashing.longBE(sequence),
                Hashing.uuidBytes(id),
                digest,
                Hashing.longBE(timestampMillis)
        );
    }

    public static byte[] hash(byte[] prevHash, long sequence, UnchainedRecord body) {
        return hash(prevHash, sequence, body.id(), body.digest(), body.timestampMillis());
    }
}
