package io.fieldsync.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * SHA-256 helpers shared by the payload codec, the chain builder and the wire codec.
 */
public final class Hashing {
    public static final int HASH_LEN = 32; // SHA-256

    private static final byte[] ZERO_HASH = new byte[HASH_LEN];

    private Hashing() {
    }

    /** H(part1 || part2 || ...). */
    public static byte[] sha256(byte[]... parts) {
        var md = newDigest();
        for (var p : parts) md.update(p);
        return md.digest();
    }

    /** A fresh all-zero hash, used as prev_hash of the first chained record. */
    public static byte[] zeroHash() {
        return ZERO_HASH.clone();
    }

    public static boolean isZero(byte[] hash) {
        if (hash == null) return true;
        for (byte b : hash) {
            if (b != 0) return false;
        }
        return true;
    }

    /** Encode a long as 8 bytes big endian. */
    public static byte[] longBE(long v) {
        return ByteBuffer.allocate(8)
                .order(ByteOrder.BIG_ENDIAN)
                .putLong(v)
                .array();
    }

    /** The 16 bytes of a UUID, most significant half first. */
    public static byte[] uuidBytes(UUID id) {
        return ByteBuffer.allocate(16)
                .order(ByteOrder.BIG_ENDIAN)
                .putLong(id.getMostSignificantBits())
                .putLong(id.getLeastSignificantBits())
                .array();
    }

    public static UUID uuidFromBytes(byte[] bytes) {
        if (bytes.length != 16) throw new IllegalArgumentException("uuid must be 16 bytes");
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
        return new UUID(b.getLong(), b.getLong());
    }

    public static String hex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
