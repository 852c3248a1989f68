// file: src/main/java/io/fieldsync/storage/RecordCodec.java
package io.fieldsync.storage;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.wire.WireCodec;
import io.fieldsync.core.wire.WireFormatException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.UUID;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL entries.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xF51C
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - kind (1B)
 *     - PENDING:  unchained record (see encodeUnchained)
 *     - CHAINED:  the record's wire encoding; the entry is also the new chain head
 *     - REMOVED:  id (16B) + cause (1B)
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xF51C;
    static final byte VERSION = 1;
    static final int HEADER_LEN = 2 + 1 + 4 + 4;

    enum Kind { PENDING, CHAINED, REMOVED }

    /** Decoded entry; exactly one of pending / chained / removedId is set. */
    record LogEntry(Kind kind, UnchainedRecord pending, SyncRecord chained, UUID removedId, RemovalCause cause) {
    }

    private RecordCodec() {
    }

    static byte[] pending(UnchainedRecord r) {
        byte[] body = encodeUnchained(r);
        byte[] payload = new byte[1 + body.length];
        payload[0] = (byte) Kind.PENDING.ordinal();
        System.arraycopy(body, 0, payload, 1, body.length);
        return frame(payload);
    }

    static byte[] chained(SyncRecord r) {
        byte[] wire = WireCodec.encode(r);
        byte[] payload = new byte[1 + wire.length];
        payload[0] = (byte) Kind.CHAINED.ordinal();
        System.arraycopy(wire, 0, payload, 1, wire.length);
        return frame(payload);
    }

    static byte[] removed(UUID id, RemovalCause cause) {
        ByteBuffer b = ByteBuffer.allocate(1 + 16 + 1);
        b.put((byte) Kind.REMOVED.ordinal());
        b.put(Hashing.uuidBytes(id));
        b.put((byte) cause.ordinal());
        return frame(b.array());
    }

    /** Decode a full payload (not including header). */
    static LogEntry decode(byte[] payload) {
        if (payload.length == 0) throw new StorageException("empty WAL entry");
        byte kind = payload[0];
        try {
            switch (kind) {
                case 0: {
                    ByteBuffer b = ByteBuffer.wrap(payload, 1, payload.length - 1).order(ByteOrder.LITTLE_ENDIAN);
                    return new LogEntry(Kind.PENDING, decodeUnchained(b), null, null, null);
                }
                case 1: {
                    SyncRecord r = WireCodec.decode(Arrays.copyOfRange(payload, 1, payload.length));
                    return new LogEntry(Kind.CHAINED, null, r, null, null);
                }
                case 2: {
                    ByteBuffer b = ByteBuffer.wrap(payload, 1, payload.length - 1);
                    byte[] id = new byte[16];
                    b.get(id);
                    return new LogEntry(Kind.REMOVED, null, null, Hashing.uuidFromBytes(id), RemovalCause.fromCode(b.get()));
                }
                default:
                    throw new StorageException("unknown WAL entry kind " + kind);
            }
        } catch (BufferUnderflowException | IllegalArgumentException | WireFormatException e) {
            throw new StorageException("undecodable WAL entry of kind " + kind, e);
        }
    }

    // ----------------- unchained records (also used by snapshots) -----------------

    /**
     * id (16B) | priority (1B) | msgType (1B) | timestamp (8B) | digest (32B) | payloadLen (4B) | payload
     */
    static byte[] encodeUnchained(UnchainedRecord r) {
        byte[] payload = r.payload();
        ByteBuffer b = ByteBuffer.allocate(16 + 1 + 1 + 8 + Hashing.HASH_LEN + 4 + payload.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        b.put(Hashing.uuidBytes(r.id()));
        b.put((byte) r.priority().level());
        b.put(r.msgType().tag());
        b.putLong(r.timestampMillis());
        b.put(r.digest());
        b.putInt(payload.length).put(payload);
        return b.array();
    }

    static UnchainedRecord decodeUnchained(ByteBuffer b) {
        byte[] id = new byte[16];
        b.get(id);
        Priority priority = Priority.fromLevel(b.get());
        MessageType type = MessageType.fromTag(b.get());
        long ts = b.getLong();
        byte[] digest = new byte[Hashing.HASH_LEN];
        b.get(digest);
        int len = b.getInt();
        if (len < 0) throw new IllegalArgumentException("negative payload length");
        byte[] payload = new byte[len];
        b.get(payload);
        return new UnchainedRecord(Hashing.uuidFromBytes(id), priority, type, payload, digest, ts);
    }

    // ----------------- helpers -----------------

    static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_LEN + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // unsigned value fits; compared as int
    }
}
