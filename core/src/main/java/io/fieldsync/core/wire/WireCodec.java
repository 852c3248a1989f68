// file: src/main/java/io/fieldsync/core/wire/WireCodec.java
package io.fieldsync.core.wire;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.ChainHasher;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.UUID;

/**
 * Binary encoding of a chained record, shared by uplink and downlink.
 * <p>
 * Layout (big-endian, in transmission order):
 * <p>
 *   id         16B
 *   priority    1B   0..5
 *   msgType     1B   enum tag
 *   payloadLen  4B   followed by payloadLen compressed bytes
 *   digest     32B
 *   signature  64B
 *   timestamp   8B   epoch millis
 *   sequence    8B   unsigned
 *   prevHash   32B   zero-filled for the first record
 * <p>
 * The record hash is not on the wire; decode() recomputes it from the fields so a
 * receiver can never be handed a hash that disagrees with the data.
 */
public final class WireCodec {
    public static final int MAX_PAYLOAD_BYTES = 64 * 1024 * 1024;

    static final int FIXED_LEN = 16 + 1 + 1 + 4 + 32 + SyncRecord.SIGNATURE_LEN + 8 + 8 + 32;

    private WireCodec() {
    }

    public static byte[] encode(SyncRecord r) {
        byte[] payload = r.payload();
        ByteBuffer b = ByteBuffer.allocate(FIXED_LEN + payload.length).order(ByteOrder.BIG_ENDIAN);
        b.put(Hashing.uuidBytes(r.id()));
        b.put((byte) r.priority().level());
        b.put(r.msgType().tag());
        b.putInt(payload.length).put(payload);
        b.put(r.digest());
        b.put(r.signature());
        b.putLong(r.timestampMillis());
        b.putLong(r.sequence());
        b.put(r.prevHash());
        return b.array();
    }

    /**
     * @throws WireFormatException on truncated input, trailing bytes or invalid fields
     */
    public static SyncRecord decode(byte[] bytes) {
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
        try {
            UUID id = Hashing.uuidFromBytes(read(b, 16));
            Priority priority = Priority.fromLevel(b.get());
            MessageType type = MessageType.fromTag(b.get());
            int payloadLen = b.getInt();
            if (payloadLen < 0 || payloadLen > MAX_PAYLOAD_BYTES) {
                throw new WireFormatException("invalid payload length " + payloadLen);
            }
            byte[] payload = read(b, payloadLen);
            byte[] digest = read(b, Hashing.HASH_LEN);
            byte[] signature = read(b, SyncRecord.SIGNATURE_LEN);
            long timestamp = b.getLong();
            long sequence = b.getLong();
            byte[] prevHash = read(b, Hashing.HASH_LEN);
            if (b.hasRemaining()) {
                throw new WireFormatException(b.remaining() + " trailing bytes after record");
            }

            var body = new UnchainedRecord(id, priority, type, payload, digest, timestamp);
            byte[] hash = ChainHasher.hash(prevHash, sequence, body);
            return new SyncRecord(body, sequence, prevHash, hash, signature);
        } catch (BufferUnderflowException e) {
            throw new WireFormatException("truncated record", e);
        } catch (IllegalArgumentException e) {
            throw new WireFormatException("invalid record field: " + e.getMessage(), e);
        }
    }

    private static byte[] read(ByteBuffer b, int len) {
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
