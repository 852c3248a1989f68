package io.fieldsync.core.wire;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.chain.NodeKeys;

import java.nio.charset.StandardCharsets;
import java.security.PublicKey;

/**
 * What a node signs to open a session: {@code node_id (UTF-8) || timestamp_millis (8B BE)}.
 * <p>
 * The timestamp lets the gateway refuse stale proofs, so a captured handshake
 * cannot be replayed indefinitely.
 */
public final class HandshakeProof {

    private HandshakeProof() {
    }

    public static byte[] signedBytes(String nodeId, long timestampMillis) {
        byte[] id = nodeId.getBytes(StandardCharsets.UTF_8);
        byte[] ts = Hashing.longBE(timestampMillis);
        byte[] out = new byte[id.length + ts.length];
        System.arraycopy(id, 0, out, 0, id.length);
        System.arraycopy(ts, 0, out, id.length, ts.length);
        return out;
    }

    public static byte[] sign(NodeKeys keys, String nodeId, long timestampMillis) {
        return keys.sign(signedBytes(nodeId, timestampMillis));
    }

    public static boolean verify(PublicKey key, String nodeId, long timestampMillis, byte[] signature) {
        return NodeKeys.verify(key, signedBytes(nodeId, timestampMillis), signature);
    }
}
