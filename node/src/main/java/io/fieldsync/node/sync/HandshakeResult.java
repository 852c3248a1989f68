package io.fieldsync.node.sync;

/**
 * Gateway answer to a handshake.
 *
 * @param lastSequence highest sequence the gateway holds for this node, 0 if none
 */
public record HandshakeResult(boolean accepted,
                              String sessionId,
                              String reason,
                              long gatewayTimeMillis,
                              long lastSequence) {

    public static HandshakeResult refused(String reason, long gatewayTimeMillis) {
        return new HandshakeResult(false, null, reason, gatewayTimeMillis, 0L);
    }
}
