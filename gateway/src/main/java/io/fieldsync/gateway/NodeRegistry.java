// file: gateway/src/main/java/io/fieldsync/gateway/NodeRegistry.java
package io.fieldsync.gateway;

import io.fieldsync.core.wire.HandshakeProof;

import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered node identities and their open sessions.
 * <p>
 *  - A node is known by its id and Ed25519 public key; unknown ids never get a session.
 *  - A handshake proof older or newer than {@link #MAX_PROOF_SKEW} is refused.
 *  - A new handshake replaces the node's previous session.
 */
public final class NodeRegistry {
    static final Duration MAX_PROOF_SKEW = Duration.ofMinutes(5);

    public sealed interface AuthResult permits Accepted, Refused {
    }

    public record Accepted(String sessionId) implements AuthResult {
    }

    public record Refused(String reason) implements AuthResult {
    }

    private final Map<String, PublicKey> keys;
    private final Clock clock;
    private final Map<String, String> nodeBySession = new ConcurrentHashMap<>();
    private final Map<String, String> sessionByNode = new ConcurrentHashMap<>();

    public NodeRegistry(Map<String, PublicKey> keys, Clock clock) {
        this.keys = Map.copyOf(keys);
        this.clock = clock;
    }

    public AuthResult authenticate(String nodeId, long timestampMillis, byte[] signature) {
        PublicKey key = keys.get(nodeId);
        if (key == null) {
            return new Refused("unknown node " + nodeId);
        }
        long skew = Math.abs(clock.millis() - timestampMillis);
        if (skew > MAX_PROOF_SKEW.toMillis()) {
            return new Refused("handshake timestamp off by " + skew + "ms");
        }
        if (!HandshakeProof.verify(key, nodeId, timestampMillis, signature)) {
            return new Refused("bad handshake signature");
        }

        String sessionId = UUID.randomUUID().toString();
        String previous = sessionByNode.put(nodeId, sessionId);
        if (previous != null) {
            nodeBySession.remove(previous);
        }
        nodeBySession.put(sessionId, nodeId);
        return new Accepted(sessionId);
    }

    /** Node owning an open session. */
    public Optional<String> nodeFor(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) return Optional.empty();
        return Optional.ofNullable(nodeBySession.get(sessionId));
    }

    public Optional<PublicKey> keyOf(String nodeId) {
        return Optional.ofNullable(keys.get(nodeId));
    }

    public Iterable<String> nodeIds() {
        return keys.keySet();
    }
}
