package io.fieldsync.node.sync;

import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.NodeKeys;

import java.time.Duration;
import java.util.List;

/**
 * Node side of the gateway protocol.
 * <p>
 * Every call is bounded by a timeout; none of them retries. Retry and backoff
 * belong to the sync engine and the connection manager.
 */
public interface SyncTransport extends AutoCloseable {

    /**
     * Bring the underlying connection up.
     *
     * @throws TransportException when the gateway is unreachable
     */
    void connect();

    /**
     * Authenticate with a signed proof of {@code nodeId} at {@code timestampMillis}.
     *
     * @throws TransportException on transport failure; a refusal is a result, not an exception
     */
    HandshakeResult handshake(String nodeId, NodeKeys keys, long timestampMillis);

    /** Upload one record and wait at most {@code ackTimeout} for its outcome. Never throws. */
    PushOutcome push(String sessionId, SyncRecord record, Duration ackTimeout);

    /**
     * Fetch pending downlink records in their wire encoding.
     *
     * @throws TransportException on transport failure or an unknown session
     */
    List<byte[]> pollDownlink(String sessionId, int maxRecords);

    @Override
    void close();
}
