package io.fieldsync.node.sync;

import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.NodeKeys;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/** Scriptable in-memory transport; acks everything unless told otherwise. */
public final class FakeTransport implements SyncTransport {

    public final List<SyncRecord> pushed = new ArrayList<>();
    public final Deque<byte[]> downlink = new ArrayDeque<>();
    public Function<SyncRecord, PushOutcome> outcome = r -> new PushOutcome.Acked(5);
    public HandshakeResult handshakeResult = new HandshakeResult(true, "session-1", null, 0L, 0L);
    public boolean connectFails;
    public boolean handshakeFails;
    public int connectCalls;
    public int handshakeCalls;
    public int pollCalls;
    public boolean closed;

    @Override
    public void connect() {
        connectCalls++;
        if (connectFails) {
            throw new TransportException("connection refused", null);
        }
    }

    @Override
    public HandshakeResult handshake(String nodeId, NodeKeys keys, long timestampMillis) {
        handshakeCalls++;
        if (handshakeFails) {
            throw new TransportException("UNAVAILABLE: handshake", null);
        }
        return handshakeResult;
    }

    @Override
    public PushOutcome push(String sessionId, SyncRecord record, Duration ackTimeout) {
        pushed.add(record);
        return outcome.apply(record);
    }

    @Override
    public List<byte[]> pollDownlink(String sessionId, int maxRecords) {
        pollCalls++;
        List<byte[]> out = new ArrayList<>();
        while (out.size() < maxRecords && !downlink.isEmpty()) {
            out.add(downlink.poll());
        }
        return out;
    }

    @Override
    public void close() {
        closed = true;
    }
}
