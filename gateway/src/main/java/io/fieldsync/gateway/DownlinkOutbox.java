// file: gateway/src/main/java/io/fieldsync/gateway/DownlinkOutbox.java
package io.fieldsync.gateway;

import io.fieldsync.core.MessageType;
import io.fieldsync.core.RecordIds;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.IntegrityChain;
import io.fieldsync.core.chain.NodeKeys;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;

/**
 * Pending gateway-to-node records.
 * <p>
 * Downlink records use the uplink record format, chained and signed by the
 * gateway's own key. Each node's outbox drains in priority order, then sequence.
 * Delivery is at most once: a polled record is gone from the outbox.
 */
public final class DownlinkOutbox {

    private static final Comparator<SyncRecord> DELIVERY_ORDER =
            Comparator.comparingInt((SyncRecord r) -> r.priority().level()).thenComparingLong(SyncRecord::sequence);

    private final IntegrityChain chain;
    private final RecordIds ids;
    private final Clock clock;
    private final Map<String, PriorityBlockingQueue<SyncRecord>> outboxes = new ConcurrentHashMap<>();

    public DownlinkOutbox(NodeKeys gatewayKeys, Clock clock) {
        this.chain = new IntegrityChain(new VolatileChainStateStore(), gatewayKeys);
        this.ids = new RecordIds(clock);
        this.clock = clock;
    }

    /**
     * Chain and queue a downlink record for {@code nodeId}. The priority comes from
     * the type's fixed table priority.
     */
    public SyncRecord enqueue(String nodeId, MessageType type, byte[] rawPayload) {
        if (!type.isDownlink()) {
            throw new IllegalArgumentException(type + " is not a downlink type");
        }
        SyncRecord r = chain.chainAppend(
                UnchainedRecord.create(ids, type.downlinkPriority(), type, rawPayload, clock.millis()));
        outboxes.computeIfAbsent(nodeId, k -> new PriorityBlockingQueue<>(16, DELIVERY_ORDER)).add(r);
        return r;
    }

    public List<SyncRecord> poll(String nodeId, int maxRecords) {
        PriorityBlockingQueue<SyncRecord> q = outboxes.get(nodeId);
        List<SyncRecord> out = new ArrayList<>();
        if (q == null) return out;
        while (out.size() < maxRecords) {
            SyncRecord r = q.poll();
            if (r == null) break;
            out.add(r);
        }
        return out;
    }

    public int pending(String nodeId) {
        PriorityBlockingQueue<SyncRecord> q = outboxes.get(nodeId);
        return q == null ? 0 : q.size();
    }
}
