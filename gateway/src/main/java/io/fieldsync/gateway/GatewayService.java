// file: gateway/src/main/java/io/fieldsync/gateway/GatewayService.java
package io.fieldsync.gateway;

import com.google.protobuf.ByteString;
import io.fieldsync.core.Hashing;
import io.fieldsync.core.MessageType;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.wire.SyncGatewayGrpc;
import io.fieldsync.core.wire.SyncGatewayProto;
import io.fieldsync.core.wire.WireCodec;
import io.fieldsync.core.wire.WireFormatException;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * gRPC Cloud Sync Gateway: the receiving end of a node's uplink.
 * <p>
 * Responsibilities:
 *  - Authenticate nodes (Handshake) and hand out sessions.
 *  - Decode pushed records, re-verify hash, signature and contiguity against the
 *    node's ledger, and ack by id or reject with a reason.
 *  - Serve downlink records; a TIME_SYNC carrying the gateway clock is queued on
 *    every successful handshake.
 *  - Map IllegalArgumentException to INVALID_ARGUMENT, everything else to INTERNAL.
 */
public final class GatewayService extends SyncGatewayGrpc.SyncGatewayImplBase {
    private static final Logger log = Logger.getLogger(GatewayService.class.getName());

    static final int MAX_DOWNLINK_BATCH = 64;

    private final NodeRegistry registry;
    private final DownlinkOutbox outbox;
    private final Clock clock;
    private final Map<String, NodeLedger> ledgers = new ConcurrentHashMap<>();

    public GatewayService(NodeRegistry registry, DownlinkOutbox outbox, Clock clock) {
        this.registry = registry;
        this.outbox = outbox;
        this.clock = clock;
    }

    @Override
    public void handshake(SyncGatewayProto.HandshakeRequest request,
                          StreamObserver<SyncGatewayProto.HandshakeResponse> responseObserver) {
        try {
            String nodeId = request.getNodeId();
            NodeRegistry.AuthResult result = registry.authenticate(
                    nodeId, request.getTimestampMillis(), request.getSignature().toByteArray());

            var resp = SyncGatewayProto.HandshakeResponse.newBuilder()
                    .setGatewayTimeMillis(clock.millis());
            if (result instanceof NodeRegistry.Accepted accepted) {
                Optional<NodeLedger> ledger = ledgerFor(nodeId);
                ledger.ifPresent(NodeLedger::reanchor);
                long last = ledger.map(NodeLedger::lastSequence).orElse(0L);
                resp.setAccepted(true).setSessionId(accepted.sessionId()).setLastSequence(last);
                outbox.enqueue(nodeId, MessageType.TIME_SYNC, Hashing.longBE(clock.millis()));
                log.log(Level.INFO, "node {0} authenticated, gateway holds up to sequence {1}",
                        new Object[]{nodeId, last});
            } else {
                String reason = ((NodeRegistry.Refused) result).reason();
                resp.setAccepted(false).setReason(reason);
                log.log(Level.WARNING, "handshake refused for {0}: {1}", new Object[]{nodeId, reason});
            }
            responseObserver.onNext(resp.build());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(iae.getMessage()).asException());
        } catch (Exception e) {
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
        }
    }

    @Override
    public void push(SyncGatewayProto.PushRequest request,
                     StreamObserver<SyncGatewayProto.PushResponse> responseObserver) {
        try {
            responseObserver.onNext(handlePush(request));
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(iae.getMessage()).asException());
        } catch (Exception e) {
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
        }
    }

    @Override
    public void pollDownlink(SyncGatewayProto.DownlinkRequest request,
                             StreamObserver<SyncGatewayProto.DownlinkBatch> responseObserver) {
        try {
            Optional<String> nodeId = registry.nodeFor(request.getSessionId());
            if (nodeId.isEmpty()) {
                responseObserver.onError(Status.UNAUTHENTICATED.withDescription("unknown session").asException());
                return;
            }
            int max = request.getMaxRecords() <= 0 ? MAX_DOWNLINK_BATCH : Math.min(request.getMaxRecords(), MAX_DOWNLINK_BATCH);
            var batch = SyncGatewayProto.DownlinkBatch.newBuilder();
            for (SyncRecord r : outbox.poll(nodeId.get(), max)) {
                batch.addRecords(ByteString.copyFrom(WireCodec.encode(r)));
            }
            responseObserver.onNext(batch.build());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(iae.getMessage()).asException());
        } catch (Exception e) {
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
        }
    }

    /** Ledger of a registered node; empty for unknown ids. */
    public Optional<NodeLedger> ledgerFor(String nodeId) {
        return registry.keyOf(nodeId).map(key -> ledgers.computeIfAbsent(nodeId, id -> new NodeLedger(id, key)));
    }

    private SyncGatewayProto.PushResponse handlePush(SyncGatewayProto.PushRequest request) {
        SyncRecord record;
        try {
            record = WireCodec.decode(request.getRecord().toByteArray());
        } catch (WireFormatException e) {
            return rejected(ByteString.EMPTY, SyncGatewayProto.RejectReason.REJECT_REASON_MALFORMED, e.getMessage());
        }
        ByteString recordId = ByteString.copyFrom(Hashing.uuidBytes(record.id()));

        Optional<String> nodeId = registry.nodeFor(request.getSessionId());
        if (nodeId.isEmpty()) {
            return rejected(recordId, SyncGatewayProto.RejectReason.REJECT_REASON_UNAUTHENTICATED, "unknown session");
        }
        NodeLedger ledger = ledgerFor(nodeId.get())
                .orElseThrow(() -> new IllegalStateException("session for unregistered node " + nodeId.get()));

        NodeLedger.Verdict verdict = ledger.accept(record);
        switch (verdict) {
            case ACCEPTED:
                return SyncGatewayProto.PushResponse.newBuilder()
                        .setRecordId(recordId)
                        .setOutcome(SyncGatewayProto.Outcome.OUTCOME_ACK)
                        .build();
            case DUPLICATE:
                return rejected(recordId, SyncGatewayProto.RejectReason.REJECT_REASON_DUPLICATE, "already held");
            case BAD_SIGNATURE:
                return rejected(recordId, SyncGatewayProto.RejectReason.REJECT_REASON_BAD_SIGNATURE,
                        "record does not verify at sequence " + record.sequence());
            case SEQUENCE_GAP:
                return rejected(recordId, SyncGatewayProto.RejectReason.REJECT_REASON_SEQUENCE_GAP,
                        "sequence " + record.sequence() + " conflicts with held records");
            default:
                throw new IllegalStateException("unhandled verdict " + verdict);
        }
    }

    private static SyncGatewayProto.PushResponse rejected(ByteString recordId,
                                                          SyncGatewayProto.RejectReason reason,
                                                          String detail) {
        return SyncGatewayProto.PushResponse.newBuilder()
                .setRecordId(recordId)
                .setOutcome(SyncGatewayProto.Outcome.OUTCOME_REJECTED)
                .setReason(reason)
                .setDetail(detail == null ? "" : detail)
                .build();
    }
}
