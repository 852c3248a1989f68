// file: node/src/main/java/io/fieldsync/node/sync/GrpcSyncTransport.java
package io.fieldsync.node.sync;

import com.google.protobuf.ByteString;
import io.fieldsync.core.Hashing;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.NodeKeys;
import io.fieldsync.core.wire.HandshakeProof;
import io.fieldsync.core.wire.SyncGatewayGrpc;
import io.fieldsync.core.wire.SyncGatewayProto;
import io.fieldsync.core.wire.WireCodec;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * gRPC SyncTransport talking to one Cloud Sync Gateway.
 * <p>
 * The channel uses TLS unless plaintext is requested explicitly. gRPC's own
 * reconnect loop is not relied on: {@link #connect()} fails fast on
 * TRANSIENT_FAILURE so the connection manager's backoff stays in charge.
 */
public final class GrpcSyncTransport implements SyncTransport {
    private static final Logger log = Logger.getLogger(GrpcSyncTransport.class.getName());

    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final SyncGatewayGrpc.SyncGatewayBlockingStub stub;
    private final Duration callTimeout;

    /**
     * Production constructor.
     */
    public GrpcSyncTransport(String host, int port, boolean plaintext, Duration callTimeout) {
        this.target = host + ":" + port;
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forAddress(host, port);
        if (plaintext) {
            log.log(Level.WARNING, "gateway link {0} is NOT encrypted (plaintext requested)", target);
            builder.usePlaintext();
        } else {
            builder.useTransportSecurity();
        }
        this.channel = builder.build();
        this.stub = SyncGatewayGrpc.newBlockingStub(channel);
        this.callTimeout = callTimeout;
    }

    /**
     * Test-only constructor allowing a pre-built channel (e.g., in-process).
     */
    public GrpcSyncTransport(String target, ManagedChannel channel, Duration callTimeout) {
        this.target = target;
        this.channel = channel;
        this.stub = SyncGatewayGrpc.newBlockingStub(channel);
        this.callTimeout = callTimeout;
    }

    @Override
    public void connect() {
        long deadline = System.nanoTime() + callTimeout.toNanos();
        ConnectivityState s = channel.getState(true);
        while (s != ConnectivityState.READY) {
            if (s == ConnectivityState.TRANSIENT_FAILURE || s == ConnectivityState.SHUTDOWN) {
                throw new TransportException("gateway " + target + " unreachable (" + s + ")", null);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TransportException("gateway " + target + " not ready after "
                        + callTimeout.toMillis() + "ms (" + s + ")", null);
            }
            CountDownLatch changed = new CountDownLatch(1);
            channel.notifyWhenStateChanged(s, changed::countDown);
            try {
                changed.await(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted while connecting to " + target, e);
            }
            s = channel.getState(false);
        }
    }

    @Override
    public HandshakeResult handshake(String nodeId, NodeKeys keys, long timestampMillis) {
        var req = SyncGatewayProto.HandshakeRequest.newBuilder()
                .setNodeId(nodeId)
                .setTimestampMillis(timestampMillis)
                .setSignature(ByteString.copyFrom(HandshakeProof.sign(keys, nodeId, timestampMillis)))
                .build();
        try {
            var resp = stub.withDeadlineAfter(callTimeout.toMillis(), TimeUnit.MILLISECONDS).handshake(req);
            if (!resp.getAccepted()) {
                return HandshakeResult.refused(resp.getReason(), resp.getGatewayTimeMillis());
            }
            return new HandshakeResult(true, resp.getSessionId(), "",
                    resp.getGatewayTimeMillis(), resp.getLastSequence());
        } catch (StatusRuntimeException sre) {
            throw new TransportException("handshake with " + target + " failed: " + sre.getStatus(), sre);
        }
    }

    @Override
    public PushOutcome push(String sessionId, SyncRecord record, Duration ackTimeout) {
        var req = SyncGatewayProto.PushRequest.newBuilder()
                .setSessionId(sessionId)
                .setRecord(ByteString.copyFrom(WireCodec.encode(record)))
                .build();
        long start = System.nanoTime();
        SyncGatewayProto.PushResponse resp;
        try {
            resp = stub.withDeadlineAfter(ackTimeout.toMillis(), TimeUnit.MILLISECONDS).push(req);
        } catch (StatusRuntimeException sre) {
            if (sre.getStatus().getCode() == Status.Code.DEADLINE_EXCEEDED) {
                return new PushOutcome.TimedOut();
            }
            return new PushOutcome.Failed("push to " + target + " failed: " + sre.getStatus(), sre);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000L;

        byte[] sentId = Hashing.uuidBytes(record.id());
        switch (resp.getOutcome()) {
            case OUTCOME_ACK:
                if (!Arrays.equals(sentId, resp.getRecordId().toByteArray())) {
                    return new PushOutcome.Failed("ack for a different record id than " + record.id(), null);
                }
                return new PushOutcome.Acked(latencyMs);
            case OUTCOME_REJECTED:
                if (resp.getReason() != SyncGatewayProto.RejectReason.REJECT_REASON_MALFORMED
                        && !Arrays.equals(sentId, resp.getRecordId().toByteArray())) {
                    return new PushOutcome.Failed("rejection for a different record id than " + record.id(), null);
                }
                return new PushOutcome.Rejected(map(resp.getReason()), resp.getDetail());
            default:
                return new PushOutcome.Failed("gateway returned outcome " + resp.getOutcome(), null);
        }
    }

    @Override
    public List<byte[]> pollDownlink(String sessionId, int maxRecords) {
        var req = SyncGatewayProto.DownlinkRequest.newBuilder()
                .setSessionId(sessionId)
                .setMaxRecords(maxRecords)
                .build();
        try {
            var batch = stub.withDeadlineAfter(callTimeout.toMillis(), TimeUnit.MILLISECONDS).pollDownlink(req);
            List<byte[]> out = new ArrayList<>(batch.getRecordsCount());
            for (ByteString b : batch.getRecordsList()) {
                out.add(b.toByteArray());
            }
            return out;
        } catch (StatusRuntimeException sre) {
            boolean sessionRejected = sre.getStatus().getCode() == Status.Code.UNAUTHENTICATED;
            throw new TransportException("downlink poll from " + target + " failed: " + sre.getStatus(),
                    sre, sessionRejected);
        }
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static RejectReason map(SyncGatewayProto.RejectReason reason) {
        switch (reason) {
            case REJECT_REASON_BAD_SIGNATURE:
                return RejectReason.BAD_SIGNATURE;
            case REJECT_REASON_SEQUENCE_GAP:
                return RejectReason.SEQUENCE_GAP;
            case REJECT_REASON_DUPLICATE:
                return RejectReason.DUPLICATE;
            case REJECT_REASON_UNAUTHENTICATED:
                return RejectReason.UNAUTHENTICATED;
            default:
                return RejectReason.MALFORMED;
        }
    }
}
