// file: node/src/main/java/io/fieldsync/node/downlink/DownlinkDispatcher.java
package io.fieldsync.node.downlink;

import io.fieldsync.core.MessageType;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.ChainIntegrityViolation;
import io.fieldsync.core.chain.ChainVerifier;
import io.fieldsync.core.wire.WireCodec;
import io.fieldsync.core.wire.WireFormatException;
import io.fieldsync.node.alert.AlertKind;
import io.fieldsync.node.alert.OperationalAlerts;

import java.nio.ByteBuffer;
import java.security.PublicKey;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates gateway-to-node records and routes them by type.
 * <p>
 * Responsibilities:
 *  - Decode the wire encoding; malformed records are dropped.
 *  - Verify the gateway's signature when a gateway key is configured.
 *  - Check the declared priority against the type's table priority.
 *  - Feed TIME_SYNC into the clock-drift monitor, then call registered handlers.
 */
public final class DownlinkDispatcher {
    private static final Logger log = Logger.getLogger(DownlinkDispatcher.class.getName());

    private final ChainVerifier gatewayVerifier; // null = signatures not checked
    private final ClockDriftMonitor drift;
    private final OperationalAlerts alerts;
    private final Map<MessageType, List<DownlinkHandler>> handlers = new ConcurrentHashMap<>();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public DownlinkDispatcher(PublicKey gatewayKey, ClockDriftMonitor drift, OperationalAlerts alerts) {
        this.gatewayVerifier = gatewayKey == null ? null : new ChainVerifier(gatewayKey);
        this.drift = drift;
        this.alerts = alerts;
        if (gatewayKey == null) {
            log.warning("no gateway public key configured; downlink signatures are not verified");
        }
    }

    public void register(MessageType type, DownlinkHandler handler) {
        if (!type.isDownlink()) {
            throw new IllegalArgumentException(type + " is not a downlink type");
        }
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    /** @return number of records accepted and dispatched */
    public int dispatch(List<byte[]> encoded) {
        int ok = 0;
        for (byte[] bytes : encoded) {
            if (dispatchOne(bytes)) ok++;
        }
        return ok;
    }

    public long delivered() {
        return delivered.get();
    }

    public long dropped() {
        return dropped.get();
    }

    private boolean dispatchOne(byte[] bytes) {
        SyncRecord r;
        try {
            r = WireCodec.decode(bytes);
        } catch (WireFormatException e) {
            return drop("malformed downlink record: " + e.getMessage());
        }
        if (gatewayVerifier != null) {
            try {
                gatewayVerifier.verifyRecord(r);
            } catch (ChainIntegrityViolation v) {
                alerts.raise(AlertKind.CHAIN_INTEGRITY, "downlink record " + r.id() + " failed verification: "
                        + v.getMessage());
                return drop("unverified downlink record " + r.id());
            }
        }
        MessageType type = r.msgType();
        if (!type.isDownlink()) {
            return drop("uplink type " + type + " received on downlink");
        }
        if (r.priority() != type.downlinkPriority()) {
            return drop(type + " declared " + r.priority() + ", expected " + type.downlinkPriority());
        }

        if (type == MessageType.TIME_SYNC) {
            byte[] raw;
            try {
                raw = r.rawPayload();
            } catch (IllegalArgumentException e) {
                return drop("TIME_SYNC payload unreadable: " + e.getMessage());
            }
            if (raw.length != Long.BYTES) {
                return drop("TIME_SYNC payload must be 8 bytes, got " + raw.length);
            }
            drift.observe(ByteBuffer.wrap(raw).getLong());
        }

        List<DownlinkHandler> hs = handlers.getOrDefault(type, List.of());
        if (hs.isEmpty() && type != MessageType.TIME_SYNC) {
            log.log(Level.INFO, "downlink {0} {1} received, no handler registered", new Object[]{type, r.id()});
        }
        for (DownlinkHandler h : hs) {
            try {
                h.handle(r);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "downlink handler for " + type + " failed on " + r.id(), e);
            }
        }
        delivered.incrementAndGet();
        return true;
    }

    private boolean drop(String why) {
        dropped.incrementAndGet();
        log.warning(why);
        return false;
    }
}
