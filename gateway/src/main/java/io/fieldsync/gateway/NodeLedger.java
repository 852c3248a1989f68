// file: gateway/src/main/java/io/fieldsync/gateway/NodeLedger.java
package io.fieldsync.gateway;

import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.chain.ChainIntegrityViolation;
import io.fieldsync.core.chain.ChainVerifier;

import java.security.PublicKey;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Everything the gateway holds for one node, plus the acceptance rules.
 * <p>
 * Records arrive in priority order, not sequence order, so contiguity is checked
 * against the neighbours already held:
 *  - a held sequence-1 must be the record's prev_hash,
 *  - a held sequence+1 must link to the record,
 *  - missing neighbours are tolerated (not yet sent, or expired on the node).
 * <p>
 * Order of checks: record self-verification, then duplicate id, then
 * sequence ownership and links.
 * <p>
 * The first BAD_SIGNATURE or SEQUENCE_GAP taints the ledger. A tainted ledger
 * rejects every record until {@link #reanchor()} is called after the node
 * authenticates again and is told where the gateway's copy ends.
 */
public final class NodeLedger {
    private static final Logger log = Logger.getLogger(NodeLedger.class.getName());

    public enum Verdict {
        ACCEPTED,
        DUPLICATE,
        BAD_SIGNATURE,
        SEQUENCE_GAP
    }

    private final String nodeId;
    private final ChainVerifier verifier;

    // guarded by this
    private final TreeMap<Long, SyncRecord> bySequence = new TreeMap<>();
    private final Map<UUID, Long> sequenceById = new HashMap<>();
    private long taintedAt; // sequence of the first integrity rejection, 0 when clean

    public NodeLedger(String nodeId, PublicKey nodeKey) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.verifier = new ChainVerifier(nodeKey);
    }

    public synchronized Verdict accept(SyncRecord r) {
        if (taintedAt > 0) {
            log.log(Level.WARNING, "node {0}: rejecting {1}, ledger tainted at sequence {2}",
                    new Object[]{nodeId, r.id(), taintedAt});
            return Verdict.SEQUENCE_GAP;
        }
        Verdict v = check(r);
        if (v == Verdict.BAD_SIGNATURE || v == Verdict.SEQUENCE_GAP) {
            taintedAt = Math.max(1L, r.sequence());
        }
        return v;
    }

    /** Clear the taint; the node has proven its key again and learned our last sequence. */
    public synchronized void reanchor() {
        if (taintedAt > 0) {
            log.log(Level.INFO, "node {0}: re-anchored after rejection at sequence {1}",
                    new Object[]{nodeId, taintedAt});
            taintedAt = 0;
        }
    }

    public synchronized boolean tainted() {
        return taintedAt > 0;
    }

    private Verdict check(SyncRecord r) {
        try {
            verifier.verifyRecord(r);
        } catch (ChainIntegrityViolation v) {
            log.log(Level.WARNING, "node {0}: rejecting {1}: {2}", new Object[]{nodeId, r.id(), v.getMessage()});
            return v.reason() == ChainIntegrityViolation.Reason.BROKEN_LINK ? Verdict.SEQUENCE_GAP : Verdict.BAD_SIGNATURE;
        }

        Long heldSeq = sequenceById.get(r.id());
        if (heldSeq != null) {
            return heldSeq == r.sequence() ? Verdict.DUPLICATE : Verdict.SEQUENCE_GAP;
        }

        SyncRecord sameSeq = bySequence.get(r.sequence());
        if (sameSeq != null) {
            log.log(Level.WARNING, "node {0}: sequence {1} already held by {2}, got {3}",
                    new Object[]{nodeId, r.sequence(), sameSeq.id(), r.id()});
            return Verdict.SEQUENCE_GAP;
        }
        SyncRecord prev = bySequence.get(r.sequence() - 1);
        if (prev != null && !r.linksTo(prev)) {
            log.log(Level.WARNING, "node {0}: sequence {1} does not link to held predecessor",
                    new Object[]{nodeId, r.sequence()});
            return Verdict.SEQUENCE_GAP;
        }
        SyncRecord next = bySequence.get(r.sequence() + 1);
        if (next != null && !Arrays.equals(next.prevHash(), r.hash())) {
            log.log(Level.WARNING, "node {0}: held successor of sequence {1} does not link to it",
                    new Object[]{nodeId, r.sequence()});
            return Verdict.SEQUENCE_GAP;
        }

        bySequence.put(r.sequence(), r);
        sequenceById.put(r.id(), r.sequence());
        return Verdict.ACCEPTED;
    }

    /** Highest sequence held, or 0. */
    public synchronized long lastSequence() {
        return bySequence.isEmpty() ? 0L : bySequence.lastKey();
    }

    public synchronized int size() {
        return bySequence.size();
    }

    public synchronized boolean holds(UUID id) {
        return sequenceById.containsKey(id);
    }
}
