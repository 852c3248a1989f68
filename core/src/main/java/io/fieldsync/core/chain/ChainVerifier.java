package io.fieldsync.core.chain;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.PayloadCodec;
import io.fieldsync.core.SyncRecord;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static io.fieldsync.core.chain.ChainIntegrityViolation.Reason.*;

/**
 * Recomputes and checks everything a chained record claims about itself.
 * <p>
 * Three levels:
 *  - {@link #verifyRecord}: one record in isolation (hash, digest, signature).
 *    Used before every send and by the gateway on receipt.
 *  - {@link #verifyChain}: an ordered, contiguous run of records; adds sequence
 *    and prev_hash link checks.
 *  - {@link #verifyRetained}: the records a node still holds. Acked records have
 *    been deleted, so links are only checked between neighbours that are both
 *    present.
 * <p>
 * Every failure throws {@link ChainIntegrityViolation}.
 */
public final class ChainVerifier {

    private final PublicKey nodeKey;

    public ChainVerifier(PublicKey nodeKey) {
        this.nodeKey = Objects.requireNonNull(nodeKey, "nodeKey");
    }

    public void verifyRecord(SyncRecord r) {
        byte[] expected = ChainHasher.hash(r.prevHash(), r.sequence(), r.id(), r.digest(), r.timestampMillis());
        if (!Arrays.equals(expected, r.hash())) {
            throw new ChainIntegrityViolation(HASH_MISMATCH, r.sequence(),
                    "stored hash does not match recomputed hash for " + r.id());
        }
        if (r.sequence() == 1 && !Hashing.isZero(r.prevHash())) {
            throw new ChainIntegrityViolation(BROKEN_LINK, r.sequence(), "first record must have a zero prev_hash");
        }

        byte[] raw;
        try {
            raw = r.rawPayload();
        } catch (IllegalArgumentException e) {
            throw new ChainIntegrityViolation(DIGEST_MISMATCH, r.sequence(),
                    "payload of " + r.id() + " does not decompress: " + e.getMessage());
        }
        if (!Arrays.equals(PayloadCodec.digest(raw), r.digest())) {
            throw new ChainIntegrityViolation(DIGEST_MISMATCH, r.sequence(),
                    "payload digest mismatch for " + r.id());
        }

        if (!NodeKeys.verify(nodeKey, r.hash(), r.signature())) {
            throw new ChainIntegrityViolation(BAD_SIGNATURE, r.sequence(),
                    "signature does not verify for " + r.id());
        }
    }

    /**
     * Verify a contiguous run.
     *
     * @param ordered records in sequence order
     * @param anchor  head the first record must extend, or null to accept whatever
     *                the first record links to
     */
    public void verifyChain(List<SyncRecord> ordered, ChainState anchor) {
        SyncRecord prev = null;
        for (SyncRecord r : ordered) {
            verifyRecord(r);
            if (prev == null) {
                if (anchor != null) {
                    checkExtends(anchor, r);
                }
            } else {
                checkLink(prev, r);
            }
            prev = r;
        }
    }

    /**
     * Verify the records a node still holds, in any order.
     *
     * @return number of records verified
     */
    public int verifyRetained(Collection<SyncRecord> records) {
        List<SyncRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingLong(SyncRecord::sequence));

        SyncRecord prev = null;
        for (SyncRecord r : sorted) {
            verifyRecord(r);
            if (prev != null) {
                if (prev.sequence() == r.sequence()) {
                    throw new ChainIntegrityViolation(SEQUENCE_GAP, r.sequence(),
                            "sequence reused by " + prev.id() + " and " + r.id());
                }
                if (prev.sequence() + 1 == r.sequence()) {
                    checkLink(prev, r);
                }
            }
            prev = r;
        }
        return sorted.size();
    }

    private static void checkExtends(ChainState anchor, SyncRecord r) {
        if (r.sequence() != anchor.nextSequence()) {
            throw new ChainIntegrityViolation(SEQUENCE_GAP, r.sequence(),
                    "expected sequence " + anchor.nextSequence());
        }
        if (!Arrays.equals(anchor.lastHash(), r.prevHash())) {
            throw new ChainIntegrityViolation(BROKEN_LINK, r.sequence(), "prev_hash does not match anchor");
        }
    }

    private static void checkLink(SyncRecord prev, SyncRecord r) {
        if (r.sequence() != prev.sequence() + 1) {
            throw new ChainIntegrityViolation(SEQUENCE_GAP, r.sequence(),
                    "expected sequence " + (prev.sequence() + 1));
        }
        if (!r.linksTo(prev)) {
            throw new ChainIntegrityViolation(BROKEN_LINK, r.sequence(),
                    "prev_hash does not match hash of sequence " + prev.sequence());
        }
    }
}
