package io.fieldsync.gateway;

import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.RecordIds;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import io.fieldsync.core.chain.IntegrityChain;
import io.fieldsync.core.chain.NodeKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.fieldsync.gateway.NodeLedger.Verdict.*;
import static org.junit.jupiter.api.Assertions.*;

class NodeLedgerTest {

    private final NodeKeys nodeKeys = NodeKeys.generate();
    private final RecordIds ids = new RecordIds();
    private List<SyncRecord> chain;
    private NodeLedger ledger;

    @BeforeEach
    void setUp() {
        var builder = new IntegrityChain(new VolatileChainStateStore(), nodeKeys);
        chain = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            chain.add(builder.chainAppend(UnchainedRecord.create(ids, Priority.fromLevel(i % 3), MessageType.DETECTION,
                    ("d" + i).getBytes(StandardCharsets.UTF_8), 1_700_000_000_000L + i)));
        }
        ledger = new NodeLedger("edge-01", nodeKeys.publicKey());
    }

    @Test
    void accepts_records_in_priority_order_rather_than_sequence_order() {
        // sequences 1 and 4 are P0, 2 and 5 P1, 3 and 6 P2
        for (int idx : new int[]{0, 3, 1, 4, 2, 5}) {
            assertEquals(ACCEPTED, ledger.accept(chain.get(idx)), "sequence " + (idx + 1));
        }
        assertEquals(6L, ledger.lastSequence());
    }

    @Test
    void resend_of_held_record_is_duplicate() {
        ledger.accept(chain.get(0));

        assertEquals(DUPLICATE, ledger.accept(chain.get(0)));
        assertEquals(1, ledger.size());
    }

    @Test
    void holes_left_by_expired_records_are_tolerated() {
        assertEquals(ACCEPTED, ledger.accept(chain.get(0)));
        assertEquals(ACCEPTED, ledger.accept(chain.get(4)));
        assertEquals(5L, ledger.lastSequence());
    }

    @Test
    void broken_link_to_held_neighbour_is_sequence_gap() {
        var fork = new IntegrityChain(new VolatileChainStateStore(), nodeKeys);
        // Same key, different history: its sequence 2 does not link to our sequence 1.
        fork.chainAppend(UnchainedRecord.create(ids, Priority.P1, MessageType.GENERIC, new byte[]{1}, 1L));
        SyncRecord foreignSecond = fork.chainAppend(
                UnchainedRecord.create(ids, Priority.P1, MessageType.GENERIC, new byte[]{2}, 2L));

        ledger.accept(chain.get(0));

        assertEquals(SEQUENCE_GAP, ledger.accept(foreignSecond));
    }

    @Test
    void successor_that_does_not_link_back_is_sequence_gap() {
        var fork = new IntegrityChain(new VolatileChainStateStore(), nodeKeys);
        fork.chainAppend(UnchainedRecord.create(ids, Priority.P1, MessageType.GENERIC, new byte[]{9}, 9L));
        SyncRecord forkedSecond = fork.chainAppend(UnchainedRecord.create(ids, Priority.P1, MessageType.GENERIC, new byte[]{8}, 8L));

        ledger.accept(chain.get(2)); // sequence 3 links to the real sequence 2

        assertEquals(SEQUENCE_GAP, ledger.accept(forkedSecond));
    }

    @Test
    void reused_sequence_is_sequence_gap() {
        var fork = new IntegrityChain(new VolatileChainStateStore(), nodeKeys);
        SyncRecord otherFirst = fork.chainAppend(UnchainedRecord.create(ids, Priority.P0, MessageType.EVIDENCE, new byte[]{7}, 7L));

        ledger.accept(chain.get(0));

        assertEquals(SEQUENCE_GAP, ledger.accept(otherFirst));
    }

    @Test
    void record_signed_by_another_key_is_bad_signature() {
        var impostor = new IntegrityChain(new VolatileChainStateStore(), NodeKeys.generate());
        SyncRecord forged = impostor.chainAppend(UnchainedRecord.create(ids, Priority.P0, MessageType.EVIDENCE, new byte[]{1}, 1L));

        assertEquals(BAD_SIGNATURE, ledger.accept(forged));
        assertEquals(0, ledger.size());
    }

    @Test
    void integrity_rejection_blocks_later_records_until_reanchored() {
        var impostor = new IntegrityChain(new VolatileChainStateStore(), NodeKeys.generate());
        SyncRecord forged = impostor.chainAppend(UnchainedRecord.create(ids, Priority.P0, MessageType.EVIDENCE, new byte[]{1}, 1L));
        assertEquals(ACCEPTED, ledger.accept(chain.get(0)));

        assertEquals(BAD_SIGNATURE, ledger.accept(forged));
        assertTrue(ledger.tainted());
        assertEquals(SEQUENCE_GAP, ledger.accept(chain.get(5)));
        assertEquals(1, ledger.size());

        ledger.reanchor();

        assertFalse(ledger.tainted());
        assertEquals(ACCEPTED, ledger.accept(chain.get(5)));
        assertEquals(6L, ledger.lastSequence());
    }
}
