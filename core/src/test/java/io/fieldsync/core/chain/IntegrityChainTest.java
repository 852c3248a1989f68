package io.fieldsync.core.chain;

import io.fieldsync.core.Hashing;
import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.RecordIds;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.UnchainedRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityChainTest {

    private final RecordIds ids = new RecordIds();
    private final NodeKeys keys = NodeKeys.generate();

    private UnchainedRecord record(String text) {
        return UnchainedRecord.create(ids, Priority.P2, MessageType.HEALTH,
                text.getBytes(StandardCharsets.UTF_8), System.currentTimeMillis());
    }

    @Test
    void first_record_starts_at_one_with_zero_prev_hash() {
        var chain = new IntegrityChain(new InMemoryChainStateStore(), keys);

        SyncRecord first = chain.chainAppend(record("a"));

        assertEquals(1L, first.sequence());
        assertTrue(Hashing.isZero(first.prevHash()));
        assertEquals(64, first.signature().length);
        assertEquals(new ChainState(1L, first.hash()), chain.head());
    }

    @Test
    void consecutive_records_link_and_verify() {
        var chain = new IntegrityChain(new InMemoryChainStateStore(), keys);
        List<SyncRecord> out = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            out.add(chain.chainAppend(record("r" + i)));
        }

        for (int i = 1; i < out.size(); i++) {
            assertEquals(out.get(i - 1).sequence() + 1, out.get(i).sequence());
            assertTrue(out.get(i).linksTo(out.get(i - 1)));
        }
        assertDoesNotThrow(() -> new ChainVerifier(keys.publicKey()).verifyChain(out, ChainState.genesis()));
    }

    @Test
    void restart_resumes_from_persisted_head() {
        var store = new InMemoryChainStateStore();
        var before = new IntegrityChain(store, keys);
        before.chainAppend(record("a"));
        SyncRecord second = before.chainAppend(record("b"));

        // New builder over the same store, as after a process restart.
        var after = new IntegrityChain(store, keys);
        SyncRecord third = after.chainAppend(record("c"));

        assertEquals(3L, third.sequence());
        assertTrue(third.linksTo(second));
    }

    @Test
    void failed_commit_does_not_advance_head_or_burn_a_sequence() {
        var store = new InMemoryChainStateStore();
        var chain = new IntegrityChain(store, keys);
        SyncRecord first = chain.chainAppend(record("a"));

        store.failNextCommit = true;
        assertThrows(IllegalStateException.class, () -> chain.chainAppend(record("b")));
        assertEquals(1L, chain.head().lastSequence());

        SyncRecord retried = chain.chainAppend(record("b-again"));
        assertEquals(2L, retried.sequence());
        assertTrue(retried.linksTo(first));
    }

    @Test
    void concurrent_producers_still_get_a_gapless_chain() throws Exception {
        var store = new InMemoryChainStateStore();
        var chain = new IntegrityChain(store, keys);
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        for (int t = 0; t < threads; t++) {
            int tid = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    chain.chainAppend(record("t" + tid + "-" + i));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        List<SyncRecord> all = new ArrayList<>(store.committed);
        all.sort(Comparator.comparingLong(SyncRecord::sequence));
        assertEquals(threads * perThread, all.size());
        assertEquals(threads * perThread, all.get(all.size() - 1).sequence());
        assertDoesNotThrow(() -> new ChainVerifier(keys.publicKey()).verifyChain(all, ChainState.genesis()));
    }
}
