package io.fieldsync.core.queue;

import io.fieldsync.core.Priority;
import io.fieldsync.core.SyncRecord;
import io.fieldsync.core.TestRecords;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PriorityQueueManagerTest {

    private final TestRecords records = new TestRecords();

    /** Strict-priority drain, the way the sync loop does it. */
    private static List<SyncRecord> drain(PriorityQueueManager q) {
        List<SyncRecord> out = new ArrayList<>();
        for (Priority p : Priority.values()) {
            Optional<SyncRecord> head;
            while ((head = q.peek(p)).isPresent()) {
                out.add(head.get());
                q.remove(head.get().id());
            }
        }
        return out;
    }

    @Test
    void drains_highest_priority_first_then_by_sequence() {
        var q = new PriorityQueueManager();
        int[] levels = {5, 0, 3, 0, 1};
        for (int level : levels) {
            q.enqueue(records.next(Priority.fromLevel(level), "p" + level));
        }

        List<SyncRecord> out = drain(q);

        assertEquals(List.of(Priority.P0, Priority.P0, Priority.P1, Priority.P3, Priority.P5),
                out.stream().map(SyncRecord::priority).toList());
        assertTrue(out.get(0).sequence() < out.get(1).sequence());
        assertEquals(0, q.totalLen());
    }

    @Test
    void within_a_class_order_follows_sequence_not_arrival() {
        var q = new PriorityQueueManager();
        SyncRecord a = records.next(Priority.P2, "a");
        SyncRecord b = records.next(Priority.P2, "b");
        q.enqueue(b);
        q.enqueue(a);

        assertEquals(a, q.peek(Priority.P2).orElseThrow());
    }

    @Test
    void duplicate_enqueue_is_ignored() {
        var q = new PriorityQueueManager();
        SyncRecord r = records.next(Priority.P1, "x");
        q.enqueue(r);
        q.enqueue(r);

        assertEquals(1, q.len(Priority.P1));
        assertEquals(1, q.totalLen());
    }

    @Test
    void remove_of_unknown_id_is_a_no_op() {
        var q = new PriorityQueueManager();
        q.enqueue(records.next(Priority.P4, "t"));

        assertFalse(q.remove(UUID.randomUUID()));
        assertEquals(1, q.totalLen());
    }

    @Test
    void peek_of_empty_class_is_empty() {
        var q = new PriorityQueueManager();
        q.enqueue(records.next(Priority.P3, "t"));

        assertTrue(q.peek(Priority.P0).isEmpty());
        assertEquals(1, q.depths().get(Priority.P3));
        assertEquals(0, q.depths().get(Priority.P5));
    }

    @Test
    void concurrent_enqueue_loses_nothing() throws Exception {
        var q = new PriorityQueueManager();
        List<SyncRecord> all = new ArrayList<>();
        for (int i = 0; i < 600; i++) {
            all.add(records.next(Priority.fromLevel(i % 6), "r" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 6; t++) {
            List<SyncRecord> slice = all.subList(t * 100, (t + 1) * 100);
            pool.submit(() -> {
                start.await();
                slice.forEach(q::enqueue);
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(600, q.totalLen());
        for (Priority p : Priority.values()) {
            assertEquals(100, q.len(p));
        }
        List<SyncRecord> drained = drain(q);
        for (int i = 1; i < drained.size(); i++) {
            SyncRecord prev = drained.get(i - 1);
            SyncRecord cur = drained.get(i);
            if (prev.priority() == cur.priority()) {
                assertTrue(prev.sequence() < cur.sequence());
            }
        }
    }
}
