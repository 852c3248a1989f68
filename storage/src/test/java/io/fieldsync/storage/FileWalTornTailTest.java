package io.fieldsync.storage;

import io.fieldsync.core.MessageType;
import io.fieldsync.core.Priority;
import io.fieldsync.core.RecordIds;
import io.fieldsync.core.UnchainedRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path dataDir;

    private final RecordIds ids = new RecordIds();

    private UnchainedRecord record(String text) {
        return UnchainedRecord.create(ids, Priority.P2, MessageType.HEALTH,
                text.getBytes(StandardCharsets.UTF_8), System.currentTimeMillis());
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_entries() throws Exception {
        Path walDir = dataDir.resolve("wal");
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        var r1 = record("one");
        var r2 = record("two");
        wal.append(RecordCodec.pending(r1));
        wal.append(RecordCodec.pending(r2));
        // Third entry only partially written (simulate torn write)
        byte[] r3 = RecordCodec.pending(record("three"));
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5);
        }
        wal.close();

        var store = DurableRecordStore.open(dataDir, DurableRecordStore.DEFAULT_QUOTA_BYTES, Clock.systemUTC());
        assertEquals(List.of(r1, r2), store.pendingUnchained());

        // Writes after recovery must land where the next replay can reach them.
        var r4 = record("four");
        store.append(r4);
        store.close();

        var again = DurableRecordStore.open(dataDir, DurableRecordStore.DEFAULT_QUOTA_BYTES, Clock.systemUTC());
        assertEquals(List.of(r1, r2, r4), again.pendingUnchained());
        again.close();
    }

    private static byte[] frame(byte[] payload) {
        return RecordCodec.frame(payload);
    }

    @Test
    void corrupt_crc_stops_replay() throws Exception {
        Path walDir = dataDir.resolve("wal");
        var wal = new FileWal(walDir, 1L << 60);
        var good = record("good");
        wal.append(RecordCodec.pending(good));
        byte[] bad = RecordCodec.pending(record("bad"));
        bad[bad.length - 1] ^= 0x01;
        wal.append(bad);
        wal.close();

        var reopened = new FileWal(walDir, 1L << 60);
        try (var reader = reopened.openReader(1)) {
            assertArrayEquals(RecordCodec.pending(good), frame(reader.next()));
            assertNull(reader.next());
        }
        reopened.close();
    }
}
