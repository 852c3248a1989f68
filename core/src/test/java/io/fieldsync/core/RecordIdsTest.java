package io.fieldsync.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RecordIdsTest {

    @Test
    void ids_are_version_7_and_carry_the_clock_time() {
        Clock fixed = Clock.fixed(Instant.ofEpochMilli(1_700_000_123_456L), ZoneOffset.UTC);
        UUID id = new RecordIds(fixed).next();

        assertEquals(7, id.version());
        assertEquals(2, id.variant());
        assertEquals(1_700_000_123_456L, RecordIds.timestampOf(id));
    }

    @Test
    void ids_from_one_generator_strictly_increase_even_within_a_millisecond() {
        Clock fixed = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        var ids = new RecordIds(fixed);

        UUID prev = ids.next();
        for (int i = 0; i < 10_000; i++) {
            UUID cur = ids.next();
            assertTrue(Long.compareUnsigned(prev.getMostSignificantBits(), cur.getMostSignificantBits()) < 0,
                    "ids must sort in creation order");
            prev = cur;
        }
    }

    @Test
    void timestamp_of_rejects_other_versions() {
        assertThrows(IllegalArgumentException.class, () -> RecordIds.timestampOf(UUID.randomUUID()));
    }
}
