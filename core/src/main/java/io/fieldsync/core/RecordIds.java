package io.fieldsync.core;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;

/**
 * Time-ordered record id generator (UUID version 7).
 * <p>
 * Layout (RFC 9562):
 *  - 48 bits  unix epoch millis
 *  - 4 bits   version (0111)
 *  - 12 bits  rand_a, used here as a per-millisecond counter so ids minted in the
 *             same millisecond still sort in creation order
 *  - 2 bits   variant (10)
 *  - 62 bits  rand_b
 * <p>
 * If the clock steps backwards the generator keeps issuing ids from the last seen
 * millisecond, so ids from one generator are strictly increasing.
 */
public final class RecordIds {

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    // guarded by this
    private long lastMillis = -1L;
    private int counter;

    public RecordIds(Clock clock) {
        this.clock = clock;
    }

    public RecordIds() {
        this(Clock.systemUTC());
    }

    public synchronized UUID next() {
        long now = clock.millis();
        if (now > lastMillis) {
            lastMillis = now;
            counter = random.nextInt(1 << 10); // leave headroom before the 12-bit field wraps
        } else {
            counter++;
            if (counter >= (1 << 12)) {
                lastMillis++;
                counter = 0;
            }
        }

        long msb = (lastMillis & 0xFFFF_FFFF_FFFFL) << 16;
        msb |= 0x7000L;
        msb |= counter & 0x0FFFL;

        long lsb = random.nextLong();
        lsb &= 0x3FFF_FFFF_FFFF_FFFFL;
        lsb |= 0x8000_0000_0000_0000L;
        return new UUID(msb, lsb);
    }

    /** Millisecond timestamp embedded in a version 7 id. */
    public static long timestampOf(UUID id) {
        if (id.version() != 7) throw new IllegalArgumentException("not a UUIDv7: " + id);
        return id.getMostSignificantBits() >>> 16;
    }
}
