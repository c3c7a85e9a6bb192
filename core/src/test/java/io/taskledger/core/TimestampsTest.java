package io.taskledger.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    @Test
    void format_is_fixed_width_and_lossless() {
        Instant whole = Instant.parse("2026-10-19T08:15:30Z");
        Instant nanos = Instant.parse("2026-10-19T08:15:30.000000001Z");

        assertEquals("2026-10-19T08:15:30.000000000Z", Timestamps.format(whole));
        assertEquals("2026-10-19T08:15:30.000000001Z", Timestamps.format(nanos));
        assertEquals(nanos, Timestamps.parse(Timestamps.format(nanos)));
    }

    @Test
    void text_order_matches_time_order() {
        String earlier = Timestamps.format(Instant.parse("2026-10-19T08:15:30Z"));
        String later = Timestamps.format(Instant.parse("2026-10-19T08:15:30.5Z"));
        assertTrue(earlier.compareTo(later) < 0);
    }
}
