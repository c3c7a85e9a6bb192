package io.taskledger.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that advances by a fixed step every time it is read.
 */
public final class SteppingClock extends Clock {
    private Instant next;
    private final Duration step;

    public SteppingClock(Instant start, Duration step) {
        this.next = start;
        this.step = step;
    }

    @Override public ZoneId getZone() { return ZoneOffset.UTC; }

    @Override public Clock withZone(ZoneId zone) { return this; }

    @Override
    public synchronized Instant instant() {
        Instant now = next;
        next = next.plus(step);
        return now;
    }
}
