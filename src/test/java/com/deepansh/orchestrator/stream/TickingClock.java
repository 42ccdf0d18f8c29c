package com.deepansh.orchestrator.stream;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Advances by a fixed step every time it is read.
 */
class TickingClock extends Clock {

    private final long stepMs;
    private long now;

    TickingClock(long startMs, long stepMs) {
        this.now = startMs;
        this.stepMs = stepMs;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        now += stepMs;
        return Instant.ofEpochMilli(now);
    }
}
