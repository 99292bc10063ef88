package com.ephemera.store.core;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out write cursors: wall-clock milliseconds, bumped by one when two writes land in
 * the same millisecond so recency order and cursors stay strictly increasing per process.
 */
public final class WriteCursorSource {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public WriteCursorSource(Clock clock) {
        this.clock = clock;
    }

    public long next() {
        final long now = clock.millis();
        return last.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
