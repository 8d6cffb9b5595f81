package com.questrail.chatwire.time;

import com.questrail.chatwire.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Settable wall clock for tests. Starts at a fixed instant.
 */
public final class ManualWallClock implements WallClock {

    private volatile Instant now;

    public ManualWallClock(Instant start) {
        this.now = Objects.requireNonNull(start, "start");
    }

    public ManualWallClock() {
        this(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Override
    public Instant now() {
        return now;
    }

    public void set(Instant instant) {
        this.now = Objects.requireNonNull(instant, "instant");
    }

    public void advance(Duration duration) {
        this.now = now.plus(duration);
    }
}
