package com.ryuqq.swarm.testkit.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Test clock that only moves when told to.
 *
 * <p>Thread-safe: the current instant is published through a volatile field so background
 * loops observe {@link #advance(Duration)} immediately.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private volatile Instant instant;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.instant = start;
        this.zone = zone;
    }

    /**
     * Clock starting at 2024-01-01T00:00:00Z.
     *
     * @return new clock
     */
    public static MutableClock startingAtEpochOfTests() {
        return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public synchronized void advance(Duration duration) {
        this.instant = instant.plus(duration);
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void setInstant(Instant instant) {
        this.instant = instant;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
