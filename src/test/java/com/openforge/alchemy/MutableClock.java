package com.openforge.alchemy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Test clock that only moves when told to. */
public class MutableClock extends Clock {

    public static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 12, 0);

    private volatile Instant instant;
    private final ZoneId zone;

    public MutableClock() {
        this(START.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    private MutableClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    public void reset() {
        this.instant = START.toInstant(ZoneOffset.UTC);
    }

    public void advance(Duration d) {
        this.instant = instant.plus(d);
    }

    public LocalDateTime now() {
        return LocalDateTime.ofInstant(instant, zone);
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
