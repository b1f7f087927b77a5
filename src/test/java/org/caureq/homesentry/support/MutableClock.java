package org.caureq.homesentry.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Test clock in UTC that only moves when told to. */
public class MutableClock extends Clock {
    private volatile Instant now;

    public MutableClock(Instant start) {
        this.now = start;
    }

    public static MutableClock at(String isoLocalDateTime) {
        return new MutableClock(LocalDateTime.parse(isoLocalDateTime).toInstant(ZoneOffset.UTC));
    }

    public void advance(Duration d) {
        now = now.plus(d);
    }

    public void set(String isoLocalDateTime) {
        now = LocalDateTime.parse(isoLocalDateTime).toInstant(ZoneOffset.UTC);
    }

    public LocalDateTime localNow() {
        return LocalDateTime.ofInstant(now, ZoneOffset.UTC);
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
        return now;
    }
}
