package org.caureq.homesentry.scheduler;

import org.caureq.homesentry.config.HomeSentryProps.SchedulerProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Loop timing derived from configuration. Slow cadences are expressed as a tick count:
 * {@code max(1, interval / pollInterval)}.
 */
public record SchedulerSettings(Duration pollInterval, Duration smartInterval, Duration raidInterval,
                                Duration collectorTimeout) {
    private static final Logger log = LoggerFactory.getLogger(SchedulerSettings.class);
    static final int MIN_POLL_SECONDS = 10;
    static final int MIN_SLOW_POLL_SECONDS = 60;

    public static SchedulerSettings from(SchedulerProps p) {
        int poll = clamp("poll-interval-seconds", p.pollIntervalSeconds(), 60, MIN_POLL_SECONDS);
        int smart = clamp("smart-poll-interval-seconds", p.smartPollIntervalSeconds(), 600, MIN_SLOW_POLL_SECONDS);
        int raid = clamp("raid-poll-interval-seconds", p.raidPollIntervalSeconds(), 120, MIN_SLOW_POLL_SECONDS);
        int timeout = p.collectorTimeoutSeconds() == null || p.collectorTimeoutSeconds() <= 0
                ? 60 : p.collectorTimeoutSeconds();
        return new SchedulerSettings(Duration.ofSeconds(poll), Duration.ofSeconds(smart),
                Duration.ofSeconds(raid), Duration.ofSeconds(timeout));
    }

    public int smartEvery() {
        return (int) Math.max(1, smartInterval.toSeconds() / pollInterval.toSeconds());
    }

    public int raidEvery() {
        return (int) Math.max(1, raidInterval.toSeconds() / pollInterval.toSeconds());
    }

    private static int clamp(String key, Integer value, int def, int min) {
        int v = value == null ? def : value;
        if (v < min) {
            log.warn("[Scheduler] {}={} below minimum, using {}", key, v, min);
            return min;
        }
        return v;
    }
}
