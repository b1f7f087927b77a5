package org.caureq.homesentry.service.alerts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Recurring time-of-day range, both ends inclusive. {@code start > end} means the range
 * crosses midnight ({@code 23:45-00:15}).
 */
public record TimeWindow(LocalTime start, LocalTime end) {
    private static final Logger log = LoggerFactory.getLogger(TimeWindow.class);
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public boolean spansMidnight() {
        return start.isAfter(end);
    }

    public boolean contains(LocalTime t) {
        if (!spansMidnight()) {
            return !t.isBefore(start) && !t.isAfter(end);
        }
        return !t.isBefore(start) || !t.isAfter(end);
    }

    @Override
    public String toString() {
        return start.format(HH_MM) + "-" + end.format(HH_MM);
    }

    /** Parses {@code HH:MM-HH:MM}; malformed input is logged and yields empty. */
    public static Optional<TimeWindow> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String[] parts = raw.trim().split("-");
        if (parts.length != 2) {
            log.warn("Invalid time window (expected HH:MM-HH:MM): {}", raw);
            return Optional.empty();
        }
        var start = parseTime(parts[0]);
        var end = parseTime(parts[1]);
        if (start.isEmpty() || end.isEmpty()) {
            log.warn("Invalid time in window: {}", raw);
            return Optional.empty();
        }
        return Optional.of(new TimeWindow(start.get(), end.get()));
    }

    /** Parses {@code HH:MM} (24h); malformed input is logged and yields empty. */
    public static Optional<LocalTime> parseTime(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String[] hm = raw.trim().split(":");
        if (hm.length != 2) {
            log.warn("Invalid time (expected HH:MM): {}", raw);
            return Optional.empty();
        }
        try {
            int h = Integer.parseInt(hm[0].trim());
            int m = Integer.parseInt(hm[1].trim());
            if (h < 0 || h > 23 || m < 0 || m > 59) {
                log.warn("Time out of range: {}", raw);
                return Optional.empty();
            }
            return Optional.of(LocalTime.of(h, m));
        } catch (NumberFormatException e) {
            log.warn("Failed to parse time '{}': {}", raw, e.getMessage());
            return Optional.empty();
        }
    }
}
