package org.caureq.homesentry.domain;

import java.util.Locale;

/** Health status reported by a collector. Declaration order is severity order. */
public enum Status {
    OK, WARN, FAIL;

    public boolean isBad() {
        return this != OK;
    }

    public boolean isWorseThan(Status other) {
        return other == null || this.ordinal() > other.ordinal();
    }

    public static Status parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("status is required");
        try {
            return Status.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + raw + " (expected OK, WARN or FAIL)");
        }
    }
}
