package org.caureq.homesentry.domain;

import java.util.Locale;

public enum Category {
    SERVICE, SYSTEM, DISK, DOCKER, SMART, RAID, APP;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Drive and array health: never silenced by maintenance windows. */
    public boolean isCriticalInfrastructure() {
        return this == SMART || this == RAID;
    }

    public static Category parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("category is required");
        try {
            return Category.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown category: " + raw);
        }
    }
}
