package org.caureq.homesentry.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One reading from a collector. Details vary by category, e.g. {@code url, http_code,
 * response_ms, error} for services or {@code free_gb, total_gb, percent_used} for disks.
 */
public record Observation(Category category, String name, Status status, Map<String, Object> details) {

    public Observation {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        // LinkedHashMap tolerates null values coming from JSON
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Observation of(Category category, String name, Status status) {
        return new Observation(category, name, status, Map.of());
    }

    public String eventKey() {
        return eventKey(category, name);
    }

    /** {@code category_name}, lowercased, spaces replaced by underscores. */
    public static String eventKey(Category category, String name) {
        return category.key() + "_" + name.replace(" ", "_").toLowerCase(Locale.ROOT);
    }
}
