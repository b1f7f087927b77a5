package org.caureq.homesentry.domain;

import java.time.Instant;
import java.util.Map;

/** Sleep-queue entry as seen by the engine and the digest, independent of storage. */
public record QueuedEvent(String eventKey, Category category, String name, Status prevStatus,
                          Status newStatus, String message, Map<String, Object> details,
                          Instant queuedAt) {

    public QueuedEvent {
        details = details == null ? Map.of() : details;
    }
}
