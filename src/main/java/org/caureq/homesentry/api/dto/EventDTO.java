package org.caureq.homesentry.api.dto;

import org.caureq.homesentry.domain.EventRecord;
import org.caureq.homesentry.domain.Status;

import java.time.Instant;

public record EventDTO(Long id, String eventKey, Status prevStatus, Status newStatus, String message,
                       boolean notified, Instant notifiedAt, boolean maintenanceSuppressed,
                       boolean sleepSuppressed, Instant createdAt) {

    public static EventDTO of(EventRecord r) {
        return new EventDTO(r.getId(), r.getEventKey(), r.getPrevStatus(), r.getNewStatus(), r.getMessage(),
                r.isNotified(), r.getNotifiedAt(), r.isMaintenanceSuppressed(), r.isSleepSuppressed(),
                r.getCreatedAt());
    }
}
