package org.caureq.homesentry.service.alerts;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import org.caureq.homesentry.domain.Status;

import java.time.Instant;

/** A bad status seen for a key that has not yet lasted long enough to alert. */
@Getter @Setter @AllArgsConstructor
public class PendingState {
    private final String eventKey;
    private Status badStatus;
    private final Status prevStatus;
    private final Instant firstSeenTs;
    private int consecutiveChecks;

    PendingState copy() {
        return new PendingState(eventKey, badStatus, prevStatus, firstSeenTs, consecutiveChecks);
    }
}
