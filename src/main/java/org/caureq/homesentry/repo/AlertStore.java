package org.caureq.homesentry.repo;

import org.caureq.homesentry.domain.EventRecord;
import org.caureq.homesentry.domain.Observation;
import org.caureq.homesentry.domain.ObservationSample;
import org.caureq.homesentry.domain.QueuedEvent;
import org.caureq.homesentry.domain.Status;

import java.util.List;
import java.util.Optional;

/**
 * Persistence seen by the alert engine. The event log is append-only: a key's state is
 * its most recent row, rows are never updated except for the notified flag.
 * Write operations report storage failures as {@code false} instead of throwing.
 */
public interface AlertStore {

    Optional<EventRecord> latestEvent(String eventKey);

    boolean insertEvent(String eventKey, Status prevStatus, Status newStatus, String message,
                        boolean maintenanceSuppressed, boolean sleepSuppressed);

    /** Flags the latest row for the key as delivered, stamped with the current time. */
    boolean markNotified(String eventKey);

    boolean enqueueSleepEvent(QueuedEvent event);

    /** Returns every queued entry, oldest first, and empties the queue in the same unit of work. */
    List<QueuedEvent> drainSleepEvents();

    /** Removes observation samples and stale sleep-queue rows; event history is kept. */
    long deleteRecordsOlderThan(int days);

    boolean recordSample(Observation observation);

    List<EventRecord> recentEvents(int limit);

    List<ObservationSample> latestSamples(int limit);
}
