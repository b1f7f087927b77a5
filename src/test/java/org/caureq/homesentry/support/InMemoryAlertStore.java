package org.caureq.homesentry.support;

import org.caureq.homesentry.domain.EventRecord;
import org.caureq.homesentry.domain.Observation;
import org.caureq.homesentry.domain.ObservationSample;
import org.caureq.homesentry.domain.QueuedEvent;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.repo.AlertStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class InMemoryAlertStore implements AlertStore {
    public final List<EventRecord> events = new ArrayList<>();
    public final List<QueuedEvent> queue = new ArrayList<>();
    public final List<Observation> samples = new ArrayList<>();
    public int cleanupCalls;
    private final Clock clock;
    private long nextId = 1;

    public InMemoryAlertStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<EventRecord> latestEvent(String eventKey) {
        return events.stream()
                .filter(e -> e.getEventKey().equals(eventKey))
                .max(Comparator.comparing(EventRecord::getId));
    }

    @Override
    public synchronized boolean insertEvent(String eventKey, Status prevStatus, Status newStatus, String message,
                                            boolean maintenanceSuppressed, boolean sleepSuppressed) {
        events.add(EventRecord.builder()
                .id(nextId++)
                .eventKey(eventKey)
                .prevStatus(prevStatus)
                .newStatus(newStatus)
                .message(message)
                .maintenanceSuppressed(maintenanceSuppressed)
                .sleepSuppressed(sleepSuppressed)
                .createdAt(clock.instant())
                .build());
        return true;
    }

    @Override
    public synchronized boolean markNotified(String eventKey) {
        return latestEvent(eventKey).map(e -> {
            e.setNotified(true);
            e.setNotifiedAt(clock.instant());
            return true;
        }).orElse(false);
    }

    @Override
    public synchronized boolean enqueueSleepEvent(QueuedEvent event) {
        queue.add(event);
        return true;
    }

    @Override
    public synchronized List<QueuedEvent> drainSleepEvents() {
        var out = new ArrayList<>(queue);
        queue.clear();
        return out;
    }

    @Override
    public synchronized long deleteRecordsOlderThan(int days) {
        cleanupCalls++;
        return 0;
    }

    @Override
    public synchronized boolean recordSample(Observation observation) {
        samples.add(observation);
        return true;
    }

    @Override
    public synchronized List<EventRecord> recentEvents(int limit) {
        var copy = new ArrayList<>(events);
        copy.sort(Comparator.comparing(EventRecord::getId).reversed());
        return copy.subList(0, Math.min(limit, copy.size()));
    }

    @Override
    public List<ObservationSample> latestSamples(int limit) {
        return List.of();
    }

    public synchronized List<EventRecord> eventsFor(String key) {
        return events.stream().filter(e -> e.getEventKey().equals(key)).toList();
    }
}
