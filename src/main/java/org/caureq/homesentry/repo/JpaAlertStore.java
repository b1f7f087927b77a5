package org.caureq.homesentry.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.domain.*;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@link AlertStore} backed by Spring Data JPA. */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAlertStore implements AlertStore {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final EventRepo events;
    private final SleepEventRepo sleepEvents;
    private final ObservationSampleRepo samples;
    private final Clock clock;
    private final ObjectMapper om = new ObjectMapper();

    @Override
    @Transactional(readOnly = true)
    public Optional<EventRecord> latestEvent(String eventKey) {
        return events.findFirstByEventKeyOrderByIdDesc(eventKey);
    }

    @Override
    @Transactional
    public boolean insertEvent(String eventKey, Status prevStatus, Status newStatus, String message,
                               boolean maintenanceSuppressed, boolean sleepSuppressed) {
        try {
            events.save(EventRecord.builder()
                    .eventKey(eventKey)
                    .prevStatus(prevStatus)
                    .newStatus(newStatus)
                    .message(truncate(message, 512))
                    .notified(false)
                    .maintenanceSuppressed(maintenanceSuppressed)
                    .sleepSuppressed(sleepSuppressed)
                    .createdAt(clock.instant())
                    .build());
            log.debug("[Store] event {} {} -> {}", eventKey, prevStatus, newStatus);
            return true;
        } catch (DataAccessException e) {
            log.error("[Store] failed to insert event {}: {}", eventKey, e.getMessage(), e);
            return false;
        }
    }

    @Override
    @Transactional
    public boolean markNotified(String eventKey) {
        try {
            return events.findFirstByEventKeyOrderByIdDesc(eventKey).map(r -> {
                r.setNotified(true);
                r.setNotifiedAt(clock.instant());
                events.save(r);
                return true;
            }).orElse(false);
        } catch (DataAccessException e) {
            log.error("[Store] failed to mark {} notified: {}", eventKey, e.getMessage(), e);
            return false;
        }
    }

    @Override
    @Transactional
    public boolean enqueueSleepEvent(QueuedEvent event) {
        try {
            sleepEvents.save(SleepEvent.builder()
                    .eventKey(event.eventKey())
                    .category(event.category())
                    .name(event.name())
                    .prevStatus(event.prevStatus())
                    .newStatus(event.newStatus())
                    .message(truncate(event.message(), 512))
                    .details(toJson(event.details()))
                    .createdAt(event.queuedAt() != null ? event.queuedAt() : clock.instant())
                    .build());
            return true;
        } catch (DataAccessException e) {
            log.error("[Store] failed to queue sleep event {}: {}", event.eventKey(), e.getMessage(), e);
            return false;
        }
    }

    @Override
    @Transactional
    public List<QueuedEvent> drainSleepEvents() {
        var rows = sleepEvents.findAllByOrderByCreatedAtAscIdAsc();
        sleepEvents.deleteAllInBatch(rows);
        return rows.stream()
                .map(s -> new QueuedEvent(s.getEventKey(), s.getCategory(), s.getName(),
                        s.getPrevStatus(), s.getNewStatus(), s.getMessage(),
                        fromJson(s.getDetails()), s.getCreatedAt()))
                .toList();
    }

    @Override
    @Transactional
    public long deleteRecordsOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        long n = samples.deleteOlderThan(cutoff);
        n += sleepEvents.deleteOlderThan(cutoff);
        return n;
    }

    @Override
    @Transactional
    public boolean recordSample(Observation o) {
        try {
            samples.save(ObservationSample.builder()
                    .category(o.category())
                    .name(o.name())
                    .status(o.status())
                    .details(toJson(o.details()))
                    .ts(clock.instant())
                    .build());
            return true;
        } catch (DataAccessException e) {
            log.warn("[Store] failed to record sample {}: {}", o.eventKey(), e.getMessage());
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<EventRecord> recentEvents(int limit) {
        return events.findAll(PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "id"))).getContent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ObservationSample> latestSamples(int limit) {
        return samples.findAll(PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "id"))).getContent();
    }

    private String toJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) return null;
        try { return om.writeValueAsString(details); }
        catch (JsonProcessingException e) {
            log.warn("[Store] details not serializable, dropped: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try { return om.readValue(json, MAP_TYPE); }
        catch (JsonProcessingException e) {
            log.debug("[Store] unreadable details json: {}", e.getMessage());
            return Map.of("raw", json);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
