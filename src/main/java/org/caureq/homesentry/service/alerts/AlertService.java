package org.caureq.homesentry.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.EventRecord;
import org.caureq.homesentry.domain.Observation;
import org.caureq.homesentry.domain.QueuedEvent;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.repo.AlertStore;
import org.caureq.homesentry.service.notify.AlertDispatcher;
import org.caureq.homesentry.service.notify.AlertFormatter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Decides whether an observation becomes a notification. Only state changes alert;
 * a partial improvement inside the cooldown stays quiet. Suppressed changes are still
 * written to the event log so the next observation compares against them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {
    private final AlertConfigService cfg;
    private final AlertStore store;
    private final GracePeriodTracker grace;
    private final MaintenanceWindowPolicy maintenance;
    private final SleepSchedulePolicy sleep;
    private final AlertFormatter formatter;
    private final AlertDispatcher dispatcher;
    private final Clock clock;

    public boolean process(Observation o) {
        return process(o.category(), o.name(), o.status(), o.details());
    }

    /** @return true only when a notification was delivered */
    public boolean process(Category category, String name, Status status, Map<String, Object> details) {
        if (!cfg.isAlertsEnabled()) return false;
        if (!cfg.hasWebhook()) {
            log.debug("[Alerts] no webhook configured, skipping {} {}", category.key(), name);
            return false;
        }
        String key = Observation.eventKey(category, name);
        try {
            var last = store.latestEvent(key);
            Status prev = last.map(EventRecord::getNewStatus).orElse(null);
            Instant lastNotified = last.map(EventRecord::getNotifiedAt).orElse(null);

            // a repeated bad status has nothing to hold back; the gate below drops it
            boolean graced = cfg.isGracePeriodEnabled() && !(status == prev && status != Status.OK);
            if (graced) {
                var g = grace.evaluate(key, status, prev);
                if (!g.proceed()) {
                    log.debug("[Alerts] {} held by grace period: {}", key, g.reason());
                    return false;
                }
            }

            Instant now = clock.instant();
            if (!shouldAlert(prev, status, lastNotified, cfg.cooldown(), now)) {
                return false;
            }

            String message = name + ": " + (prev != null ? prev : "Unknown") + " → " + status;
            LocalDateTime local = LocalDateTime.now(clock);

            var sleepCheck = sleep.shouldSuppress(category, name, status, local);
            if (sleepCheck.suppressed()) {
                log.info("[Alerts] {} queued for morning digest: {}", key, sleepCheck.reason());
                store.insertEvent(key, prev, status, message, false, true);
                store.enqueueSleepEvent(new QueuedEvent(key, category, name, prev, status, message, details, now));
                return false;
            }

            var maint = maintenance.shouldSuppress(category, name, status, local);
            if (maint.suppressed()) {
                log.info("[Alerts] {} suppressed: {}", key, maint.reason());
                store.insertEvent(key, prev, status, message, true, false);
                return false;
            }

            var msg = formatter.format(category, name, prev, status, details);
            if (!dispatcher.dispatch(cfg.getWebhookUrl(), msg)) {
                log.warn("[Alerts] delivery failed for {} ({} -> {}), will retry on next observation", key, prev, status);
                if (graced && status != Status.OK) grace.retain(key, status, prev);
                return false;
            }
            store.insertEvent(key, prev, status, msg.title(), false, false);
            store.markNotified(key);
            log.info("[Alerts] sent {} ({} -> {})", key, prev, status);
            return true;
        } catch (RuntimeException e) {
            log.error("[Alerts] processing {} failed: {}", key, e.toString(), e);
            return false;
        }
    }

    /**
     * State-change gate. First sighting, recovery to OK and any worsening always pass;
     * a repeat never does; a partial improvement passes only once the cooldown has elapsed.
     */
    public static boolean shouldAlert(Status prev, Status current, Instant lastNotified, Duration cooldown, Instant now) {
        if (prev == null) return true;
        if (prev == current) return false;
        if (current == Status.OK) return true;
        if (current.isWorseThan(prev)) return true;
        if (lastNotified == null) return true;
        return !Duration.between(lastNotified, now).minus(cooldown).isNegative();
    }
}
