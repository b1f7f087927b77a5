package org.caureq.homesentry.service;

import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.config.HomeSentryProps;
import org.caureq.homesentry.repo.AlertStore;
import org.caureq.homesentry.service.alerts.TimeWindow;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Nightly removal of observation samples and stale sleep-queue rows.
 * Runs at most once per calendar day, on the first check at or after the cleanup time.
 */
@Slf4j
@Service
public class RetentionService {
    static final int DEFAULT_RETENTION_DAYS = 30;
    static final LocalTime DEFAULT_CLEANUP_TIME = LocalTime.of(3, 0);

    private final AlertStore store;
    private final int retentionDays;
    private final LocalTime cleanupTime;
    private volatile LocalDate lastRun;

    public RetentionService(HomeSentryProps props, AlertStore store) {
        this.store = store;
        var s = props.schedulerOrEmpty();
        this.retentionDays = s.retentionDays() != null ? s.retentionDays() : DEFAULT_RETENTION_DAYS;
        this.cleanupTime = Optional.ofNullable(s.cleanupTime())
                .flatMap(TimeWindow::parseTime)
                .orElse(DEFAULT_CLEANUP_TIME);
    }

    /** @return true when a cleanup attempt was made */
    public boolean runIfDue(LocalDateTime now) {
        LocalDate today = now.toLocalDate();
        if (today.equals(lastRun) || now.toLocalTime().isBefore(cleanupTime)) return false;
        try {
            cleanup();
        } finally {
            lastRun = today;
        }
        return true;
    }

    /** @return number of rows removed; 0 when retention is disabled */
    public long cleanup() {
        if (retentionDays <= 0) {
            log.warn("[Retention] retention-days is {} - nightly cleanup is DISABLED, storage will grow without bound",
                    retentionDays);
            return 0;
        }
        log.info("[Retention] running cleanup (retention: {} days)", retentionDays);
        long removed = store.deleteRecordsOlderThan(retentionDays);
        log.info("[Retention] cleanup complete: {} rows removed", removed);
        return removed;
    }

    public int getRetentionDays() { return retentionDays; }
    public LocalTime getCleanupTime() { return cleanupTime; }
    public Optional<LocalDate> lastRun() { return Optional.ofNullable(lastRun); }
}
