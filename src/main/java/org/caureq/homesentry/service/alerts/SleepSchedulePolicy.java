package org.caureq.homesentry.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.Status;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Quiet hours. While active every alert is held back for the morning digest, recoveries
 * included; with allow-critical set, drive and array health still pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SleepSchedulePolicy {
    private final AlertConfigService cfg;

    public record SleepState(boolean enabled, TimeWindow window, boolean active, String reason,
                             boolean allowCritical, boolean summaryEnabled, String summaryTime) {}

    /** Configured window, or empty when the schedule is off or its times do not parse. */
    public Optional<TimeWindow> window() {
        var s = cfg.sleepSettings();
        if (!Boolean.TRUE.equals(s.enabled())) return Optional.empty();
        var start = TimeWindow.parseTime(s.start());
        var end = TimeWindow.parseTime(s.end());
        if (start.isEmpty() || end.isEmpty()) {
            log.warn("[Sleep] schedule enabled but start/end not configured properly ({} / {})", s.start(), s.end());
            return Optional.empty();
        }
        return Optional.of(new TimeWindow(start.get(), end.get()));
    }

    public boolean isSleeping(LocalDateTime now) {
        return window().map(w -> w.contains(now.toLocalTime())).orElse(false);
    }

    public Suppression shouldSuppress(Category category, String name, Status status, LocalDateTime now) {
        var w = window();
        if (w.isEmpty() || !w.get().contains(now.toLocalTime())) {
            return Suppression.allow("Outside sleep hours");
        }
        if (cfg.sleepSettings().allowCritical() && category.isCriticalInfrastructure()) {
            return Suppression.allow("Critical infrastructure alerts allowed during sleep");
        }
        return Suppression.suppress("Sleep schedule active (" + w.get() + ")");
    }

    public SleepState describe(LocalDateTime now) {
        var s = cfg.sleepSettings();
        var w = window();
        boolean active = w.map(x -> x.contains(now.toLocalTime())).orElse(false);
        String reason = w.isEmpty() ? "Sleep schedule not enabled"
                : active ? "Sleep schedule active (" + w.get() + ")" : "Outside sleep hours";
        return new SleepState(w.isPresent(), w.orElse(null), active, reason,
                s.allowCritical(), s.summaryEnabled(), s.summaryTime());
    }
}
