package org.caureq.homesentry.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.config.HomeSentryProps.WindowProps;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.Status;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Silences non-critical alerts during scheduled maintenance. Drive/array health and
 * recoveries always get through.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceWindowPolicy {
    private final AlertConfigService cfg;

    public record ResolvedWindow(TimeWindow window, Set<DayOfWeek> days, String source) {}

    public Suppression shouldSuppress(Category category, String name, Status status, LocalDateTime now) {
        if (category.isCriticalInfrastructure()) {
            return Suppression.allow("Critical infrastructure alerts not suppressed");
        }
        if (status == Status.OK) {
            return Suppression.allow("Recovery alerts not suppressed");
        }
        var resolved = resolve(name);
        if (resolved.isEmpty()) {
            return Suppression.allow("Not in maintenance window");
        }
        var w = resolved.get();
        String day = now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        if (!w.days().contains(now.getDayOfWeek())) {
            return Suppression.allow("Maintenance window configured but not for " + day);
        }
        if (w.window().contains(now.toLocalTime())) {
            return Suppression.suppress("In maintenance window: " + w.source() + " window " + w.window() + " on " + day);
        }
        return Suppression.allow("Not in maintenance window");
    }

    /** Per-name override wins over the global window; an unparsable override falls back to global. */
    public Optional<ResolvedWindow> resolve(String name) {
        var own = cfg.maintenanceOverride(name).flatMap(p -> toResolved(p, "Service-specific"));
        if (own.isPresent()) return own;
        return cfg.globalMaintenance().flatMap(p -> toResolved(p, "Global"));
    }

    private Optional<ResolvedWindow> toResolved(WindowProps p, String source) {
        return TimeWindow.parse(p.window())
                .map(w -> new ResolvedWindow(w, DayFilter.parse(p.days()), source));
    }
}
