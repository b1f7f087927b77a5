package org.caureq.homesentry.service.alerts;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.config.HomeSentryProps;
import org.caureq.homesentry.config.HomeSentryProps.SleepProps;
import org.caureq.homesentry.config.HomeSentryProps.WindowProps;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime alert settings. Initialized from configuration and updateable via admin API.
 * Window and sleep settings are re-read on every call so policies always see current values.
 */
@Service
@Slf4j
public class AlertConfigService {
    @Getter private volatile boolean alertsEnabled = true;
    @Getter private volatile String webhookUrl = "";
    @Getter private volatile int cooldownMinutes = 30;
    @Getter private volatile boolean gracePeriodEnabled = true;
    @Getter private volatile int graceChecks = 3;
    @Getter private volatile long deliveryDelayMs = 1000;

    private final HomeSentryProps props;
    private final Environment env;

    public AlertConfigService(HomeSentryProps props, Environment env) {
        this.props = props;
        this.env = env;
        var a = props.alertsOrEmpty();
        if (a.enabled() != null) alertsEnabled = a.enabled();
        if (a.webhookUrl() != null) webhookUrl = a.webhookUrl().trim();
        if (a.cooldownMinutes() != null && a.cooldownMinutes() >= 0) cooldownMinutes = a.cooldownMinutes();
        if (a.gracePeriodEnabled() != null) gracePeriodEnabled = a.gracePeriodEnabled();
        if (a.graceChecks() != null) graceChecks = Math.max(1, a.graceChecks());
        if (a.deliveryDelayMs() != null && a.deliveryDelayMs() >= 0) deliveryDelayMs = a.deliveryDelayMs();
        if (alertsEnabled && !hasWebhook()) {
            log.warn("[Alerts] no webhook URL configured - notifications disabled");
        }
        log.info("[Alerts] enabled={} cooldown={}m grace={} ({} checks)",
                alertsEnabled, cooldownMinutes, gracePeriodEnabled, graceChecks);
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public Duration cooldown() {
        return Duration.ofMinutes(cooldownMinutes);
    }

    public synchronized void update(Boolean enabled, Integer cooldown, Boolean graceEnabled, Integer checks) {
        if (cooldown != null && cooldown < 0) throw new IllegalArgumentException("cooldownMinutes must be >= 0");
        if (checks != null && checks < 1) throw new IllegalArgumentException("graceChecks must be >= 1");
        if (enabled != null) alertsEnabled = enabled;
        if (cooldown != null) cooldownMinutes = cooldown;
        if (graceEnabled != null) gracePeriodEnabled = graceEnabled;
        if (checks != null) graceChecks = checks;
        log.info("[Alerts] config updated enabled={} cooldown={}m grace={} ({} checks)",
                alertsEnabled, cooldownMinutes, gracePeriodEnabled, graceChecks);
    }

    /**
     * Per-name maintenance override: {@code homesentry.maintenance.windows.<name>} first,
     * then the {@code <NAME>_MAINTENANCE_WINDOW} / {@code <NAME>_MAINTENANCE_DAYS} environment pair.
     */
    public Optional<WindowProps> maintenanceOverride(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        Map<String, WindowProps> windows = props.maintenanceOrEmpty().windows();
        if (windows != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (var e : windows.entrySet()) {
                String k = e.getKey().toLowerCase(Locale.ROOT);
                if ((k.equals(lower) || k.equals(envName(name).toLowerCase(Locale.ROOT)))
                        && e.getValue() != null && notBlank(e.getValue().window())) {
                    return Optional.of(e.getValue());
                }
            }
        }
        String prefix = envName(name);
        String w = env.getProperty(prefix + "_MAINTENANCE_WINDOW");
        if (notBlank(w)) {
            return Optional.of(new WindowProps(w.trim(), env.getProperty(prefix + "_MAINTENANCE_DAYS", "")));
        }
        return Optional.empty();
    }

    public Optional<WindowProps> globalMaintenance() {
        var m = props.maintenanceOrEmpty();
        if (!notBlank(m.globalWindow())) return Optional.empty();
        return Optional.of(new WindowProps(m.globalWindow().trim(), m.globalDays()));
    }

    /** Sleep settings with defaults applied; times are still raw strings. */
    public SleepProps sleepSettings() {
        var s = props.sleepOrEmpty();
        return new SleepProps(
                Boolean.TRUE.equals(s.enabled()),
                s.start(),
                s.end(),
                s.summaryEnabled() == null || s.summaryEnabled(),
                s.summaryTime(),
                Boolean.TRUE.equals(s.allowCritical()));
    }

    public String version() {
        return props.versionOrDefault();
    }

    static String envName(String name) {
        return name.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
