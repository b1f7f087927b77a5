package org.caureq.homesentry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Bound from {@code homesentry.*}. Every nested value is optional; services apply the defaults.
 */
@ConfigurationProperties(prefix = "homesentry")
public record HomeSentryProps(String version, String apiKey, AlertsProps alerts,
                              MaintenanceProps maintenance, SleepProps sleep,
                              SchedulerProps scheduler) {
    /** Webhook destination, cooldown, grace period and delivery throttle */
    public record AlertsProps(Boolean enabled, String webhookUrl, Integer cooldownMinutes,
                              Boolean gracePeriodEnabled, Integer graceChecks,
                              Long deliveryDelayMs, Integer deliveryTimeoutSeconds) {}
    /** Global window plus per-name overrides, windows as "HH:MM-HH:MM", days as "0,1,..,6" (0=Monday) */
    public record MaintenanceProps(String globalWindow, String globalDays, Map<String, WindowProps> windows) {}
    public record WindowProps(String window, String days) {}
    /** Nightly quiet hours with morning digest */
    public record SleepProps(Boolean enabled, String start, String end, Boolean summaryEnabled,
                             String summaryTime, Boolean allowCritical) {}
    /** Loop cadences (seconds), retention and worker pool sizing */
    public record SchedulerProps(Boolean enabled, Integer pollIntervalSeconds, Integer smartPollIntervalSeconds,
                                 Integer raidPollIntervalSeconds, Integer retentionDays, String cleanupTime,
                                 Integer collectorTimeoutSeconds, Integer workerThreads) {}

    public AlertsProps alertsOrEmpty() {
        return alerts != null ? alerts : new AlertsProps(null, null, null, null, null, null, null);
    }

    public MaintenanceProps maintenanceOrEmpty() {
        return maintenance != null ? maintenance : new MaintenanceProps(null, null, null);
    }

    public SleepProps sleepOrEmpty() {
        return sleep != null ? sleep : new SleepProps(null, null, null, null, null, null);
    }

    public SchedulerProps schedulerOrEmpty() {
        return scheduler != null ? scheduler : new SchedulerProps(null, null, null, null, null, null, null, null);
    }

    public String versionOrDefault() {
        return version == null || version.isBlank() ? "0.1.0" : version;
    }
}
