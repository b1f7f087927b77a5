package org.caureq.homesentry.api;

import lombok.RequiredArgsConstructor;
import org.caureq.homesentry.scheduler.MonitorScheduler;
import org.caureq.homesentry.service.RetentionService;
import org.caureq.homesentry.service.alerts.MorningDigestService;
import org.caureq.homesentry.service.alerts.SleepSchedulePolicy;
import org.caureq.homesentry.service.collect.CollectorRegistry;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/** Scheduler and sleep-schedule state, for troubleshooting. */
@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {
    private final MonitorScheduler scheduler;
    private final CollectorRegistry registry;
    private final RetentionService retention;
    private final SleepSchedulePolicy sleep;
    private final MorningDigestService digest;
    private final Clock clock;

    @GetMapping("/scheduler")
    public Map<String, Object> scheduler() {
        var s = scheduler.getSettings();
        var out = new LinkedHashMap<String, Object>();
        out.put("state", scheduler.getState());
        out.put("cycles", scheduler.getCycles());
        out.put("pollIntervalSeconds", s.pollInterval().toSeconds());
        out.put("smartEveryTicks", s.smartEvery());
        out.put("raidEveryTicks", s.raidEvery());
        out.put("collectors", registry.all().stream()
                .map(c -> Map.of("name", c.name(), "cadence", c.cadence()))
                .toList());
        out.put("lastPass", scheduler.getLastPass());
        out.put("retentionDays", retention.getRetentionDays());
        out.put("cleanupTime", retention.getCleanupTime().toString());
        out.put("lastCleanup", retention.lastRun().map(Object::toString).orElse(null));
        return out;
    }

    @GetMapping("/sleep")
    public Map<String, Object> sleep() {
        var now = LocalDateTime.now(clock);
        var st = sleep.describe(now);
        var out = new LinkedHashMap<String, Object>();
        out.put("now", now.toString());
        out.put("enabled", st.enabled());
        out.put("window", st.window() != null ? st.window().toString() : null);
        out.put("active", st.active());
        out.put("reason", st.reason());
        out.put("allowCritical", st.allowCritical());
        out.put("summaryEnabled", st.summaryEnabled());
        out.put("summaryTime", st.summaryTime());
        out.put("lastDigest", digest.lastSent().map(Object::toString).orElse(null));
        return out;
    }
}
