package org.caureq.homesentry.service.alerts;

import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.QueuedEvent;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.repo.AlertStore;
import org.caureq.homesentry.service.notify.AlertDispatcher;
import org.caureq.homesentry.service.notify.AlertFormatter;
import org.caureq.homesentry.service.notify.WebhookMessage;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds and sends the summary of everything held back during the sleep window.
 * The queue is emptied whenever a digest is built, even if sending it fails.
 */
@Slf4j
@Service
public class MorningDigestService {
    static final int COLOR_ISSUES = 0xFFA500;
    static final int MAX_LINES = 10;
    static final Duration DUPLICATE_GUARD = Duration.ofMinutes(5);
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final AlertConfigService cfg;
    private final SleepSchedulePolicy sleep;
    private final AlertStore store;
    private final AlertFormatter formatter;
    private final AlertDispatcher dispatcher;
    private final Clock clock;

    private volatile Instant lastSent;

    public MorningDigestService(AlertConfigService cfg, SleepSchedulePolicy sleep, AlertStore store,
                                AlertFormatter formatter, AlertDispatcher dispatcher, Clock clock) {
        this.cfg = cfg;
        this.sleep = sleep;
        this.store = store;
        this.formatter = formatter;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Sends the digest when {@code now} is within a minute of the configured summary time
     * and none went out in the last five minutes.
     *
     * @return true when a digest was delivered
     */
    public boolean checkAndSend(LocalDateTime now) {
        var s = cfg.sleepSettings();
        if (!s.enabled() || !s.summaryEnabled()) return false;
        var target = TimeWindow.parseTime(s.summaryTime());
        if (target.isEmpty()) return false;
        if (!isDue(now.toLocalTime(), target.get())) return false;

        Instant at = clock.instant();
        Instant prev = lastSent;
        if (prev != null && Duration.between(prev, at).compareTo(DUPLICATE_GUARD) < 0) {
            log.debug("[Digest] already sent {}s ago, skipping", Duration.between(prev, at).toSeconds());
            return false;
        }
        if (!cfg.hasWebhook()) {
            log.warn("[Digest] webhook not configured, skipping morning summary");
            return false;
        }

        log.info("[Digest] summary time reached, building report");
        var digest = buildDigest(now);
        if (digest.isEmpty()) return false;
        lastSent = at;
        boolean ok = dispatcher.dispatch(cfg.getWebhookUrl(), digest.get());
        if (ok) log.info("[Digest] morning summary sent");
        else log.error("[Digest] failed to send morning summary");
        return ok;
    }

    /** Drains the queue into a digest; empty when the schedule or the summary is disabled. */
    public Optional<WebhookMessage> buildDigest(LocalDateTime now) {
        var s = cfg.sleepSettings();
        var window = sleep.window();
        if (window.isEmpty() || !s.summaryEnabled()) return Optional.empty();

        List<QueuedEvent> events = store.drainSleepEvents();
        String period = "Period: " + window.get().start().format(HH_MM) + " - " + window.get().end().format(HH_MM);

        if (events.isEmpty()) {
            log.info("[Digest] quiet night");
            return Optional.of(formatter.message("🌅 Good Morning!", period, AlertFormatter.COLOR_OK, List.of(
                    new WebhookMessage.Field("✨ Quiet Night", "No events logged during sleep hours", false),
                    new WebhookMessage.Field("🟢 Current Status", "All systems operational", false))));
        }

        var issues = ongoingIssues(events);
        long serviceEvents = events.stream().filter(e -> e.category() == Category.SERVICE).count();

        List<String> lines = new ArrayList<>(events.size());
        for (var e : events) {
            String hhmm = LocalDateTime.ofInstant(e.queuedAt(), clock.getZone()).format(HH_MM);
            String glyph = e.newStatus() == Status.OK ? "🟢" : "🔴";
            String prev = e.prevStatus() != null ? e.prevStatus().name() : "?";
            lines.add(glyph + " " + hhmm + " - " + e.name() + ": " + prev + " → " + e.newStatus());
        }
        String activity = String.join("\n", lines.subList(Math.max(0, lines.size() - MAX_LINES), lines.size()));
        if (lines.size() > MAX_LINES) {
            activity = "*(Showing last " + MAX_LINES + " of " + lines.size() + " events)*\n\n" + activity;
        }

        List<WebhookMessage.Field> fields = new ArrayList<>();
        fields.add(new WebhookMessage.Field("📊 Activity Overview",
                "• " + events.size() + " events logged\n"
                        + "• " + serviceEvents + " service events\n"
                        + "• " + issues.size() + " ongoing issues", false));
        fields.add(new WebhookMessage.Field("✅ Activity Log", activity, false));
        if (issues.isEmpty()) {
            fields.add(new WebhookMessage.Field("🟢 Current Status", "All systems operational", false));
        } else {
            List<String> issueLines = issues.stream().map(e -> "• " + e.name() + ": " + e.newStatus()).toList();
            fields.add(new WebhookMessage.Field("⚠️ Ongoing Issues", String.join("\n", issueLines), false));
        }

        log.info("[Digest] built summary with {} events, {} ongoing issues", events.size(), issues.size());
        int color = issues.isEmpty() ? AlertFormatter.COLOR_OK : COLOR_ISSUES;
        return Optional.of(formatter.message("🌅 Overnight Activity Summary", period, color, fields));
    }

    /** Latest queued entry per key, kept only when that entry is not OK. */
    static List<QueuedEvent> ongoingIssues(List<QueuedEvent> events) {
        Map<String, QueuedEvent> latest = new LinkedHashMap<>();
        for (var e : events) {
            latest.remove(e.eventKey());
            latest.put(e.eventKey(), e);
        }
        return latest.values().stream().filter(e -> e.newStatus() != Status.OK).toList();
    }

    /** Within one minute of target, wrapping around midnight. */
    static boolean isDue(LocalTime now, LocalTime target) {
        int a = now.getHour() * 60 + now.getMinute();
        int b = target.getHour() * 60 + target.getMinute();
        int diff = Math.abs(a - b);
        return Math.min(diff, 1440 - diff) <= 1;
    }

    public Optional<Instant> lastSent() {
        return Optional.ofNullable(lastSent);
    }
}
