package org.caureq.homesentry.service.alerts;

import org.caureq.homesentry.config.HomeSentryProps.SleepProps;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.QueuedEvent;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.service.notify.AlertDispatcher;
import org.caureq.homesentry.service.notify.AlertFormatter;
import org.caureq.homesentry.service.notify.WebhookMessage;
import org.caureq.homesentry.support.InMemoryAlertStore;
import org.caureq.homesentry.support.MutableClock;
import org.caureq.homesentry.support.RecordingWebhookClient;
import org.caureq.homesentry.support.TestProps;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MorningDigestServiceTest {

    private final MutableClock clock = MutableClock.at("2026-03-03T07:00");
    private final RecordingWebhookClient webhook = new RecordingWebhookClient();
    private final InMemoryAlertStore store = new InMemoryAlertStore(clock);

    private MorningDigestService digest(TestProps props) {
        var cfg = new AlertConfigService(props.build(), new MockEnvironment());
        return new MorningDigestService(cfg, new SleepSchedulePolicy(cfg), store,
                new AlertFormatter(cfg, clock), new AlertDispatcher(webhook, Runnable::run, cfg), clock);
    }

    private MorningDigestService digest() {
        return digest(TestProps.defaults().sleep("22:00", "07:00", "07:00", false));
    }

    private void queue(String name, Category category, Status prev, Status now, String at) {
        store.enqueueSleepEvent(new QueuedEvent(
                category.key() + "_" + name, category, name, prev, now,
                name + ": " + prev + " → " + now, Map.of(), Instant.parse(at + ":00Z")));
    }

    private static String field(WebhookMessage m, String name) {
        return m.fields().stream().filter(f -> f.name().equals(name)).findFirst()
                .map(WebhookMessage.Field::value).orElse(null);
    }

    @Test
    void shouldBuildQuietVariantForEmptyQueue() {
        var msg = digest().buildDigest(clock.localNow()).orElseThrow();

        assertThat(msg.title()).isEqualTo("🌅 Good Morning!");
        assertThat(msg.description()).isEqualTo("Period: 22:00 - 07:00");
        assertThat(msg.color()).isEqualTo(AlertFormatter.COLOR_OK);
        assertThat(field(msg, "✨ Quiet Night")).isEqualTo("No events logged during sleep hours");
        assertThat(field(msg, "🟢 Current Status")).isEqualTo("All systems operational");
    }

    @Test
    void shouldListActivityAndOngoingIssues() {
        queue("plex", Category.SERVICE, Status.OK, Status.FAIL, "2026-03-02T23:10");
        queue("/mnt/data", Category.DISK, Status.OK, Status.WARN, "2026-03-03T01:00");
        queue("plex", Category.SERVICE, Status.FAIL, Status.OK, "2026-03-03T02:40");

        var msg = digest().buildDigest(clock.localNow()).orElseThrow();

        assertThat(msg.title()).isEqualTo("🌅 Overnight Activity Summary");
        assertThat(msg.color()).isEqualTo(0xFFA500);
        assertThat(field(msg, "📊 Activity Overview"))
                .isEqualTo("• 3 events logged\n• 2 service events\n• 1 ongoing issues");
        assertThat(field(msg, "✅ Activity Log")).isEqualTo(
                "🔴 23:10 - plex: OK → FAIL\n"
                        + "🔴 01:00 - /mnt/data: OK → WARN\n"
                        + "🟢 02:40 - plex: FAIL → OK");
        // plex recovered, so only the disk is still a problem
        assertThat(field(msg, "⚠️ Ongoing Issues")).isEqualTo("• /mnt/data: WARN");
        assertThat(store.queue).isEmpty();
    }

    @Test
    void shouldShowAllClearWhenEverythingRecovered() {
        queue("plex", Category.SERVICE, Status.OK, Status.FAIL, "2026-03-02T23:10");
        queue("plex", Category.SERVICE, Status.FAIL, Status.OK, "2026-03-02T23:20");

        var msg = digest().buildDigest(clock.localNow()).orElseThrow();

        assertThat(msg.color()).isEqualTo(AlertFormatter.COLOR_OK);
        assertThat(field(msg, "⚠️ Ongoing Issues")).isNull();
        assertThat(field(msg, "🟢 Current Status")).isEqualTo("All systems operational");
    }

    @Test
    void shouldKeepOnlyTheTenMostRecentLines() {
        for (int i = 0; i < 12; i++) {
            queue("svc" + i, Category.SERVICE, Status.OK, Status.FAIL, "2026-03-03T0%d:%02d".formatted(i / 6, i * 5 % 60));
        }

        var activity = field(digest().buildDigest(clock.localNow()).orElseThrow(), "✅ Activity Log");

        assertThat(activity).startsWith("*(Showing last 10 of 12 events)*\n\n");
        assertThat(activity).doesNotContain("svc0:").doesNotContain("svc1:").contains("svc2:").contains("svc11:");
    }

    @Test
    void shouldBuildNothingWhenSummaryDisabled() {
        var svc = digest(TestProps.defaults().sleep(new SleepProps(true, "22:00", "07:00", false, "07:00", false)));
        queue("plex", Category.SERVICE, Status.OK, Status.FAIL, "2026-03-02T23:10");

        assertThat(svc.buildDigest(clock.localNow())).isEmpty();
        assertThat(store.queue).hasSize(1);
    }

    @Test
    void shouldSendOnceAroundSummaryTime() {
        var svc = digest();
        clock.set("2026-03-03T06:59");

        assertThat(svc.checkAndSend(clock.localNow())).isTrue();
        clock.advance(Duration.ofMinutes(2));
        assertThat(svc.checkAndSend(clock.localNow())).isFalse();

        assertThat(webhook.sent).hasSize(1);
    }

    @Test
    void shouldNotSendAwayFromSummaryTime() {
        var svc = digest();
        clock.set("2026-03-03T07:02");

        assertThat(svc.checkAndSend(clock.localNow())).isFalse();
        assertThat(webhook.attempts).isZero();
    }

    @Test
    void shouldClearQueueEvenWhenSendingFails() {
        var svc = digest();
        webhook.succeed = false;
        queue("plex", Category.SERVICE, Status.OK, Status.FAIL, "2026-03-02T23:10");

        assertThat(svc.checkAndSend(clock.localNow())).isFalse();

        assertThat(store.queue).isEmpty();
        assertThat(svc.lastSent()).isPresent();
    }

    @Test
    void shouldSendAgainNextMorning() {
        var svc = digest();
        assertThat(svc.checkAndSend(clock.localNow())).isTrue();

        clock.advance(Duration.ofDays(1));

        assertThat(svc.checkAndSend(clock.localNow())).isTrue();
        assertThat(webhook.sent).hasSize(2);
    }

    @Test
    void shouldMatchSummaryTimeAcrossMidnight() {
        assertThat(MorningDigestService.isDue(LocalTime.of(23, 59), LocalTime.MIDNIGHT)).isTrue();
        assertThat(MorningDigestService.isDue(LocalTime.of(0, 1), LocalTime.MIDNIGHT)).isTrue();
        assertThat(MorningDigestService.isDue(LocalTime.of(0, 2), LocalTime.MIDNIGHT)).isFalse();
        assertThat(MorningDigestService.isDue(LocalDateTime.parse("2026-03-03T07:01").toLocalTime(),
                LocalTime.of(7, 0))).isTrue();
    }
}
