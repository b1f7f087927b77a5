package org.caureq.homesentry.service.alerts;

import org.caureq.homesentry.config.HomeSentryProps.WindowProps;
import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.support.TestProps;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MaintenanceWindowPolicyTest {

    // 2026-03-02 is a Monday
    private static final LocalDateTime MONDAY_3AM = LocalDateTime.parse("2026-03-02T03:00");

    private MaintenanceWindowPolicy policy(TestProps props, MockEnvironment env) {
        return new MaintenanceWindowPolicy(new AlertConfigService(props.build(), env));
    }

    @Test
    void shouldSuppressProblemsInsideGlobalWindow() {
        var p = policy(TestProps.defaults().globalMaintenance("02:00-04:00", ""), new MockEnvironment());

        var s = p.shouldSuppress(Category.SERVICE, "plex", Status.FAIL, MONDAY_3AM);

        assertThat(s.suppressed()).isTrue();
        assertThat(s.reason()).isEqualTo("In maintenance window: Global window 02:00-04:00 on Monday");
    }

    @Test
    void shouldNotSuppressOutsideWindow() {
        var p = policy(TestProps.defaults().globalMaintenance("02:00-04:00", ""), new MockEnvironment());

        assertThat(p.shouldSuppress(Category.SERVICE, "plex", Status.FAIL, MONDAY_3AM.withHour(5)).suppressed())
                .isFalse();
    }

    @Test
    void shouldNeverSuppressDriveOrArrayHealth() {
        var p = policy(TestProps.defaults().globalMaintenance("00:00-23:59", ""), new MockEnvironment());

        assertThat(p.shouldSuppress(Category.SMART, "/dev/sda", Status.FAIL, MONDAY_3AM).suppressed()).isFalse();
        assertThat(p.shouldSuppress(Category.RAID, "md0", Status.WARN, MONDAY_3AM).suppressed()).isFalse();
    }

    @Test
    void shouldNeverSuppressRecoveries() {
        var p = policy(TestProps.defaults().globalMaintenance("02:00-04:00", ""), new MockEnvironment());

        var s = p.shouldSuppress(Category.SERVICE, "plex", Status.OK, MONDAY_3AM);

        assertThat(s.suppressed()).isFalse();
        assertThat(s.reason()).isEqualTo("Recovery alerts not suppressed");
    }

    @Test
    void shouldHonourDayFilter() {
        var p = policy(TestProps.defaults().globalMaintenance("02:00-04:00", "5,6"), new MockEnvironment());

        var monday = p.shouldSuppress(Category.SERVICE, "plex", Status.FAIL, MONDAY_3AM);
        var saturday = p.shouldSuppress(Category.SERVICE, "plex", Status.FAIL, MONDAY_3AM.plusDays(5));

        assertThat(monday.suppressed()).isFalse();
        assertThat(monday.reason()).contains("not for Monday");
        assertThat(saturday.suppressed()).isTrue();
    }

    @Test
    void shouldPreferPerNameOverride() {
        var props = TestProps.defaults().maintenance("02:00-04:00", "",
                Map.of("plex", new WindowProps("05:00-06:00", "")));
        var p = policy(props, new MockEnvironment());

        assertThat(p.shouldSuppress(Category.SERVICE, "plex", Status.FAIL, MONDAY_3AM).suppressed()).isFalse();
        var own = p.shouldSuppress(Category.SERVICE, "Plex", Status.FAIL, MONDAY_3AM.withHour(5).withMinute(30));
        assertThat(own.suppressed()).isTrue();
        assertThat(own.reason()).startsWith("In maintenance window: Service-specific window 05:00-06:00");
        // other names still use the global window
        assertThat(p.shouldSuppress(Category.SERVICE, "jellyfin", Status.FAIL, MONDAY_3AM).suppressed()).isTrue();
    }

    @Test
    void shouldReadOverrideFromEnvironment() {
        var env = new MockEnvironment()
                .withProperty("HOME_ASSISTANT_MAINTENANCE_WINDOW", "23:30-00:30")
                .withProperty("HOME_ASSISTANT_MAINTENANCE_DAYS", "0");
        var p = policy(TestProps.defaults(), env);

        var s = p.shouldSuppress(Category.SERVICE, "home assistant", Status.WARN,
                LocalDateTime.parse("2026-03-02T23:45"));

        assertThat(s.suppressed()).isTrue();
    }

    @Test
    void shouldFallBackToGlobalWhenOverrideIsMalformed() {
        var props = TestProps.defaults().maintenance("02:00-04:00", "",
                Map.of("plex", new WindowProps("nonsense", "")));
        var p = policy(props, new MockEnvironment());

        assertThat(p.resolve("plex")).get().extracting(MaintenanceWindowPolicy.ResolvedWindow::source)
                .isEqualTo("Global");
    }

    @Test
    void shouldAllowWhenNothingConfigured() {
        var p = policy(TestProps.defaults(), new MockEnvironment());

        assertThat(p.shouldSuppress(Category.SERVICE, "plex", Status.FAIL, MONDAY_3AM).suppressed()).isFalse();
    }
}
