package org.caureq.homesentry.service.alerts;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeWindowTest {

    @Test
    void shouldContainBothEndsOfSameDayWindow() {
        var w = TimeWindow.parse("02:00-04:00").orElseThrow();

        assertThat(w.spansMidnight()).isFalse();
        assertThat(w.contains(LocalTime.of(2, 0))).isTrue();
        assertThat(w.contains(LocalTime.of(3, 30))).isTrue();
        assertThat(w.contains(LocalTime.of(4, 0))).isTrue();
        assertThat(w.contains(LocalTime.of(4, 1))).isFalse();
        assertThat(w.contains(LocalTime.of(1, 59))).isFalse();
    }

    @Test
    void shouldHandleWindowCrossingMidnight() {
        var w = TimeWindow.parse("23:45-00:15").orElseThrow();

        assertThat(w.spansMidnight()).isTrue();
        assertThat(w.contains(LocalTime.of(0, 5))).isTrue();
        assertThat(w.contains(LocalTime.of(23, 50))).isTrue();
        assertThat(w.contains(LocalTime.of(0, 20))).isFalse();
        assertThat(w.contains(LocalTime.of(23, 40))).isFalse();
    }

    @Test
    void shouldRenderAsConfigured() {
        assertThat(TimeWindow.parse(" 7:05 - 9:30 ").orElseThrow().toString()).isEqualTo("07:05-09:30");
    }

    @Test
    void shouldTreatMalformedInputAsNoWindow() {
        assertThat(TimeWindow.parse(null)).isEmpty();
        assertThat(TimeWindow.parse("")).isEmpty();
        assertThat(TimeWindow.parse("25:00-03:00")).isEmpty();
        assertThat(TimeWindow.parse("02:00")).isEmpty();
        assertThat(TimeWindow.parse("aa:bb-cc:dd")).isEmpty();
        assertThat(TimeWindow.parse("01:00-02:00-03:00")).isEmpty();
    }

    @Test
    void shouldParseSingleTimes() {
        assertThat(TimeWindow.parseTime("07:00")).contains(LocalTime.of(7, 0));
        assertThat(TimeWindow.parseTime("7:60")).isEmpty();
        assertThat(TimeWindow.parseTime("0700")).isEmpty();
    }
}
