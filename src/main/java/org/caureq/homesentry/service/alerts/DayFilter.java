package org.caureq.homesentry.service.alerts;

import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Day-of-week allow-list for maintenance windows: {@code "0,1,2"} with 0 = Monday,
 * or day names ({@code "MON,SAT"}). Empty means every day.
 */
@Slf4j
public final class DayFilter {
    private static final Map<String, DayOfWeek> NAMES = Map.of(
            "MON", DayOfWeek.MONDAY, "TUE", DayOfWeek.TUESDAY, "WED", DayOfWeek.WEDNESDAY,
            "THU", DayOfWeek.THURSDAY, "FRI", DayOfWeek.FRIDAY, "SAT", DayOfWeek.SATURDAY,
            "SUN", DayOfWeek.SUNDAY);

    private DayFilter() {}

    public static Set<DayOfWeek> parse(String raw) {
        if (raw == null || raw.isBlank()) return EnumSet.allOf(DayOfWeek.class);
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        boolean invalid = false;
        for (String token : raw.split(",")) {
            String t = token.trim().toUpperCase(Locale.ROOT);
            if (t.isEmpty()) continue;
            DayOfWeek d = toDay(t);
            if (d == null) invalid = true;
            else days.add(d);
        }
        if (invalid) log.warn("Some invalid day entries in maintenance days: {}", raw);
        if (days.isEmpty()) {
            log.warn("No valid days in '{}', using all days", raw);
            return EnumSet.allOf(DayOfWeek.class);
        }
        return days;
    }

    private static DayOfWeek toDay(String t) {
        if (t.length() >= 3 && NAMES.containsKey(t.substring(0, 3))) return NAMES.get(t.substring(0, 3));
        try {
            int n = Integer.parseInt(t);
            return n >= 0 && n <= 6 ? DayOfWeek.of(n + 1) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
