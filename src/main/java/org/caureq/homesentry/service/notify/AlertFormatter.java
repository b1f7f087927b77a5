package org.caureq.homesentry.service.notify;

import org.caureq.homesentry.domain.Category;
import org.caureq.homesentry.domain.Status;
import org.caureq.homesentry.service.alerts.AlertConfigService;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a status change as a color-coded message. Services, disks and everything else
 * (system metrics, containers, drives, arrays, app modules) each get their own field layout.
 */
@Component
public class AlertFormatter {
    public static final int COLOR_OK = 0x00FF00;
    public static final int COLOR_WARN = 0xFFFF00;
    public static final int COLOR_FAIL = 0xFF0000;

    private final AlertConfigService cfg;
    private final Clock clock;

    public AlertFormatter(AlertConfigService cfg, Clock clock) {
        this.cfg = cfg;
        this.clock = clock;
    }

    public static int color(Status s) {
        if (s == null) return COLOR_WARN;
        return switch (s) {
            case OK -> COLOR_OK;
            case FAIL -> COLOR_FAIL;
            default -> COLOR_WARN;
        };
    }

    public static String glyph(Status s) {
        if (s == null) return "⚪";
        return switch (s) {
            case OK -> "🟢";
            case WARN -> "🟡";
            case FAIL -> "🔴";
        };
    }

    public String footer() {
        return "HomeSentry v" + cfg.version();
    }

    public WebhookMessage format(Category category, String name, Status prev, Status status, Map<String, Object> details) {
        Map<String, Object> d = details == null ? Map.of() : details;
        return switch (category) {
            case SERVICE -> service(name, prev, status, d);
            case DISK -> disk(name, prev, status, d);
            default -> metric(name, prev, status, d);
        };
    }

    WebhookMessage service(String name, Status prev, Status status, Map<String, Object> d) {
        String svc = titleCase(name);
        String title;
        String description;
        switch (status) {
            case FAIL -> { title = "Service Down: " + svc; description = svc + " is unreachable"; }
            case WARN -> { title = "Service Warning: " + svc; description = svc + " is responding slowly or with errors"; }
            default -> { title = "Service Recovered: " + svc; description = svc + " is responding normally"; }
        }
        List<WebhookMessage.Field> fields = new ArrayList<>();
        fields.add(transition(prev, status));
        Double ms = num(d, "response_ms");
        if (ms != null) fields.add(new WebhookMessage.Field("Response Time", fmt("%.0fms", ms), true));
        Object code = d.get("http_code");
        if (truthy(code)) fields.add(new WebhookMessage.Field("HTTP Code", plain(code), true));
        if (truthy(d.get("url"))) fields.add(new WebhookMessage.Field("URL", String.valueOf(d.get("url")), false));
        if (truthy(d.get("error"))) fields.add(new WebhookMessage.Field("Error", String.valueOf(d.get("error")), false));
        return message(glyph(status) + " " + title, description, status, fields);
    }

    WebhookMessage disk(String mount, Status prev, Status status, Map<String, Object> d) {
        String title;
        String description;
        switch (status) {
            case FAIL -> { title = "Critical Disk Space: " + mount; description = "Disk space is critically low"; }
            case WARN -> { title = "Low Disk Space: " + mount; description = "Disk usage is approaching critical levels"; }
            default -> { title = "Disk Space Recovered: " + mount; description = "Disk space has returned to normal levels"; }
        }
        List<WebhookMessage.Field> fields = new ArrayList<>();
        fields.add(transition(prev, status));
        Double free = num(d, "free_gb");
        if (free != null) {
            Double used = num(d, "percent_used");
            double pctFree = 100 - (used == null ? 0 : used);
            fields.add(new WebhookMessage.Field("Free Space", fmt("%.1f GB (%.0f%%)", free, pctFree), true));
        }
        Double total = num(d, "total_gb");
        if (total != null && total != 0) {
            fields.add(new WebhookMessage.Field("Total Capacity", fmt("%.1f GB", total), true));
        }
        List<String> th = new ArrayList<>();
        if (truthy(d.get("threshold_gb"))) th.add(plain(d.get("threshold_gb")) + " GB");
        if (truthy(d.get("threshold_pct"))) th.add(plain(d.get("threshold_pct")) + "%");
        if (!th.isEmpty()) fields.add(new WebhookMessage.Field("Threshold", String.join(" or ", th), false));
        return message(glyph(status) + " " + title, description, status, fields);
    }

    WebhookMessage metric(String name, Status prev, Status status, Map<String, Object> d) {
        String metric = titleCase(name.replace("_", " "));
        String title = switch (status) {
            case FAIL -> "Critical: " + metric;
            case WARN -> "Warning: " + metric;
            default -> "Recovered: " + metric;
        };
        String description = truthy(d.get("message")) ? String.valueOf(d.get("message")) : metric + " status changed";
        String unit = d.get("unit") == null ? "" : String.valueOf(d.get("unit"));
        List<WebhookMessage.Field> fields = new ArrayList<>();
        fields.add(transition(prev, status));
        if (d.get("value") != null) fields.add(new WebhookMessage.Field("Current Value", plain(d.get("value")) + unit, true));
        if (d.get("threshold") != null) fields.add(new WebhookMessage.Field("Threshold", plain(d.get("threshold")) + unit, true));
        return message(glyph(status) + " " + title, description, status, fields);
    }

    public WebhookMessage testMessage() {
        return message("🧪 Test Alert - HomeSentry",
                "If you can see this, webhook alerts are working correctly!",
                Status.OK,
                List.of(new WebhookMessage.Field("Status", "✅ Configuration Valid", true),
                        new WebhookMessage.Field("Webhook", "Connected Successfully", true)));
    }

    public WebhookMessage message(String title, String description, Status status, List<WebhookMessage.Field> fields) {
        return message(title, description, color(status), fields);
    }

    public WebhookMessage message(String title, String description, int color, List<WebhookMessage.Field> fields) {
        return new WebhookMessage(title, description, color, fields, clock.instant(), footer());
    }

    private static WebhookMessage.Field transition(Status prev, Status status) {
        String text = prev != null ? prev + " → " + status : "First detection: " + status;
        return new WebhookMessage.Field("Status", text, true);
    }

    private static Double num(Map<String, Object> d, String key) {
        Object v = d.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s && !s.isBlank()) {
            try { return Double.parseDouble(s.trim()); } catch (NumberFormatException e) { return null; }
        }
        return null;
    }

    private static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Number n) return n.doubleValue() != 0;
        if (v instanceof Boolean b) return b;
        return !String.valueOf(v).isBlank();
    }

    /** 87 -> "87", 87.50 -> "87.5" */
    static String plain(Object v) {
        if (v instanceof Double || v instanceof Float) {
            double x = ((Number) v).doubleValue();
            if (Double.isFinite(x)) return BigDecimal.valueOf(x).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(v);
    }

    static String titleCase(String s) {
        if (s == null || s.isBlank()) return "";
        StringBuilder sb = new StringBuilder(s.length());
        boolean up = true;
        for (char c : s.trim().toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(up ? Character.toUpperCase(c) : Character.toLowerCase(c));
                up = false;
            } else {
                sb.append(c);
                up = true;
            }
        }
        return sb.toString();
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
