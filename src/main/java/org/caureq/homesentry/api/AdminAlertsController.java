package org.caureq.homesentry.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.api.dto.AlertConfigDTO;
import org.caureq.homesentry.service.alerts.AlertConfigService;
import org.caureq.homesentry.service.alerts.GracePeriodTracker;
import org.caureq.homesentry.service.alerts.PendingState;
import org.caureq.homesentry.service.notify.AlertDispatcher;
import org.caureq.homesentry.service.notify.AlertFormatter;
import org.caureq.homesentry.service.notify.WebhookDeliveryException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Admin endpoints to view/update alert settings at runtime. */
@Slf4j
@RestController
@RequestMapping("/api/admin/alerts")
@RequiredArgsConstructor
public class AdminAlertsController {
    private final AlertConfigService cfg;
    private final GracePeriodTracker grace;
    private final AlertFormatter formatter;
    private final AlertDispatcher dispatcher;

    @GetMapping("/config")
    public Map<String, Object> get() {
        return Map.of(
                "alertsEnabled", cfg.isAlertsEnabled(),
                "webhookConfigured", cfg.hasWebhook(),
                "cooldownMinutes", cfg.getCooldownMinutes(),
                "gracePeriodEnabled", cfg.isGracePeriodEnabled(),
                "graceChecks", cfg.getGraceChecks(),
                "deliveryDelayMs", cfg.getDeliveryDelayMs()
        );
    }

    @PutMapping("/config")
    public ResponseEntity<?> update(@RequestBody @Valid AlertConfigDTO body) {
        cfg.update(body.alertsEnabled(), body.cooldownMinutes(), body.gracePeriodEnabled(), body.graceChecks());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/pending")
    public Map<String, PendingState> pending() {
        return grace.pendingStates();
    }

    @DeleteMapping("/pending")
    public Map<String, Object> clearPending() {
        int n = grace.reset();
        log.info("[Alerts] grace state reset by admin ({} pending)", n);
        return Map.of("cleared", n);
    }

    @PostMapping("/test")
    public Map<String, Object> test() {
        if (!cfg.hasWebhook()) {
            throw new IllegalArgumentException("no webhook URL configured");
        }
        if (!dispatcher.sendNow(cfg.getWebhookUrl(), formatter.testMessage())) {
            throw new WebhookDeliveryException(0, "test alert was not delivered");
        }
        return Map.of("status", "sent");
    }
}
