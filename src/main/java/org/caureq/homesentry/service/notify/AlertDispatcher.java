package org.caureq.homesentry.service.notify;

import lombok.extern.slf4j.Slf4j;
import org.caureq.homesentry.service.alerts.AlertConfigService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Sends messages off the caller's thread, each one after a fixed pause. The pause keeps a
 * burst of alerts under the webhook's rate limit (30 requests per 60 s); it is not a retry.
 */
@Slf4j
@Component
public class AlertDispatcher {
    private final WebhookClient client;
    private final Executor executor;
    private final AlertConfigService cfg;

    public AlertDispatcher(WebhookClient client, @Qualifier("deliveryExecutor") Executor executor,
                           AlertConfigService cfg) {
        this.client = client;
        this.executor = executor;
        this.cfg = cfg;
    }

    public CompletableFuture<Boolean> dispatchAsync(String webhookUrl, WebhookMessage message) {
        long delay = cfg.getDeliveryDelayMs();
        Executor delayed = delay > 0
                ? CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS, executor)
                : executor;
        return CompletableFuture.supplyAsync(() -> client.deliver(webhookUrl, message), delayed)
                .exceptionally(e -> {
                    log.error("[Dispatch] delivery of '{}' failed: {}", message.title(), e.toString());
                    return false;
                });
    }

    /** Throttled send, waiting for the outcome. */
    public boolean dispatch(String webhookUrl, WebhookMessage message) {
        return dispatchAsync(webhookUrl, message).join();
    }

    /** Unthrottled send for operator-triggered messages. */
    public boolean sendNow(String webhookUrl, WebhookMessage message) {
        return client.deliver(webhookUrl, message);
    }
}
