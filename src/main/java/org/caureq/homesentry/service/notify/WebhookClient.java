package org.caureq.homesentry.service.notify;

/** Ships one message to a chat webhook. Implementations never throw. */
public interface WebhookClient {
    boolean deliver(String webhookUrl, WebhookMessage message);
}
