package org.caureq.homesentry.support;

import org.caureq.homesentry.service.notify.WebhookClient;
import org.caureq.homesentry.service.notify.WebhookMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Captures every delivery attempt; answers with {@link #succeed}. */
public class RecordingWebhookClient implements WebhookClient {
    public final List<WebhookMessage> sent = new CopyOnWriteArrayList<>();
    public volatile boolean succeed = true;
    public volatile int attempts;

    @Override
    public boolean deliver(String webhookUrl, WebhookMessage message) {
        attempts++;
        if (!succeed) return false;
        sent.add(message);
        return true;
    }

    public WebhookMessage last() {
        return sent.get(sent.size() - 1);
    }
}
