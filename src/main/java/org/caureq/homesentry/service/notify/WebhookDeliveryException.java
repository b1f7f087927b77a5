package org.caureq.homesentry.service.notify;

/** Webhook delivery failed. {@code status} is the HTTP status, or 0 when nothing came back. */
public class WebhookDeliveryException extends RuntimeException {
    private final int status;

    public WebhookDeliveryException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() { return status; }
}
