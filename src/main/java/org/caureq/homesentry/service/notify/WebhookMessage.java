package org.caureq.homesentry.service.notify;

import java.time.Instant;
import java.util.List;

/** Rich chat message: one embed with title, colored bar, fields and footer. */
public record WebhookMessage(String title, String description, int color, List<Field> fields,
                             Instant timestamp, String footer) {

    public WebhookMessage {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public record Field(String name, String value, boolean inline) {}

    public WebhookMessage withTitle(String newTitle, String newDescription, List<Field> newFields) {
        return new WebhookMessage(newTitle, newDescription, color, newFields, timestamp, footer);
    }
}
