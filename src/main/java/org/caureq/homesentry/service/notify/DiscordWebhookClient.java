package org.caureq.homesentry.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Discord-compatible webhook sender. Blocks the calling thread for at most the timeout;
 * network errors and non-2xx answers are logged and reported as {@code false}.
 */
@Slf4j
@Component
public class DiscordWebhookClient implements WebhookClient {
    static final String USERNAME = "HomeSentry";

    private final WebClient webClient;
    private final Duration timeout;
    private final ObjectMapper om = new ObjectMapper();

    @Autowired
    public DiscordWebhookClient(@Qualifier("webhookWebClient") WebClient webClient) {
        this(webClient, Duration.ofSeconds(10));
    }

    DiscordWebhookClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public boolean deliver(String webhookUrl, WebhookMessage message) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            log.warn("[Webhook] no destination configured, dropping '{}'", message.title());
            return false;
        }
        try {
            webClient.post()
                    .uri(webhookUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload(message).toString())
                    .retrieve()
                    .onStatus(s -> !s.is2xxSuccessful(),
                            r -> r.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> new WebhookDeliveryException(
                                            r.statusCode().value(),
                                            "Webhook answered " + r.statusCode().value()
                                                    + (body.isBlank() ? "" : " -> " + body))))
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            log.info("[Webhook] alert sent: {}", message.title());
            return true;
        } catch (WebhookDeliveryException e) {
            log.error("[Webhook] failed to send '{}': {}", message.title(), e.getMessage());
            return false;
        } catch (Exception e) {
            log.error("[Webhook] failed to send '{}': {}", message.title(), e.toString());
            return false;
        }
    }

    /** {@code {"username": ..., "embeds": [embed]}} */
    ObjectNode payload(WebhookMessage m) {
        ObjectNode root = om.createObjectNode();
        root.put("username", USERNAME);
        ArrayNode embeds = root.putArray("embeds");
        ObjectNode embed = embeds.addObject();
        embed.put("title", m.title());
        if (m.description() != null) embed.put("description", m.description());
        embed.put("color", m.color());
        ArrayNode fields = embed.putArray("fields");
        for (var f : m.fields()) {
            fields.addObject()
                    .put("name", f.name())
                    .put("value", f.value())
                    .put("inline", f.inline());
        }
        if (m.timestamp() != null) embed.put("timestamp", m.timestamp().toString());
        if (m.footer() != null) embed.putObject("footer").put("text", m.footer());
        return root;
    }
}
