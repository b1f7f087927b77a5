package org.caureq.homesentry.service.notify;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class DiscordWebhookClientTest {

    private static final String URL = "https://discord.example.test/api/webhooks/1/abc";

    private final WebhookMessage message = new WebhookMessage("🔴 Service Down: Plex", "Plex is unreachable",
            0xFF0000, List.of(new WebhookMessage.Field("Status", "OK → FAIL", true)),
            Instant.parse("2026-03-02T12:00:00Z"), "HomeSentry v0.1.0");

    private static DiscordWebhookClient client(AtomicReference<ClientRequest> seen, Mono<ClientResponse> answer) {
        WebClient wc = WebClient.builder()
                .exchangeFunction(req -> {
                    seen.set(req);
                    return answer;
                })
                .build();
        return new DiscordWebhookClient(wc, Duration.ofSeconds(2));
    }

    @Test
    void shouldPostToWebhook() {
        var seen = new AtomicReference<ClientRequest>();
        var client = client(seen, Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build()));

        assertThat(client.deliver(URL, message)).isTrue();

        assertThat(seen.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(seen.get().url().toString()).isEqualTo(URL);
    }

    @Test
    void shouldReportNon2xxAsFailure() {
        var seen = new AtomicReference<ClientRequest>();
        var client = client(seen, Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .body("{\"retry_after\":1.5}").build()));

        assertThat(client.deliver(URL, message)).isFalse();
    }

    @Test
    void shouldReportNetworkErrorAsFailure() {
        var seen = new AtomicReference<ClientRequest>();
        var client = client(seen, Mono.error(new IOException("connection refused")));

        assertThat(client.deliver(URL, message)).isFalse();
    }

    @Test
    void shouldReportTimeoutAsFailure() {
        var seen = new AtomicReference<ClientRequest>();
        var client = new DiscordWebhookClient(WebClient.builder()
                .exchangeFunction(req -> Mono.never())
                .build(), Duration.ofMillis(100));

        assertThat(client.deliver(URL, message)).isFalse();
        assertThat(seen.get()).isNull();
    }

    @Test
    void shouldSkipBlankDestination() {
        var seen = new AtomicReference<ClientRequest>();
        var client = client(seen, Mono.just(ClientResponse.create(HttpStatus.OK).build()));

        assertThat(client.deliver(" ", message)).isFalse();
        assertThat(seen.get()).isNull();
    }

    @Test
    void shouldBuildEmbedPayload() {
        var client = client(new AtomicReference<>(), Mono.empty());

        var json = client.payload(message);

        assertThat(json.get("username").asText()).isEqualTo("HomeSentry");
        var embed = json.get("embeds").get(0);
        assertThat(embed.get("title").asText()).isEqualTo("🔴 Service Down: Plex");
        assertThat(embed.get("color").asInt()).isEqualTo(16711680);
        assertThat(embed.get("fields").get(0).get("value").asText()).isEqualTo("OK → FAIL");
        assertThat(embed.get("fields").get(0).get("inline").asBoolean()).isTrue();
        assertThat(embed.get("timestamp").asText()).isEqualTo("2026-03-02T12:00:00Z");
        assertThat(embed.get("footer").get("text").asText()).isEqualTo("HomeSentry v0.1.0");
    }
}
