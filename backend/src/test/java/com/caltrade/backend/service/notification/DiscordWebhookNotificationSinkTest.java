package com.caltrade.backend.service.notification;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.noContent;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.serverError;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class DiscordWebhookNotificationSinkTest {

    private static final String HOOK_PATH = "/api/webhooks/123/abc";

    private WireMockServer wireMock;
    private CalendarTradeProperties properties;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(0);
        wireMock.start();
        properties = new CalendarTradeProperties();
        properties.getNotification().setDiscordWebhookUrl("http://localhost:" + wireMock.port() + HOOK_PATH);
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void postsEmbedColouredByLevel() {
        wireMock.stubFor(post(urlEqualTo(HOOK_PATH)).willReturn(noContent()));

        sink().notify("Trade Executed Successfully", "Trade executed successfully: ok", NotificationLevel.SUCCESS,
                Map.of("eventId", "evt-1"));

        wireMock.verify(postRequestedFor(urlEqualTo(HOOK_PATH))
                .withRequestBody(matchingJsonPath("$.embeds[0].title",
                        equalTo("Trading Bot Notification: Trade Executed Successfully")))
                .withRequestBody(matchingJsonPath("$.embeds[0].color", equalTo(String.valueOf(0x2ECC71))))
                .withRequestBody(matchingJsonPath("$.embeds[0].fields[0].name", equalTo("eventId")))
                .withRequestBody(matchingJsonPath("$.embeds[0].fields[0].value", equalTo("evt-1"))));
    }

    @Test
    void deliveryFailureIsNotSurfaced() {
        wireMock.stubFor(post(urlEqualTo(HOOK_PATH)).willReturn(serverError()));

        assertThatCode(() -> sink().notify("Trade Execution Failed", "down", NotificationLevel.ERROR))
                .doesNotThrowAnyException();
    }

    @Test
    void relativeWebhookUrlIsNotSurfaced() {
        properties.getNotification().setDiscordWebhookUrl("discord-webhook/123");

        assertThatCode(() -> sink().notify("Trade Executed Successfully", "ok", NotificationLevel.SUCCESS,
                Map.of("eventId", "evt-1"))).doesNotThrowAnyException();
    }

    @Test
    void unconfiguredSinkOnlyLogs() {
        properties.getNotification().setDiscordWebhookUrl("");

        DiscordWebhookNotificationSink sink = sink();
        sink.notify("Trade Executed Successfully", "ok", NotificationLevel.SUCCESS);

        assertThat(sink.isConfigured()).isFalse();
        wireMock.verify(0, postRequestedFor(urlEqualTo(HOOK_PATH)));
    }

    @Test
    void webhookFormatIsChecked() {
        assertThat(sink().hasValidWebhookFormat()).isFalse();

        properties.getNotification().setDiscordWebhookUrl("https://discord.com/api/webhooks/1/x");
        assertThat(sink().hasValidWebhookFormat()).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void longFieldValuesAreTruncated() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("input", "x".repeat(2000));
        details.put("orderId", null);

        Map<String, Object> payload = sink().payload("s", "m", NotificationLevel.INFO, details);

        Map<String, Object> embed = ((List<Map<String, Object>>) payload.get("embeds")).get(0);
        List<Map<String, Object>> fields = (List<Map<String, Object>>) embed.get("fields");
        assertThat(fields).hasSize(1);
        assertThat((String) fields.get(0).get("value")).hasSize(1024).endsWith("...");
    }

    private DiscordWebhookNotificationSink sink() {
        return new DiscordWebhookNotificationSink(new RestTemplate(), properties);
    }
}
