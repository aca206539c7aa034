package com.caltrade.backend.service.notification;

import com.caltrade.backend.config.CalendarTradeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts outcome reports to a Discord webhook as a single embed. Without a webhook URL the report is only logged.
 */
@Slf4j
@Service
public class DiscordWebhookNotificationSink implements NotificationSink {

    public static final String DISCORD_WEBHOOK_PREFIX = "https://discord.com/api/webhooks/";
    private static final int MAX_FIELDS = 25;
    private static final int MAX_FIELD_VALUE = 1024;

    private final RestTemplate restTemplate;
    private final CalendarTradeProperties.Notification config;

    public DiscordWebhookNotificationSink(@Qualifier("notificationRestTemplate") RestTemplate restTemplate,
                                          CalendarTradeProperties properties) {
        this.restTemplate = restTemplate;
        this.config = properties.getNotification();
    }

    @Override
    public boolean isConfigured() {
        return config.getDiscordWebhookUrl() != null && !config.getDiscordWebhookUrl().isBlank();
    }

    public boolean hasValidWebhookFormat() {
        return isConfigured() && config.getDiscordWebhookUrl().startsWith(DISCORD_WEBHOOK_PREFIX);
    }

    @Override
    public void notify(String subject, String message, NotificationLevel level, Map<String, Object> details) {
        if (!isConfigured()) {
            log.info("No Discord webhook configured. {}: {}", subject, message);
            return;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(config.getDiscordWebhookUrl(),
                    new HttpEntity<>(payload(subject, message, level, details), headers), String.class);
            log.info("Discord notification sent: {}", subject);
        } catch (RestClientException e) {
            log.warn("Failed to send Discord notification '{}': {}", subject, e.getMessage());
        } catch (RuntimeException e) {
            // malformed webhook URLs fail before any request is made
            log.warn("Discord notification '{}' not sent, webhook URL rejected: {}", subject, e.getMessage());
        }
    }

    Map<String, Object> payload(String subject, String message, NotificationLevel level, Map<String, Object> details) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", config.getTitle() + ": " + subject);
        embed.put("description", message);
        embed.put("color", level.color());
        embed.put("timestamp", Instant.now().toString());
        if (details != null && !details.isEmpty()) {
            List<Map<String, Object>> fields = new ArrayList<>();
            details.forEach((name, value) -> {
                if (fields.size() < MAX_FIELDS && value != null) {
                    fields.add(Map.of(
                            "name", name,
                            "value", truncate(String.valueOf(value)),
                            "inline", false
                    ));
                }
            });
            embed.put("fields", fields);
        }
        return Map.of("embeds", List.of(embed));
    }

    private static String truncate(String value) {
        if (value.isEmpty()) {
            return "-";
        }
        return value.length() <= MAX_FIELD_VALUE ? value : value.substring(0, MAX_FIELD_VALUE - 3) + "...";
    }
}
