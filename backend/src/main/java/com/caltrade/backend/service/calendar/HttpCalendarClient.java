package com.caltrade.backend.service.calendar;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.exception.CalendarSourceException;
import com.caltrade.backend.model.CalendarEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads events from a Google Calendar v3 style REST endpoint.
 */
@Slf4j
@Service
public class HttpCalendarClient implements CalendarPort {

    static final int MAX_PAGES = 50;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CalendarTradeProperties.Calendar config;

    public HttpCalendarClient(@Qualifier("calendarRestTemplate") RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              CalendarTradeProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getCalendar();
    }

    @Override
    public boolean isConfigured() {
        return config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                && config.getCalendarId() != null && !config.getCalendarId().isBlank();
    }

    @Override
    public List<CalendarEvent> getEvents(Instant start, Instant end) {
        if (!isConfigured()) {
            throw new CalendarSourceException("Calendar base URL or calendar id not configured");
        }
        List<CalendarEvent> events = new ArrayList<>();
        Set<String> seenTokens = new HashSet<>();
        String pageToken = null;
        int pages = 0;
        while (true) {
            JsonNode page = fetchPage(start, end, pageToken);
            pages++;
            for (JsonNode item : page.path("items")) {
                CalendarEvent event = toEvent(item);
                if (event != null) {
                    events.add(event);
                }
            }
            pageToken = page.hasNonNull("nextPageToken") ? page.get("nextPageToken").asText() : null;
            if (pageToken == null || pageToken.isBlank()) {
                break;
            }
            if (!seenTokens.add(pageToken)) {
                log.warn("Calendar repeated page token {}, stopping after {} pages", pageToken, pages);
                break;
            }
            if (pages >= MAX_PAGES) {
                log.warn("Calendar listing exceeded {} pages, remaining events ignored", MAX_PAGES);
                break;
            }
        }
        log.debug("Calendar returned {} events between {} and {}", events.size(), start, end);
        return events;
    }

    private JsonNode fetchPage(Instant start, Instant end, String pageToken) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .pathSegment("calendars", config.getCalendarId(), "events")
                .queryParam("timeMin", start.toString())
                .queryParam("timeMax", end.toString())
                .queryParam("singleEvents", true)
                .queryParam("orderBy", "startTime");
        if (pageToken != null) {
            builder.queryParam("pageToken", pageToken);
        }
        URI uri = builder.encode().build().toUri();
        HttpHeaders headers = new HttpHeaders();
        if (config.getAccessToken() != null && !config.getAccessToken().isBlank()) {
            headers.setBearerAuth(config.getAccessToken());
        }
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            String body = response.getBody();
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (HttpStatusCodeException e) {
            throw new CalendarSourceException("Calendar API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new CalendarSourceException("Calendar API unreachable: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new CalendarSourceException("Calendar API returned unreadable JSON", e);
        }
    }

    private CalendarEvent toEvent(JsonNode item) {
        String id = item.path("id").asText(null);
        if (id == null || id.isBlank()) {
            return null;
        }
        if ("cancelled".equalsIgnoreCase(item.path("status").asText(""))) {
            return null;
        }
        Instant startTime = parseStart(item.path("start"));
        if (startTime == null) {
            log.warn("Skipping calendar event {} without a readable start time", id);
            return null;
        }
        return new CalendarEvent(
                id,
                item.path("summary").asText(""),
                item.path("description").asText(""),
                startTime
        );
    }

    private Instant parseStart(JsonNode start) {
        try {
            if (start.hasNonNull("dateTime")) {
                return OffsetDateTime.parse(start.get("dateTime").asText()).toInstant();
            }
            if (start.hasNonNull("date")) {
                return LocalDate.parse(start.get("date").asText()).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
        } catch (DateTimeParseException e) {
            log.debug("Unparseable event start {}: {}", start, e.getMessage());
        }
        return null;
    }
}
