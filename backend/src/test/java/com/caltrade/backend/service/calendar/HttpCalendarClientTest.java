package com.caltrade.backend.service.calendar;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.exception.CalendarSourceException;
import com.caltrade.backend.model.CalendarEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.serverError;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpCalendarClientTest {

    private static final String EVENTS_PATH = "/calendar/v3/calendars/primary/events";
    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-02T00:00:00Z");

    private WireMockServer wireMock;
    private CalendarTradeProperties properties;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(0);
        wireMock.start();
        properties = new CalendarTradeProperties();
        properties.getCalendar().setBaseUrl("http://localhost:" + wireMock.port() + "/calendar/v3");
        properties.getCalendar().setAccessToken("token-123");
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void mapsEventsAndSendsWindowAsQuery() {
        wireMock.stubFor(get(urlPathEqualTo(EVENTS_PATH))
                .willReturn(okJson("{\"items\":["
                        + "{\"id\":\"e1\",\"summary\":\"BUY 1 BYD\",\"start\":{\"dateTime\":\"2024-03-01T09:30:00+01:00\"}},"
                        + "{\"id\":\"e2\",\"summary\":\"All day\",\"description\":\"SELL 2 AAPL\",\"start\":{\"date\":\"2024-03-01\"}},"
                        + "{\"id\":\"e3\",\"status\":\"cancelled\",\"summary\":\"BUY 3 TSLA\",\"start\":{\"date\":\"2024-03-01\"}}"
                        + "]}")));

        List<CalendarEvent> events = client().getEvents(START, END);

        assertThat(events).containsExactly(
                new CalendarEvent("e1", "BUY 1 BYD", "", Instant.parse("2024-03-01T08:30:00Z")),
                new CalendarEvent("e2", "All day", "SELL 2 AAPL", Instant.parse("2024-03-01T00:00:00Z")));
        wireMock.verify(getRequestedFor(urlPathEqualTo(EVENTS_PATH))
                .withHeader("Authorization", equalTo("Bearer token-123"))
                .withQueryParam("timeMin", equalTo("2024-03-01T00:00:00Z"))
                .withQueryParam("timeMax", equalTo("2024-03-02T00:00:00Z"))
                .withQueryParam("singleEvents", equalTo("true"))
                .withQueryParam("orderBy", equalTo("startTime")));
    }

    @Test
    void followsPageTokens() {
        wireMock.stubFor(get(urlPathEqualTo(EVENTS_PATH))
                .withQueryParam("pageToken", absent())
                .willReturn(okJson("{\"items\":[{\"id\":\"e1\",\"summary\":\"BUY\",\"start\":{\"date\":\"2024-03-01\"}}],"
                        + "\"nextPageToken\":\"p2\"}")));
        wireMock.stubFor(get(urlPathEqualTo(EVENTS_PATH))
                .withQueryParam("pageToken", equalTo("p2"))
                .willReturn(okJson("{\"items\":[{\"id\":\"e2\",\"summary\":\"SELL\",\"start\":{\"date\":\"2024-03-01\"}}]}")));

        assertThat(client().getEvents(START, END)).extracting(CalendarEvent::id).containsExactly("e1", "e2");
    }

    @Test
    void repeatedPageTokenEndsListing() {
        wireMock.stubFor(get(urlPathEqualTo(EVENTS_PATH))
                .willReturn(okJson("{\"items\":[{\"id\":\"e1\",\"summary\":\"BUY\",\"start\":{\"date\":\"2024-03-01\"}}],"
                        + "\"nextPageToken\":\"same\"}")));

        List<CalendarEvent> events = client().getEvents(START, END);

        assertThat(events).extracting(CalendarEvent::id).containsExactly("e1", "e1");
        wireMock.verify(2, getRequestedFor(urlPathEqualTo(EVENTS_PATH)));
    }

    @Test
    void serverErrorBecomesCalendarSourceException() {
        wireMock.stubFor(get(urlPathEqualTo(EVENTS_PATH)).willReturn(serverError().withBody("boom")));

        assertThatThrownBy(() -> client().getEvents(START, END))
                .isInstanceOf(CalendarSourceException.class)
                .hasMessageContaining("500");
    }

    @Test
    void blankBaseUrlIsNotConfigured() {
        properties.getCalendar().setBaseUrl("");

        HttpCalendarClient client = client();

        assertThat(client.isConfigured()).isFalse();
        assertThatThrownBy(() -> client.getEvents(START, END)).isInstanceOf(CalendarSourceException.class);
    }

    private HttpCalendarClient client() {
        return new HttpCalendarClient(new RestTemplate(), new ObjectMapper(), properties);
    }
}
