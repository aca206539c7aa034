package com.caltrade.backend.service.calendar;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.model.CalendarEvent;
import com.caltrade.backend.model.TriggerSource;
import com.caltrade.backend.service.trigger.ReconcileWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CalendarEventSourceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final CalendarPort calendarPort = mock(CalendarPort.class);
    private final CalendarEventSource source = new CalendarEventSource(calendarPort, new CalendarTradeProperties());

    @Test
    void keepsOnlyEventsMentioningATradeKeyword() {
        when(calendarPort.getEvents(any(), any())).thenReturn(List.of(
                new CalendarEvent("1", "Buy 1 BYD", "", NOW),
                new CalendarEvent("2", "Lunch with Sam", null, NOW),
                new CalendarEvent("3", "Desk sync", "trade review", NOW)
        ));

        List<CalendarEvent> candidates = source.getCandidateEvents(NOW, NOW.plusSeconds(60));

        assertThat(candidates).extracting(CalendarEvent::id).containsExactly("1", "3");
    }

    @Test
    void narrowWindowDropsEventsStartingAfterLookAhead() {
        ReconcileWindow window = ReconcileWindow.narrow(TriggerSource.POLL, NOW, Duration.ofMinutes(2));
        when(calendarPort.getEvents(window.start(), window.end())).thenReturn(List.of(
                new CalendarEvent("soon", "BUY 1 BYD", "", NOW.plusSeconds(60)),
                new CalendarEvent("edge", "BUY 1 BYD", "", NOW.plusSeconds(120)),
                new CalendarEvent("later", "BUY 1 BYD", "", NOW.plusSeconds(600))
        ));

        assertThat(source.getCandidateEvents(window)).extracting(CalendarEvent::id).containsExactly("soon", "edge");
    }

    @Test
    void wideWindowKeepsEveryCandidate() {
        ReconcileWindow window = ReconcileWindow.wide(TriggerSource.PUSH, NOW, Duration.ofHours(24), Duration.ofHours(24));
        when(calendarPort.getEvents(window.start(), window.end())).thenReturn(List.of(
                new CalendarEvent("past", "SELL 2 AAPL", "", NOW.minusSeconds(3600)),
                new CalendarEvent("future", "BUY 1 BYD", "", NOW.plusSeconds(7200))
        ));

        assertThat(source.getCandidateEvents(window)).hasSize(2);
        verify(calendarPort).getEvents(NOW.minus(Duration.ofHours(24)), NOW.plus(Duration.ofHours(24)));
    }
}
