package com.caltrade.backend.service.calendar;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.model.CalendarEvent;
import com.caltrade.backend.service.trigger.ReconcileWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Candidate events for reconciliation: calendar events whose text mentions a trade keyword.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarEventSource {

    private final CalendarPort calendarPort;
    private final CalendarTradeProperties properties;

    public List<CalendarEvent> getCandidateEvents(Instant windowStart, Instant windowEnd) {
        List<String> keywords = properties.getTrading().getKeywords().stream()
                .map(keyword -> keyword.toUpperCase(Locale.ROOT))
                .toList();
        return calendarPort.getEvents(windowStart, windowEnd).stream()
                .filter(event -> mentionsKeyword(event, keywords))
                .toList();
    }

    /**
     * Applies the window's start-time cap on top of the keyword filter. A window with a look-ahead drops
     * events starting later than {@code reference + lookAhead}, whatever the calendar returned.
     */
    public List<CalendarEvent> getCandidateEvents(ReconcileWindow window) {
        List<CalendarEvent> candidates = getCandidateEvents(window.start(), window.end());
        if (window.lookAhead() == null) {
            return candidates;
        }
        Instant latestStart = window.reference().plus(window.lookAhead());
        List<CalendarEvent> startingSoon = candidates.stream()
                .filter(event -> !event.startTime().isAfter(latestStart))
                .toList();
        if (startingSoon.size() < candidates.size()) {
            log.debug("Dropped {} candidates starting after {}", candidates.size() - startingSoon.size(), latestStart);
        }
        return startingSoon;
    }

    private boolean mentionsKeyword(CalendarEvent event, List<String> keywords) {
        String text = event.text().toUpperCase(Locale.ROOT);
        return keywords.stream().anyMatch(text::contains);
    }
}
