package com.caltrade.backend.service.calendar;

import com.caltrade.backend.model.CalendarEvent;

import java.time.Instant;
import java.util.List;

public interface CalendarPort {

    /**
     * Events overlapping {@code [start, end)}, in calendar order.
     */
    List<CalendarEvent> getEvents(Instant start, Instant end);

    boolean isConfigured();
}
