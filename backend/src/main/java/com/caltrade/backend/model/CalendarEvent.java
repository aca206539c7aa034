package com.caltrade.backend.model;

import java.time.Instant;

public record CalendarEvent(String id, String title, String description, Instant startTime) {

    public String text() {
        String safeTitle = title == null ? "" : title;
        String safeDescription = description == null ? "" : description;
        return safeTitle + " " + safeDescription;
    }
}
