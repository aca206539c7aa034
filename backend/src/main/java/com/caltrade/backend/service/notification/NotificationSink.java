package com.caltrade.backend.service.notification;

import java.util.Map;

/**
 * Human-facing outcome channel. Delivery problems stay inside the implementation.
 */
public interface NotificationSink {

    void notify(String subject, String message, NotificationLevel level, Map<String, Object> details);

    default void notify(String subject, String message, NotificationLevel level) {
        notify(subject, message, level, Map.of());
    }

    boolean isConfigured();
}
