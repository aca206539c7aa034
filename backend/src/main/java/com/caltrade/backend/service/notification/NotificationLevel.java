package com.caltrade.backend.service.notification;

public enum NotificationLevel {
    INFO(0x3498DB),
    SUCCESS(0x2ECC71),
    WARNING(0xFFAA00),
    ERROR(0xED4245);

    private final int color;

    NotificationLevel(int color) {
        this.color = color;
    }

    public int color() {
        return color;
    }
}
