package com.caltrade.backend.exception;

public class CalendarSourceException extends RuntimeException {
    private final int statusCode;

    public CalendarSourceException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public CalendarSourceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public CalendarSourceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
