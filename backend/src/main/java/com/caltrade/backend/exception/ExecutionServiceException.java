package com.caltrade.backend.exception;

public class ExecutionServiceException extends RuntimeException {
    private final int statusCode;

    public ExecutionServiceException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public ExecutionServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public ExecutionServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
