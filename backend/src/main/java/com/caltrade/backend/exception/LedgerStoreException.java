package com.caltrade.backend.exception;

public class LedgerStoreException extends RuntimeException {
    public LedgerStoreException(String message) {
        super(message);
    }

    public LedgerStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
