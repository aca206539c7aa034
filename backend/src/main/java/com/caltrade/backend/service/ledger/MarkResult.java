package com.caltrade.backend.service.ledger;

public enum MarkResult {
    /** Newly recorded by this call. */
    MARKED,
    /** Another invocation recorded it first. */
    ALREADY_MARKED,
    /** The store could not be read or written; nothing was recorded. */
    UNAVAILABLE
}
