package com.caltrade.backend.model;

import java.time.Instant;

/**
 * Ledger entry written when an event is claimed for dispatch. Never edited after it is stored.
 */
public record ExecutionRecord(
        String eventId,
        String eventTitle,
        Instant dispatchedAt,
        TriggerSource source,
        String outcomeTag
) {
    public static final String PRE_COMMITTED = "PRE_COMMITTED";
}
