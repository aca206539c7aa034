package com.caltrade.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Locale;

/**
 * Reply of the execution service. Batch calls fill {@code results} with one entry per trade.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionServiceResponse(
        String status,
        String message,
        String orderId,
        List<ExecutionServiceResponse> results
) {
    public static final String SIMULATED = "simulated";
    public static final String EXECUTED = "executed";
    public static final String ERROR = "error";

    public boolean isSuccess() {
        if (status == null) {
            return false;
        }
        String normalized = status.toLowerCase(Locale.ROOT);
        return SIMULATED.equals(normalized) || EXECUTED.equals(normalized);
    }
}
