package com.caltrade.backend.dto;

public record TradeRequestPayload(
        String symbol,
        String action,
        int quantity,
        String correlationEventId,
        String correlationEventTitle
) {
}
