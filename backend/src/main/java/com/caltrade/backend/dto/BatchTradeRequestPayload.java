package com.caltrade.backend.dto;

public record BatchTradeRequestPayload(
        String rawTradesText,
        String correlationEventId,
        String correlationEventTitle
) {
}
