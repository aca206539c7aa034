package com.caltrade.backend.service.dispatch;

import com.caltrade.backend.model.TradeInstruction;

import java.util.List;

public record DispatchOutcome(
        String eventId,
        String eventTitle,
        boolean batch,
        List<TradeInstruction> instructions,
        boolean success,
        String status,
        String message,
        String orderId
) {
    public DispatchOutcome {
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }
}
