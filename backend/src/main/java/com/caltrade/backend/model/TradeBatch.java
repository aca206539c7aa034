package com.caltrade.backend.model;

import java.util.List;

/**
 * Several instructions encoded in a single event, kept together with the text they came from.
 */
public record TradeBatch(List<TradeInstruction> instructions, String rawText) {

    public TradeBatch {
        instructions = List.copyOf(instructions);
        if (instructions.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one instruction");
        }
    }

    public int size() {
        return instructions.size();
    }
}
