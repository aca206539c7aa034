package com.caltrade.backend.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One parsed trade. Derived per parse and never persisted.
 */
public record TradeInstruction(String symbol, TradeAction action, int quantity) {

    private static final Pattern SYMBOL = Pattern.compile("[A-Z]{1,5}");

    public TradeInstruction {
        Objects.requireNonNull(action, "action");
        if (symbol == null || !SYMBOL.matcher(symbol.toUpperCase(Locale.ROOT)).matches()) {
            throw new IllegalArgumentException("Symbol must be 1-5 letters: " + symbol);
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        symbol = symbol.toUpperCase(Locale.ROOT);
    }

    public String describe() {
        return action + " " + quantity + " " + symbol;
    }
}
