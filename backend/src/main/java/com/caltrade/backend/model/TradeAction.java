package com.caltrade.backend.model;

import java.util.Locale;

public enum TradeAction {
    BUY,
    SELL;

    public static TradeAction fromText(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Trade action is required");
        }
        return TradeAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
