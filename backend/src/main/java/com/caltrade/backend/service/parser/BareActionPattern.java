package com.caltrade.backend.service.parser;

import com.caltrade.backend.model.TradeInstruction;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * A lone {@code BUY} or {@code SELL}; symbol and quantity come from configuration.
 */
public class BareActionPattern extends RegexInstructionPattern {

    private final String defaultSymbol;
    private final int defaultQuantity;

    public BareActionPattern(String defaultSymbol, int defaultQuantity) {
        super("\\b(BUY|SELL)\\b");
        this.defaultSymbol = defaultSymbol;
        this.defaultQuantity = defaultQuantity;
    }

    @Override
    public String name() {
        return "BARE_ACTION";
    }

    @Override
    protected Optional<TradeInstruction> build(Matcher matcher) {
        return instruction(defaultSymbol, matcher.group(1), String.valueOf(defaultQuantity));
    }
}
