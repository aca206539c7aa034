package com.caltrade.backend.service.parser;

import com.caltrade.backend.model.TradeInstruction;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * {@code AAPL BUY 5}
 */
public class SymbolActionQuantityPattern extends RegexInstructionPattern {

    public SymbolActionQuantityPattern() {
        super("\\b([A-Z]{1,5})\\s+(BUY|SELL)\\s+(\\d{1,5})\\b");
    }

    @Override
    public String name() {
        return "SYMBOL_ACTION_QUANTITY";
    }

    @Override
    protected Optional<TradeInstruction> build(Matcher matcher) {
        return instruction(matcher.group(1), matcher.group(2), matcher.group(3));
    }
}
