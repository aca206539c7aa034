package com.caltrade.backend.service.parser;

import com.caltrade.backend.model.TradeInstruction;

import java.util.Optional;
import java.util.regex.Matcher;

/**
 * {@code BUY 5 AAPL}
 */
public class ActionQuantitySymbolPattern extends RegexInstructionPattern {

    public ActionQuantitySymbolPattern() {
        super("\\b(BUY|SELL)\\s+(\\d{1,5})\\s+([A-Z]{1,5})\\b");
    }

    @Override
    public String name() {
        return "ACTION_QUANTITY_SYMBOL";
    }

    @Override
    protected Optional<TradeInstruction> build(Matcher matcher) {
        return instruction(matcher.group(3), matcher.group(1), matcher.group(2));
    }
}
