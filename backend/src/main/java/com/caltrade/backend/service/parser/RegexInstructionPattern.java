package com.caltrade.backend.service.parser;

import com.caltrade.backend.model.TradeAction;
import com.caltrade.backend.model.TradeInstruction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

abstract class RegexInstructionPattern implements InstructionPattern {

    private final Pattern pattern;

    protected RegexInstructionPattern(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    @Override
    public Optional<TradeInstruction> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return build(matcher);
    }

    protected abstract Optional<TradeInstruction> build(Matcher matcher);

    protected static Optional<TradeInstruction> instruction(String symbol, String action, String quantity) {
        int parsed = Integer.parseInt(quantity);
        if (parsed <= 0) {
            return Optional.empty();
        }
        return Optional.of(new TradeInstruction(symbol, TradeAction.fromText(action), parsed));
    }
}
