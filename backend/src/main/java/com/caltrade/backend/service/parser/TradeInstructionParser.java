package com.caltrade.backend.service.parser;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.model.TradeBatch;
import com.caltrade.backend.model.TradeInstruction;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns event text into trade instructions.
 * <p>
 * The single-instruction grammar is an ordered list of {@link InstructionPattern}s where the first match wins.
 * Text holding a separator (comma, semicolon or newline) and at least two action keywords is split and each
 * segment is parsed on its own; segments that match nothing are dropped.
 */
@Component
public class TradeInstructionParser {

    private static final Pattern SEPARATOR = Pattern.compile("[,;\\r\\n]");
    private static final Pattern ACTION_KEYWORD = Pattern.compile("\\b(BUY|SELL)\\b");

    private final List<InstructionPattern> patterns;

    @Autowired
    public TradeInstructionParser(CalendarTradeProperties properties) {
        this(properties.getTrading().getDefaultSymbol(), properties.getTrading().getDefaultQuantity());
    }

    public TradeInstructionParser(String defaultSymbol, int defaultQuantity) {
        this(List.of(
                new ActionQuantitySymbolPattern(),
                new SymbolActionQuantityPattern(),
                new BareActionPattern(defaultSymbol, defaultQuantity)
        ));
    }

    public TradeInstructionParser(List<InstructionPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public ParseResult parse(String title, String description) {
        String safeTitle = title == null ? "" : title;
        String safeDescription = description == null ? "" : description;
        return parse(safeTitle + " " + safeDescription);
    }

    public ParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return ParseResult.none(text);
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (isBatch(upper)) {
            return parseBatch(text, upper);
        }
        return parseSingle(upper)
                .map(instruction -> ParseResult.single(instruction, text))
                .orElseGet(() -> ParseResult.none(text));
    }

    public Optional<TradeInstruction> parseSingle(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        for (InstructionPattern pattern : patterns) {
            Optional<TradeInstruction> match = pattern.match(upper);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    boolean isBatch(String upper) {
        if (!SEPARATOR.matcher(upper).find()) {
            return false;
        }
        Matcher keywords = ACTION_KEYWORD.matcher(upper);
        int count = 0;
        while (keywords.find()) {
            count++;
            if (count >= 2) {
                return true;
            }
        }
        return false;
    }

    private ParseResult parseBatch(String rawText, String upper) {
        List<TradeInstruction> instructions = new ArrayList<>();
        for (String segment : SEPARATOR.split(upper)) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            parseSingle(trimmed).ifPresent(instructions::add);
        }
        if (instructions.isEmpty()) {
            return ParseResult.none(rawText);
        }
        if (instructions.size() == 1) {
            return ParseResult.single(instructions.get(0), rawText);
        }
        return ParseResult.batch(new TradeBatch(instructions, rawText));
    }
}
