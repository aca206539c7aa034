package com.caltrade.backend.service.parser;

import com.caltrade.backend.model.TradeBatch;
import com.caltrade.backend.model.TradeInstruction;

import java.util.List;

public record ParseResult(Kind kind, List<TradeInstruction> instructions, String rawText) {

    public enum Kind {
        NONE,
        SINGLE,
        BATCH
    }

    public ParseResult {
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }

    public static ParseResult none(String rawText) {
        return new ParseResult(Kind.NONE, List.of(), rawText);
    }

    public static ParseResult single(TradeInstruction instruction, String rawText) {
        return new ParseResult(Kind.SINGLE, List.of(instruction), rawText);
    }

    public static ParseResult batch(TradeBatch batch) {
        return new ParseResult(Kind.BATCH, batch.instructions(), batch.rawText());
    }

    public boolean isEmpty() {
        return kind == Kind.NONE;
    }

    public boolean isBatch() {
        return kind == Kind.BATCH;
    }

    public TradeInstruction singleInstruction() {
        if (kind != Kind.SINGLE) {
            throw new IllegalStateException("Parse result is " + kind + ", not a single instruction");
        }
        return instructions.get(0);
    }

    public TradeBatch toBatch() {
        if (kind != Kind.BATCH) {
            throw new IllegalStateException("Parse result is " + kind + ", not a batch");
        }
        return new TradeBatch(instructions, rawText);
    }

    public String describe() {
        return switch (kind) {
            case NONE -> "no instruction";
            case SINGLE -> instructions.get(0).describe();
            case BATCH -> instructions.size() + " trades: " + String.join("; ",
                    instructions.stream().map(TradeInstruction::describe).toList());
        };
    }
}
