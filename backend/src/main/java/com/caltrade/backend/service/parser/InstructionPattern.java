package com.caltrade.backend.service.parser;

import com.caltrade.backend.model.TradeInstruction;

import java.util.Optional;

/**
 * One rule of the single-instruction grammar. Implementations receive upper-cased text.
 */
public interface InstructionPattern {

    String name();

    Optional<TradeInstruction> match(String text);
}
