package com.caltrade.backend.dto;

import com.caltrade.backend.model.TradeInstruction;
import com.caltrade.backend.service.parser.ParseResult;

import java.util.List;

public record ParsePreviewResponse(String kind, boolean hasInstruction, List<TradeInstruction> instructions,
                                   String summary) {

    public static ParsePreviewResponse from(ParseResult result) {
        return new ParsePreviewResponse(result.kind().name(), !result.isEmpty(), result.instructions(),
                result.describe());
    }
}
