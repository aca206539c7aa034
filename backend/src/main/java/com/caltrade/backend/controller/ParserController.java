package com.caltrade.backend.controller;

import com.caltrade.backend.dto.ParsePreviewRequest;
import com.caltrade.backend.dto.ParsePreviewResponse;
import com.caltrade.backend.exception.BadRequestException;
import com.caltrade.backend.service.parser.TradeInstructionParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/parser")
@RequiredArgsConstructor
@Tag(name = "Parser")
public class ParserController {

    private final TradeInstructionParser parser;

    @PostMapping("/preview")
    @Operation(summary = "Show what an event title and description would dispatch")
    public ResponseEntity<ParsePreviewResponse> preview(@RequestBody ParsePreviewRequest request) {
        if (isBlank(request.title()) && isBlank(request.description())) {
            throw new BadRequestException("title or description is required");
        }
        return ResponseEntity.ok(ParsePreviewResponse.from(parser.parse(request.title(), request.description())));
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
