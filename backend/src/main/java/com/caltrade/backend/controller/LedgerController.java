package com.caltrade.backend.controller;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.dto.LedgerResponse;
import com.caltrade.backend.exception.ForbiddenException;
import com.caltrade.backend.model.ExecutionRecord;
import com.caltrade.backend.service.ledger.DispatchLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Tag(name = "Dispatch Ledger")
public class LedgerController {

    private final DispatchLedger dispatchLedger;
    private final CalendarTradeProperties properties;

    @GetMapping
    @Operation(summary = "List dispatched events, oldest first")
    public ResponseEntity<LedgerResponse> list() {
        List<ExecutionRecord> entries = dispatchLedger.list();
        return ResponseEntity.ok(new LedgerResponse(entries.size(), dispatchLedger.capacity(), entries));
    }

    @DeleteMapping
    @Operation(summary = "Clear the ledger")
    public ResponseEntity<Void> clear(@RequestHeader(value = "X-Admin-Token", required = false) String token) {
        if (!isAuthorized(token)) {
            throw new ForbiddenException("Not authorized to clear the ledger");
        }
        log.warn("Ledger clear requested by operator");
        dispatchLedger.clear();
        return ResponseEntity.noContent().build();
    }

    private boolean isAuthorized(String token) {
        String expected = properties.getAdmin().getToken();
        return expected != null && !expected.isBlank() && expected.equals(token);
    }
}
