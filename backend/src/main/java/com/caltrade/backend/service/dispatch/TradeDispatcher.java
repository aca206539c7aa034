package com.caltrade.backend.service.dispatch;

import com.caltrade.backend.dto.ExecutionServiceResponse;
import com.caltrade.backend.model.TradeBatch;
import com.caltrade.backend.model.TradeInstruction;
import com.caltrade.backend.service.notification.NotificationLevel;
import com.caltrade.backend.service.notification.NotificationSink;
import com.caltrade.backend.service.parser.ParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands instructions to the execution service and reports the outcome. One call, one outcome, one report;
 * nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeDispatcher {

    private final ExecutionServicePort executionService;
    private final NotificationSink notificationSink;

    public DispatchOutcome submit(ParseResult parsed, String correlationEventId, String correlationEventTitle) {
        return switch (parsed.kind()) {
            case SINGLE -> submit(parsed.singleInstruction(), correlationEventId, correlationEventTitle);
            case BATCH -> submit(parsed.toBatch(), correlationEventId, correlationEventTitle);
            case NONE -> throw new IllegalArgumentException("Nothing to dispatch for event " + correlationEventId);
        };
    }

    public DispatchOutcome submit(TradeInstruction instruction, String correlationEventId, String correlationEventTitle) {
        DispatchOutcome outcome;
        try {
            ExecutionServiceResponse response = executionService.submitTrade(instruction, correlationEventId, correlationEventTitle);
            outcome = toOutcome(response, false, List.of(instruction), correlationEventId, correlationEventTitle);
        } catch (RuntimeException e) {
            outcome = failure(e, false, List.of(instruction), correlationEventId, correlationEventTitle);
        }
        report(outcome, instruction.describe());
        return outcome;
    }

    public DispatchOutcome submit(TradeBatch batch, String correlationEventId, String correlationEventTitle) {
        DispatchOutcome outcome;
        try {
            ExecutionServiceResponse response = executionService.submitBatch(batch, correlationEventId, correlationEventTitle);
            outcome = toOutcome(response, true, batch.instructions(), correlationEventId, correlationEventTitle);
        } catch (RuntimeException e) {
            outcome = failure(e, true, batch.instructions(), correlationEventId, correlationEventTitle);
        }
        report(outcome, batch.rawText());
        return outcome;
    }

    public boolean isExecutionAvailable() {
        return executionService.isAcceptingCalls();
    }

    /**
     * Outcome for an instruction held back because the execution service is not accepting calls. The event is
     * not claimed, so a later run picks it up again.
     */
    public DispatchOutcome deferred(ParseResult parsed, String correlationEventId, String correlationEventTitle) {
        String reason = "Execution service not accepting calls; event left unclaimed for the next run";
        log.warn("Deferring event {} ({}): {}", correlationEventId, correlationEventTitle, reason);
        DispatchOutcome outcome = new DispatchOutcome(correlationEventId, correlationEventTitle, parsed.isBatch(),
                parsed.instructions(), false, ExecutionServiceResponse.ERROR, reason, null);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", correlationEventId);
        details.put("eventTitle", correlationEventTitle);
        details.put("input", parsed.describe());
        notificationSink.notify("Trade Deferred", reason, NotificationLevel.WARNING, details);
        return outcome;
    }

    private DispatchOutcome toOutcome(ExecutionServiceResponse response, boolean batch, List<TradeInstruction> instructions,
                                      String eventId, String eventTitle) {
        String message = response.message() != null ? response.message() : "No message from execution service";
        return new DispatchOutcome(eventId, eventTitle, batch, instructions,
                response.isSuccess(), response.status(), message, response.orderId());
    }

    private DispatchOutcome failure(RuntimeException e, boolean batch, List<TradeInstruction> instructions,
                                    String eventId, String eventTitle) {
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("Trade dispatch failed for event {} ({}): {}", eventId, eventTitle, reason);
        return new DispatchOutcome(eventId, eventTitle, batch, instructions,
                false, ExecutionServiceResponse.ERROR, reason, null);
    }

    private void report(DispatchOutcome outcome, String input) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", outcome.eventId());
        details.put("eventTitle", outcome.eventTitle());
        details.put("input", input);
        details.put("status", outcome.status());
        if (outcome.orderId() != null) {
            details.put("orderId", outcome.orderId());
        }
        if (outcome.success()) {
            log.info("Trade executed for event {}: {}", outcome.eventId(), outcome.message());
            notificationSink.notify("Trade Executed Successfully",
                    "Trade executed successfully: " + outcome.message(), NotificationLevel.SUCCESS, details);
        } else {
            log.warn("Trade failed for event {}: {}. Event stays marked; resubmit manually if needed.",
                    outcome.eventId(), outcome.message());
            notificationSink.notify("Trade Execution Failed",
                    "Trade execution failed: " + outcome.message(), NotificationLevel.ERROR, details);
        }
    }
}
