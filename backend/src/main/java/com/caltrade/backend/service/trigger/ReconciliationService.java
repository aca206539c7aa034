package com.caltrade.backend.service.trigger;

import com.caltrade.backend.model.CalendarEvent;
import com.caltrade.backend.service.DispatchMetrics;
import com.caltrade.backend.service.calendar.CalendarEventSource;
import com.caltrade.backend.service.dispatch.DispatchOutcome;
import com.caltrade.backend.service.dispatch.TradeDispatcher;
import com.caltrade.backend.service.ledger.DispatchLedger;
import com.caltrade.backend.service.ledger.MarkResult;
import com.caltrade.backend.service.parser.ParseResult;
import com.caltrade.backend.service.parser.TradeInstructionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * The one routine both trigger paths run. Events are handled in calendar order; each event with an
 * instruction is marked in the ledger before it is dispatched, so whichever invocation marks first is the
 * only one that submits it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationService {

    private final CalendarEventSource eventSource;
    private final TradeInstructionParser parser;
    private final DispatchLedger ledger;
    private final TradeDispatcher dispatcher;
    private final DispatchMetrics dispatchMetrics;

    public ReconcileReport reconcileAndDispatch(ReconcileWindow window) {
        List<CalendarEvent> candidates = eventSource.getCandidateEvents(window);
        log.info("{} reconciliation: {} candidate events between {} and {}",
                window.source(), candidates.size(), window.start(), window.end());

        int withInstructions = 0;
        int skipped = 0;
        int failures = 0;
        int dispatched = 0;
        List<DispatchOutcome> outcomes = new ArrayList<>();

        for (CalendarEvent event : candidates) {
            ParseResult parsed = parser.parse(event.title(), event.description());
            if (parsed.isEmpty()) {
                log.debug("Event {} has no trade instruction", event.id());
                continue;
            }
            withInstructions++;

            if (ledger.has(event.id())) {
                log.info("Skipping already executed event: {} (id={})", event.title(), event.id());
                dispatchMetrics.recordDuplicateSkipped(window.source());
                skipped++;
                continue;
            }

            if (!dispatcher.isExecutionAvailable()) {
                outcomes.add(dispatcher.deferred(parsed, event.id(), event.title()));
                dispatchMetrics.recordFailed(window.source());
                failures++;
                continue;
            }

            MarkResult mark = ledger.markDispatched(event.id(), event.title(), window.source());
            if (mark == MarkResult.ALREADY_MARKED) {
                log.info("Event {} (id={}) was claimed by another invocation, skipping", event.title(), event.id());
                dispatchMetrics.recordDuplicateSkipped(window.source());
                skipped++;
                continue;
            }
            if (mark == MarkResult.UNAVAILABLE) {
                log.warn("Ledger unavailable, dispatching event {} without a dedup record", event.id());
            }

            log.info("Executing trade for event '{}' starting {}: {}", event.title(), event.startTime(), parsed.describe());
            DispatchOutcome outcome = dispatcher.submit(parsed, event.id(), event.title());
            outcomes.add(outcome);
            dispatched++;
            if (outcome.success()) {
                dispatchMetrics.recordDispatched(window.source());
            } else {
                dispatchMetrics.recordFailed(window.source());
                failures++;
            }
        }

        ReconcileReport report = new ReconcileReport(
                window.source(),
                window.start(),
                window.end(),
                candidates.size(),
                withInstructions,
                dispatched,
                skipped,
                failures,
                outcomes
        );
        log.info("{} reconciliation complete: dispatched={} skipped={} failures={}",
                window.source(), report.dispatched(), report.skippedDuplicates(), report.failures());
        return report;
    }
}
