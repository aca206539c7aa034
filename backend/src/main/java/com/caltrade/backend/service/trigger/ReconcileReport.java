package com.caltrade.backend.service.trigger;

import com.caltrade.backend.model.TriggerSource;
import com.caltrade.backend.service.dispatch.DispatchOutcome;

import java.time.Instant;
import java.util.List;

public record ReconcileReport(
        TriggerSource source,
        Instant windowStart,
        Instant windowEnd,
        int candidates,
        int withInstructions,
        int dispatched,
        int skippedDuplicates,
        int failures,
        List<DispatchOutcome> outcomes
) {
    public ReconcileReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static ReconcileReport empty(ReconcileWindow window) {
        return new ReconcileReport(window.source(), window.start(), window.end(), 0, 0, 0, 0, 0, List.of());
    }
}
