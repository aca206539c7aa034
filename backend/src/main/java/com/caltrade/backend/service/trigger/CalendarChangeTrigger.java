package com.caltrade.backend.service.trigger;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.model.TriggerSource;
import com.caltrade.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Push path. A change notification says only that something changed, so every call rescans the wide window.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CalendarChangeTrigger {

    private final ReconciliationService reconciliationService;
    private final ScheduledTaskGuard taskGuard;
    private final CalendarTradeProperties properties;
    private final Clock clock;

    public Optional<ReconcileReport> onCalendarChanged() {
        return taskGuard.run("calendar-change", () -> {
            log.info("Calendar change notification received, running full rescan");
            CalendarTradeProperties.Window window = properties.getWindow();
            return reconciliationService.reconcileAndDispatch(ReconcileWindow.wide(
                    TriggerSource.PUSH, clock.instant(), window.getWidePast(), window.getWideFuture()));
        });
    }
}
