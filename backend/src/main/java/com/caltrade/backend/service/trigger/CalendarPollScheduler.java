package com.caltrade.backend.service.trigger;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.model.TriggerSource;
import com.caltrade.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Poll path. Looks a short way ahead for events about to start.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CalendarPollScheduler {

    private final ReconciliationService reconciliationService;
    private final ScheduledTaskGuard taskGuard;
    private final CalendarTradeProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${caltrade.poll.interval-ms:300000}",
            initialDelayString = "${caltrade.poll.initial-delay-ms:30000}")
    public void poll() {
        if (!properties.getPoll().isEnabled()) {
            log.debug("Calendar polling disabled - skipping cycle");
            return;
        }
        runOnce(TriggerSource.POLL);
    }

    public Optional<ReconcileReport> runOnce(TriggerSource source) {
        return taskGuard.run("calendar-poll", () -> {
            log.debug("Checking for upcoming trading events");
            return reconciliationService.reconcileAndDispatch(ReconcileWindow.narrow(
                    source, clock.instant(), properties.getWindow().getLookAhead()));
        });
    }
}
