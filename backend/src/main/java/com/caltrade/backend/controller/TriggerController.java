package com.caltrade.backend.controller;

import com.caltrade.backend.config.CalendarTradeProperties;
import com.caltrade.backend.exception.ForbiddenException;
import com.caltrade.backend.model.TriggerSource;
import com.caltrade.backend.service.trigger.CalendarChangeTrigger;
import com.caltrade.backend.service.trigger.CalendarPollScheduler;
import com.caltrade.backend.service.trigger.ReconcileReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/triggers")
@RequiredArgsConstructor
@Tag(name = "Triggers")
public class TriggerController {

    static final String SYNC_STATE = "sync";

    private final CalendarChangeTrigger calendarChangeTrigger;
    private final CalendarPollScheduler calendarPollScheduler;
    private final CalendarTradeProperties properties;

    /**
     * Change notification from the calendar platform. Answers 2xx once authorised, whatever the rescan did,
     * so the platform keeps the registration alive.
     */
    @PostMapping("/calendar-change")
    @Operation(summary = "Calendar change notification (push path)")
    public ResponseEntity<Map<String, Object>> calendarChange(
            @RequestHeader(value = "X-Channel-Token", required = false) String channelToken,
            @RequestHeader(value = "X-Resource-State", required = false) String resourceState) {
        String expected = properties.getPush().getChannelToken();
        if (expected != null && !expected.isBlank() && !expected.equals(channelToken)) {
            throw new ForbiddenException("Invalid channel token");
        }
        if (SYNC_STATE.equalsIgnoreCase(resourceState)) {
            log.info("Calendar channel sync handshake acknowledged");
            return ResponseEntity.ok(Map.of("status", "sync-acknowledged"));
        }
        Optional<ReconcileReport> report = calendarChangeTrigger.onCalendarChanged();
        return ResponseEntity.ok(report
                .<Map<String, Object>>map(r -> Map.of("status", "processed", "dispatched", r.dispatched(),
                        "skippedDuplicates", r.skippedDuplicates(), "failures", r.failures()))
                .orElseGet(() -> Map.of("status", "faulted")));
    }

    @PostMapping("/poll")
    @Operation(summary = "Run the poll path now")
    public ResponseEntity<ReconcileReport> poll() {
        return calendarPollScheduler.runOnce(TriggerSource.MANUAL)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }
}
