package com.caltrade.backend.controller;

import com.caltrade.backend.dto.HealthResponse;
import com.caltrade.backend.service.calendar.CalendarPort;
import com.caltrade.backend.service.dispatch.ExecutionServicePort;
import com.caltrade.backend.service.ledger.DispatchLedger;
import com.caltrade.backend.service.notification.DiscordWebhookNotificationSink;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final CalendarPort calendarPort;
    private final ExecutionServicePort executionServicePort;
    private final DiscordWebhookNotificationSink notificationSink;
    private final DispatchLedger dispatchLedger;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Configuration and ledger health")
    public ResponseEntity<HealthResponse> health() {
        Map<String, HealthResponse.Check> checks = new LinkedHashMap<>();
        checks.put("calendar", new HealthResponse.Check(calendarPort.isConfigured(),
                calendarPort.isConfigured() ? "configured" : "base URL or calendar id missing"));
        checks.put("executionService", new HealthResponse.Check(executionServicePort.isConfigured(),
                executionServicePort.isConfigured() ? "configured" : "base URL missing"));
        checks.put("notification", notificationCheck());
        checks.put("ledger", ledgerCheck());

        boolean healthy = checks.values().stream().allMatch(HealthResponse.Check::ok);
        return ResponseEntity.ok(HealthResponse.builder()
                .status(healthy ? HealthResponse.HEALTHY : HealthResponse.DEGRADED)
                .checkedAt(Instant.now(clock))
                .checks(checks)
                .build());
    }

    private HealthResponse.Check notificationCheck() {
        if (!notificationSink.isConfigured()) {
            return new HealthResponse.Check(false, "webhook not configured, notifications are only logged");
        }
        if (!notificationSink.hasValidWebhookFormat()) {
            return new HealthResponse.Check(false, "webhook URL must start with "
                    + DiscordWebhookNotificationSink.DISCORD_WEBHOOK_PREFIX);
        }
        return new HealthResponse.Check(true, "configured");
    }

    private HealthResponse.Check ledgerCheck() {
        try {
            int count = dispatchLedger.list().size();
            return new HealthResponse.Check(true, count + " of " + dispatchLedger.capacity() + " entries");
        } catch (RuntimeException e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return new HealthResponse.Check(false, "ledger unreadable: " + e.getMessage());
        }
    }
}
