package com.caltrade.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Top-level boundary of a trigger invocation. Whatever the task throws is logged and swallowed so the
 * scheduler or the platform registration that fired it is never torn down.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final DispatchMetrics dispatchMetrics;

    public <T> Optional<T> run(String taskName, Supplier<T> task) {
        String invocationId = UUID.randomUUID().toString();
        MDC.put("invocationId", invocationId);
        MDC.put("trigger", taskName);
        try {
            return Optional.ofNullable(task.get());
        } catch (Throwable t) {
            log.error("Trigger task failed task={} invocationId={}", taskName, invocationId, t);
            dispatchMetrics.recordTriggerFault(taskName);
            return Optional.empty();
        } finally {
            MDC.remove("invocationId");
            MDC.remove("trigger");
        }
    }
}
