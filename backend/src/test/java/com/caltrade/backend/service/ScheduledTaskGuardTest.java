package com.caltrade.backend.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledTaskGuardTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ScheduledTaskGuard guard = new ScheduledTaskGuard(new DispatchMetrics(meterRegistry));

    @Test
    void returnsTaskResultAndTagsInvocation() {
        AtomicReference<String> invocationId = new AtomicReference<>();

        Optional<String> result = guard.run("calendar-poll", () -> {
            invocationId.set(MDC.get("invocationId"));
            return "done";
        });

        assertThat(result).contains("done");
        assertThat(invocationId.get()).isNotBlank();
        assertThat(MDC.get("invocationId")).isNull();
        assertThat(MDC.get("trigger")).isNull();
    }

    @Test
    void swallowsFaultsAndCountsThem() {
        Optional<Object> result = guard.run("calendar-change", () -> {
            throw new IllegalStateException("calendar down");
        });

        assertThat(result).isEmpty();
        assertThat(meterRegistry.counter("trigger_faults_total", "task", "calendar-change").count()).isEqualTo(1.0);
        assertThat(MDC.get("invocationId")).isNull();
    }

    @Test
    void swallowsErrorsToo() {
        Optional<Object> result = guard.run("calendar-poll", () -> {
            throw new StackOverflowError();
        });

        assertThat(result).isEmpty();
    }
}
