package com.caltrade.backend.service;

import com.caltrade.backend.model.TriggerSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DispatchMetrics {

    private final MeterRegistry meterRegistry;

    public void recordDispatched(TriggerSource source) {
        counter("trades_dispatched_total", source).increment();
    }

    public void recordFailed(TriggerSource source) {
        counter("trades_failed_total", source).increment();
    }

    public void recordDuplicateSkipped(TriggerSource source) {
        counter("dispatch_duplicates_skipped_total", source).increment();
    }

    public void recordTriggerFault(String task) {
        Counter.builder("trigger_faults_total")
                .tag("task", task)
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startExecutionCall() {
        return Timer.start(meterRegistry);
    }

    public void stopExecutionCall(Timer.Sample sample, String endpoint, boolean success) {
        sample.stop(Timer.builder("execution_call_latency")
                .tag("endpoint", endpoint)
                .tag("status", success ? "success" : "error")
                .register(meterRegistry));
    }

    private Counter counter(String name, TriggerSource source) {
        return Counter.builder(name)
                .tag("source", source == null ? "unknown" : source.name())
                .register(meterRegistry);
    }
}
