package com.caltrade.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker only. Execution calls are never retried: a repeated order is worse than a missed one.
 */
@Configuration
public class ExecutionResilienceConfig {

    @Bean
    public CircuitBreaker executionCircuitBreaker(CalendarTradeProperties properties) {
        CalendarTradeProperties.Circuit circuit = properties.getExecution().getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .build();
        return CircuitBreaker.of("execution-service", config);
    }
}
