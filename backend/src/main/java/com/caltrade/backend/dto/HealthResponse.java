package com.caltrade.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class HealthResponse {
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private String status;
    private Instant checkedAt;
    private Map<String, Check> checks;

    public record Check(boolean ok, String detail) {
    }
}
