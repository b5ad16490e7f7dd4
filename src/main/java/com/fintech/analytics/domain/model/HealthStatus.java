package com.fintech.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private String status;
    private double responseTimeMs;

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
