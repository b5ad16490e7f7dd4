package com.fintech.analytics.infrastructure.health;

import com.fintech.analytics.domain.model.HealthStatus;
import com.fintech.analytics.domain.model.SystemMetadata;
import com.fintech.analytics.domain.service.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the store health check through the Actuator health endpoint as the {@code transactionStore} component.
 */
@Component
@RequiredArgsConstructor
public class TransactionStoreHealthIndicator implements HealthIndicator {

    private final HealthService healthService;

    @Override
    public Health health() {
        HealthStatus status = healthService.checkHealth();
        Health.Builder builder = status.isHealthy() ? Health.up() : Health.down();

        if (status.isHealthy()) {
            SystemMetadata metadata = healthService.metadata();
            builder.withDetail("transactions", metadata.getTotalTransactionCount())
                    .withDetail("dataLoadDate", String.valueOf(metadata.getDataLoadDate()));
        }
        return builder
                .withDetail("responseTime", status.getResponseTimeMs() + "ms")
                .build();
    }
}
