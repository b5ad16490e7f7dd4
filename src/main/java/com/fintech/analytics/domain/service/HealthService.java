package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.HealthStatus;
import com.fintech.analytics.domain.model.SystemMetadata;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Liveness check and data set metadata.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    private final TransactionStore store;

    @Value("${app.api.version:1.0.0}")
    private String apiVersion;

    /**
     * Check the store with a trivial read. Any failure reports "unhealthy".
     */
    public HealthStatus checkHealth() {
        long start = System.nanoTime();
        String status;
        try {
            store.size();
            status = HealthStatus.HEALTHY;
        } catch (RuntimeException e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            status = HealthStatus.UNHEALTHY;
        }
        double responseTimeMs = Math.max(0, System.nanoTime() - start) / 1_000_000.0;

        return HealthStatus.builder()
                .status(status)
                .responseTimeMs(responseTimeMs)
                .build();
    }

    /**
     * Date bounds fall back to the current time while the store is empty.
     */
    public SystemMetadata metadata() {
        LocalDateTime now = LocalDateTime.now();

        return store.read(view -> {
            int count = view.size();
            return SystemMetadata.builder()
                    .totalTransactionCount(count)
                    .dataLoadDate(view.loadedAt().orElse(now))
                    .apiVersion(apiVersion)
                    .minDate(count == 0 ? now : view.minDate().orElse(now))
                    .maxDate(count == 0 ? now : view.maxDate().orElse(now))
                    .build();
        });
    }
}
