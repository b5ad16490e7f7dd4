package com.fintech.analytics.api;

import com.fintech.analytics.domain.model.HealthStatus;
import com.fintech.analytics.domain.model.SystemMetadata;
import com.fintech.analytics.domain.service.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final HealthService healthService;

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(healthService.checkHealth());
    }

    @GetMapping("/metadata")
    public ResponseEntity<SystemMetadata> metadata() {
        return ResponseEntity.ok(healthService.metadata());
    }
}
