package com.fintech.analytics.api;

import com.fintech.analytics.domain.model.AmountDistribution;
import com.fintech.analytics.domain.model.DailyStats;
import com.fintech.analytics.domain.model.OverviewStats;
import com.fintech.analytics.domain.model.TypeStats;
import com.fintech.analytics.domain.service.StatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatisticsController {

    private final StatisticsService statisticsService;

    @GetMapping("/overview")
    public ResponseEntity<OverviewStats> overview() {
        return ResponseEntity.ok(statisticsService.overview());
    }

    @GetMapping("/amount-distribution")
    public ResponseEntity<AmountDistribution> amountDistribution() {
        return ResponseEntity.ok(statisticsService.amountDistribution());
    }

    /**
     * Statistics per merchant category code.
     */
    @GetMapping("/by-type")
    public ResponseEntity<List<TypeStats>> byType() {
        return ResponseEntity.ok(statisticsService.byCategoryCode());
    }

    @GetMapping("/daily")
    public ResponseEntity<List<DailyStats>> daily() {
        return ResponseEntity.ok(statisticsService.daily());
    }
}
