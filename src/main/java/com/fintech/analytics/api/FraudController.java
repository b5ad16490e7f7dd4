package com.fintech.analytics.api;

import com.fintech.analytics.domain.model.FraudPrediction;
import com.fintech.analytics.domain.model.FraudSummary;
import com.fintech.analytics.domain.model.FraudTypeStats;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.domain.service.FraudService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/fraud")
@RequiredArgsConstructor
public class FraudController {

    private final FraudService fraudService;

    @GetMapping("/summary")
    public ResponseEntity<FraudSummary> summary() {
        return ResponseEntity.ok(fraudService.summary());
    }

    /**
     * Fraud rate per payment channel type.
     */
    @GetMapping("/by-type")
    public ResponseEntity<List<FraudTypeStats>> byType() {
        return ResponseEntity.ok(fraudService.byChannelType());
    }

    /**
     * Score a transaction with the fraud heuristic. The transaction need not be stored.
     */
    @PostMapping("/predict")
    public ResponseEntity<FraudPrediction> predict(@Valid @RequestBody Transaction transaction) {
        log.info("Fraud prediction requested for transaction {}", transaction.getId());
        return ResponseEntity.ok(fraudService.predict(transaction));
    }
}
