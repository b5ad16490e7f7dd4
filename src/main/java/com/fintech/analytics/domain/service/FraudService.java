package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.FraudPrediction;
import com.fintech.analytics.domain.model.FraudSummary;
import com.fintech.analytics.domain.model.FraudTypeStats;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.infrastructure.store.IndexedAttribute;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fraud summaries over flagged transactions and a rule-based fraud score.
 *
 * A transaction counts as fraudulent when its error flag is set. The score is
 * a fixed heuristic:
 * - error flag present: +0.8
 * - amount above 5000: +0.2, otherwise amount above 2000: +0.1
 * - no payment channel: +0.1
 * clamped to [0, 1].
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudService {

    static final BigDecimal VERY_HIGH_AMOUNT = new BigDecimal("5000");
    static final BigDecimal HIGH_AMOUNT = new BigDecimal("2000");
    static final String NO_INDICATORS = "No fraud indicators detected";

    private final TransactionStore store;

    public FraudSummary summary() {
        return store.read(view -> {
            List<Transaction> flagged = view.findFlagged();

            return FraudSummary.builder()
                    .totalFraudCount(flagged.size())
                    .fraudRate(Amounts.ratio(flagged.size(), view.size()))
                    .totalFraudAmount(Amounts.total(flagged))
                    .build();
        });
    }

    /**
     * Fraud rate per payment channel type, highest rate first.
     */
    public List<FraudTypeStats> byChannelType() {
        List<FraudTypeStats> stats = store.read(view -> {
            List<FraudTypeStats> perType = new ArrayList<>();
            for (String channelType : view.attributeValues(IndexedAttribute.CHANNEL_TYPE)) {
                List<Transaction> transactions = view.findByAttribute(IndexedAttribute.CHANNEL_TYPE, channelType);
                long fraudCount = transactions.stream().filter(Transaction::isFlagged).count();

                perType.add(FraudTypeStats.builder()
                        .type(channelType)
                        .fraudCount(fraudCount)
                        .totalCount(transactions.size())
                        .fraudRate(Amounts.ratio(fraudCount, transactions.size()))
                        .build());
            }
            return perType;
        });

        stats.sort(Comparator.comparingDouble(FraudTypeStats::getFraudRate).reversed());
        return stats;
    }

    public FraudPrediction predict(Transaction transaction) {
        double score = 0.0;
        List<String> indicators = new ArrayList<>();

        if (transaction.isFlagged()) {
            score += 0.8;
            indicators.add("Error flag present: " + transaction.getErrors());
        }

        BigDecimal amount = transaction.getAmount();
        if (amount != null && amount.compareTo(VERY_HIGH_AMOUNT) > 0) {
            score += 0.2;
            indicators.add("Very high amount (> 5000)");
        } else if (amount != null && amount.compareTo(HIGH_AMOUNT) > 0) {
            score += 0.1;
            indicators.add("High amount (> 2000)");
        }

        if (transaction.getUseChip() == null || transaction.getUseChip().isBlank()) {
            score += 0.1;
            indicators.add("Missing transaction type");
        }

        score = Math.max(0.0, Math.min(1.0, score));
        String reasoning = indicators.isEmpty() ? NO_INDICATORS : String.join("; ", indicators);

        log.debug("Fraud score for transaction {}: {} ({})", transaction.getId(), score, reasoning);
        return FraudPrediction.builder()
                .fraudScore(score)
                .reasoning(reasoning)
                .build();
    }
}
