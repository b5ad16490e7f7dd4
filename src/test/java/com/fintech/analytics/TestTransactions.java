package com.fintech.analytics;

import com.fintech.analytics.domain.model.Transaction;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Builders for transaction fixtures.
 */
public final class TestTransactions {

    private TestTransactions() {
    }

    public static Transaction.TransactionBuilder transaction(String id) {
        return Transaction.builder()
                .id(id)
                .date(LocalDateTime.of(2023, 1, 1, 12, 0, 0))
                .clientId("C001")
                .cardId("CARD001")
                .amount(new BigDecimal("100.00"))
                .useChip("Swipe Transaction")
                .merchantId("M001")
                .merchantCity("New York")
                .merchantState("NY")
                .zip("10001")
                .mcc("5411");
    }

    public static Transaction transaction(String id, String clientId, String amount, LocalDateTime date) {
        return transaction(id)
                .clientId(clientId)
                .amount(new BigDecimal(amount))
                .date(date)
                .build();
    }
}
