package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.Transaction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;

/**
 * Amount arithmetic shared by the aggregation services.
 */
final class Amounts {

    private Amounts() {
    }

    static BigDecimal total(Collection<Transaction> transactions) {
        BigDecimal total = BigDecimal.ZERO;
        for (Transaction transaction : transactions) {
            total = total.add(transaction.getAmount());
        }
        return total;
    }

    /**
     * Zero when count is zero.
     */
    static BigDecimal average(BigDecimal total, long count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return total.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
    }

    static double ratio(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }
}
