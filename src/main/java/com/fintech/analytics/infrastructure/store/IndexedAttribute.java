package com.fintech.analytics.infrastructure.store;

import com.fintech.analytics.domain.model.Transaction;

import java.util.function.Function;

/**
 * Transaction attributes that carry a secondary index in {@link TransactionStore}.
 */
public enum IndexedAttribute {

    CUSTOMER(Transaction::getClientId),
    MERCHANT(Transaction::getMerchantId),
    CATEGORY_CODE(Transaction::getMcc),
    CHANNEL_TYPE(Transaction::getUseChip);

    private final Function<Transaction, String> extractor;

    IndexedAttribute(Function<Transaction, String> extractor) {
        this.extractor = extractor;
    }

    /**
     * Index key of the given transaction. Missing values index under the empty string.
     */
    public String keyOf(Transaction transaction) {
        String value = extractor.apply(transaction);
        return value == null ? "" : value;
    }
}
