package com.fintech.analytics.infrastructure.store;

import com.fintech.analytics.domain.model.Transaction;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over the transaction store.
 *
 * Lists returned are copies. Unknown keys produce empty results.
 */
public interface TransactionView {

    Optional<Transaction> findById(String id);

    /**
     * All records in insertion order.
     */
    List<Transaction> findAll();

    /**
     * Records whose attribute equals the value, in index insertion order.
     */
    List<Transaction> findByAttribute(IndexedAttribute attribute, String value);

    int countByAttribute(IndexedAttribute attribute, String value);

    /**
     * Distinct values of the attribute that currently have records.
     */
    List<String> attributeValues(IndexedAttribute attribute);

    /**
     * Records carrying a non-blank error flag.
     */
    List<Transaction> findFlagged();

    int size();

    Optional<LocalDateTime> minDate();

    Optional<LocalDateTime> maxDate();

    /**
     * Time of the last successful bulk load, empty before the first one.
     */
    Optional<LocalDateTime> loadedAt();
}
