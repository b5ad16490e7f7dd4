package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.SearchFilters;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.infrastructure.store.IndexedAttribute;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Conjunctive filter over the transaction store.
 *
 * Starts from the narrowest candidate set the store can supply (exact id, then
 * the customer index, then everything) and applies the remaining criteria in a
 * single pass. Matches are returned newest first. Any combination of criteria
 * is accepted; contradictory bounds simply match nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionSearchEngine {

    static final Comparator<Transaction> NEWEST_FIRST =
            Comparator.comparing(Transaction::getDate).reversed();

    private final TransactionStore store;

    public List<Transaction> search(SearchFilters filters) {
        Predicate<Transaction> predicate = compose(filters);
        List<Transaction> matches = new ArrayList<>();
        for (Transaction transaction : candidates(filters)) {
            if (predicate.test(transaction)) {
                matches.add(transaction);
            }
        }

        matches.sort(NEWEST_FIRST);
        log.debug("Search {} matched {} transactions", filters, matches.size());
        return matches;
    }

    private List<Transaction> candidates(SearchFilters filters) {
        if (filters.getTransactionId() != null) {
            return store.findById(filters.getTransactionId()).map(List::of).orElse(List.of());
        }
        if (filters.getClientId() != null) {
            return store.findByAttribute(IndexedAttribute.CUSTOMER, filters.getClientId());
        }
        return store.findAll();
    }

    private Predicate<Transaction> compose(SearchFilters filters) {
        Predicate<Transaction> predicate = t -> true;

        if (filters.getMinAmount() != null) {
            BigDecimal min = filters.getMinAmount();
            predicate = predicate.and(t -> t.getAmount().compareTo(min) >= 0);
        }
        if (filters.getMaxAmount() != null) {
            BigDecimal max = filters.getMaxAmount();
            predicate = predicate.and(t -> t.getAmount().compareTo(max) <= 0);
        }
        if (filters.getClientId() != null) {
            String clientId = filters.getClientId();
            predicate = predicate.and(t -> clientId.equals(t.getClientId()));
        }
        if (filters.getTransactionId() != null) {
            String transactionId = filters.getTransactionId();
            predicate = predicate.and(t -> transactionId.equals(t.getId()));
        }
        if (filters.getMerchantCity() != null) {
            String merchantCity = filters.getMerchantCity();
            predicate = predicate.and(t -> merchantCity.equals(t.getMerchantCity()));
        }
        if (filters.getUseChip() != null) {
            String useChip = filters.getUseChip();
            predicate = predicate.and(t -> useChip.equals(t.getUseChip()));
        }
        return predicate;
    }
}
