package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.exception.TransactionNotFoundException;
import com.fintech.analytics.domain.model.PageRequest;
import com.fintech.analytics.domain.model.PaginatedResponse;
import com.fintech.analytics.domain.model.SearchFilters;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.domain.model.TransactionTypeCount;
import com.fintech.analytics.infrastructure.store.IndexedAttribute;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Transaction listing, lookup, search and deletion.
 *
 * Every listing is ordered newest first and wrapped in a pagination envelope.
 * Unknown ids are reported as {@link TransactionNotFoundException}; unknown
 * customers or merchants simply yield an empty page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    private final TransactionStore store;
    private final TransactionSearchEngine searchEngine;
    private final PaginationService paginationService;
    private final MeterRegistry meterRegistry;

    public PaginatedResponse<Transaction> getAll(int page, int limit) {
        PageRequest request = paginationService.validateParams(page, limit);
        return paginationService.paginate(newestFirst(store.findAll()), request);
    }

    public Transaction getById(String transactionId) {
        return store.findById(transactionId)
                .orElseThrow(() -> {
                    log.warn("Transaction not found: {}", transactionId);
                    return new TransactionNotFoundException(transactionId);
                });
    }

    public PaginatedResponse<Transaction> search(SearchFilters filters, int page, int limit) {
        PageRequest request = paginationService.validateParams(page, limit);
        Timer.Sample sample = Timer.start(meterRegistry);

        List<Transaction> matches = searchEngine.search(filters);

        sample.stop(Timer.builder("transactions.search.latency")
                .register(meterRegistry));
        return paginationService.paginate(matches, request);
    }

    public void delete(String transactionId) {
        if (!store.delete(transactionId)) {
            log.warn("Transaction not found for deletion: {}", transactionId);
            throw new TransactionNotFoundException(transactionId);
        }

        Counter.builder("transactions.deleted")
                .register(meterRegistry)
                .increment();
        log.info("Deleted transaction: {}", transactionId);
    }

    /**
     * Transaction count per payment channel type, most frequent first.
     */
    public List<TransactionTypeCount> getTransactionTypes() {
        List<TransactionTypeCount> counts = store.read(view -> {
            List<TransactionTypeCount> perType = new ArrayList<>();
            for (String channelType : view.attributeValues(IndexedAttribute.CHANNEL_TYPE)) {
                perType.add(TransactionTypeCount.builder()
                        .type(channelType)
                        .count(view.countByAttribute(IndexedAttribute.CHANNEL_TYPE, channelType))
                        .build());
            }
            return perType;
        });
        counts.sort(Comparator.comparingLong(TransactionTypeCount::getCount).reversed());
        return counts;
    }

    public PaginatedResponse<Transaction> getRecent(int limit) {
        return getAll(PaginationService.DEFAULT_PAGE, limit);
    }

    public PaginatedResponse<Transaction> getByCustomer(String customerId, int page, int limit) {
        return byAttribute(IndexedAttribute.CUSTOMER, customerId, page, limit);
    }

    public PaginatedResponse<Transaction> getByMerchant(String merchantId, int page, int limit) {
        return byAttribute(IndexedAttribute.MERCHANT, merchantId, page, limit);
    }

    private PaginatedResponse<Transaction> byAttribute(IndexedAttribute attribute, String value, int page, int limit) {
        PageRequest request = paginationService.validateParams(page, limit);
        return paginationService.paginate(newestFirst(store.findByAttribute(attribute, value)), request);
    }

    private static List<Transaction> newestFirst(List<Transaction> transactions) {
        transactions.sort(TransactionSearchEngine.NEWEST_FIRST);
        return transactions;
    }
}
