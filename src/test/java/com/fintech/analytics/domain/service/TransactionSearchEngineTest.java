package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.SearchFilters;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static com.fintech.analytics.TestTransactions.transaction;
import static org.junit.jupiter.api.Assertions.*;

class TransactionSearchEngineTest {

    private TransactionStore store;
    private TransactionSearchEngine searchEngine;

    @BeforeEach
    void setUp() {
        store = new TransactionStore();
        searchEngine = new TransactionSearchEngine(store);

        store.add(transaction("1").clientId("C001").amount(new BigDecimal("50.00"))
                .merchantCity("Paris").useChip("Swipe Transaction")
                .date(LocalDateTime.of(2023, 1, 1, 9, 0)).build());
        store.add(transaction("2").clientId("C001").amount(new BigDecimal("250.00"))
                .merchantCity("Lyon").useChip("Online Transaction")
                .date(LocalDateTime.of(2023, 1, 3, 9, 0)).build());
        store.add(transaction("3").clientId("C002").amount(new BigDecimal("1000.00"))
                .merchantCity("Paris").useChip("Chip Transaction")
                .date(LocalDateTime.of(2023, 1, 2, 9, 0)).build());
        store.add(transaction("4").clientId("C003").amount(new BigDecimal("100.00"))
                .merchantCity("Paris").useChip("Swipe Transaction")
                .date(LocalDateTime.of(2023, 1, 4, 9, 0)).build());
    }

    @Test
    void noCriteria_returnsEverythingNewestFirst() {
        List<Transaction> result = searchEngine.search(new SearchFilters());

        assertEquals(List.of("4", "2", "3", "1"), ids(result));
    }

    @Test
    void amountBounds_areInclusive() {
        SearchFilters filters = SearchFilters.builder()
                .minAmount(new BigDecimal("100"))
                .maxAmount(new BigDecimal("1000"))
                .build();

        assertEquals(List.of("4", "2", "3"), ids(searchEngine.search(filters)));
    }

    @Test
    void criteria_combineWithLogicalAnd() {
        SearchFilters filters = SearchFilters.builder()
                .merchantCity("Paris")
                .useChip("Swipe Transaction")
                .maxAmount(new BigDecimal("75"))
                .build();

        List<Transaction> result = searchEngine.search(filters);

        assertEquals(List.of("1"), ids(result));
        result.forEach(t -> {
            assertEquals("Paris", t.getMerchantCity());
            assertEquals("Swipe Transaction", t.getUseChip());
            assertTrue(t.getAmount().compareTo(new BigDecimal("75")) <= 0);
        });
    }

    @Test
    void customerFilter_usesCustomerIndexAndAppliesOtherCriteria() {
        SearchFilters filters = SearchFilters.builder()
                .clientId("C001")
                .minAmount(new BigDecimal("100"))
                .build();

        assertEquals(List.of("2"), ids(searchEngine.search(filters)));
    }

    @Test
    void transactionIdFilter_matchesExactlyOneOrNone() {
        assertEquals(List.of("3"), ids(searchEngine.search(SearchFilters.builder().transactionId("3").build())));
        assertTrue(searchEngine.search(SearchFilters.builder().transactionId("3").clientId("C001").build()).isEmpty());
        assertTrue(searchEngine.search(SearchFilters.builder().transactionId("99").build()).isEmpty());
    }

    @Test
    void unknownValues_matchNothing() {
        assertTrue(searchEngine.search(SearchFilters.builder().merchantCity("Berlin").build()).isEmpty());
        assertTrue(searchEngine.search(SearchFilters.builder().clientId("C999").build()).isEmpty());
    }

    @Test
    void negativeLowerBound_matchesEveryRecord() {
        SearchFilters filters = SearchFilters.builder().minAmount(new BigDecimal("-1")).build();

        assertEquals(List.of("4", "2", "3", "1"), ids(searchEngine.search(filters)));
    }

    @Test
    void negativeUpperBound_matchesNothing() {
        SearchFilters filters = SearchFilters.builder().maxAmount(new BigDecimal("-0.01")).build();

        assertTrue(searchEngine.search(filters).isEmpty());
    }

    @Test
    void lowerBoundAboveUpperBound_matchesNothing() {
        SearchFilters filters = SearchFilters.builder()
                .minAmount(new BigDecimal("500"))
                .maxAmount(new BigDecimal("100"))
                .build();

        assertTrue(searchEngine.search(filters).isEmpty());
    }

    private static List<String> ids(List<Transaction> transactions) {
        return transactions.stream().map(Transaction::getId).collect(Collectors.toList());
    }
}
