package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.CustomerSummary;
import com.fintech.analytics.domain.model.FraudSummary;
import com.fintech.analytics.domain.model.FraudTypeStats;
import com.fintech.analytics.domain.model.PaginatedResponse;
import com.fintech.analytics.domain.model.SystemMetadata;
import com.fintech.analytics.domain.model.TopCustomer;
import com.fintech.analytics.domain.model.TransactionTypeCount;
import com.fintech.analytics.domain.model.TypeStats;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import com.fintech.analytics.infrastructure.store.TransactionView;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

import static com.fintech.analytics.TestTransactions.transaction;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Aggregations racing a delete: the delete is started from another thread while
 * the aggregation is inside its store read, and must not be visible halfway.
 */
class ConsistentAggregationTest {

    private DeleteDuringReadStore store;

    @BeforeEach
    void setUp() {
        store = new DeleteDuringReadStore("1");
        store.add(transaction("1").clientId("C001").useChip("Swipe Transaction").mcc("5411")
                .amount(new BigDecimal("100.00")).errors("Bad PIN").build());
        store.add(transaction("2").clientId("C002").useChip("Online Transaction").mcc("5812")
                .amount(new BigDecimal("40.00")).build());
    }

    @AfterEach
    void deleteLandsAfterTheRead() throws InterruptedException {
        store.awaitDelete();
        assertEquals(1, store.size());
        assertTrue(store.findById("1").isEmpty());
    }

    @Test
    void top_neverListsCustomersWithoutTransactions() {
        List<TopCustomer> top = new CustomerService(store, new PaginationService()).top(10);

        assertEquals(2, top.size());
        top.forEach(customer -> assertEquals(1, customer.getTransactionCount()));
    }

    @Test
    void listAll_countsMatchTheListedCustomers() {
        PaginatedResponse<CustomerSummary> page = new CustomerService(store, new PaginationService()).listAll(1, 50);

        assertEquals(2, page.getPagination().getTotalCount());
        page.getData().forEach(summary -> assertEquals(1, summary.getTransactionCount()));
    }

    @Test
    void fraudByChannelType_totalsAddUpToOneState() {
        List<FraudTypeStats> stats = new FraudService(store).byChannelType();

        assertEquals(2, stats.stream().mapToLong(FraudTypeStats::getTotalCount).sum());
        stats.forEach(s -> assertTrue(s.getTotalCount() > 0));
    }

    @Test
    void fraudSummary_rateAndAmountComeFromOneState() {
        FraudSummary summary = new FraudService(store).summary();

        assertEquals(1, summary.getTotalFraudCount());
        assertEquals(0.5, summary.getFraudRate(), 1e-9);
        assertEquals(0, summary.getTotalFraudAmount().compareTo(new BigDecimal("100.00")));
    }

    @Test
    void byCategoryCode_hasNoEmptyCodes() {
        List<TypeStats> stats = new StatisticsService(store).byCategoryCode();

        assertEquals(2, stats.size());
        stats.forEach(s -> assertEquals(1, s.getCount()));
    }

    @Test
    void transactionTypes_countsComeFromOneState() {
        TransactionQueryService queryService = new TransactionQueryService(
                store, new TransactionSearchEngine(store), new PaginationService(), new SimpleMeterRegistry());

        List<TransactionTypeCount> types = queryService.getTransactionTypes();

        assertEquals(2, types.stream().mapToLong(TransactionTypeCount::getCount).sum());
    }

    @Test
    void metadata_countMatchesDateBounds() {
        HealthService healthService = new HealthService(store);
        ReflectionTestUtils.setField(healthService, "apiVersion", "1.0.0");

        SystemMetadata metadata = healthService.metadata();

        assertEquals(2, metadata.getTotalTransactionCount());
        assertEquals(store.minDate().orElseThrow(), metadata.getMinDate());
        assertEquals(store.maxDate().orElseThrow(), metadata.getMaxDate());
    }

    /**
     * Starts a delete on another thread on the first consistent read and waits
     * until that delete is parked behind the read lock before running the query.
     */
    private static class DeleteDuringReadStore extends TransactionStore {

        private final String idToDelete;
        private Thread deleter;

        DeleteDuringReadStore(String idToDelete) {
            this.idToDelete = idToDelete;
        }

        @Override
        public <T> T read(Function<TransactionView, T> query) {
            return super.read(view -> {
                if (deleter == null && view.size() == 2) {
                    deleter = new Thread(() -> delete(idToDelete));
                    deleter.start();
                    awaitParked(deleter);
                }
                return query.apply(view);
            });
        }

        void awaitDelete() throws InterruptedException {
            assertNotNull(deleter, "no read was issued");
            deleter.join(10_000);
            assertFalse(deleter.isAlive());
        }

        private static void awaitParked(Thread thread) {
            long deadline = System.currentTimeMillis() + 5_000;
            while (thread.getState() != Thread.State.WAITING) {
                if (System.currentTimeMillis() > deadline) {
                    fail("delete never blocked on the store lock");
                }
                Thread.onSpinWait();
            }
        }
    }
}
