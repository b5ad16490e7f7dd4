package com.fintech.analytics;

import com.fintech.analytics.infrastructure.health.TransactionStoreHealthIndicator;
import com.fintech.analytics.infrastructure.ingestion.CsvTransactionLoader;
import com.fintech.analytics.infrastructure.ingestion.LoadReport;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full application context over the sample data set.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TransactionAnalyticsApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CsvTransactionLoader loader;

    @Autowired
    private ApplicationContext context;

    @BeforeEach
    void loadSampleData() throws Exception {
        LoadReport report = loader.load(new ClassPathResource("sample-transactions.csv").getFile().toPath());

        assertEquals(3, report.getLoadedCount());
        assertEquals(1, report.getSkippedCount());
        assertEquals(1, report.getErrorCount());
    }

    @Test
    void context_registersStoreAndHealthIndicatorUnderDistinctNames() {
        assertInstanceOf(TransactionStore.class, context.getBean("transactionStore"));
        assertInstanceOf(TransactionStoreHealthIndicator.class, context.getBean("transactionStoreHealthIndicator"));
    }

    @Test
    void listing_isNewestFirst() throws Exception {
        mockMvc.perform(get("/api/transaction").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].id").value("3"))
                .andExpect(jsonPath("$.data[1].id").value("2"))
                .andExpect(jsonPath("$.pagination.total_count").value(3))
                .andExpect(jsonPath("$.pagination.total_pages").value(2))
                .andExpect(jsonPath("$.pagination.has_next_page").value(true));
    }

    @Test
    void customerAndFraudViews() throws Exception {
        mockMvc.perform(get("/api/customers/C001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transaction_count").value(2))
                .andExpect(jsonPath("$.total_amount").value(300.0))
                .andExpect(jsonPath("$.average_amount").value(150.0));

        mockMvc.perform(get("/api/fraud/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_fraud_count").value(1))
                .andExpect(jsonPath("$.fraud_rate").value(closeTo(1.0 / 3, 1e-9)))
                .andExpect(jsonPath("$.total_fraud_amount").value(150.0));

        mockMvc.perform(get("/api/customers/Ranked/top").param("n", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].customer_id").value("C001"));
    }

    @Test
    void delete_isVisibleToLaterReads() throws Exception {
        mockMvc.perform(delete("/api/transaction/1"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/transaction/1"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/customers/C001"))
                .andExpect(jsonPath("$.transaction_count").value(1));
        mockMvc.perform(get("/api/system/metadata"))
                .andExpect(jsonPath("$.total_transaction_count").value(2))
                .andExpect(jsonPath("$.api_version").value("1.0.0"));
    }

    @Test
    void actuatorHealth_includesStoreContributor() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.transactionStore.status").value("UP"))
                .andExpect(jsonPath("$.components.transactionStore.details.transactions").value(3));
    }
}
