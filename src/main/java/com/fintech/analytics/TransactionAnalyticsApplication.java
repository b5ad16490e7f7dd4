package com.fintech.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Transaction Analytics API
 *
 * Read-mostly query service over a fixed set of card transactions.
 *
 * Architecture:
 * - CSV data set loaded once at startup into an in-memory indexed store
 * - Secondary indexes by customer, merchant, category code and channel type
 * - Paginated listing and multi-criteria search, newest first
 * - Statistics, fraud, customer and health views recomputed per request
 * - Single-record delete as the only mutation after load
 */
@SpringBootApplication
public class TransactionAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionAnalyticsApplication.class, args);
    }
}
