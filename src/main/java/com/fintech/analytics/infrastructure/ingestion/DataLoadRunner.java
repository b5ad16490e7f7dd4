package com.fintech.analytics.infrastructure.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Loads the transaction data set once at startup.
 *
 * A failed load propagates and stops the application.
 * Disabled with {@code app.data.load-on-startup=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.data.load-on-startup", havingValue = "true", matchIfMissing = true)
public class DataLoadRunner implements ApplicationRunner {

    private final CsvTransactionLoader loader;

    @Value("${app.data.csv-path}")
    private String csvPath;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Loading transaction data from {}", csvPath);
        try {
            LoadReport report = loader.load(Path.of(csvPath));
            log.info("Successfully loaded {} transactions", report.getLoadedCount());
        } catch (RuntimeException e) {
            log.error("Failed to load transaction data: {}", e.getMessage());
            throw e;
        }
    }
}
