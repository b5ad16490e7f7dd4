package com.fintech.analytics.infrastructure.ingestion;

import com.fintech.analytics.domain.exception.DataLoadException;
import com.fintech.analytics.domain.exception.InvalidRecordDataException;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Consumer;

/**
 * Reads transactions from a CSV file into the {@link TransactionStore}.
 *
 * Expected header: id, date, client_id, card_id, amount, use_chip, merchant_id,
 * merchant_city, merchant_state, zip, mcc, errors.
 *
 * Row handling:
 * - A row with an empty id is skipped silently
 * - A row whose date or amount cannot be parsed is skipped and counted as an error
 * - A missing file, unreadable file or missing header aborts the whole load
 *
 * The load replaces the store contents atomically; on abort the store keeps
 * whatever it held before.
 */
@Slf4j
@Component
public class CsvTransactionLoader {

    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final TransactionStore store;
    private final MeterRegistry meterRegistry;

    /** Rows between progress log lines; zero or less disables them. */
    @Value("${app.data.progress-interval:10000}")
    private int progressInterval = 10000;

    public CsvTransactionLoader(TransactionStore store, MeterRegistry meterRegistry) {
        this.store = store;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Replace the store contents with the transactions in the given file.
     *
     * @throws DataLoadException if the file cannot be read or has no header row
     */
    public LoadReport load(Path csvPath) {
        log.info("Loading transactions from {}", csvPath);

        LoadReport report = store.load(sink -> {
            try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
                return read(reader, csvPath.toString(), sink);
            } catch (NoSuchFileException e) {
                log.error("CSV file not found: {}", csvPath);
                throw new DataLoadException("CSV file not found: " + csvPath, e);
            } catch (IOException e) {
                log.error("Error reading CSV file {}: {}", csvPath, e.getMessage(), e);
                throw new DataLoadException("Cannot read CSV file: " + csvPath, e);
            }
        });

        log.info("Load of '{}' finished. Loaded: {}, skipped: {}, errors: {}",
                report.getSource(), report.getLoadedCount(), report.getSkippedCount(), report.getErrorCount());
        return report;
    }

    /**
     * Parse every row of the reader and hand the valid ones to the sink.
     */
    LoadReport read(Reader reader, String source, Consumer<Transaction> sink) throws IOException {
        int loaded = 0;
        int skipped = 0;
        int errors = 0;

        try (CSVParser parser = CSVParser.parse(reader, FORMAT)) {
            if (parser.getHeaderNames().isEmpty()) {
                throw new DataLoadException("CSV file has no headers: " + source);
            }

            for (CSVRecord csvRecord : parser) {
                long rowNumber = csvRecord.getRecordNumber() + 1;
                try {
                    if (field(csvRecord, "id").isEmpty()) {
                        skipped++;
                        count("skipped");
                        continue;
                    }

                    sink.accept(parseRecord(csvRecord));
                    loaded++;
                    count("loaded");

                    if (progressInterval > 0 && loaded % progressInterval == 0) {
                        log.info("Loaded {} transactions from {}", loaded, source);
                    }
                } catch (InvalidRecordDataException e) {
                    errors++;
                    count("error");
                    log.warn("Error loading transaction at row {} of {}: {}", rowNumber, source, e.getMessage());
                }
            }
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new DataLoadException("Malformed CSV content in " + source + ": " + e.getMessage(), e);
        }

        return LoadReport.builder()
                .source(source)
                .loadedCount(loaded)
                .skippedCount(skipped)
                .errorCount(errors)
                .build();
    }

    Transaction parseRecord(CSVRecord csvRecord) {
        String id = field(csvRecord, "id");
        String errors = field(csvRecord, "errors");

        return Transaction.builder()
                .id(id)
                .date(parseDate(field(csvRecord, "date")))
                .clientId(field(csvRecord, "client_id"))
                .cardId(field(csvRecord, "card_id"))
                .amount(parseAmount(field(csvRecord, "amount")))
                .useChip(field(csvRecord, "use_chip"))
                .merchantId(field(csvRecord, "merchant_id"))
                .merchantCity(field(csvRecord, "merchant_city"))
                .merchantState(field(csvRecord, "merchant_state"))
                .zip(field(csvRecord, "zip"))
                .mcc(field(csvRecord, "mcc"))
                .errors(errors.isEmpty() ? null : errors)
                .build();
    }

    private static LocalDateTime parseDate(String value) {
        if (value.isEmpty()) {
            throw new InvalidRecordDataException("Date is empty");
        }
        try {
            return LocalDateTime.parse(value, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordDataException("Invalid date '" + value + "'", e);
        }
    }

    private static BigDecimal parseAmount(String value) {
        String digits = value.startsWith("$") ? value.substring(1) : value;
        try {
            BigDecimal amount = new BigDecimal(digits);
            if (amount.signum() < 0) {
                throw new InvalidRecordDataException("Negative amount '" + value + "'");
            }
            return amount;
        } catch (NumberFormatException e) {
            throw new InvalidRecordDataException("Invalid amount '" + value + "'", e);
        }
    }

    /**
     * Trimmed column value, empty when the column is absent from the header or the row.
     */
    private static String field(CSVRecord csvRecord, String name) {
        if (!csvRecord.isMapped(name) || !csvRecord.isSet(name)) {
            return "";
        }
        String value = csvRecord.get(name);
        return value == null ? "" : value.trim();
    }

    private void count(String result) {
        Counter.builder("transactions.load.rows")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
