package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.AmountBucket;
import com.fintech.analytics.domain.model.AmountDistribution;
import com.fintech.analytics.domain.model.DailyStats;
import com.fintech.analytics.domain.model.OverviewStats;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.domain.model.TypeStats;
import com.fintech.analytics.infrastructure.store.IndexedAttribute;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Volume statistics over the whole store.
 *
 * Every call recomputes from the current store contents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsService {

    /**
     * Amount ranges, lower bound inclusive, upper bound exclusive. A null upper bound is open.
     */
    enum Bucket {
        UP_TO_100("0-100", BigDecimal.ZERO, new BigDecimal("100")),
        UP_TO_500("100-500", new BigDecimal("100"), new BigDecimal("500")),
        UP_TO_1000("500-1000", new BigDecimal("500"), new BigDecimal("1000")),
        ABOVE_1000("1000+", new BigDecimal("1000"), null);

        private final String label;
        private final BigDecimal min;
        private final BigDecimal max;

        Bucket(String label, BigDecimal min, BigDecimal max) {
            this.label = label;
            this.min = min;
            this.max = max;
        }

        boolean contains(BigDecimal amount) {
            return amount.compareTo(min) >= 0 && (max == null || amount.compareTo(max) < 0);
        }
    }

    private final TransactionStore store;

    public OverviewStats overview() {
        List<Transaction> transactions = store.findAll();

        if (transactions.isEmpty()) {
            LocalDateTime now = LocalDateTime.now();
            return OverviewStats.builder()
                    .totalCount(0)
                    .totalAmount(BigDecimal.ZERO)
                    .averageAmount(BigDecimal.ZERO)
                    .minDate(now)
                    .maxDate(now)
                    .build();
        }

        LocalDateTime minDate = transactions.get(0).getDate();
        LocalDateTime maxDate = minDate;
        for (Transaction transaction : transactions) {
            if (transaction.getDate().isBefore(minDate)) {
                minDate = transaction.getDate();
            }
            if (transaction.getDate().isAfter(maxDate)) {
                maxDate = transaction.getDate();
            }
        }

        BigDecimal totalAmount = Amounts.total(transactions);
        return OverviewStats.builder()
                .totalCount(transactions.size())
                .totalAmount(totalAmount)
                .averageAmount(Amounts.average(totalAmount, transactions.size()))
                .minDate(minDate)
                .maxDate(maxDate)
                .build();
    }

    public AmountDistribution amountDistribution() {
        List<Transaction> transactions = store.findAll();
        long[] counts = new long[Bucket.values().length];

        for (Transaction transaction : transactions) {
            for (Bucket bucket : Bucket.values()) {
                if (bucket.contains(transaction.getAmount())) {
                    counts[bucket.ordinal()]++;
                    break;
                }
            }
        }

        List<AmountBucket> buckets = new ArrayList<>();
        for (Bucket bucket : Bucket.values()) {
            long count = counts[bucket.ordinal()];
            buckets.add(AmountBucket.builder()
                    .range(bucket.label)
                    .count(count)
                    .percentage(Amounts.ratio(count, transactions.size()) * 100)
                    .build());
        }
        return AmountDistribution.builder().buckets(buckets).build();
    }

    /**
     * Statistics per merchant category code, highest count first.
     */
    public List<TypeStats> byCategoryCode() {
        List<TypeStats> stats = store.read(view -> {
            List<TypeStats> perCode = new ArrayList<>();
            for (String mcc : view.attributeValues(IndexedAttribute.CATEGORY_CODE)) {
                List<Transaction> transactions = view.findByAttribute(IndexedAttribute.CATEGORY_CODE, mcc);
                BigDecimal totalAmount = Amounts.total(transactions);
                perCode.add(TypeStats.builder()
                        .type(mcc)
                        .count(transactions.size())
                        .totalAmount(totalAmount)
                        .averageAmount(Amounts.average(totalAmount, transactions.size()))
                        .build());
            }
            return perCode;
        });

        stats.sort(Comparator.comparingLong(TypeStats::getCount).reversed());
        return stats;
    }

    /**
     * Statistics per calendar day, oldest day first.
     */
    public List<DailyStats> daily() {
        Map<LocalDate, List<Transaction>> byDay = new TreeMap<>();
        for (Transaction transaction : store.findAll()) {
            byDay.computeIfAbsent(transaction.getDate().toLocalDate(), day -> new ArrayList<>())
                    .add(transaction);
        }

        List<DailyStats> stats = new ArrayList<>(byDay.size());
        byDay.forEach((day, transactions) -> {
            BigDecimal totalAmount = Amounts.total(transactions);
            stats.add(DailyStats.builder()
                    .date(day)
                    .count(transactions.size())
                    .totalAmount(totalAmount)
                    .averageAmount(Amounts.average(totalAmount, transactions.size()))
                    .build());
        });
        log.debug("Computed daily statistics for {} days", stats.size());
        return stats;
    }
}
