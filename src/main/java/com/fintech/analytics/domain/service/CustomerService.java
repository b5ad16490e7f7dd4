package com.fintech.analytics.domain.service;

import com.fintech.analytics.domain.model.Customer;
import com.fintech.analytics.domain.model.CustomerSummary;
import com.fintech.analytics.domain.model.PageRequest;
import com.fintech.analytics.domain.model.PaginatedResponse;
import com.fintech.analytics.domain.model.TopCustomer;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.infrastructure.store.IndexedAttribute;
import com.fintech.analytics.infrastructure.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Customer-level views derived from the customer index.
 *
 * An unknown customer is not an error: details come back zero-valued with the
 * requested id echoed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService {

    private final TransactionStore store;
    private final PaginationService paginationService;

    /**
     * Distinct customers in ascending id order with their transaction counts.
     */
    public PaginatedResponse<CustomerSummary> listAll(int page, int limit) {
        PageRequest request = paginationService.validateParams(page, limit);

        return store.read(view -> {
            List<String> customerIds = view.attributeValues(IndexedAttribute.CUSTOMER);
            customerIds.sort(Comparator.naturalOrder());

            int from = (int) Math.min(request.offset(), customerIds.size());
            int to = (int) Math.min((long) from + request.getLimit(), customerIds.size());

            List<CustomerSummary> summaries = new ArrayList<>(to - from);
            for (String customerId : customerIds.subList(from, to)) {
                summaries.add(CustomerSummary.builder()
                        .customerId(customerId)
                        .transactionCount(view.countByAttribute(IndexedAttribute.CUSTOMER, customerId))
                        .build());
            }
            return paginationService.buildEnvelope(summaries, request.getPage(), request.getLimit(), customerIds.size());
        });
    }

    public Customer details(String customerId) {
        List<Transaction> transactions = store.findByAttribute(IndexedAttribute.CUSTOMER, customerId);
        if (transactions.isEmpty()) {
            log.debug("No transactions for customer {}", customerId);
        }

        BigDecimal totalAmount = Amounts.total(transactions);
        return Customer.builder()
                .customerId(customerId)
                .transactionCount(transactions.size())
                .totalAmount(totalAmount)
                .averageAmount(Amounts.average(totalAmount, transactions.size()))
                .build();
    }

    /**
     * The n customers with the most transactions.
     */
    public List<TopCustomer> top(int n) {
        List<TopCustomer> customers = store.read(view -> {
            List<TopCustomer> ranked = new ArrayList<>();
            for (String customerId : view.attributeValues(IndexedAttribute.CUSTOMER)) {
                List<Transaction> transactions = view.findByAttribute(IndexedAttribute.CUSTOMER, customerId);
                ranked.add(TopCustomer.builder()
                        .customerId(customerId)
                        .transactionCount(transactions.size())
                        .totalAmount(Amounts.total(transactions))
                        .build());
            }
            return ranked;
        });

        customers.sort(Comparator.comparingLong(TopCustomer::getTransactionCount).reversed());
        return new ArrayList<>(customers.subList(0, Math.min(Math.max(n, 0), customers.size())));
    }
}
