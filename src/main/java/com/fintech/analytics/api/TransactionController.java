package com.fintech.analytics.api;

import com.fintech.analytics.domain.model.PaginatedResponse;
import com.fintech.analytics.domain.model.Transaction;
import com.fintech.analytics.domain.model.TransactionTypeCount;
import com.fintech.analytics.domain.service.TransactionQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for transaction listing, lookup, search and deletion.
 *
 * Page and limit are validated by the service layer; invalid values yield 400.
 */
@Slf4j
@RestController
@RequestMapping("/api/transaction")
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionQueryService transactionQueryService;

    /**
     * GET /api/transaction?page=1&limit=50
     */
    @GetMapping
    public ResponseEntity<PaginatedResponse<Transaction>> getAll(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(transactionQueryService.getAll(page, limit));
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<Transaction> getById(@PathVariable String transactionId) {
        return ResponseEntity.ok(transactionQueryService.getById(transactionId));
    }

    @DeleteMapping("/{transactionId}")
    public ResponseEntity<Void> delete(@PathVariable String transactionId) {
        transactionQueryService.delete(transactionId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Multi-criteria search. Every criterion in the body is optional.
     */
    @PostMapping("/transactionResearch/search")
    public ResponseEntity<PaginatedResponse<Transaction>> search(
            @RequestBody SearchRequest searchRequest,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit) {
        log.debug("Search request: {}", searchRequest);
        return ResponseEntity.ok(transactionQueryService.search(searchRequest.toFilters(), page, limit));
    }

    @GetMapping("/Type/types")
    public ResponseEntity<List<TransactionTypeCount>> getTransactionTypes() {
        return ResponseEntity.ok(transactionQueryService.getTransactionTypes());
    }

    @GetMapping("/Latest/recent")
    public ResponseEntity<PaginatedResponse<Transaction>> getRecent(
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(transactionQueryService.getRecent(limit));
    }

    @GetMapping("/by-customer/{customerId}")
    public ResponseEntity<PaginatedResponse<Transaction>> getByCustomer(
            @PathVariable String customerId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(transactionQueryService.getByCustomer(customerId, page, limit));
    }

    /**
     * Transactions received by a merchant.
     */
    @GetMapping("/to-customer/{merchantId}")
    public ResponseEntity<PaginatedResponse<Transaction>> getByMerchant(
            @PathVariable String merchantId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(transactionQueryService.getByMerchant(merchantId, page, limit));
    }
}
