package com.fintech.analytics.api;

import com.fintech.analytics.domain.model.Customer;
import com.fintech.analytics.domain.model.CustomerSummary;
import com.fintech.analytics.domain.model.PaginatedResponse;
import com.fintech.analytics.domain.model.TopCustomer;
import com.fintech.analytics.domain.service.CustomerService;
import com.fintech.analytics.domain.service.PaginationService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;

    @GetMapping
    public ResponseEntity<PaginatedResponse<CustomerSummary>> listAll(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(customerService.listAll(page, limit));
    }

    /**
     * Unknown customers come back with zero counts rather than 404.
     */
    @GetMapping("/{customerId}")
    public ResponseEntity<Customer> details(@PathVariable String customerId) {
        return ResponseEntity.ok(customerService.details(customerId));
    }

    @GetMapping("/Ranked/top")
    public ResponseEntity<List<TopCustomer>> top(
            @RequestParam(defaultValue = "10")
            @Min(1) @Max(PaginationService.MAX_LIMIT) int n) {
        return ResponseEntity.ok(customerService.top(n));
    }
}
