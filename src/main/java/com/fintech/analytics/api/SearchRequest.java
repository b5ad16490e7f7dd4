package com.fintech.analytics.api;

import com.fintech.analytics.domain.model.SearchFilters;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Search body as sent by clients.
 *
 * Blank strings and the Swagger placeholder "string" are treated as absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    static final String PLACEHOLDER = "string";

    private BigDecimal minAmount;
    private BigDecimal maxAmount;
    private String clientId;
    private String transactionId;
    private String merchantCity;
    private String useChip;

    public SearchFilters toFilters() {
        return SearchFilters.builder()
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .clientId(normalize(clientId))
                .transactionId(normalize(transactionId))
                .merchantCity(normalize(merchantCity))
                .useChip(normalize(useChip))
                .build();
    }

    static String normalize(String value) {
        if (value == null || value.isBlank() || PLACEHOLDER.equals(value)) {
            return null;
        }
        return value;
    }
}
