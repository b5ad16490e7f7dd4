package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Optional, independent search criteria.
 *
 * A null field imposes no constraint. Amount bounds are inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {

    private BigDecimal minAmount;
    private BigDecimal maxAmount;
    private String clientId;
    private String transactionId;
    private String merchantCity;
    private String useChip;
}
