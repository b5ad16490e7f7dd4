package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Volume statistics for one merchant category code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeStats {

    private String type;
    private long count;
    private BigDecimal totalAmount;
    private BigDecimal averageAmount;
}
