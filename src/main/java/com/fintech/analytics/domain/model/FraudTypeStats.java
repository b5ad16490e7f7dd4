package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fraud counts for one payment channel type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudTypeStats {

    private String type;
    private long fraudCount;
    private long totalCount;
    private double fraudRate;
}
