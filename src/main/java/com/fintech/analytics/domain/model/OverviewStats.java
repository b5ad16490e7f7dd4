package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewStats {

    private long totalCount;
    private BigDecimal totalAmount;
    private BigDecimal averageAmount;
    private LocalDateTime minDate;
    private LocalDateTime maxDate;
}
