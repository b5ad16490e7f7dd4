package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStats {

    private LocalDate date;
    private long count;
    private BigDecimal totalAmount;
    private BigDecimal averageAmount;
}
