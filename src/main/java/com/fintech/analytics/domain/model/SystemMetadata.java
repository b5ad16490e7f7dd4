package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemMetadata {

    private long totalTransactionCount;
    private LocalDateTime dataLoadDate;
    private String apiVersion;
    private LocalDateTime minDate;
    private LocalDateTime maxDate;
}
