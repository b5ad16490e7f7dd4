package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmountBucket {

    /** Range label, e.g. "0-100" or "1000+". */
    private String range;
    private long count;
    private double percentage;
}
