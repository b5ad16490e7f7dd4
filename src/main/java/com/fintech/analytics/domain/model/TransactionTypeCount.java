package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Number of transactions recorded for one payment channel type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionTypeCount {

    private String type;
    private long count;
}
