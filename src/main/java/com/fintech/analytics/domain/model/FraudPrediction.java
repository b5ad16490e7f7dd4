package com.fintech.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudPrediction {

    /** Heuristic score in [0, 1]. */
    private double fraudScore;
    private String reasoning;
}
