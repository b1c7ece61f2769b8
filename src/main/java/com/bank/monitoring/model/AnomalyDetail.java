package com.bank.monitoring.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-status breakdown of one detection call. Z-score and baseline keep full precision.
 */
@Value
@Builder
public class AnomalyDetail {
    String status;
    long currentValue;
    double baselineMean;
    double baselineStd;
    double zScore;
    boolean anomalous;
    // Human-readable explanation, empty when not anomalous
    @Builder.Default
    String contribution = "";
}
