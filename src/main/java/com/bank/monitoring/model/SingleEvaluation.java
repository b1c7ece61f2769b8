package com.bank.monitoring.model;

import lombok.Builder;
import lombok.Value;

/**
 * Verdict for one ad-hoc (status, count) pair.
 */
@Value
@Builder
public class SingleEvaluation {
    String status;
    long count;
    Severity severity;
    double zScore;
    double baselineMean;
    double baselineStd;
    boolean anomalous;
    String message;
}
