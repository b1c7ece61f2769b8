package com.bank.monitoring.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one detection call: one detail per monitored status, in declared order.
 */
@Value
@Builder
public class AnomalyResult {
    double maxZScore;
    Severity severity;
    @Singular("anomaly")
    List<AnomalyDetail> anomalies;
    Instant timestamp;

    public boolean hasAnomalies() {
        return anomalies.stream().anyMatch(AnomalyDetail::isAnomalous);
    }

    public static AnomalyResult normal(Instant timestamp) {
        return AnomalyResult.builder()
                .maxZScore(0.0)
                .severity(Severity.NORMAL)
                .timestamp(timestamp)
                .build();
    }
}
