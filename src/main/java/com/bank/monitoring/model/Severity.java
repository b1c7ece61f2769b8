package com.bank.monitoring.model;

public enum Severity {
    NORMAL,
    WARNING,
    CRITICAL;

    /**
     * Classifies a z-score against the two thresholds. Both comparisons are strict.
     */
    public static Severity fromZScore(double zScore, double warningThreshold, double criticalThreshold) {
        if (zScore > criticalThreshold) return CRITICAL;
        if (zScore > warningThreshold) return WARNING;
        return NORMAL;
    }
}
