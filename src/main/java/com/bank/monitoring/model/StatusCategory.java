package com.bank.monitoring.model;

/**
 * How a monitored status behaves in healthy traffic.
 */
public enum StatusCategory {
    // Normally rare (denied, failed, reversed): any occurrence without a baseline is suspicious
    PROBLEM,
    // High values are benign (approved)
    VOLUME
}
