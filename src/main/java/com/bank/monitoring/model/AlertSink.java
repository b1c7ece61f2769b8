package com.bank.monitoring.model;

public enum AlertSink {
    LOG,
    METRICS,
    WEBHOOK,
    SMS
}
