package com.bank.monitoring.engine;

import lombok.Value;

/**
 * Rolling mean and sample standard deviation of one status over a history window.
 */
@Value
public class Baseline {

    public static final Baseline EMPTY = new Baseline(0.0, 0.0);

    double mean;
    double std;
}
