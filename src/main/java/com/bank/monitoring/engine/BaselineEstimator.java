package com.bank.monitoring.engine;

import java.util.List;
import java.util.Map;

/**
 * Computes the baseline of a status from a per-minute history window.
 *
 * A status missing from an entry counts as 0 for that minute. The standard deviation
 * is the sample deviation (n - 1 divisor), which matters for windows of 30-60 points.
 * Stateless, never throws on well-formed input.
 */
public final class BaselineEstimator {

    private BaselineEstimator() {}

    public static Baseline estimate(List<Map<String, Long>> history, String status) {
        int n = history.size();
        if (n == 0) {
            return Baseline.EMPTY;
        }

        double[] values = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            values[i] = countOf(history.get(i), status);
            sum += values[i];
        }
        double mean = sum / n;
        if (n == 1) {
            return new Baseline(mean, 0.0);
        }

        double squaredDeviations = 0.0;
        for (double value : values) {
            double delta = value - mean;
            squaredDeviations += delta * delta;
        }
        return new Baseline(mean, Math.sqrt(squaredDeviations / (n - 1)));
    }

    static long countOf(Map<String, Long> counts, String status) {
        Long count = counts.get(status);
        return count != null ? count : 0L;
    }
}
