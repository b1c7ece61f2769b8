package com.bank.monitoring.config;

import com.bank.monitoring.model.AnomalyDetail;
import com.bank.monitoring.model.AnomalyResult;
import com.bank.monitoring.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    // Gauge values are stored as raw double bits
    private final AtomicLong overallAnomalyScore;
    private final Map<String, AtomicLong> statusAnomalyScores = new ConcurrentHashMap<>();

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.overallAnomalyScore = registry.gauge("transaction.anomaly.overall_score",
                new AtomicLong(Double.doubleToLongBits(0.0)),
                bits -> Double.longBitsToDouble(bits.get()));
    }

    public void recordAlert(String status, Severity severity) {
        Counter.builder("transaction.alerts.count")
                .description("Anomaly alerts dispatched by status and severity")
                .tag("status", status)
                .tag("severity", severity.name())
                .register(registry)
                .increment();
    }

    public void recordAlertSuppressed(String status, Severity severity) {
        Counter.builder("transaction.alerts.suppressed.count")
                .tag("status", status)
                .tag("severity", severity.name())
                .register(registry)
                .increment();
    }

    /**
     * Pushes the overall and per-status z-scores of a detection result to gauges.
     * Called for every result, NORMAL included, so dashboards stay continuous.
     */
    public void updateAnomalyScores(AnomalyResult result) {
        overallAnomalyScore.set(Double.doubleToLongBits(result.getMaxZScore()));
        for (AnomalyDetail detail : result.getAnomalies()) {
            statusScoreHolder(detail.getStatus()).set(Double.doubleToLongBits(detail.getZScore()));
        }
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAlertCheck(String outcome, Duration duration) {
        Counter.builder("alert.check.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("alert.check.duration")
                .register(registry)
                .record(duration);
    }

    private AtomicLong statusScoreHolder(String status) {
        return statusAnomalyScores.computeIfAbsent(status, s -> registry.gauge(
                "transaction.anomaly.score",
                Tags.of("status", s),
                new AtomicLong(Double.doubleToLongBits(0.0)),
                bits -> Double.longBitsToDouble(bits.get())));
    }
}
