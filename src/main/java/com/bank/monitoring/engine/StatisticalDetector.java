package com.bank.monitoring.engine;

import com.bank.monitoring.config.DetectorConfig;
import com.bank.monitoring.model.AnomalyDetail;
import com.bank.monitoring.model.AnomalyResult;
import com.bank.monitoring.model.MonitoredStatus;
import com.bank.monitoring.model.Severity;
import com.bank.monitoring.model.SingleEvaluation;
import com.bank.monitoring.model.StatusCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rolling z-score detector over per-minute status counts.
 *
 * For each monitored status:
 * <pre>
 *   z = (current - mean) / max(std, stdFloor)
 * </pre>
 * A status is anomalous when z exceeds the warning threshold. Only increases are
 * flagged; drops below the baseline produce negative z-scores and stay NORMAL.
 *
 * Thresholds and the monitored-status table are copied at construction and
 * validated there, so a bad configuration fails at startup, not on the first check.
 */
@Component
public class StatisticalDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalDetector.class);

    // Z-score reported for a problem status seen before any baseline exists
    public static final double NO_BASELINE_Z_SCORE = 10.0;

    private final double warningThreshold;
    private final double criticalThreshold;
    private final int minHistory;
    private final double stdFloor;
    private final Map<String, StatusCategory> statuses;
    private final Clock clock;

    public StatisticalDetector(DetectorConfig config, Clock clock) {
        if (config.getWarningThreshold() <= 0) {
            throw new IllegalArgumentException("warningThreshold must be > 0, got " + config.getWarningThreshold());
        }
        if (config.getCriticalThreshold() < config.getWarningThreshold()) {
            throw new IllegalArgumentException("criticalThreshold (" + config.getCriticalThreshold()
                    + ") must be >= warningThreshold (" + config.getWarningThreshold() + ")");
        }
        if (config.getMinHistory() < 0) {
            throw new IllegalArgumentException("minHistory must be >= 0, got " + config.getMinHistory());
        }
        if (config.getStdFloor() <= 0) {
            throw new IllegalArgumentException("stdFloor must be > 0, got " + config.getStdFloor());
        }
        if (config.getStatuses() == null || config.getStatuses().isEmpty()) {
            throw new IllegalArgumentException("At least one monitored status is required");
        }

        Map<String, StatusCategory> table = new LinkedHashMap<>();
        for (MonitoredStatus status : config.getStatuses()) {
            if (status.getName() == null || status.getName().isBlank()) {
                throw new IllegalArgumentException("Monitored status name must not be blank");
            }
            StatusCategory category = status.getCategory() != null ? status.getCategory() : StatusCategory.VOLUME;
            if (table.put(status.getName(), category) != null) {
                throw new IllegalArgumentException("Duplicate monitored status: " + status.getName());
            }
        }

        this.warningThreshold = config.getWarningThreshold();
        this.criticalThreshold = config.getCriticalThreshold();
        this.minHistory = config.getMinHistory();
        this.stdFloor = config.getStdFloor();
        this.statuses = Collections.unmodifiableMap(table);
        this.clock = clock;

        log.info("Statistical detector configured: statuses={}, warning>{}, critical>{}, minHistory={}",
                statuses.keySet(), warningThreshold, criticalThreshold, minHistory);
    }

    public AnomalyResult detect(Map<String, Long> current, List<Map<String, Long>> history) {
        return detect(current, history, clock.instant());
    }

    /**
     * Run detection for the current counts against the history window (oldest first).
     *
     * @return a NORMAL result with no details while the history is shorter than
     *         {@code minHistory}; otherwise one detail per monitored status
     */
    public AnomalyResult detect(Map<String, Long> current, List<Map<String, Long>> history, Instant timestamp) {
        if (history.size() < minHistory) {
            log.debug("Insufficient history ({} < {}), returning NORMAL", history.size(), minHistory);
            return AnomalyResult.normal(timestamp);
        }

        AnomalyResult.AnomalyResultBuilder result = AnomalyResult.builder().timestamp(timestamp);
        double maxZ = 0.0;
        boolean first = true;
        boolean anyWarning = false;
        boolean anyCritical = false;

        for (String status : statuses.keySet()) {
            long count = BaselineEstimator.countOf(current, status);
            Baseline baseline = BaselineEstimator.estimate(history, status);
            double z = zScore(count, baseline);
            boolean anomalous = z > warningThreshold;

            result.anomaly(AnomalyDetail.builder()
                    .status(status)
                    .currentValue(count)
                    .baselineMean(baseline.getMean())
                    .baselineStd(baseline.getStd())
                    .zScore(z)
                    .anomalous(anomalous)
                    .contribution(anomalous ? describe(status, count, z, baseline) : "")
                    .build());

            maxZ = first ? z : Math.max(maxZ, z);
            first = false;
            anyWarning |= anomalous;
            anyCritical |= z > criticalThreshold;
        }

        Severity severity = anyCritical ? Severity.CRITICAL
                : anyWarning ? Severity.WARNING
                : Severity.NORMAL;

        return result.maxZScore(maxZ).severity(severity).build();
    }

    /**
     * Evaluate one status count against the rolling baseline, outside the periodic check.
     *
     * With too little history, a problem status with a non-zero count is reported as
     * CRITICAL with a z-score of {@value #NO_BASELINE_Z_SCORE}; anything else is NORMAL.
     */
    public SingleEvaluation evaluateSingle(String status, long count, List<Map<String, Long>> history) {
        SingleEvaluation.SingleEvaluationBuilder evaluation = SingleEvaluation.builder()
                .status(status)
                .count(count);

        if (history.size() < minHistory) {
            if (isProblemStatus(status) && count > 0) {
                return evaluation
                        .severity(Severity.CRITICAL)
                        .zScore(NO_BASELINE_Z_SCORE)
                        .anomalous(true)
                        .message(String.format(Locale.ROOT,
                                "%s count %d detected with no historical baseline "
                                        + "(problem status should be rare/zero)", status, count))
                        .build();
            }
            return evaluation
                    .severity(Severity.NORMAL)
                    .zScore(0.0)
                    .anomalous(false)
                    .message(String.format(Locale.ROOT,
                            "Insufficient history (%d < %d) for reliable evaluation.",
                            history.size(), minHistory))
                    .build();
        }

        Baseline baseline = BaselineEstimator.estimate(history, status);
        double z = zScore(count, baseline);
        boolean anomalous = z > warningThreshold;

        return evaluation
                .severity(classify(z))
                .zScore(z)
                .baselineMean(baseline.getMean())
                .baselineStd(baseline.getStd())
                .anomalous(anomalous)
                .message(anomalous ? describe(status, count, z, baseline) : "")
                .build();
    }

    public Severity classify(double zScore) {
        return Severity.fromZScore(zScore, warningThreshold, criticalThreshold);
    }

    public boolean isMonitored(String status) {
        return statuses.containsKey(status);
    }

    public boolean isProblemStatus(String status) {
        return statuses.get(status) == StatusCategory.PROBLEM;
    }

    public List<String> getMonitoredStatuses() {
        return List.copyOf(statuses.keySet());
    }

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    private double zScore(long count, Baseline baseline) {
        return (count - baseline.getMean()) / Math.max(baseline.getStd(), stdFloor);
    }

    private static String describe(String status, long count, double z, Baseline baseline) {
        return String.format(Locale.ROOT, "%s count %d is %.1fσ above baseline (mean=%.1f, std=%.1f)",
                status, count, z, baseline.getMean(), baseline.getStd());
    }
}
