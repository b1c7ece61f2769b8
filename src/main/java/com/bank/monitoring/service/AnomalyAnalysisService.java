package com.bank.monitoring.service;

import com.bank.monitoring.config.AlertingConfig;
import com.bank.monitoring.config.MetricsConfig;
import com.bank.monitoring.engine.StatisticalDetector;
import com.bank.monitoring.model.AnomalyResult;
import com.bank.monitoring.repository.StatusCountRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches counts from the store and runs the detector over them.
 * Shared by the scheduler tick and the on-demand analysis endpoints.
 */
@Service
public class AnomalyAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAnalysisService.class);

    private final StatusCountRepository repository;
    private final StatisticalDetector detector;
    private final MetricsConfig metricsConfig;
    private final AlertingConfig alertingConfig;

    public AnomalyAnalysisService(StatusCountRepository repository,
                                  StatisticalDetector detector,
                                  MetricsConfig metricsConfig,
                                  AlertingConfig alertingConfig) {
        this.repository = repository;
        this.detector = detector;
        this.metricsConfig = metricsConfig;
        this.alertingConfig = alertingConfig;
    }

    /**
     * Current counts and the completed-minute history preceding them.
     */
    @Value
    public static class CountSnapshot {
        Map<String, Long> current;
        List<Map<String, Long>> history;
    }

    /**
     * Reads the current window and {@code historyMinutes} of history.
     *
     * @return empty when the store has no data at all; when only the current minute is
     *         empty, the most recent history bucket stands in for it
     */
    public Optional<CountSnapshot> fetchSnapshot(int historyMinutes) {
        Map<String, Long> current = repository.getStatusCountsAt(alertingConfig.getCurrentWindowMinutes());
        List<Map<String, Long>> history = repository.getHistoryWindow(historyMinutes);

        if (current.isEmpty() && history.isEmpty()) {
            return Optional.empty();
        }
        if (current.isEmpty()) {
            log.debug("No counts for the current window, using the latest history bucket");
            current = history.get(history.size() - 1);
        }
        return Optional.of(new CountSnapshot(current, history));
    }

    /**
     * Runs detection and publishes the anomaly score gauges, whatever the severity.
     */
    public AnomalyResult detect(CountSnapshot snapshot) {
        AnomalyResult result = detector.detect(snapshot.getCurrent(), snapshot.getHistory());
        try {
            metricsConfig.updateAnomalyScores(result);
        } catch (RuntimeException e) {
            log.warn("Failed to publish anomaly score gauges: {}", e.getMessage());
        }
        return result;
    }

    /**
     * On-demand detection over a custom history window. Never dispatches alerts.
     */
    @Observed(name = "alert.analyze", contextualName = "analyze-status-counts")
    public Optional<AnomalyResult> analyze(int windowMinutes) {
        return fetchSnapshot(windowMinutes).map(this::detect);
    }

    public Optional<AnomalyResult> analyze() {
        return analyze(alertingConfig.getHistoryWindowMinutes());
    }
}
