package com.bank.monitoring.service;

import com.bank.monitoring.config.AlertingConfig;
import com.bank.monitoring.engine.StatisticalDetector;
import com.bank.monitoring.model.AlertRecord;
import com.bank.monitoring.model.AnomalyDetail;
import com.bank.monitoring.model.AnomalyResult;
import com.bank.monitoring.model.EvaluationResponse;
import com.bank.monitoring.model.Severity;
import com.bank.monitoring.model.SingleEvaluation;
import com.bank.monitoring.repository.StatusCountRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Evaluates one (status, count) observation against the rolling baseline, outside the
 * scheduler. A non-NORMAL verdict goes through the shared dispatcher, so cooldowns
 * apply across scheduled and ad-hoc alerts. The observation is then recorded.
 */
@Service
public class SingleEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(SingleEvaluationService.class);

    private final StatusCountRepository repository;
    private final StatisticalDetector detector;
    private final AlertDispatcher dispatcher;
    private final AlertingConfig alertingConfig;
    private final Clock clock;

    public SingleEvaluationService(StatusCountRepository repository,
                                   StatisticalDetector detector,
                                   AlertDispatcher dispatcher,
                                   AlertingConfig alertingConfig,
                                   Clock clock) {
        this.repository = repository;
        this.detector = detector;
        this.alertingConfig = alertingConfig;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * @param timestampMillis observation time; {@code <= 0} means now
     * @return always a complete response; dispatch and store failures show up as
     *         {@code alertDispatched=false} / {@code recorded=false}
     */
    @Observed(name = "alert.evaluate", contextualName = "evaluate-single")
    public EvaluationResponse evaluate(String status, long count, long timestampMillis) {
        long observedAt = timestampMillis > 0 ? timestampMillis : clock.millis();

        List<Map<String, Long>> history = repository.getHistoryWindow(alertingConfig.getHistoryWindowMinutes());
        SingleEvaluation evaluation = detector.evaluateSingle(status, count, history);

        boolean alertDispatched = false;
        if (evaluation.getSeverity() != Severity.NORMAL) {
            alertDispatched = dispatch(evaluation);
        }

        boolean recorded = false;
        try {
            repository.record(status, count, observedAt);
            recorded = true;
        } catch (RuntimeException e) {
            log.warn("Failed to record {} count {} at {}: {}", status, count, observedAt, e.getMessage());
        }

        return EvaluationResponse.builder()
                .status(status)
                .count(count)
                .severity(evaluation.getSeverity())
                .zScore(round2(evaluation.getZScore()))
                .baselineMean(round2(evaluation.getBaselineMean()))
                .baselineStd(round2(evaluation.getBaselineStd()))
                .anomalous(evaluation.isAnomalous())
                .message(evaluation.getMessage())
                .alertDispatched(alertDispatched)
                .recorded(recorded)
                .evaluatedAt(clock.millis())
                .build();
    }

    private boolean dispatch(SingleEvaluation evaluation) {
        AnomalyResult result = AnomalyResult.builder()
                .maxZScore(evaluation.getZScore())
                .severity(evaluation.getSeverity())
                .timestamp(Instant.now(clock))
                .anomaly(AnomalyDetail.builder()
                        .status(evaluation.getStatus())
                        .currentValue(evaluation.getCount())
                        .baselineMean(evaluation.getBaselineMean())
                        .baselineStd(evaluation.getBaselineStd())
                        .zScore(evaluation.getZScore())
                        .anomalous(evaluation.isAnomalous())
                        .contribution(evaluation.getMessage())
                        .build())
                .build();
        try {
            List<AlertRecord> alerts = dispatcher.dispatch(result);
            return !alerts.isEmpty();
        } catch (RuntimeException e) {
            log.warn("Alert dispatch failed for {}: {}", evaluation.getStatus(), e.getMessage());
            return false;
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
