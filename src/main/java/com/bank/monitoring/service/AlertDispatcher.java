package com.bank.monitoring.service;

import com.bank.monitoring.config.AlertingConfig;
import com.bank.monitoring.config.MetricsConfig;
import com.bank.monitoring.engine.CooldownTable;
import com.bank.monitoring.engine.StatisticalDetector;
import com.bank.monitoring.model.AlertRecord;
import com.bank.monitoring.model.AlertSink;
import com.bank.monitoring.model.AnomalyDetail;
import com.bank.monitoring.model.AnomalyResult;
import com.bank.monitoring.model.Severity;
import com.bank.monitoring.model.SinkOutcome;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.spi.LoggingEventBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns detection results into alerts, at most one per (status, severity) per cooldown window.
 *
 * Each anomalous detail gets its own severity from |z|, so a single result can raise a
 * CRITICAL alert for one status and a WARNING for another. Routing:
 * <ul>
 *   <li>WARNING: structured log only (dashboard-visible)</li>
 *   <li>CRITICAL: structured log, plus webhook and SMS when those channels are enabled</li>
 * </ul>
 * Every dispatched alert also increments {@code transaction.alerts.count}. Each side effect
 * is isolated and reported as a {@link SinkOutcome}; none of them can fail the dispatch.
 *
 * One instance owns one {@link CooldownTable}; the scheduler and ad-hoc evaluations share
 * the bean, so suppression applies across both.
 */
@Service
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    // Log-based alert routes select on these markers
    public static final Marker ALERT_MARKER = MarkerFactory.getMarker("ALERT");
    public static final Marker CRITICAL_MARKER = MarkerFactory.getMarker("CRITICAL");

    private final StatisticalDetector detector;
    private final MetricsConfig metricsConfig;
    private final WebhookNotificationService webhookService;
    private final TwilioNotificationService smsService;
    private final Tracer tracer;
    private final Clock clock;
    private final CooldownTable cooldowns;
    private final Duration cooldown;

    @Autowired
    public AlertDispatcher(AlertingConfig alertingConfig,
                           StatisticalDetector detector,
                           MetricsConfig metricsConfig,
                           WebhookNotificationService webhookService,
                           TwilioNotificationService smsService,
                           Tracer tracer,
                           Clock clock) {
        this(alertingConfig, detector, metricsConfig, webhookService, smsService, tracer, clock, new CooldownTable());
    }

    AlertDispatcher(AlertingConfig alertingConfig,
                    StatisticalDetector detector,
                    MetricsConfig metricsConfig,
                    WebhookNotificationService webhookService,
                    TwilioNotificationService smsService,
                    Tracer tracer,
                    Clock clock,
                    CooldownTable cooldowns) {
        long cooldownSeconds = alertingConfig.getCooldownSeconds();
        if (cooldownSeconds < 0 || cooldownSeconds > AlertingConfig.MAX_COOLDOWN_SECONDS) {
            throw new IllegalArgumentException("cooldownSeconds must be between 0 and "
                    + AlertingConfig.MAX_COOLDOWN_SECONDS + ", got " + cooldownSeconds);
        }
        this.detector = detector;
        this.metricsConfig = metricsConfig;
        this.webhookService = webhookService;
        this.smsService = smsService;
        this.tracer = tracer;
        this.clock = clock;
        this.cooldowns = cooldowns;
        this.cooldown = Duration.ofSeconds(cooldownSeconds);
    }

    /**
     * Dispatch alerts for the anomalous statuses of a detection result.
     *
     * @return the alerts actually dispatched; empty for a NORMAL result or when every
     *         anomalous status is still inside its cooldown
     */
    public List<AlertRecord> dispatch(AnomalyResult result) {
        if (result.getSeverity() == Severity.NORMAL) {
            return Collections.emptyList();
        }

        List<AlertRecord> dispatched = new ArrayList<>();

        for (AnomalyDetail detail : result.getAnomalies()) {
            if (!detail.isAnomalous()) {
                continue;
            }

            Severity severity = detector.classify(Math.abs(detail.getZScore()));
            if (severity == Severity.NORMAL) {
                continue;
            }

            if (!cooldowns.tryAcquire(detail.getStatus(), severity, cooldown)) {
                log.debug("Alert suppressed by cooldown: status={}, severity={}", detail.getStatus(), severity);
                recordSuppressed(detail.getStatus(), severity);
                continue;
            }

            AlertRecord alert = AlertRecord.builder()
                    .status(detail.getStatus())
                    .severity(severity)
                    .currentValue(detail.getCurrentValue())
                    .baselineMean(round2(detail.getBaselineMean()))
                    .baselineStd(round2(detail.getBaselineStd()))
                    .zScore(round2(detail.getZScore()))
                    .score(round2(result.getMaxZScore()))
                    .timestamp(clock.instant())
                    .build();

            dispatched.add(alert.toBuilder().sinkOutcomes(deliver(alert)).build());
        }

        return dispatched;
    }

    /**
     * Clears every cooldown, re-arming all (status, severity) keys.
     */
    public void resetCooldowns() {
        cooldowns.clear();
        log.info("Alert cooldowns reset");
    }

    /**
     * Keys still cooling down ("status:SEVERITY") with the time left before they re-arm.
     */
    public Map<String, Duration> activeCooldowns() {
        return cooldowns.active(cooldown);
    }

    public Duration getCooldown() {
        return cooldown;
    }

    private List<SinkOutcome> deliver(AlertRecord alert) {
        Span span = tracer.nextSpan()
                .name("alert.dispatch")
                .tag("alert.status", alert.getStatus())
                .tag("alert.severity", alert.getSeverity().name())
                .tag("alert.current_value", String.valueOf(alert.getCurrentValue()))
                .tag("alert.z_score", String.valueOf(alert.getZScore()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<SinkOutcome> outcomes = List.of(
                    logAlert(alert),
                    notifyWebhook(alert),
                    notifySms(alert),
                    countAlert(alert));

            outcomes.stream()
                    .filter(SinkOutcome::isFailed)
                    .forEach(o -> span.tag("alert.sink_failed." + o.getSink().name().toLowerCase(Locale.ROOT), o.getError()));
            return outcomes;
        } finally {
            span.end();
        }
    }

    private SinkOutcome logAlert(AlertRecord alert) {
        try {
            boolean critical = alert.getSeverity() == Severity.CRITICAL;
            LoggingEventBuilder event = critical
                    ? log.atError().addMarker(CRITICAL_MARKER)
                    : log.atWarn();

            event.addMarker(ALERT_MARKER)
                    .addKeyValue("alert", true)
                    .addKeyValue("alert_status", alert.getStatus())
                    .addKeyValue("severity", alert.getSeverity().name())
                    .addKeyValue("current_value", alert.getCurrentValue())
                    .addKeyValue("baseline_mean", alert.getBaselineMean())
                    .addKeyValue("baseline_std", alert.getBaselineStd())
                    .addKeyValue("z_score", alert.getZScore())
                    .addKeyValue("score", alert.getScore())
                    .addKeyValue("alert_timestamp", alert.getTimestamp())
                    .log(critical
                                    ? "ALERT: {} transactions anomaly, count={}, z_score={} (baseline mean={}, std={})"
                                    : "ELEVATED: {} transactions above normal, count={}, z_score={} (baseline mean={}, std={})",
                            alert.getStatus(), alert.getCurrentValue(), alert.getZScore(),
                            alert.getBaselineMean(), alert.getBaselineStd());
            return SinkOutcome.delivered(AlertSink.LOG);
        } catch (RuntimeException e) {
            return SinkOutcome.failed(AlertSink.LOG, e);
        }
    }

    private SinkOutcome notifyWebhook(AlertRecord alert) {
        if (alert.getSeverity() != Severity.CRITICAL || !webhookService.isEnabled()) {
            return SinkOutcome.skipped(AlertSink.WEBHOOK);
        }
        try {
            webhookService.notifyCritical(alert);
            return SinkOutcome.submitted(AlertSink.WEBHOOK);
        } catch (RuntimeException e) {
            log.warn("Webhook alert for status={} could not be submitted: {}", alert.getStatus(), e.getMessage());
            return SinkOutcome.failed(AlertSink.WEBHOOK, e);
        }
    }

    private SinkOutcome notifySms(AlertRecord alert) {
        if (alert.getSeverity() != Severity.CRITICAL || !smsService.isEnabled()) {
            return SinkOutcome.skipped(AlertSink.SMS);
        }
        try {
            smsService.notifyCritical(alert);
            return SinkOutcome.submitted(AlertSink.SMS);
        } catch (RuntimeException e) {
            log.warn("SMS alert for status={} could not be submitted: {}", alert.getStatus(), e.getMessage());
            return SinkOutcome.failed(AlertSink.SMS, e);
        }
    }

    private SinkOutcome countAlert(AlertRecord alert) {
        try {
            metricsConfig.recordAlert(alert.getStatus(), alert.getSeverity());
            return SinkOutcome.delivered(AlertSink.METRICS);
        } catch (RuntimeException e) {
            log.debug("Alert counter update failed for status={}: {}", alert.getStatus(), e.getMessage());
            return SinkOutcome.failed(AlertSink.METRICS, e);
        }
    }

    private void recordSuppressed(String status, Severity severity) {
        try {
            metricsConfig.recordAlertSuppressed(status, severity);
        } catch (RuntimeException e) {
            log.debug("Suppression counter update failed for status={}: {}", status, e.getMessage());
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
