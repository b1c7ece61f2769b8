package com.bank.monitoring.service;

import com.bank.monitoring.config.AlertingConfig;
import com.bank.monitoring.config.DetectorConfig;
import com.bank.monitoring.config.MetricsConfig;
import com.bank.monitoring.engine.CooldownTable;
import com.bank.monitoring.engine.StatisticalDetector;
import com.bank.monitoring.model.*;
import com.bank.monitoring.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.bank.monitoring.testutil.TestDataFactory.anomalyDetail;
import static com.bank.monitoring.testutil.TestDataFactory.anomalyResult;
import static com.bank.monitoring.testutil.TestDataFactory.counts;
import static com.bank.monitoring.testutil.TestDataFactory.normalHistory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertDispatcherTest {

    @Mock private MetricsConfig metricsConfig;
    @Mock private WebhookNotificationService webhookService;
    @Mock private TwilioNotificationService smsService;

    private final AtomicLong nanos = new AtomicLong(0L);
    private StatisticalDetector detector;
    private AlertingConfig alertingConfig;

    @BeforeEach
    void setUp() {
        detector = new StatisticalDetector(new DetectorConfig(), Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC));
        alertingConfig = new AlertingConfig();
        alertingConfig.setCooldownSeconds(300);
    }

    @Test
    void dispatch_normalResult_returnsEmptyWithoutSideEffects() {
        AlertDispatcher dispatcher = newDispatcher();

        List<AlertRecord> alerts = dispatcher.dispatch(AnomalyResult.normal(TestDataFactory.NOW));

        assertThat(alerts).isEmpty();
        verifyNoInteractions(metricsConfig, webhookService, smsService);
    }

    @Test
    void dispatch_twiceInsideCooldown_secondCallIsSuppressed() {
        AlertDispatcher dispatcher = newDispatcher();
        AnomalyResult result = anomalyResult(Severity.WARNING,
                anomalyDetail("failed", 9, 2.5, 1.1, 3.2, true));

        List<AlertRecord> first = dispatcher.dispatch(result);
        List<AlertRecord> second = dispatcher.dispatch(result);

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        verify(metricsConfig, times(1)).recordAlert("failed", Severity.WARNING);
        verify(metricsConfig).recordAlertSuppressed("failed", Severity.WARNING);
    }

    @Test
    void dispatch_afterResetCooldowns_alertsAgain() {
        AlertDispatcher dispatcher = newDispatcher();
        AnomalyResult result = anomalyResult(Severity.WARNING,
                anomalyDetail("failed", 9, 2.5, 1.1, 3.2, true));

        dispatcher.dispatch(result);
        dispatcher.resetCooldowns();

        assertThat(dispatcher.dispatch(result)).hasSize(1);
    }

    @Test
    void dispatch_afterCooldownElapses_alertsAgain() {
        AlertDispatcher dispatcher = newDispatcher();
        AnomalyResult result = anomalyResult(Severity.WARNING,
                anomalyDetail("failed", 9, 2.5, 1.1, 3.2, true));

        dispatcher.dispatch(result);
        nanos.addAndGet(Duration.ofSeconds(300).toNanos());

        assertThat(dispatcher.dispatch(result)).hasSize(1);
    }

    @Test
    void dispatch_sameStatusDifferentSeverity_hasIndependentCooldowns() {
        AlertDispatcher dispatcher = newDispatcher();

        List<AlertRecord> warning = dispatcher.dispatch(anomalyResult(Severity.WARNING,
                anomalyDetail("denied", 9, 5.0, 1.4, 3.0, true)));
        List<AlertRecord> critical = dispatcher.dispatch(anomalyResult(Severity.CRITICAL,
                anomalyDetail("denied", 40, 5.0, 1.4, 25.0, true)));

        assertThat(warning).extracting(AlertRecord::getSeverity).containsExactly(Severity.WARNING);
        assertThat(critical).extracting(AlertRecord::getSeverity).containsExactly(Severity.CRITICAL);
    }

    @Test
    void dispatch_mixedSeverities_derivesSeverityPerStatus() {
        when(webhookService.isEnabled()).thenReturn(true);
        AlertDispatcher dispatcher = newDispatcher();
        AnomalyResult result = anomalyResult(Severity.CRITICAL,
                anomalyDetail("denied", 200, 5.0, 0.82, 195.0, true),
                anomalyDetail("failed", 6, 2.5, 1.13, 3.1, true),
                anomalyDetail("approved", 100, 99.75, 3.2, 0.08, false));

        List<AlertRecord> alerts = dispatcher.dispatch(result);

        assertThat(alerts).extracting(AlertRecord::getStatus).containsExactly("denied", "failed");
        assertThat(alerts).extracting(AlertRecord::getSeverity).containsExactly(Severity.CRITICAL, Severity.WARNING);
        assertThat(alerts).allSatisfy(a -> assertThat(a.getScore()).isEqualTo(195.0));

        ArgumentCaptor<AlertRecord> sent = ArgumentCaptor.forClass(AlertRecord.class);
        verify(webhookService).notifyCritical(sent.capture());
        assertThat(sent.getValue().getStatus()).isEqualTo("denied");
    }

    @Test
    void dispatch_warningAlert_neverReachesWebhookOrSms() {
        AlertDispatcher dispatcher = newDispatcher();

        List<AlertRecord> alerts = dispatcher.dispatch(anomalyResult(Severity.WARNING,
                anomalyDetail("reversed", 4, 0.5, 0.5, 3.5, true)));

        assertThat(outcome(alerts.get(0), AlertSink.WEBHOOK).getStatus()).isEqualTo(SinkOutcome.Status.SKIPPED);
        assertThat(outcome(alerts.get(0), AlertSink.SMS).getStatus()).isEqualTo(SinkOutcome.Status.SKIPPED);
        assertThat(outcome(alerts.get(0), AlertSink.LOG).getStatus()).isEqualTo(SinkOutcome.Status.DELIVERED);
        verify(webhookService, never()).notifyCritical(any());
        verify(smsService, never()).notifyCritical(any());
    }

    @Test
    void dispatch_criticalAlert_submitsToEnabledChannels() {
        when(webhookService.isEnabled()).thenReturn(true);
        when(smsService.isEnabled()).thenReturn(true);
        AlertDispatcher dispatcher = newDispatcher();

        AlertRecord alert = dispatcher.dispatch(anomalyResult(Severity.CRITICAL,
                anomalyDetail("denied", 200, 5.0, 0.82, 195.0, true))).get(0);

        assertThat(outcome(alert, AlertSink.WEBHOOK).getStatus()).isEqualTo(SinkOutcome.Status.SUBMITTED);
        assertThat(outcome(alert, AlertSink.SMS).getStatus()).isEqualTo(SinkOutcome.Status.SUBMITTED);
        assertThat(outcome(alert, AlertSink.METRICS).getStatus()).isEqualTo(SinkOutcome.Status.DELIVERED);
        verify(webhookService).notifyCritical(alert.toBuilder().sinkOutcomes(null).build());
        verify(smsService).notifyCritical(any(AlertRecord.class));
    }

    @Test
    void dispatch_criticalAlertWithDisabledChannels_skipsThem() {
        when(webhookService.isEnabled()).thenReturn(false);
        when(smsService.isEnabled()).thenReturn(false);
        AlertDispatcher dispatcher = newDispatcher();

        AlertRecord alert = dispatcher.dispatch(anomalyResult(Severity.CRITICAL,
                anomalyDetail("denied", 200, 5.0, 0.82, 195.0, true))).get(0);

        assertThat(outcome(alert, AlertSink.WEBHOOK).getStatus()).isEqualTo(SinkOutcome.Status.SKIPPED);
        assertThat(outcome(alert, AlertSink.SMS).getStatus()).isEqualTo(SinkOutcome.Status.SKIPPED);
        verify(webhookService, never()).notifyCritical(any());
    }

    @Test
    void dispatch_failingMetricsSink_doesNotBlockOtherSinks() {
        when(webhookService.isEnabled()).thenReturn(true);
        doThrow(new IllegalStateException("registry closed"))
                .when(metricsConfig).recordAlert(eq("denied"), eq(Severity.CRITICAL));
        AlertDispatcher dispatcher = newDispatcher();

        List<AlertRecord> alerts = dispatcher.dispatch(anomalyResult(Severity.CRITICAL,
                anomalyDetail("denied", 200, 5.0, 0.82, 195.0, true)));

        assertThat(alerts).hasSize(1);
        SinkOutcome metrics = outcome(alerts.get(0), AlertSink.METRICS);
        assertThat(metrics.getStatus()).isEqualTo(SinkOutcome.Status.FAILED);
        assertThat(metrics.getError()).isEqualTo("registry closed");
        assertThat(outcome(alerts.get(0), AlertSink.LOG).getStatus()).isEqualTo(SinkOutcome.Status.DELIVERED);
        assertThat(outcome(alerts.get(0), AlertSink.WEBHOOK).getStatus()).isEqualTo(SinkOutcome.Status.SUBMITTED);
    }

    @Test
    void dispatch_rejectedWebhookSubmission_isReportedAsFailed() {
        when(webhookService.isEnabled()).thenReturn(true);
        doThrow(new TaskRejectedException("queue full")).when(webhookService).notifyCritical(any());
        AlertDispatcher dispatcher = newDispatcher();

        List<AlertRecord> alerts = dispatcher.dispatch(anomalyResult(Severity.CRITICAL,
                anomalyDetail("denied", 200, 5.0, 0.82, 195.0, true)));

        assertThat(alerts).hasSize(1);
        assertThat(outcome(alerts.get(0), AlertSink.WEBHOOK).isFailed()).isTrue();
        verify(metricsConfig).recordAlert("denied", Severity.CRITICAL);
    }

    @Test
    void dispatch_roundsReportedValues() {
        AlertDispatcher dispatcher = newDispatcher();

        AlertRecord alert = dispatcher.dispatch(anomalyResult(Severity.WARNING,
                anomalyDetail("failed", 6, 2.5, 1.1274, 3.10456, true))).get(0);

        assertThat(alert.getZScore()).isEqualTo(3.1);
        assertThat(alert.getBaselineStd()).isEqualTo(1.13);
        assertThat(alert.getCurrentValue()).isEqualTo(6);
        assertThat(alert.getSinkOutcomes()).extracting(SinkOutcome::getSink)
                .containsExactlyInAnyOrder(AlertSink.LOG, AlertSink.METRICS, AlertSink.WEBHOOK, AlertSink.SMS);
    }

    @Test
    void dispatch_incidentScenario_emitsAlertForEachAnomalousStatus() {
        alertingConfig.setCooldownSeconds(0);
        when(webhookService.isEnabled()).thenReturn(false);
        when(smsService.isEnabled()).thenReturn(false);
        AlertDispatcher dispatcher = newDispatcher();
        AnomalyResult result = detector.detect(
                counts("approved", 100, "denied", 200, "failed", 100, "reversed", 80),
                normalHistory());

        List<AlertRecord> alerts = dispatcher.dispatch(result);

        assertThat(alerts.size()).isGreaterThanOrEqualTo(2);
        assertThat(alerts).extracting(AlertRecord::getStatus).contains("denied", "failed");
    }

    @Test
    void activeCooldowns_listsKeysStillCoolingDown() {
        AlertDispatcher dispatcher = newDispatcher();
        dispatcher.dispatch(anomalyResult(Severity.WARNING, anomalyDetail("failed", 9, 2.5, 1.1, 3.2, true)));
        nanos.addAndGet(Duration.ofSeconds(100).toNanos());

        assertThat(dispatcher.activeCooldowns()).containsEntry("failed:WARNING", Duration.ofSeconds(200));
        assertThat(dispatcher.getCooldown()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void constructor_rejectsNegativeCooldown() {
        alertingConfig.setCooldownSeconds(-1);

        assertThatThrownBy(this::newDispatcher).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsCooldownAboveOneWeek() {
        alertingConfig.setCooldownSeconds(AlertingConfig.MAX_COOLDOWN_SECONDS + 1);

        assertThatThrownBy(this::newDispatcher)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("604800");
    }

    @Test
    void constructor_acceptsOneWeekCooldownAndDispatches() {
        alertingConfig.setCooldownSeconds(AlertingConfig.MAX_COOLDOWN_SECONDS);
        AlertDispatcher dispatcher = newDispatcher();

        List<AlertRecord> alerts = dispatcher.dispatch(
                anomalyResult(Severity.WARNING, anomalyDetail("failed", 9, 2.5, 1.1, 3.2, true)));

        assertThat(alerts).hasSize(1);
        assertThat(dispatcher.activeCooldowns()).containsEntry("failed:WARNING", Duration.ofDays(7));
    }

    @Test
    void dispatch_stampsAlertsWithInjectedClock() {
        AlertDispatcher dispatcher = newDispatcher();

        List<AlertRecord> alerts = dispatcher.dispatch(
                anomalyResult(Severity.WARNING, anomalyDetail("failed", 9, 2.5, 1.1, 3.2, true)));

        assertThat(alerts.get(0).getTimestamp()).isEqualTo(TestDataFactory.NOW);
    }

    private AlertDispatcher newDispatcher() {
        return new AlertDispatcher(alertingConfig, detector, metricsConfig, webhookService, smsService,
                Tracer.NOOP, Clock.fixed(TestDataFactory.NOW, ZoneOffset.UTC), new CooldownTable(nanos::get));
    }

    private static SinkOutcome outcome(AlertRecord alert, AlertSink sink) {
        return alert.getSinkOutcomes().stream()
                .filter(o -> o.getSink() == sink)
                .findFirst()
                .orElseThrow();
    }
}
