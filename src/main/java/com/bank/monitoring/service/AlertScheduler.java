package com.bank.monitoring.service;

import com.bank.monitoring.config.AlertingConfig;
import com.bank.monitoring.config.MetricsConfig;
import com.bank.monitoring.model.AlertRecord;
import com.bank.monitoring.model.AnomalyResult;
import com.bank.monitoring.model.Severity;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic alert check: fetch counts, detect, dispatch.
 *
 * Ticks run with a fixed delay on the single-threaded {@code alertTaskScheduler}, so
 * scheduled ticks never overlap. Manual checks share the same lock and are skipped
 * while another tick is in flight. A tick never throws; failures are logged and
 * counted, and the next tick runs as usual.
 */
@Service
public class AlertScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AlertScheduler.class);

    public enum TickState {
        IDLE,
        FETCHING,
        DETECTING,
        DISPATCHING
    }

    public enum CheckOutcome {
        // No data in the store
        SKIPPED,
        NORMAL,
        ANOMALOUS,
        FAILED,
        // Another tick was in progress
        BUSY
    }

    @Value
    @Builder
    public static class CheckResult {
        CheckOutcome outcome;
        Severity severity;
        double score;
        int alertsDispatched;
        Instant checkedAt;
        String error;
    }

    private final TaskScheduler taskScheduler;
    private final AnomalyAnalysisService analysisService;
    private final AlertDispatcher dispatcher;
    private final MetricsConfig metricsConfig;
    private final AlertingConfig config;
    private final Clock clock;
    private final ObservationRegistry observationRegistry;

    private final ReentrantLock tickLock = new ReentrantLock();

    private ScheduledFuture<?> scheduledTick;
    private volatile Duration interval;
    private volatile TickState state = TickState.IDLE;
    private volatile Instant lastCheckAt;
    private volatile CheckResult lastResult;

    public AlertScheduler(@Qualifier("alertTaskScheduler") TaskScheduler taskScheduler,
                          AnomalyAnalysisService analysisService,
                          AlertDispatcher dispatcher,
                          MetricsConfig metricsConfig,
                          AlertingConfig config,
                          Clock clock,
                          ObservationRegistry observationRegistry) {
        this.taskScheduler = taskScheduler;
        this.analysisService = analysisService;
        this.dispatcher = dispatcher;
        this.metricsConfig = metricsConfig;
        this.config = config;
        this.clock = clock;
        this.observationRegistry = observationRegistry;
        this.interval = Duration.ofSeconds(config.getCheckIntervalSeconds());
    }

    @Override
    public void start() {
        start(interval);
    }

    /**
     * Starts the periodic check, or restarts it with a new interval if already running.
     * The first tick runs immediately.
     */
    public synchronized void start(Duration newInterval) {
        if (newInterval.isZero() || newInterval.isNegative()) {
            throw new IllegalArgumentException("Check interval must be positive, got " + newInterval);
        }
        if (scheduledTick != null) {
            scheduledTick.cancel(false);
        }
        interval = newInterval;
        scheduledTick = taskScheduler.scheduleWithFixedDelay(this::tick, newInterval);
        log.info("Alert scheduler started (interval={}s)", newInterval.toSeconds());
    }

    /**
     * Cancels future ticks and waits, up to the configured stop timeout, for an
     * in-flight tick to finish. The running tick is not interrupted.
     */
    @Override
    public void stop() {
        synchronized (this) {
            if (scheduledTick == null) {
                return;
            }
            scheduledTick.cancel(false);
            scheduledTick = null;
        }

        try {
            if (tickLock.tryLock(config.getStopTimeoutSeconds(), TimeUnit.SECONDS)) {
                tickLock.unlock();
            } else {
                log.warn("Alert check still running after {}s, stopping without waiting",
                        config.getStopTimeoutSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Alert scheduler stopped");
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduledTick != null;
    }

    @Override
    public boolean isAutoStartup() {
        return config.isSchedulerEnabled();
    }

    void tick() {
        try {
            observeCheck("scheduled");
        } catch (RuntimeException e) {
            log.error("Alert check failed unexpectedly", e);
        }
    }

    /**
     * Runs one check now. Returns {@link CheckOutcome#BUSY} without waiting when
     * another check is in progress.
     */
    public CheckResult runAlertCheck() {
        return observeCheck("manual");
    }

    // Scheduled ticks bypass the bean proxy; both triggers are observed here
    private CheckResult observeCheck(String trigger) {
        Observation observation = Observation.createNotStarted("alert.check", observationRegistry)
                .contextualName("run-alert-check")
                .lowCardinalityKeyValue("trigger", trigger);
        return observation.observe(() -> {
            CheckResult result = runLocked();
            observation.lowCardinalityKeyValue("outcome", result.getOutcome().name().toLowerCase(Locale.ROOT));
            return result;
        });
    }

    private CheckResult runLocked() {
        if (!tickLock.tryLock()) {
            log.debug("Alert check already in progress, skipping");
            metricsConfig.recordAlertCheck("busy", Duration.ZERO);
            return CheckResult.builder()
                    .outcome(CheckOutcome.BUSY)
                    .checkedAt(clock.instant())
                    .build();
        }

        long start = System.nanoTime();
        CheckResult result;
        try {
            result = check();
        } catch (RuntimeException e) {
            log.error("Alert check failed: {}", e.getMessage(), e);
            result = CheckResult.builder()
                    .outcome(CheckOutcome.FAILED)
                    .checkedAt(clock.instant())
                    .error(e.getMessage())
                    .build();
        } finally {
            state = TickState.IDLE;
            tickLock.unlock();
        }

        lastCheckAt = result.getCheckedAt();
        lastResult = result;
        try {
            metricsConfig.recordAlertCheck(result.getOutcome().name().toLowerCase(Locale.ROOT),
                    Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException e) {
            log.debug("Alert check metrics update failed: {}", e.getMessage());
        }
        return result;
    }

    private CheckResult check() {
        state = TickState.FETCHING;
        Optional<AnomalyAnalysisService.CountSnapshot> snapshot =
                analysisService.fetchSnapshot(config.getHistoryWindowMinutes());
        if (snapshot.isEmpty()) {
            log.debug("No transaction counts available, skipping alert check");
            return CheckResult.builder()
                    .outcome(CheckOutcome.SKIPPED)
                    .checkedAt(clock.instant())
                    .build();
        }

        state = TickState.DETECTING;
        AnomalyResult result = analysisService.detect(snapshot.get());

        if (result.getSeverity() == Severity.NORMAL) {
            log.debug("Alert check complete: NORMAL (score={})", result.getMaxZScore());
            return CheckResult.builder()
                    .outcome(CheckOutcome.NORMAL)
                    .severity(Severity.NORMAL)
                    .score(result.getMaxZScore())
                    .checkedAt(result.getTimestamp())
                    .build();
        }

        state = TickState.DISPATCHING;
        List<AlertRecord> alerts = dispatcher.dispatch(result);
        log.info("Alert check complete: severity={}, score={}, alertsDispatched={}",
                result.getSeverity(), String.format("%.2f", result.getMaxZScore()), alerts.size());

        return CheckResult.builder()
                .outcome(CheckOutcome.ANOMALOUS)
                .severity(result.getSeverity())
                .score(result.getMaxZScore())
                .alertsDispatched(alerts.size())
                .checkedAt(result.getTimestamp())
                .build();
    }

    public TickState getState() {
        return state;
    }

    public Duration getInterval() {
        return interval;
    }

    public Instant getLastCheckAt() {
        return lastCheckAt;
    }

    public CheckResult getLastResult() {
        return lastResult;
    }
}
