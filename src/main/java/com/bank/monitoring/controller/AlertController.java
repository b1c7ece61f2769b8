package com.bank.monitoring.controller;

import com.bank.monitoring.engine.StatisticalDetector;
import com.bank.monitoring.model.AlertAnalysisResponse;
import com.bank.monitoring.model.AlertStatusResponse;
import com.bank.monitoring.model.AnomalyDetail;
import com.bank.monitoring.model.AnomalyResult;
import com.bank.monitoring.model.EvaluationRequest;
import com.bank.monitoring.model.EvaluationResponse;
import com.bank.monitoring.model.Severity;
import com.bank.monitoring.model.StatusAlert;
import com.bank.monitoring.model.StatusCountRecord;
import com.bank.monitoring.service.AlertDispatcher;
import com.bank.monitoring.service.AlertScheduler;
import com.bank.monitoring.service.AnomalyAnalysisService;
import com.bank.monitoring.service.CountQueryService;
import com.bank.monitoring.service.SingleEvaluationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Anomaly analysis, ad-hoc evaluation, and alert scheduler control")
public class AlertController {

    private final AnomalyAnalysisService analysisService;
    private final SingleEvaluationService evaluationService;
    private final AlertScheduler scheduler;
    private final AlertDispatcher dispatcher;
    private final StatisticalDetector detector;
    private final CountQueryService queryService;
    private final Clock clock;

    public AlertController(AnomalyAnalysisService analysisService,
                           SingleEvaluationService evaluationService,
                           AlertScheduler scheduler,
                           AlertDispatcher dispatcher,
                           StatisticalDetector detector,
                           CountQueryService queryService,
                           Clock clock) {
        this.analysisService = analysisService;
        this.evaluationService = evaluationService;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.detector = detector;
        this.queryService = queryService;
        this.clock = clock;
    }

    @Operation(summary = "Analyze recent transaction counts",
            description = "Runs z-score detection for every monitored status against the last windowMinutes " +
                    "of history and returns a per-status breakdown with a recommendation. Does not dispatch alerts.")
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(
            @Parameter(description = "History window in minutes (5-1440)", example = "60")
            @RequestParam(defaultValue = "60") int windowMinutes) {
        if (windowMinutes < 5 || windowMinutes > 1440) {
            return ResponseEntity.badRequest().body(Map.of("error", "windowMinutes must be between 5 and 1440"));
        }

        Optional<AnomalyResult> analysis = analysisService.analyze(windowMinutes);
        if (analysis.isEmpty()) {
            return ResponseEntity.ok(AlertAnalysisResponse.builder()
                    .timestamp(clock.instant())
                    .overallScore(0.0)
                    .overallSeverity(Severity.NORMAL)
                    .alerts(List.of())
                    .recommendation("No transaction data available for analysis.")
                    .windowMinutes(windowMinutes)
                    .build());
        }

        AnomalyResult result = analysis.get();
        List<StatusAlert> alerts = result.getAnomalies().stream()
                .map(this::toStatusAlert)
                .collect(Collectors.toList());
        List<String> anomalousStatuses = result.getAnomalies().stream()
                .filter(AnomalyDetail::isAnomalous)
                .map(AnomalyDetail::getStatus)
                .collect(Collectors.toList());

        return ResponseEntity.ok(AlertAnalysisResponse.builder()
                .timestamp(result.getTimestamp())
                .overallScore(round2(result.getMaxZScore()))
                .overallSeverity(result.getSeverity())
                .alerts(alerts)
                .recommendation(recommendation(result.getSeverity(), anomalousStatuses))
                .windowMinutes(windowMinutes)
                .build());
    }

    @Operation(summary = "Current anomaly status",
            description = "Lightweight check: overall severity and the z-score of each monitored status.")
    @GetMapping("/status")
    public ResponseEntity<AlertStatusResponse> status() {
        Optional<AnomalyResult> analysis = analysisService.analyze();
        if (analysis.isEmpty()) {
            return ResponseEntity.ok(AlertStatusResponse.builder()
                    .timestamp(clock.instant())
                    .overallSeverity(Severity.NORMAL)
                    .overallScore(0.0)
                    .statuses(Map.of())
                    .build());
        }

        AnomalyResult result = analysis.get();
        Map<String, Double> statuses = new LinkedHashMap<>();
        for (AnomalyDetail detail : result.getAnomalies()) {
            statuses.put(detail.getStatus(), round2(detail.getZScore()));
        }

        return ResponseEntity.ok(AlertStatusResponse.builder()
                .timestamp(result.getTimestamp())
                .overallSeverity(result.getSeverity())
                .overallScore(round2(result.getMaxZScore()))
                .statuses(statuses)
                .build());
    }

    @Operation(summary = "Per-minute status counts",
            description = "Time series of counts per status and minute, oldest first, for charting.")
    @GetMapping("/rates")
    public ResponseEntity<?> rates(
            @Parameter(description = "Window size in minutes (1-1440)", example = "60")
            @RequestParam(defaultValue = "60") int minutes) {
        if (minutes < 1 || minutes > 1440) {
            return ResponseEntity.badRequest().body(Map.of("error", "minutes must be between 1 and 1440"));
        }

        List<StatusCountRecord> data = queryService.rates(minutes);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("windowMinutes", minutes);
        response.put("data", data);
        response.put("totalPoints", data.size());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Evaluate a single status count",
            description = "Scores one count against the rolling baseline. A WARNING or CRITICAL verdict is " +
                    "dispatched through the shared cooldown gate, and the count is recorded.")
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody EvaluationRequest request) {
        if (request.getStatus() == null || !detector.isMonitored(request.getStatus())) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid status: " + request.getStatus(),
                    "validStatuses", detector.getMonitoredStatuses()
            ));
        }
        if (request.getCount() < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "count must be >= 0"));
        }

        EvaluationResponse response = evaluationService.evaluate(
                request.getStatus(), request.getCount(), request.getTimestamp());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Run an alert check now",
            description = "Runs one scheduler tick immediately. Returns BUSY if a check is already in progress.")
    @PostMapping("/check")
    public ResponseEntity<Map<String, Object>> check() {
        AlertScheduler.CheckResult result = scheduler.runAlertCheck();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("outcome", result.getOutcome());
        response.put("severity", result.getSeverity());
        response.put("score", round2(result.getScore()));
        response.put("alertsDispatched", result.getAlertsDispatched());
        response.put("checkedAt", result.getCheckedAt());
        if (result.getError() != null) {
            response.put("error", result.getError());
        }
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Scheduler status")
    @GetMapping("/scheduler")
    public ResponseEntity<Map<String, Object>> schedulerStatus() {
        return ResponseEntity.ok(schedulerView());
    }

    @Operation(summary = "Start or restart the scheduler",
            description = "Restarts with the given interval if already running. Omit intervalSeconds to keep the current one.")
    @PostMapping("/scheduler/start")
    public ResponseEntity<?> startScheduler(
            @Parameter(description = "Check interval in seconds (> 0)", example = "30")
            @RequestParam(required = false) Integer intervalSeconds) {
        if (intervalSeconds != null && intervalSeconds <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "intervalSeconds must be > 0"));
        }

        Duration interval = intervalSeconds != null
                ? Duration.ofSeconds(intervalSeconds)
                : scheduler.getInterval();
        scheduler.start(interval);
        return ResponseEntity.ok(schedulerView());
    }

    @Operation(summary = "Stop the scheduler",
            description = "Cancels future checks and waits for an in-flight check to finish.")
    @PostMapping("/scheduler/stop")
    public ResponseEntity<Map<String, Object>> stopScheduler() {
        scheduler.stop();
        return ResponseEntity.ok(schedulerView());
    }

    @Operation(summary = "Active alert cooldowns",
            description = "Status/severity keys still inside their cooldown, with the seconds left.")
    @GetMapping("/cooldowns")
    public ResponseEntity<Map<String, Object>> cooldowns() {
        Map<String, Long> remaining = new LinkedHashMap<>();
        dispatcher.activeCooldowns().forEach((key, left) -> remaining.put(key, left.toSeconds()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("cooldownSeconds", dispatcher.getCooldown().toSeconds());
        response.put("activeCount", remaining.size());
        response.put("remainingSeconds", remaining);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Reset alert cooldowns",
            description = "Clears every cooldown so the next anomaly for any status alerts immediately.")
    @DeleteMapping("/cooldowns")
    public ResponseEntity<Map<String, Object>> resetCooldowns() {
        dispatcher.resetCooldowns();
        return ResponseEntity.ok(Map.of("status", "reset"));
    }

    private Map<String, Object> schedulerView() {
        AlertScheduler.CheckResult last = scheduler.getLastResult();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("running", scheduler.isRunning());
        response.put("state", scheduler.getState());
        response.put("intervalSeconds", scheduler.getInterval().toSeconds());
        response.put("lastCheckAt", scheduler.getLastCheckAt());
        response.put("lastOutcome", last != null ? last.getOutcome() : null);
        response.put("lastSeverity", last != null ? last.getSeverity() : null);
        return response;
    }

    private StatusAlert toStatusAlert(AnomalyDetail detail) {
        return StatusAlert.builder()
                .status(detail.getStatus())
                .severity(detector.classify(Math.abs(detail.getZScore())))
                .currentValue(detail.getCurrentValue())
                .baselineMean(round2(detail.getBaselineMean()))
                .baselineStd(round2(detail.getBaselineStd()))
                .zScore(round2(detail.getZScore()))
                .anomalous(detail.isAnomalous())
                .message(detail.getContribution())
                .build();
    }

    static String recommendation(Severity severity, List<String> anomalousStatuses) {
        String statuses = String.join(", ", anomalousStatuses);
        switch (severity) {
            case CRITICAL:
                return "ALERT: Critical anomaly detected in " + statuses + ". Immediate investigation "
                        + "recommended. Check payment gateway status and system health.";
            case WARNING:
                return "WARNING: Elevated anomaly in " + statuses + ". Monitor closely. Consider "
                        + "pre-emptive investigation if trend continues.";
            default:
                return "All transaction statuses within normal parameters.";
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
