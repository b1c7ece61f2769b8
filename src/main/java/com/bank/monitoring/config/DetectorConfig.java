package com.bank.monitoring.config;

import com.bank.monitoring.model.MonitoredStatus;
import com.bank.monitoring.model.StatusCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "monitoring.detector")
public class DetectorConfig {

    // Z-score above which a status is flagged as anomalous (WARNING boundary)
    @Positive
    private double warningThreshold = 2.5;

    // Z-score above which a status escalates to CRITICAL
    @Positive
    private double criticalThreshold = 4.0;

    // Minimum number of per-minute history entries before any status is evaluated.
    // Below this, detection returns NORMAL (warm-up).
    @PositiveOrZero
    private int minHistory = 30;

    // Floor applied to the baseline std before dividing, so flat history
    // cannot produce unbounded z-scores.
    @Positive
    private double stdFloor = 1.0;

    // Monitored statuses in evaluation order. PROBLEM statuses are normally rare,
    // so any occurrence without a baseline is treated as suspicious.
    @Valid
    @NotEmpty
    private List<MonitoredStatus> statuses = new ArrayList<>(List.of(
            new MonitoredStatus("denied", StatusCategory.PROBLEM),
            new MonitoredStatus("failed", StatusCategory.PROBLEM),
            new MonitoredStatus("reversed", StatusCategory.PROBLEM),
            new MonitoredStatus("backend_reversed", StatusCategory.PROBLEM),
            new MonitoredStatus("approved", StatusCategory.VOLUME)));
}
