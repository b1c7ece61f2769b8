package com.bank.monitoring.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "monitoring.alerting")
public class AlertingConfig {

    // One week
    public static final long MAX_COOLDOWN_SECONDS = 604_800;

    private boolean schedulerEnabled = true;

    @Positive
    private int checkIntervalSeconds = 30;

    // Minimum gap between two alerts for the same status + severity
    @PositiveOrZero
    @Max(MAX_COOLDOWN_SECONDS)
    private long cooldownSeconds = 300;

    // Trailing window summed into the "current" observation
    @Positive
    private int currentWindowMinutes = 1;

    @Positive
    @Max(1440)
    private int historyWindowMinutes = 60;

    // How long stop() waits for an in-flight check to finish
    @Positive
    private int stopTimeoutSeconds = 30;
}
