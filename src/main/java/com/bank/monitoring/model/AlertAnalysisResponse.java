package com.bank.monitoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "On-demand anomaly analysis over the recent count history")
public class AlertAnalysisResponse {

    @Schema(description = "Detection timestamp")
    private Instant timestamp;

    @Schema(description = "Highest z-score across statuses (2 decimals)", example = "87.05")
    private double overallScore;

    @Schema(description = "Overall severity", example = "CRITICAL")
    private Severity overallSeverity;

    @Schema(description = "Per-status breakdown, in monitored-status order")
    private List<StatusAlert> alerts;

    @Schema(description = "Operator guidance for the overall severity")
    private String recommendation;

    @Schema(description = "History window used for the baseline, in minutes", example = "60")
    private int windowMinutes;
}
