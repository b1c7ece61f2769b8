package com.bank.monitoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Lightweight current anomaly status")
public class AlertStatusResponse {

    @Schema(description = "Detection timestamp")
    private Instant timestamp;

    @Schema(description = "Overall severity", example = "NORMAL")
    private Severity overallSeverity;

    @Schema(description = "Highest z-score across statuses (2 decimals)", example = "1.2")
    private double overallScore;

    @Schema(description = "Z-score per status (2 decimals)")
    private Map<String, Double> statuses;
}
