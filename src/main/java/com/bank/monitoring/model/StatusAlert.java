package com.bank.monitoring.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-status line of an on-demand analysis")
public class StatusAlert {

    @Schema(description = "Transaction status", example = "failed")
    private String status;

    @Schema(description = "Severity of this status alone", example = "WARNING")
    private Severity severity;

    @Schema(description = "Current count", example = "100")
    private long currentValue;

    @Schema(description = "Baseline mean (2 decimals)", example = "2.5")
    private double baselineMean;

    @Schema(description = "Baseline standard deviation (2 decimals)", example = "1.12")
    private double baselineStd;

    @JsonProperty("zScore")
    @Schema(description = "Z-score (2 decimals)", example = "87.05")
    private double zScore;

    @Schema(description = "Whether the status is above the warning threshold", example = "true")
    private boolean anomalous;

    @Schema(description = "Explanation; empty when not anomalous")
    private String message;
}
