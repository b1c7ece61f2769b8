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
@Schema(description = "Verdict for an ad-hoc status count, with side-effect flags")
public class EvaluationResponse {

    @Schema(description = "Evaluated status", example = "denied")
    private String status;

    @Schema(description = "Evaluated count", example = "200")
    private long count;

    @Schema(description = "NORMAL, WARNING or CRITICAL", example = "CRITICAL")
    private Severity severity;

    @JsonProperty("zScore")
    @Schema(description = "Z-score against the baseline (2 decimals). 10.0 marks a problem status seen with no baseline.", example = "138.31")
    private double zScore;

    @Schema(description = "Baseline mean (2 decimals)", example = "5.02")
    private double baselineMean;

    @Schema(description = "Baseline standard deviation (2 decimals)", example = "1.41")
    private double baselineStd;

    @Schema(description = "Whether the count is above the warning threshold", example = "true")
    private boolean anomalous;

    @Schema(description = "Explanation; empty for a normal verdict",
            example = "denied count 200 is 138.3σ above baseline (mean=5.0, std=1.4)")
    private String message;

    @Schema(description = "True if at least one alert was dispatched (false when suppressed by cooldown or on failure)", example = "true")
    private boolean alertDispatched;

    @Schema(description = "True if the observed count was written to the count store", example = "true")
    private boolean recorded;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    private long evaluatedAt;
}
