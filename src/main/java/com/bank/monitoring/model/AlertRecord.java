package com.bank.monitoring.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Schema(description = "An alert that passed the cooldown gate and was dispatched")
public class AlertRecord {

    @Schema(description = "Transaction status", example = "denied")
    String status;

    @Schema(description = "Severity derived from this status' own z-score", example = "CRITICAL")
    Severity severity;

    @Schema(description = "Observed count", example = "200")
    long currentValue;

    @Schema(description = "Baseline mean (2 decimals)", example = "5.02")
    double baselineMean;

    @Schema(description = "Baseline standard deviation (2 decimals)", example = "1.41")
    double baselineStd;

    @JsonProperty("zScore")
    @Schema(description = "Z-score of this status (2 decimals)", example = "138.31")
    double zScore;

    @Schema(description = "Highest z-score across all statuses in the same detection (2 decimals)", example = "138.31")
    double score;

    @Schema(description = "Dispatch time")
    Instant timestamp;

    @Schema(description = "Per-sink side effect outcomes")
    List<SinkOutcome> sinkOutcomes;
}
