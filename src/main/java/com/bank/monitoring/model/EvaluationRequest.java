package com.bank.monitoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ad-hoc evaluation of one status count against the rolling baseline")
public class EvaluationRequest {

    @Schema(description = "Monitored transaction status", example = "denied")
    private String status;

    @Schema(description = "Observed count (>= 0)", example = "200")
    private long count;

    @Schema(description = "Observation time in epoch milliseconds. Defaults to current time if not provided.", example = "1739886764000")
    private long timestamp;
}
