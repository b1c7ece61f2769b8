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
@Schema(description = "Aggregate counts for one status over a time window")
public class StatusSummary {

    @Schema(description = "Transaction status", example = "approved")
    private String status;

    @Schema(description = "Sum of counts in the window", example = "6000")
    private long total;

    @Schema(description = "Average count per minute with data (2 decimals)", example = "100.0")
    private double avgPerMinute;

    @Schema(description = "Highest per-minute count", example = "131")
    private long maxCount;

    @Schema(description = "Lowest per-minute count", example = "72")
    private long minCount;

    @Schema(description = "Number of minutes with data for this status", example = "60")
    private int dataPoints;
}
