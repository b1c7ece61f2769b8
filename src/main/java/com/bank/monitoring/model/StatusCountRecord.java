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
@Schema(description = "Transaction count for one status in one minute")
public class StatusCountRecord {

    @Schema(description = "Bucket timestamp in epoch milliseconds. Defaults to current time if not provided.", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Transaction status", example = "denied")
    private String status;

    @Schema(description = "Number of transactions with this status in the minute (>= 0)", example = "5")
    private long count;
}
