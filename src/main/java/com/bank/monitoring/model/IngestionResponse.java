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
@Schema(description = "Result of a count ingestion request")
public class IngestionResponse {

    @Schema(description = "Number of records written", example = "4")
    private int recordsInserted;

    @Schema(description = "Latest record timestamp in epoch milliseconds, null for an empty batch", example = "1739886764000")
    private Long timestamp;
}
