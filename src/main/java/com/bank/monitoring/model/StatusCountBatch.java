package com.bank.monitoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Batch of per-minute status counts")
public class StatusCountBatch {

    @Builder.Default
    @Schema(description = "Records to ingest")
    private List<StatusCountRecord> records = new ArrayList<>();
}
