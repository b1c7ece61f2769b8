package com.bank.monitoring.controller;

import com.bank.monitoring.model.IngestionResponse;
import com.bank.monitoring.model.StatusCountBatch;
import com.bank.monitoring.model.StatusCountRecord;
import com.bank.monitoring.model.StatusSummary;
import com.bank.monitoring.repository.StatusCountRepository;
import com.bank.monitoring.service.CountQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/transactions")
@Tag(name = "Transaction Counts", description = "Ingest per-minute transaction counts by status and query aggregates")
public class TransactionCountController {

    private final StatusCountRepository repository;
    private final CountQueryService queryService;
    private final Clock clock;

    public TransactionCountController(StatusCountRepository repository,
                                      CountQueryService queryService,
                                      Clock clock) {
        this.repository = repository;
        this.queryService = queryService;
        this.clock = clock;
    }

    @Operation(summary = "Ingest one status count",
            description = "Adds the count to the per-minute bucket of its timestamp. Counts for the same " +
                    "status and minute accumulate.")
    @PostMapping
    public ResponseEntity<?> ingest(@RequestBody StatusCountRecord record) {
        String error = validate(record);
        if (error != null) {
            return ResponseEntity.badRequest().body(Map.of("error", error));
        }
        if (record.getTimestamp() <= 0) {
            record.setTimestamp(clock.millis());
        }

        repository.record(record.getStatus(), record.getCount(), record.getTimestamp());
        return ResponseEntity.ok(IngestionResponse.builder()
                .recordsInserted(1)
                .timestamp(record.getTimestamp())
                .build());
    }

    @Operation(summary = "Ingest a batch of status counts",
            description = "Validates every record before writing any. An empty batch is accepted and inserts nothing.")
    @PostMapping("/batch")
    public ResponseEntity<?> ingestBatch(@RequestBody StatusCountBatch batch) {
        List<StatusCountRecord> records = batch.getRecords() != null ? batch.getRecords() : List.of();

        for (int i = 0; i < records.size(); i++) {
            String error = validate(records.get(i));
            if (error != null) {
                return ResponseEntity.badRequest().body(Map.of("error", "records[" + i + "]: " + error));
            }
        }

        long now = clock.millis();
        Long latest = null;
        for (StatusCountRecord record : records) {
            if (record.getTimestamp() <= 0) {
                record.setTimestamp(now);
            }
            latest = latest == null ? record.getTimestamp() : Math.max(latest, record.getTimestamp());
        }

        int inserted = repository.recordAll(records);
        return ResponseEntity.ok(IngestionResponse.builder()
                .recordsInserted(inserted)
                .timestamp(latest)
                .build());
    }

    @Operation(summary = "Per-status summary",
            description = "Total, average, min and max per-minute count for each status over the trailing window.")
    @GetMapping("/summary")
    public ResponseEntity<?> summary(
            @Parameter(description = "Window size in minutes (1-1440)", example = "60")
            @RequestParam(defaultValue = "60") int minutes) {
        if (minutes < 1 || minutes > 1440) {
            return ResponseEntity.badRequest().body(Map.of("error", "minutes must be between 1 and 1440"));
        }

        List<StatusSummary> statuses = queryService.summarize(minutes);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("windowMinutes", minutes);
        response.put("statuses", statuses);
        response.put("totalRecords", statuses.stream().mapToInt(StatusSummary::getDataPoints).sum());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Most recent status counts",
            description = "Newest per-minute (minute, status) counters first, from the last 24 hours.")
    @GetMapping("/recent")
    public ResponseEntity<?> recent(
            @Parameter(description = "Maximum number of records (1-100)", example = "10")
            @RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > 100) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be between 1 and 100"));
        }

        List<StatusCountRecord> records = queryService.recent(limit);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("records", records);
        response.put("count", records.size());
        return ResponseEntity.ok(response);
    }

    private static String validate(StatusCountRecord record) {
        if (record.getStatus() == null || record.getStatus().isBlank()) {
            return "status is required";
        }
        if (record.getCount() < 0) {
            return "count must be >= 0";
        }
        return null;
    }
}
