package com.bank.monitoring.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of a single alert side effect. Sink failures are reported here instead of thrown.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of one alert side effect (log, metric, webhook, SMS)")
public class SinkOutcome {

    public enum Status {
        // Completed synchronously
        DELIVERED,
        // Handed to the notification executor; delivery happens in the background
        SUBMITTED,
        // Not applicable (channel disabled, or WARNING on a CRITICAL-only channel)
        SKIPPED,
        FAILED
    }

    AlertSink sink;
    Status status;
    String error;

    public static SinkOutcome delivered(AlertSink sink) {
        return new SinkOutcome(sink, Status.DELIVERED, null);
    }

    public static SinkOutcome submitted(AlertSink sink) {
        return new SinkOutcome(sink, Status.SUBMITTED, null);
    }

    public static SinkOutcome skipped(AlertSink sink) {
        return new SinkOutcome(sink, Status.SKIPPED, null);
    }

    public static SinkOutcome failed(AlertSink sink, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new SinkOutcome(sink, Status.FAILED, message);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
