package com.bank.monitoring.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.Value;
import com.aerospike.client.cdt.MapOperation;
import com.aerospike.client.cdt.MapPolicy;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.monitoring.config.AerospikeConfig;
import com.bank.monitoring.model.StatusCountRecord;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-minute transaction counts by status.
 *
 * One record per epoch minute in {@link AerospikeConfig#SET_STATUS_MINUTE_COUNTS}, with
 * a map bin {@code counts} (status → count) updated through atomic map increments.
 * Status names live in the map rather than as bin names because some exceed the
 * 15-character bin name limit (backend_reversed).
 */
@Repository
public class StatusCountRepository {

    private static final Logger log = LoggerFactory.getLogger(StatusCountRepository.class);

    static final String BIN_MINUTE = "minute";
    static final String BIN_COUNTS = "counts";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy counterWritePolicy;
    private final BatchPolicy batchPolicy;
    private final Clock clock;

    public StatusCountRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultBatchPolicy") BatchPolicy batchPolicy,
                                 @org.springframework.beans.factory.annotation.Value("${monitoring.store.retention-hours:48}") int retentionHours,
                                 Clock clock) {
        this.client = client;
        this.namespace = namespace;
        this.batchPolicy = batchPolicy;
        this.clock = clock;

        this.counterWritePolicy = new WritePolicy(writePolicy);
        this.counterWritePolicy.expiration = (int) TimeUnit.HOURS.toSeconds(retentionHours);
    }

    /**
     * Atomically add {@code count} to the status counter of the minute containing the timestamp.
     */
    public void record(String status, long count, long timestampMillis) {
        long minute = toEpochMinute(timestampMillis);
        client.operate(counterWritePolicy, minuteKey(minute),
                Operation.put(new Bin(BIN_MINUTE, minute)),
                MapOperation.increment(MapPolicy.Default, BIN_COUNTS, Value.get(status), Value.get(count)));
    }

    public int recordAll(List<StatusCountRecord> records) {
        for (StatusCountRecord record : records) {
            record(record.getStatus(), record.getCount(), record.getTimestamp());
        }
        return records.size();
    }

    /**
     * Counts aggregated over the trailing {@code minutes} minutes, current minute included.
     *
     * @return status → summed count, empty when there is no data in the window
     */
    @Observed(name = "store.status_counts", contextualName = "get-status-counts")
    public Map<String, Long> getStatusCountsAt(int minutes) {
        long currentMinute = toEpochMinute(clock.millis());
        Map<String, Long> totals = new HashMap<>();
        for (Map<String, Long> bucket : readBuckets(currentMinute - minutes + 1, minutes)) {
            bucket.forEach((status, count) -> totals.merge(status, count, Long::sum));
        }
        return totals;
    }

    /**
     * One entry per completed minute in the trailing {@code minutes} window, oldest first.
     * The minute in progress is excluded; minutes without data are left out.
     */
    @Observed(name = "store.history_window", contextualName = "get-history-window")
    public List<Map<String, Long>> getHistoryWindow(int minutes) {
        long currentMinute = toEpochMinute(clock.millis());
        return readBuckets(currentMinute - minutes, minutes);
    }

    /**
     * Per-minute counts over the trailing {@code minutes} minutes, current minute included,
     * flattened to one record per (minute, status), oldest minute first.
     */
    @Observed(name = "store.minute_series", contextualName = "get-minute-series")
    public List<StatusCountRecord> getMinuteSeries(int minutes) {
        long currentMinute = toEpochMinute(clock.millis());
        List<StatusCountRecord> series = new ArrayList<>();
        readMinutes(currentMinute - minutes + 1, minutes).forEach((minute, counts) ->
                counts.entrySet().stream()
                        .sorted(Map.Entry.comparingByKey())
                        .forEach(e -> series.add(StatusCountRecord.builder()
                                .timestamp(minute * 60_000L)
                                .status(e.getKey())
                                .count(e.getValue())
                                .build())));
        return series;
    }

    /**
     * Number of stored (minute, status) counters across the whole set. The set holds at
     * most one record per minute of retention, so a full scan stays small.
     */
    @Observed(name = "store.count_records", contextualName = "count-status-records")
    public long countStatusRecords() {
        ScanPolicy policy = new ScanPolicy();
        policy.totalTimeout = batchPolicy.totalTimeout;

        // Callbacks may arrive concurrently from several nodes
        AtomicLong total = new AtomicLong();
        client.scanAll(policy, namespace, AerospikeConfig.SET_STATUS_MINUTE_COUNTS,
                (key, record) -> total.addAndGet(toCounts(record).size()), BIN_COUNTS);
        return total.get();
    }

    private List<Map<String, Long>> readBuckets(long firstMinute, int count) {
        return new ArrayList<>(readMinutes(firstMinute, count).values());
    }

    private Map<Long, Map<String, Long>> readMinutes(long firstMinute, int count) {
        if (count <= 0) {
            return Collections.emptyMap();
        }
        Key[] keys = new Key[count];
        for (int i = 0; i < count; i++) {
            keys[i] = minuteKey(firstMinute + i);
        }

        // Batch results line up with the key array; missing minutes come back null
        Record[] records = client.get(batchPolicy, keys);
        Map<Long, Map<String, Long>> buckets = new LinkedHashMap<>();
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                buckets.put(firstMinute + i, toCounts(records[i]));
            }
        }
        return buckets;
    }

    private Map<String, Long> toCounts(Record record) {
        Map<?, ?> raw = record.getMap(BIN_COUNTS);
        if (raw == null) {
            return Collections.emptyMap();
        }
        Map<String, Long> counts = new HashMap<>();
        raw.forEach((status, count) -> {
            if (count instanceof Number) {
                counts.put(String.valueOf(status), ((Number) count).longValue());
            } else {
                log.warn("Ignoring non-numeric count for status {} in minute {}: {}",
                        status, record.getValue(BIN_MINUTE), count);
            }
        });
        return counts;
    }

    private Key minuteKey(long epochMinute) {
        return new Key(namespace, AerospikeConfig.SET_STATUS_MINUTE_COUNTS, epochMinute);
    }

    static long toEpochMinute(long epochMillis) {
        return Math.floorDiv(epochMillis, 60_000L);
    }
}
