package com.bank.monitoring.service;

import com.bank.monitoring.model.StatusCountRecord;
import com.bank.monitoring.model.StatusSummary;
import com.bank.monitoring.repository.StatusCountRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LongSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only views over the stored minute counts, for dashboards and operators.
 */
@Service
public class CountQueryService {

    // How far back the recent-records view looks
    static final int RECENT_LOOKBACK_MINUTES = 1440;

    private final StatusCountRepository repository;

    public CountQueryService(StatusCountRepository repository) {
        this.repository = repository;
    }

    /**
     * Per-status aggregates over the trailing window, highest total first.
     */
    public List<StatusSummary> summarize(int minutes) {
        Map<String, LongSummaryStatistics> stats = repository.getMinuteSeries(minutes).stream()
                .collect(Collectors.groupingBy(StatusCountRecord::getStatus, TreeMap::new,
                        Collectors.summarizingLong(StatusCountRecord::getCount)));

        List<StatusSummary> summaries = new ArrayList<>();
        stats.forEach((status, s) -> summaries.add(StatusSummary.builder()
                .status(status)
                .total(s.getSum())
                .avgPerMinute(Math.round(s.getAverage() * 100.0) / 100.0)
                .maxCount(s.getMax())
                .minCount(s.getMin())
                .dataPoints((int) s.getCount())
                .build()));

        summaries.sort(Comparator.comparingLong(StatusSummary::getTotal).reversed());
        return summaries;
    }

    /**
     * Per-minute, per-status counts over the trailing window, oldest first.
     */
    public List<StatusCountRecord> rates(int minutes) {
        return repository.getMinuteSeries(minutes);
    }

    /**
     * The newest {@code limit} (minute, status) records, newest minute first and
     * statuses alphabetical within a minute.
     */
    public List<StatusCountRecord> recent(int limit) {
        return repository.getMinuteSeries(RECENT_LOOKBACK_MINUTES).stream()
                .sorted(Comparator.comparingLong(StatusCountRecord::getTimestamp).reversed()
                        .thenComparing(StatusCountRecord::getStatus))
                .limit(limit)
                .collect(Collectors.toList());
    }
}
