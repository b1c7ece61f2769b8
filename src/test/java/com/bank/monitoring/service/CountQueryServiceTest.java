package com.bank.monitoring.service;

import com.bank.monitoring.model.StatusCountRecord;
import com.bank.monitoring.model.StatusSummary;
import com.bank.monitoring.repository.StatusCountRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.bank.monitoring.testutil.TestDataFactory.statusCount;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CountQueryServiceTest {

    @Mock private StatusCountRepository repository;
    @InjectMocks private CountQueryService queryService;

    @Test
    void summarize_aggregatesPerStatusOrderedByTotal() {
        when(repository.getMinuteSeries(60)).thenReturn(List.of(
                statusCount("denied", 3, 60_000L),
                statusCount("approved", 90, 60_000L),
                statusCount("denied", 6, 120_000L),
                statusCount("approved", 110, 120_000L),
                statusCount("denied", 4, 180_000L)));

        List<StatusSummary> summaries = queryService.summarize(60);

        assertThat(summaries).extracting(StatusSummary::getStatus).containsExactly("approved", "denied");
        StatusSummary denied = summaries.get(1);
        assertThat(denied.getTotal()).isEqualTo(13);
        assertThat(denied.getAvgPerMinute()).isEqualTo(4.33);
        assertThat(denied.getMaxCount()).isEqualTo(6);
        assertThat(denied.getMinCount()).isEqualTo(3);
        assertThat(denied.getDataPoints()).isEqualTo(3);
    }

    @Test
    void summarize_noData_returnsEmpty() {
        when(repository.getMinuteSeries(15)).thenReturn(List.of());

        assertThat(queryService.summarize(15)).isEmpty();
    }

    @Test
    void recent_returnsNewestRecordsFirstUpToLimit() {
        when(repository.getMinuteSeries(CountQueryService.RECENT_LOOKBACK_MINUTES)).thenReturn(List.of(
                statusCount("approved", 90, 60_000L),
                statusCount("denied", 3, 60_000L),
                statusCount("approved", 110, 120_000L),
                statusCount("denied", 6, 120_000L)));

        List<StatusCountRecord> recent = queryService.recent(3);

        assertThat(recent).extracting(StatusCountRecord::getTimestamp).containsExactly(120_000L, 120_000L, 60_000L);
        assertThat(recent).extracting(StatusCountRecord::getStatus).containsExactly("approved", "denied", "approved");
    }
}
