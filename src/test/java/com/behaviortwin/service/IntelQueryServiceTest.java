package com.behaviortwin.service;

import com.behaviortwin.dto.WebIntelResponse;
import com.behaviortwin.exception.NoWebIntelException;
import com.behaviortwin.model.DailyIntelReport;
import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.model.SkipReason;
import com.behaviortwin.model.WebIntelRecord;
import com.behaviortwin.repository.IntelRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IntelQueryServiceTest {

    @Mock IntelRepository repository;
    @InjectMocks IntelQueryService service;

    private DailyIntelReport daily(String date) {
        return DailyIntelReport.builder()
            .date(date).dailyIntelligenceSummary("summary " + date)
            .behavioralTwinReport(Map.of()).incentiveAnalysis(Map.of()).metadata(Map.of())
            .build();
    }

    private WebIntelRecord web(String date) {
        return WebIntelRecord.builder()
            .date(date).holidayEvents(List.of()).socialPosts(List.of())
            .trendingTopics(List.of("連假")).marketInsights(List.of())
            .build();
    }

    @Test
    void dailyIntel_noDate_returnsUpToLimitInFileOrder() {
        when(repository.loadDailyIntel()).thenReturn(new IngestionReport<>(
            List.of(daily("2024-03-01"), daily("2024-03-02"), daily("2024-03-03")),
            List.of(new IngestionReport.SkippedRecord(2, SkipReason.MISSING_FIELD, "metadata is required"))));

        assertThat(service.dailyIntel(null, 2))
            .extracting(DailyIntelReport::getDate)
            .containsExactly("2024-03-01", "2024-03-02");
    }

    @Test
    void dailyIntel_filtersByDate() {
        when(repository.loadDailyIntel()).thenReturn(new IngestionReport<>(
            List.of(daily("2024-03-01"), daily("2024-03-02"), daily("2024-03-02")), List.of()));

        assertThat(service.dailyIntel(LocalDate.of(2024, 3, 2), 10)).hasSize(2);
        assertThat(service.dailyIntel(LocalDate.of(2024, 4, 1), 10)).isEmpty();
    }

    @Test
    void webIntel_noDate_returnsFirstDay() {
        when(repository.loadWebIntel()).thenReturn(new IngestionReport<>(
            List.of(web("2024-03-01"), web("2024-03-02")), List.of()));

        WebIntelResponse resp = service.webIntel(null);

        assertThat(resp.isSuccess()).isTrue();
        assertThat(resp.getDate()).isEqualTo("2024-03-01");
        assertThat(resp.getTrendingTopics()).containsExactly("連假");
    }

    @Test
    void webIntel_unknownDate_throwsNoWebIntel() {
        when(repository.loadWebIntel()).thenReturn(new IngestionReport<>(List.of(web("2024-03-01")), List.of()));

        assertThatThrownBy(() -> service.webIntel(LocalDate.of(2024, 3, 9)))
            .isInstanceOf(NoWebIntelException.class)
            .hasMessageContaining("2024-03-09");
    }
}
