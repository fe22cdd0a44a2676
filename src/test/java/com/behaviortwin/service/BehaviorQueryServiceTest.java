package com.behaviortwin.service;

import com.behaviortwin.dto.BehaviorResponse;
import com.behaviortwin.dto.BehaviorSummaryResponse;
import com.behaviortwin.exception.NoBehaviorDataException;
import com.behaviortwin.model.BehaviorRecord;
import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.repository.BehaviorRecordRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BehaviorQueryServiceTest {

    @Mock BehaviorRecordRepository repository;
    @InjectMocks BehaviorQueryService service;

    private BehaviorRecord record(String timestamp, String persona, String region,
                                  double a, double b, double o, double satisfaction, boolean artifact) {
        return BehaviorRecord.builder()
            .timestamp(timestamp).persona(persona).region(region)
            .brandPercentage("7-11", a).brandPercentage("FamilyMart", b).brandPercentage("Other", o)
            .avgSatisfaction(satisfaction).simulationArtifact(artifact).build();
    }

    private IngestionReport<BehaviorRecord> store() {
        return new IngestionReport<>(List.of(
            record("2024-01-31T00:00:00", "新鮮人", "台北", 50, 30, 20, 0.72, false),
            record("2024-01-31T00:00:00", "FinTech家庭", "台南", 40, 45, 15, 0.81, false),
            record("2024-02-29T00:00:00", "新鮮人", "台北", 45, 35, 20, 0.70, false),
            record("2024-03-01T10:00:00", "新鮮人", "台北", 10, 10, 80, 0.50, true)),
            List.of());
    }

    @Test
    void find_noFilters_returnsObservationsOnly() {
        when(repository.loadAll()).thenReturn(store());

        BehaviorResponse resp = service.find(null, null, null, null, 100);

        assertThat(resp.isSuccess()).isTrue();
        assertThat(resp.getCount()).isEqualTo(3);
        assertThat(resp.getData()).noneMatch(BehaviorRecord::isSimulationArtifact);
        assertThat(resp.getFiltersApplied()).containsEntry("limit", 100);
    }

    @Test
    void find_personaAliasAndDateRange() {
        when(repository.loadAll()).thenReturn(store());

        BehaviorResponse resp = service.find("fresh_grad", "Taipei",
            LocalDate.of(2024, 2, 1), LocalDate.of(2024, 12, 31), 100);

        assertThat(resp.getData()).extracting(BehaviorRecord::getTimestamp)
            .containsExactly("2024-02-29T00:00:00");
    }

    @Test
    void find_endDateIsInclusive() {
        when(repository.loadAll()).thenReturn(store());

        BehaviorResponse resp = service.find(null, null, null, LocalDate.of(2024, 1, 31), 100);

        assertThat(resp.getCount()).isEqualTo(2);
    }

    @Test
    void find_unparsableTimestampIsNotFilteredByDate() {
        when(repository.loadAll()).thenReturn(new IngestionReport<>(List.of(
            record("January 2024", "新鮮人", "台北", 50, 30, 20, 0.7, false)), List.of()));

        BehaviorResponse resp = service.find(null, null, LocalDate.of(2025, 1, 1), null, 10);

        assertThat(resp.getCount()).isEqualTo(1);
    }

    @Test
    void find_missingTimestampIsNotFilteredByDate() {
        when(repository.loadAll()).thenReturn(new IngestionReport<>(List.of(
            record(null, "新鮮人", "台北", 50, 30, 20, 0.7, false),
            record("2023-06-30T00:00:00", "新鮮人", "台北", 50, 30, 20, 0.7, false)), List.of()));

        BehaviorResponse resp = service.find(null, null, LocalDate.of(2024, 1, 1), null, 10);

        assertThat(resp.getCount()).isEqualTo(1);
        assertThat(resp.getData().get(0).getTimestamp()).isNull();
    }

    @Test
    void find_limitAppliesAfterArtifactsAreDropped() {
        when(repository.loadAll()).thenReturn(store());

        BehaviorResponse resp = service.find("新鮮人", null, null, null, 1);

        assertThat(resp.getCount()).isEqualTo(1);
        assertThat(resp.getData().get(0).getTimestamp()).isEqualTo("2024-01-31T00:00:00");
    }

    @Test
    void summary_aggregatesObservations() {
        when(repository.loadAll()).thenReturn(store());

        BehaviorSummaryResponse summary = service.summary();

        assertThat(summary.getTotalRecords()).isEqualTo(3);
        assertThat(summary.getAverageSatisfaction()).isEqualTo(0.743);
        assertThat(summary.getTopBrand()).isEqualTo("7-11");
        assertThat(summary.getBrandDistributionSummary().get("7-11")).isCloseTo(45.0, within(1e-9));
        assertThat(summary.getBrandDistributionSummary().get("FamilyMart")).isCloseTo(36.667, within(1e-3));
        assertThat(summary.getPersonaBreakdown()).containsEntry("新鮮人", 2).containsEntry("FinTech家庭", 1);
        assertThat(summary.getRegionBreakdown()).containsEntry("台北", 2).containsEntry("台南", 1);
    }

    @Test
    void summary_onlyArtifacts_throwsNoBehaviorData() {
        when(repository.loadAll()).thenReturn(new IngestionReport<>(List.of(
            record("2024-03-01", "新鮮人", "台北", 10, 10, 80, 0.5, true)), List.of()));

        assertThatThrownBy(() -> service.summary()).isInstanceOf(NoBehaviorDataException.class);
    }
}
