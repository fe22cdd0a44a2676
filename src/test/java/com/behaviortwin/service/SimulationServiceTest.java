package com.behaviortwin.service;

import com.behaviortwin.dto.SimulationCatalogResponse;
import com.behaviortwin.dto.SimulationParameters;
import com.behaviortwin.dto.SimulationRequest;
import com.behaviortwin.dto.SimulationResponse;
import com.behaviortwin.exception.BehaviorDataNotFoundException;
import com.behaviortwin.exception.NoBaselineDataException;
import com.behaviortwin.exception.NoMatchingSegmentsException;
import com.behaviortwin.model.BehaviorRecord;
import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.model.SkipReason;
import com.behaviortwin.repository.BehaviorRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SimulationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    @Mock BehaviorRecordRepository repository;

    private SimulationService service;

    @BeforeEach
    void setUp() {
        WhatIfEngine engine = new WhatIfEngine(
            new BaselineResolver(), new ImpactCalculator(List.of("新鮮人")),
            new InsightGenerator(), new ImpactAggregator(),
            Clock.fixed(NOW, ZoneOffset.UTC), "1.0.0");
        service = new SimulationService(repository, engine);
    }

    private BehaviorRecord record(String persona, String region, double a, double b, double o) {
        return BehaviorRecord.builder()
            .timestamp("2024-01-31T00:00:00").persona(persona).region(region)
            .brandPercentage("7-11", a).brandPercentage("FamilyMart", b).brandPercentage("Other", o)
            .avgSatisfaction(0.7).build();
    }

    private IngestionReport<BehaviorRecord> report() {
        return new IngestionReport<>(
            List.of(record("新鮮人", "台北", 50, 30, 20), record("FinTech家庭", "台南", 40, 45, 15)),
            List.of(new IngestionReport.SkippedRecord(3, SkipReason.INVALID_JSON, "Unexpected end-of-input")));
    }

    private SimulationRequest request(String eventType, SimulationParameters params, String persona) {
        return SimulationRequest.builder()
            .eventType(eventType).parameters(params).persona(persona).build();
    }

    @Test
    void simulate_priceChange_mapsEngineResultToResponse() {
        when(repository.loadAll()).thenReturn(report());

        SimulationResponse resp = service.simulate(
            request("price_change", SimulationParameters.builder().electricityPrice(1.5).build(), "fresh_grad"),
            "req-1");

        assertThat(resp.isSuccess()).isTrue();
        assertThat(resp.getEvent()).isEqualTo("電價/價格變動");
        assertThat(resp.getEventType()).isEqualTo("price_change");
        assertThat(resp.getResults()).containsOnlyKeys("新鮮人_台北");
        SimulationResponse.SegmentProjection projection = resp.getResults().get("新鮮人_台北");
        assertThat(projection.getPersona()).isEqualTo("新鮮人");
        assertThat(projection.getRegion()).isEqualTo("台北");
        assertThat(projection.getProjected()).containsEntry("7-11", 50.0).containsEntry("Other", 20.1);
        assertThat(projection.getChangeFromBaseline()).containsEntry("Other", 0.1);
        assertThat(resp.getInsights()).first().asString().contains("50%");
        assertThat(resp.getProjectedImpact().getEstimatedRevenueChange()).isEqualTo(-1.0);
        assertThat(resp.getProjectedImpact().getAffectedPersonas()).isEqualTo(1);
        assertThat(resp.getConfidenceScore()).isEqualTo(0.85);
        assertThat(resp.getMetadata().getSimulationTime()).isEqualTo(NOW);
        assertThat(resp.getMetadata().getDurationDays()).isEqualTo(30);
        assertThat(resp.getMetadata().getModelVersion()).isEqualTo("1.0.0");
        assertThat(resp.getMetadata().getRecordsSkipped()).isEqualTo(1);
    }

    @Test
    void simulate_withoutParameters_echoesNeutralDefaults() {
        when(repository.loadAll()).thenReturn(report());

        SimulationResponse resp = service.simulate(request("promotion", null, null), "req-2");

        assertThat(resp.getParameters()).isEqualTo(SimulationParameters.defaults());
        assertThat(resp.getParameters().getPromotionIntensity()).isEqualTo(1.0);
        assertThat(resp.getResults()).hasSize(2);
    }

    @Test
    void catalog_describesEventsInTraditionalChinese() {
        SimulationCatalogResponse catalog = service.catalog();

        assertThat(catalog.getEventTypes())
            .extracting(SimulationCatalogResponse.EventTypeInfo::getName)
            .containsExactly("電價/價格變動", "促銷活動", "競合變化", "外部因素");
        assertThat(catalog.getParameters().get("electricityPrice").getDescription())
            .isEqualTo("電價倍數 (1.0 = 無變化)");
    }

    @Test
    void simulate_noBaseline_throwsNoBaselineData() {
        when(repository.loadAll()).thenReturn(IngestionReport.empty());

        assertThatThrownBy(() -> service.simulate(request("external", SimulationParameters.defaults(), null), "r"))
            .isInstanceOf(NoBaselineDataException.class);
    }

    @Test
    void simulate_unknownPersona_throwsNoMatchingSegments() {
        when(repository.loadAll()).thenReturn(report());

        assertThatThrownBy(() -> service.simulate(request("external", SimulationParameters.defaults(), "retiree"), "r"))
            .isInstanceOf(NoMatchingSegmentsException.class)
            .hasMessageContaining("retiree");
    }

    @Test
    void simulate_missingDataFile_propagates() {
        when(repository.loadAll()).thenThrow(new BehaviorDataNotFoundException(Path.of("data", "missing.jsonl")));

        assertThatThrownBy(() -> service.simulate(request("external", SimulationParameters.defaults(), null), "r"))
            .isInstanceOf(BehaviorDataNotFoundException.class);
        verify(repository, times(1)).loadAll();
    }

    @Test
    void catalog_listsEventTypesParametersAndSegments() {
        SimulationCatalogResponse catalog = service.catalog();

        assertThat(catalog.getEventTypes())
            .extracting(SimulationCatalogResponse.EventTypeInfo::getId)
            .containsExactly("price_change", "promotion", "competition", "external");
        assertThat(catalog.getParameters())
            .containsOnlyKeys("electricityPrice", "pointMultiplier", "promotionIntensity", "priceSensitivity");
        assertThat(catalog.getParameters().get("electricityPrice").getMax()).isEqualTo(3.0);
        assertThat(catalog.getParameters().get("promotionIntensity").getMin()).isZero();
        assertThat(catalog.getPersonas()).containsExactly("新鮮人", "FinTech家庭");
        assertThat(catalog.getRegions()).containsExactly("台北", "台南");
        assertThat(catalog.getDurationDays().getDefaultValue()).isEqualTo(30);
        verifyNoInteractions(repository);
    }
}
