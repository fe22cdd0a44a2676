package com.behaviortwin.service;

import com.behaviortwin.dto.SimulationCatalogResponse;
import com.behaviortwin.dto.SimulationParameters;
import com.behaviortwin.dto.SimulationRequest;
import com.behaviortwin.dto.SimulationResponse;
import com.behaviortwin.exception.NoBaselineDataException;
import com.behaviortwin.exception.NoMatchingSegmentsException;
import com.behaviortwin.model.BehaviorRecord;
import com.behaviortwin.model.EventType;
import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.model.SegmentResult;
import com.behaviortwin.model.WhatIfResult;
import com.behaviortwin.repository.BehaviorRecordRepository;
import com.behaviortwin.util.SegmentAliases;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationService {

    private final BehaviorRecordRepository repository;
    private final WhatIfEngine engine;

    public SimulationResponse simulate(SimulationRequest request, String requestId) {
        IngestionReport<BehaviorRecord> report = repository.loadAll();
        SimulationParameters params = request.getParameters() != null
            ? request.getParameters()
            : SimulationParameters.defaults();
        WhatIfResult result = engine.run(
            report.records(), request.getEventType(), params,
            request.getPersona(), request.getRegion(), request.getDurationDays());

        switch (result.getStatus()) {
            case NO_BASELINE_DATA -> throw new NoBaselineDataException();
            case NO_MATCHING_SEGMENTS -> throw new NoMatchingSegmentsException(
                request.getPersona(), request.getRegion());
            case COMPLETED -> log.info("Simulation completed | eventType={} | segments={} | skipped={} | requestId={}",
                request.getEventType(), result.getResults().size(), report.skippedCount(), requestId);
        }
        return toResponse(request, params, result, report);
    }

    public SimulationCatalogResponse catalog() {
        List<SimulationCatalogResponse.EventTypeInfo> eventTypes = Arrays.stream(EventType.values())
            .map(type -> SimulationCatalogResponse.EventTypeInfo.builder()
                .id(type.getId())
                .name(type.getDisplayName())
                .description(type.getDescription())
                .build())
            .toList();

        Map<String, SimulationCatalogResponse.ParameterRange> parameters = new LinkedHashMap<>();
        parameters.put("electricityPrice", range(0.5, 3.0, "電價倍數 (1.0 = 無變化)"));
        parameters.put("pointMultiplier", range(0.5, 5.0, "點數加成倍率"));
        parameters.put("promotionIntensity", range(0.0, 2.0, "促銷強度 (0-2)"));
        parameters.put("priceSensitivity", range(0.5, 2.0, "消費者價格敏感度"));

        return SimulationCatalogResponse.builder()
            .eventTypes(eventTypes)
            .parameters(parameters)
            .personas(List.of(SegmentAliases.FRESH_GRAD, SegmentAliases.FINTECH_FAMILY))
            .regions(List.of(SegmentAliases.TAIPEI, SegmentAliases.TAINAN))
            .durationDays(SimulationCatalogResponse.DurationRange.builder()
                .min(1).max(365).defaultValue(30).build())
            .build();
    }

    private SimulationCatalogResponse.ParameterRange range(double min, double max, String description) {
        return SimulationCatalogResponse.ParameterRange.builder()
            .type("float")
            .min(min)
            .max(max)
            .defaultValue(SimulationParameters.NEUTRAL)
            .description(description)
            .build();
    }

    private SimulationResponse toResponse(SimulationRequest request, SimulationParameters params,
                                          WhatIfResult result, IngestionReport<BehaviorRecord> report) {
        Map<String, SimulationResponse.SegmentProjection> projections = new LinkedHashMap<>();
        result.getResults().forEach((key, segment) -> projections.put(key, toProjection(segment)));

        String eventName = EventType.fromId(request.getEventType())
            .map(EventType::getDisplayName)
            .orElse(request.getEventType());

        return SimulationResponse.builder()
            .success(true)
            .event(eventName)
            .eventType(request.getEventType())
            .parameters(params)
            .results(projections)
            .insights(result.getInsights())
            .projectedImpact(SimulationResponse.ProjectedImpact.builder()
                .avgBrandShiftPercent(result.getImpact().avgBrandShiftPercent())
                .confidenceScore(result.getImpact().confidenceScore())
                .affectedPersonas(result.getImpact().affectedPersonas())
                .estimatedRevenueChange(result.getImpact().estimatedRevenueChange())
                .build())
            .confidenceScore(ImpactAggregator.CONFIDENCE_SCORE)
            .metadata(SimulationResponse.Metadata.builder()
                .simulationTime(result.getGeneratedAt())
                .durationDays(result.getDurationDays())
                .modelVersion(result.getModelVersion())
                .recordsSkipped(report.skippedCount())
                .build())
            .build();
    }

    private SimulationResponse.SegmentProjection toProjection(SegmentResult segment) {
        return SimulationResponse.SegmentProjection.builder()
            .persona(segment.key().persona())
            .region(segment.key().region())
            .projected(segment.projected().toMap())
            .changeFromBaseline(segment.delta().toMap())
            .build();
    }
}
