package com.behaviortwin.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class SimulationResponse {
    boolean success;
    String event;
    String eventType;
    SimulationParameters parameters;
    Map<String, SegmentProjection> results;
    List<String> insights;
    ProjectedImpact projectedImpact;
    double confidenceScore;
    Metadata metadata;

    @Value
    @Builder
    public static class SegmentProjection {
        String persona;
        String region;
        Map<String, Double> projected;
        Map<String, Double> changeFromBaseline;
    }

    @Value
    @Builder
    public static class ProjectedImpact {
        double avgBrandShiftPercent;
        double confidenceScore;
        int affectedPersonas;
        double estimatedRevenueChange;
    }

    @Value
    @Builder
    public static class Metadata {
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant simulationTime;
        Integer durationDays;
        String modelVersion;
        int recordsSkipped;
    }
}
