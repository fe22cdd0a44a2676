package com.behaviortwin.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class SimulationCatalogResponse {
    List<EventTypeInfo> eventTypes;
    Map<String, ParameterRange> parameters;
    List<String> personas;
    List<String> regions;
    DurationRange durationDays;

    @Value
    @Builder
    public static class EventTypeInfo {
        String id;
        String name;
        String description;
    }

    @Value
    @Builder
    public static class ParameterRange {
        String type;
        double min;
        double max;
        double defaultValue;
        String description;
    }

    @Value
    @Builder
    public static class DurationRange {
        int min;
        int max;
        int defaultValue;
    }
}
