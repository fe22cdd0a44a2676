package com.behaviortwin.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class WhatIfResult {
    SimulationStatus status;
    String eventType;
    /** Keyed by {@link SegmentKey#asKey()}, in baseline order. */
    Map<String, SegmentResult> results;
    List<String> insights;
    ImpactSummary impact;
    Instant generatedAt;
    String modelVersion;
    Integer durationDays;

    public boolean isCompleted() {
        return status == SimulationStatus.COMPLETED;
    }
}
