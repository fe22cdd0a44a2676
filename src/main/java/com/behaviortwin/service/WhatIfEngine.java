package com.behaviortwin.service;

import com.behaviortwin.dto.SimulationParameters;
import com.behaviortwin.model.BaselineEntry;
import com.behaviortwin.model.BehaviorRecord;
import com.behaviortwin.model.SegmentKey;
import com.behaviortwin.model.SegmentResult;
import com.behaviortwin.model.SimulationStatus;
import com.behaviortwin.model.WhatIfResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one what-if simulation: baseline resolution, projection, then insights and impact
 * over the projected segments. Holds no mutable state; a single instance serves all
 * requests.
 *
 * <p>Business conditions that leave nothing to simulate are reported through
 * {@link WhatIfResult#getStatus()} rather than thrown.
 */
@Slf4j
@RequiredArgsConstructor
public class WhatIfEngine {

    private final BaselineResolver baselineResolver;
    private final ImpactCalculator impactCalculator;
    private final InsightGenerator insightGenerator;
    private final ImpactAggregator impactAggregator;
    private final Clock clock;
    private final String modelVersion;

    public WhatIfResult run(List<BehaviorRecord> records, String eventType, SimulationParameters params,
                            String persona, String region, Integer durationDays) {
        SimulationParameters effective = params != null ? params : SimulationParameters.defaults();

        Map<SegmentKey, BaselineEntry> baseline = baselineResolver.resolve(records);
        if (baseline.isEmpty()) {
            log.debug("No baseline among {} records", records.size());
            return empty(SimulationStatus.NO_BASELINE_DATA, eventType, durationDays);
        }

        Map<SegmentKey, SegmentResult> results = impactCalculator.calculate(
            baseline, effective, eventType, persona, region);
        if (results.isEmpty()) {
            log.debug("No segment matches persona={} region={} among {} baselines",
                      persona, region, baseline.size());
            return empty(SimulationStatus.NO_MATCHING_SEGMENTS, eventType, durationDays);
        }

        Map<String, SegmentResult> keyed = new LinkedHashMap<>();
        results.forEach((key, result) -> keyed.put(key.asKey(), result));

        return WhatIfResult.builder()
            .status(SimulationStatus.COMPLETED)
            .eventType(eventType)
            .results(Collections.unmodifiableMap(keyed))
            .insights(insightGenerator.generate(eventType, results, effective))
            .impact(impactAggregator.aggregate(eventType, results, effective))
            .generatedAt(clock.instant())
            .modelVersion(modelVersion)
            .durationDays(durationDays)
            .build();
    }

    private WhatIfResult empty(SimulationStatus status, String eventType, Integer durationDays) {
        return WhatIfResult.builder()
            .status(status)
            .eventType(eventType)
            .results(Map.of())
            .insights(List.of())
            .generatedAt(clock.instant())
            .modelVersion(modelVersion)
            .durationDays(durationDays)
            .build();
    }
}
