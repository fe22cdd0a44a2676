package com.behaviortwin.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One monthly observation of a persona/region segment as read from the behavior store.
 * Records flagged as simulation artifacts were written by earlier simulation runs and
 * never serve as a baseline.
 */
@Value
@Builder
public class BehaviorRecord {
    String timestamp;
    String persona;
    String region;
    Integer totalPersonas;
    @Singular("brandPercentage")
    Map<String, Double> brandPercentages;
    double avgSatisfaction;
    Double digitalAdoptionRate;
    Double gamificationEngagement;
    Double efficiencyScore;
    List<String> keyInsights;
    @JsonIgnore
    boolean simulationArtifact;

    public SegmentKey segmentKey() {
        return new SegmentKey(persona, region);
    }

    public BrandShares brandShares() {
        return BrandShares.fromMap(brandPercentages);
    }
}
