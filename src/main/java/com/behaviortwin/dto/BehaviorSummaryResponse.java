package com.behaviortwin.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class BehaviorSummaryResponse {
    int totalRecords;
    double averageSatisfaction;
    String topBrand;
    Map<String, Double> brandDistributionSummary;
    Map<String, Integer> personaBreakdown;
    Map<String, Integer> regionBreakdown;
}
