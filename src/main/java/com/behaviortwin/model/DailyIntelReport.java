package com.behaviortwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One day's intelligence digest: a narrative summary plus the twin, incentive and metadata
 * sections, which are passed through as read.
 */
@Value
@Builder
public class DailyIntelReport {
    String date;
    String dailyIntelligenceSummary;
    Map<String, Object> behavioralTwinReport;
    String anomalyDetection;
    Map<String, Object> incentiveAnalysis;
    Map<String, Object> metadata;
}
