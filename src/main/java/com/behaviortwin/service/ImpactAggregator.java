package com.behaviortwin.service;

import com.behaviortwin.dto.SimulationParameters;
import com.behaviortwin.model.EventType;
import com.behaviortwin.model.ImpactSummary;
import com.behaviortwin.model.SegmentKey;
import com.behaviortwin.model.SegmentResult;

import java.util.Map;

public class ImpactAggregator {

    /** Declared model confidence; not derived from the data. */
    public static final double CONFIDENCE_SCORE = 0.85;

    private static final double SHIFT_TO_REVENUE_RATIO = 0.5;

    public ImpactSummary aggregate(
            String eventType, Map<SegmentKey, SegmentResult> results, SimulationParameters params) {
        double avgShift = averageAbsoluteShift(results);
        return new ImpactSummary(
            round(avgShift, 100.0),
            CONFIDENCE_SCORE,
            results.size(),
            round(revenueChange(eventType, avgShift, params), 10.0));
    }

    /** Mean magnitude of movement across all three brands and all segments. */
    double averageAbsoluteShift(Map<SegmentKey, SegmentResult> results) {
        if (results.isEmpty()) {
            return 0.0;
        }
        double total = results.values().stream()
            .mapToDouble(r -> Math.abs(r.delta().sevenEleven())
                + Math.abs(r.delta().familyMart())
                + Math.abs(r.delta().other()))
            .sum();
        return total / (results.size() * 3);
    }

    private double revenueChange(String eventType, double avgShift, SimulationParameters params) {
        EventType type = EventType.fromId(eventType).orElse(null);
        if (type == EventType.PRICE_CHANGE) {
            return -2.0 * params.getElectricityPrice() + 2.0;
        }
        if (type == EventType.PROMOTION) {
            return 3.0 * params.getPromotionIntensity() + params.getPointMultiplier();
        }
        return avgShift * SHIFT_TO_REVENUE_RATIO;
    }

    private double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}
