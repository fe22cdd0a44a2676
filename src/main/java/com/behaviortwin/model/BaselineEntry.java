package com.behaviortwin.model;

/**
 * Reference distribution for a segment before any simulated event.
 */
public record BaselineEntry(SegmentKey key, BrandShares shares, double satisfaction) {

    public static BaselineEntry of(BehaviorRecord record) {
        return new BaselineEntry(record.segmentKey(), record.brandShares(), record.getAvgSatisfaction());
    }
}
