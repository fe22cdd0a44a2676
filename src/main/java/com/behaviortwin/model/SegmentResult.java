package com.behaviortwin.model;

/**
 * Projected distribution of one segment. {@code projected} and {@code delta} are rounded to
 * one decimal place; {@code baseline} is kept as read.
 */
public record SegmentResult(SegmentKey key, BrandShares baseline, BrandShares projected, BrandShares delta) {

    public static SegmentResult of(SegmentKey key, BrandShares baseline, BrandShares projected) {
        return new SegmentResult(key, baseline,
            projected.roundedToTenth(),
            projected.minus(baseline).roundedToTenth());
    }
}
