package com.behaviortwin.model;

import java.util.Objects;

/**
 * Identifies a customer sub-population by persona group and region.
 */
public record SegmentKey(String persona, String region) {

    public SegmentKey {
        Objects.requireNonNull(persona, "persona must not be null");
        Objects.requireNonNull(region, "region must not be null");
    }

    /** Key used in API payloads, e.g. {@code 新鮮人_台北}. */
    public String asKey() {
        return persona + "_" + region;
    }
}
