package com.behaviortwin.service;

import com.behaviortwin.model.BaselineEntry;
import com.behaviortwin.model.BehaviorRecord;
import com.behaviortwin.model.SegmentKey;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Reduces behavior records to one baseline per segment. The first eligible record for a
 * segment wins; later records for the same segment are ignored.
 */
public class BaselineResolver {

    private final Predicate<BehaviorRecord> artifactRule;

    public BaselineResolver() {
        this(BehaviorRecord::isSimulationArtifact);
    }

    public BaselineResolver(Predicate<BehaviorRecord> artifactRule) {
        this.artifactRule = artifactRule;
    }

    /**
     * @return baselines in first-seen order; empty when no eligible record exists
     */
    public Map<SegmentKey, BaselineEntry> resolve(List<BehaviorRecord> records) {
        Map<SegmentKey, BaselineEntry> baseline = new LinkedHashMap<>();
        for (BehaviorRecord record : records) {
            if (artifactRule.test(record)) {
                continue;
            }
            baseline.putIfAbsent(record.segmentKey(), BaselineEntry.of(record));
        }
        return baseline;
    }
}
