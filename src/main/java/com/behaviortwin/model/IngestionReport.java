package com.behaviortwin.model;

import java.util.List;

/**
 * Outcome of reading a line-delimited store: records kept in file order plus every line that
 * was skipped, with the reason.
 */
public record IngestionReport<T>(List<T> records, List<SkippedRecord> skipped) {

    public IngestionReport {
        records = List.copyOf(records);
        skipped = List.copyOf(skipped);
    }

    public static <T> IngestionReport<T> empty() {
        return new IngestionReport<>(List.of(), List.of());
    }

    public int keptCount() {
        return records.size();
    }

    public int skippedCount() {
        return skipped.size();
    }

    public record SkippedRecord(int lineNumber, SkipReason reason, String detail) {}
}
