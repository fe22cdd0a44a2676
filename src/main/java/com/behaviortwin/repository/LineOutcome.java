package com.behaviortwin.repository;

import com.behaviortwin.model.IngestionReport;
import com.behaviortwin.model.SkipReason;

/** Result of parsing one line: either a kept record or the reason it was skipped. */
record LineOutcome<T>(T record, IngestionReport.SkippedRecord skipped) {

    static <T> LineOutcome<T> keep(T record) {
        return new LineOutcome<>(record, null);
    }

    static <T> LineOutcome<T> skip(int lineNumber, SkipReason reason, String detail) {
        return new LineOutcome<>(null, new IngestionReport.SkippedRecord(lineNumber, reason, detail));
    }
}
