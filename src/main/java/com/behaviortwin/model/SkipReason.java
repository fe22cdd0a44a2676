package com.behaviortwin.model;

public enum SkipReason {
    INVALID_JSON,
    MISSING_FIELD,
    OUT_OF_RANGE
}
