package com.behaviortwin.model;

public enum SimulationStatus {
    COMPLETED,
    NO_BASELINE_DATA,
    NO_MATCHING_SEGMENTS
}
