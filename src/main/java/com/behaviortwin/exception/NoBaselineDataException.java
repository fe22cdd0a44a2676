package com.behaviortwin.exception;

public class NoBaselineDataException extends BehaviorTwinException {
    public NoBaselineDataException() {
        super("NO_BASELINE_DATA",
              "No baseline behavior data found. Please check data sources.");
    }
}
