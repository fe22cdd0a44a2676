package com.behaviortwin.exception;

public class NoBehaviorDataException extends BehaviorTwinException {
    public NoBehaviorDataException() {
        super("NO_BEHAVIOR_DATA", "No behavior data found.");
    }
}
