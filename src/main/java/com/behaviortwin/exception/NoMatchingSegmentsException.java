package com.behaviortwin.exception;

public class NoMatchingSegmentsException extends BehaviorTwinException {
    public NoMatchingSegmentsException(String persona, String region) {
        super("NO_MATCHING_SEGMENTS",
              "No data matches the specified persona/region filters (persona=" + persona
                  + ", region=" + region + ").");
    }
}
