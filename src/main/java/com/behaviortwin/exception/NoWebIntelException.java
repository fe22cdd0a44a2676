package com.behaviortwin.exception;

import java.time.LocalDate;

public class NoWebIntelException extends BehaviorTwinException {
    public NoWebIntelException(LocalDate date) {
        super("NO_WEB_INTEL", "No web intel found for date: " + date);
    }
}
