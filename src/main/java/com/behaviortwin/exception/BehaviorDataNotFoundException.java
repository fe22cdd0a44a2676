package com.behaviortwin.exception;

import java.nio.file.Path;

public class BehaviorDataNotFoundException extends BehaviorTwinException {
    public BehaviorDataNotFoundException(Path file) {
        super("DATA_FILE_NOT_FOUND", "Data file not found: " + file);
    }
}
