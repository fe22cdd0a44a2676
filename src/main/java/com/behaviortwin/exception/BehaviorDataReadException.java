package com.behaviortwin.exception;

import java.nio.file.Path;

public class BehaviorDataReadException extends BehaviorTwinException {
    public BehaviorDataReadException(Path file, Throwable cause) {
        super("DATA_FILE_UNREADABLE", "Failed to read data file: " + file, cause);
    }
}
