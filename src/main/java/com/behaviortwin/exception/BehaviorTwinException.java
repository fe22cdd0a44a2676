package com.behaviortwin.exception;

import lombok.Getter;

@Getter
public abstract class BehaviorTwinException extends RuntimeException {
    private final String errorCode;
    protected BehaviorTwinException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected BehaviorTwinException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
