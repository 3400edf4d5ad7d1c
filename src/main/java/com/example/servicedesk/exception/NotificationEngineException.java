package com.example.servicedesk.exception;

/**
 * Base class for runtime failures raised by the notification engine.
 */
public abstract class NotificationEngineException extends RuntimeException {

    private final String errorCode;

    protected NotificationEngineException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected NotificationEngineException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
