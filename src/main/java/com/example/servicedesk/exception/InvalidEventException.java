package com.example.servicedesk.exception;

/**
 * An ingested event is missing something every event needs, such as its type.
 */
public class InvalidEventException extends NotificationEngineException {

    public InvalidEventException(String message) {
        super(message, "INVALID_EVENT");
    }
}
