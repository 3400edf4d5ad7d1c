package com.example.servicedesk.exception;

public class EntityNotFoundException extends NotificationEngineException {

    public EntityNotFoundException(String entity, String id) {
        super(entity + " not found: " + id, "NOT_FOUND");
    }
}
