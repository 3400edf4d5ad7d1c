package com.example.servicedesk.exception;

/**
 * Raised by a delivery sink when a batch could not be handed to its channels.
 */
public abstract class DeliveryException extends Exception {

    protected DeliveryException(String message) {
        super(message);
    }

    protected DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
