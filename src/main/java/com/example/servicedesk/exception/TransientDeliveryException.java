package com.example.servicedesk.exception;

/**
 * Delivery failed in a way worth retrying: I/O error, timeout, 5xx or 429.
 */
public class TransientDeliveryException extends DeliveryException {

    public TransientDeliveryException(String message) {
        super(message);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
