package com.example.servicedesk.exception;

/**
 * Delivery was rejected and resending the same batch cannot succeed.
 */
public class PermanentDeliveryException extends DeliveryException {

    public PermanentDeliveryException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
