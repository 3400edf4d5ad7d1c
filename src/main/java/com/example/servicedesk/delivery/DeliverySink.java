package com.example.servicedesk.delivery;

import com.example.servicedesk.domain.NotificationBatch;
import com.example.servicedesk.exception.DeliveryException;

/**
 * Boundary to the external delivery channels (email, webhook, chat, push).
 *
 * Implementations must be idempotent per batch id: a retry resends the same batch
 * under the same id.
 */
public interface DeliverySink {

    void deliver(NotificationBatch batch) throws DeliveryException;
}
