package com.example.servicedesk.batching;

import com.example.servicedesk.domain.NotificationEvent;

/**
 * A named, pure grouping function for batch configurations with {@code groupBy: custom}.
 * Spring beans implementing this are registered at startup under {@link #getId()}.
 */
public interface CustomGrouper {

    String getId();

    String groupKey(NotificationEvent event);
}
