package com.example.servicedesk.batching.grouper;

import com.example.servicedesk.batching.CustomGrouper;
import com.example.servicedesk.domain.NotificationEvent;
import org.springframework.stereotype.Component;

/**
 * One batch per ticket and event type, e.g. all comments on ticket 42 together.
 */
@Component
public class TicketAndTypeGrouper implements CustomGrouper {

    @Override
    public String getId() {
        return "ticket_and_type";
    }

    @Override
    public String groupKey(NotificationEvent event) {
        String ticket = event.getTicketId() != null ? event.getTicketId() : "general";
        return "ticket_" + ticket + "_type_" + event.getType();
    }
}
