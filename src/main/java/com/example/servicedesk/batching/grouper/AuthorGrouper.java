package com.example.servicedesk.batching.grouper;

import com.example.servicedesk.batching.CustomGrouper;
import com.example.servicedesk.domain.NotificationEvent;
import org.springframework.stereotype.Component;

@Component
public class AuthorGrouper implements CustomGrouper {

    @Override
    public String getId() {
        return "author";
    }

    @Override
    public String groupKey(NotificationEvent event) {
        return "author_" + (event.getAuthorId() != null ? event.getAuthorId() : "system");
    }
}
