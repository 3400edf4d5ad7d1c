package com.example.servicedesk.batching;

import com.example.servicedesk.batching.grouper.AuthorGrouper;
import com.example.servicedesk.batching.grouper.TicketAndTypeGrouper;
import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.GroupingStrategy;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GroupKeyResolverTest {

    private final CustomGrouperRegistry registry =
            new CustomGrouperRegistry(List.of(new TicketAndTypeGrouper(), new AuthorGrouper()));
    private final GroupKeyResolver resolver = new GroupKeyResolver(registry);

    private static BatchConfiguration config(GroupingStrategy groupBy, String customGrouperId) {
        return BatchConfiguration.builder()
                .batchKey("test")
                .maxBatchSize(10)
                .maxWaitTimeMs(1000)
                .groupBy(groupBy)
                .customGrouperId(customGrouperId)
                .build();
    }

    private static NotificationEvent event(String ticketId, NotificationPriority priority, String... targets) {
        return NotificationEvent.builder()
                .id("e1")
                .type("comment_added")
                .ticketId(ticketId)
                .priority(priority)
                .targetUserIds(new ArrayList<>(List.of(targets)))
                .build();
    }

    @Test
    void builtInStrategies() {
        NotificationEvent event = event("T-9", NotificationPriority.HIGH, "alice", "bob");

        assertEquals("user_alice", resolver.resolve(event, config(GroupingStrategy.USER, null)));
        assertEquals("ticket_T-9", resolver.resolve(event, config(GroupingStrategy.TICKET, null)));
        assertEquals("type_comment_added", resolver.resolve(event, config(GroupingStrategy.TYPE, null)));
        assertEquals("priority_high", resolver.resolve(event, config(GroupingStrategy.PRIORITY, null)));
    }

    @Test
    void fallbacksForMissingFields() {
        NotificationEvent event = event(null, null);

        assertEquals("user_all", resolver.resolve(event, config(GroupingStrategy.USER, null)));
        assertEquals("ticket_general", resolver.resolve(event, config(GroupingStrategy.TICKET, null)));
        assertEquals("priority_medium", resolver.resolve(event, config(GroupingStrategy.PRIORITY, null)));
    }

    @Test
    void customGroupersAreLookedUpById() {
        NotificationEvent event = event("T-9", NotificationPriority.LOW, "alice");

        assertEquals("ticket_T-9_type_comment_added",
                resolver.resolve(event, config(GroupingStrategy.CUSTOM, "ticket_and_type")));

        registry.register("by_first_target", e -> "first_" + e.getTargetUserIds().get(0));
        assertEquals("first_alice", resolver.resolve(event, config(GroupingStrategy.CUSTOM, "by_first_target")));
    }

    @Test
    void unknownOrBlankCustomGrouperFallsBackToDefaultGroup() {
        NotificationEvent event = event("T-9", NotificationPriority.LOW);

        assertEquals(GroupKeyResolver.DEFAULT_GROUP,
                resolver.resolve(event, config(GroupingStrategy.CUSTOM, "does_not_exist")));

        registry.register("blank", e -> " ");
        assertEquals(GroupKeyResolver.DEFAULT_GROUP, resolver.resolve(event, config(GroupingStrategy.CUSTOM, "blank")));
    }
}
