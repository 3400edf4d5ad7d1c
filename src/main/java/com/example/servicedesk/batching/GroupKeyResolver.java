package com.example.servicedesk.batching;

import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.NotificationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes the group key that, together with the batch key, selects the accumulating batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroupKeyResolver {

    static final String DEFAULT_GROUP = "default";

    private final CustomGrouperRegistry grouperRegistry;

    public String resolve(NotificationEvent event, BatchConfiguration config) {
        if (config.getGroupBy() == null) {
            return DEFAULT_GROUP;
        }
        return switch (config.getGroupBy()) {
            case USER -> "user_" + firstTarget(event.getTargetUserIds());
            case TICKET -> "ticket_" + (event.getTicketId() != null ? event.getTicketId() : "general");
            case TYPE -> "type_" + event.getType();
            case PRIORITY -> "priority_" + (event.getPriority() != null ? event.getPriority().wireName() : "medium");
            case CUSTOM -> custom(event, config);
        };
    }

    private String custom(NotificationEvent event, BatchConfiguration config) {
        return grouperRegistry.getGrouper(config.getCustomGrouperId())
                .map(grouper -> {
                    String key = grouper.groupKey(event);
                    return key == null || key.isBlank() ? DEFAULT_GROUP : key;
                })
                .orElseGet(() -> {
                    log.warn("Unknown custom grouper '{}' for batch key {}, using '{}'",
                            config.getCustomGrouperId(), config.getBatchKey(), DEFAULT_GROUP);
                    return DEFAULT_GROUP;
                });
    }

    private static String firstTarget(List<String> targets) {
        return targets == null || targets.isEmpty() ? "all" : targets.get(0);
    }
}
