package com.example.servicedesk.delivery;

import com.example.servicedesk.domain.NotificationBatch;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the digest title and message for a flushed batch.
 */
@Component
public class BatchDigestFormatter {

    private static final int MAX_TITLES_PER_TYPE = 5;

    private static final Map<String, String> TYPE_NAMES = Map.ofEntries(
            Map.entry("ticket_assigned", "Assigned Tickets"),
            Map.entry("ticket_updated", "Ticket Updates"),
            Map.entry("ticket_resolved", "Resolved Tickets"),
            Map.entry("ticket_closed", "Closed Tickets"),
            Map.entry("comment_added", "New Comments"),
            Map.entry("comment_internal", "Internal Comments"),
            Map.entry("sla_warning", "SLA Warnings"),
            Map.entry("sla_breach", "SLA Breaches"),
            Map.entry("system_alert", "System Alerts"),
            Map.entry("status_changed", "Status Changes"),
            Map.entry("priority_changed", "Priority Changes"),
            Map.entry("escalation_alert", "Escalations")
    );

    public BatchDigest format(NotificationBatch batch) {
        List<NotificationEvent> notifications = batch.getNotifications();
        Map<String, List<NotificationEvent>> byType = notifications.stream()
                .collect(Collectors.groupingBy(e -> String.valueOf(e.getType()), LinkedHashMap::new, Collectors.toList()));

        Map<String, Integer> counts = new LinkedHashMap<>();
        byType.forEach((type, events) -> counts.put(type, events.size()));

        return BatchDigest.builder()
                .batchId(batch.getId())
                .batchKey(batch.getBatchKey())
                .groupKey(batch.getGroupKey())
                .title(title(batch, byType))
                .message(message(batch, byType))
                .priority(highestPriority(notifications))
                .notificationCount(notifications.size())
                .countsByType(counts)
                .targetUserIds(new ArrayList<>(batch.getTargetUserIds()))
                .build();
    }

    String title(NotificationBatch batch, Map<String, List<NotificationEvent>> byType) {
        List<NotificationEvent> notifications = batch.getNotifications();
        int total = notifications.size();
        if (total == 1) {
            NotificationEvent only = notifications.get(0);
            return only.getTitle() != null ? only.getTitle() : displayName(only.getType());
        }
        String ticketId = notifications.get(0).getTicketId();
        return switch (batch.getBatchKey()) {
            case "digest_email" -> "Notification digest - " + total + " updates";
            case "ticket_updates" -> "Updates on ticket #" + ticketId + " - " + total + " items";
            case "sla_warnings" -> "SLA warnings - " + total + " tickets close to breach";
            case "system_alerts" -> "System alerts - " + total + " notifications";
            case "comment_notifications" -> "New comments on ticket #" + ticketId;
            case "status_updates" -> "Status updates - " + total + " changes";
            default -> byType.size() == 1
                    ? displayName(byType.keySet().iterator().next()) + " - " + total + " notifications"
                    : total + " notifications across " + byType.size() + " types";
        };
    }

    String message(NotificationBatch batch, Map<String, List<NotificationEvent>> byType) {
        List<NotificationEvent> notifications = batch.getNotifications();
        switch (batch.getBatchKey()) {
            case "digest_email": {
                StringBuilder sb = new StringBuilder("Here is a summary of your recent notifications:\n\n");
                byType.forEach((type, events) -> {
                    sb.append(displayName(type)).append(" (").append(events.size()).append("):\n");
                    events.stream().limit(MAX_TITLES_PER_TYPE)
                            .forEach(e -> sb.append("  - ").append(textOrType(e.getTitle(), e)).append('\n'));
                    if (events.size() > MAX_TITLES_PER_TYPE) {
                        sb.append("  - ... and ").append(events.size() - MAX_TITLES_PER_TYPE).append(" more\n");
                    }
                    sb.append('\n');
                });
                return sb.toString().trim();
            }
            case "sla_warnings":
                return "The following tickets are close to breaching their SLA:\n\n" + notifications.stream()
                        .map(e -> "- Ticket #" + e.getTicketId() + ": " + textOrType(e.getMessage(), e))
                        .collect(Collectors.joining("\n"));
            case "comment_notifications":
                return "New comments were added:\n\n" + bullets(notifications);
            case "ticket_updates":
            case "status_updates":
                return bullets(notifications);
            default:
                return notifications.stream()
                        .map(e -> "- " + textOrType(e.getTitle(), e) + (e.getMessage() != null ? ": " + e.getMessage() : ""))
                        .collect(Collectors.joining("\n"));
        }
    }

    static NotificationPriority highestPriority(List<NotificationEvent> notifications) {
        return notifications.stream()
                .map(NotificationEvent::getPriority)
                .filter(Objects::nonNull)
                .max(Enum::compareTo)
                .orElse(NotificationPriority.LOW);
    }

    static String displayName(String type) {
        if (type == null) {
            return "Notifications";
        }
        String known = TYPE_NAMES.get(type);
        if (known != null) {
            return known;
        }
        return Arrays.stream(type.split("_"))
                .filter(word -> !word.isEmpty())
                .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String bullets(List<NotificationEvent> notifications) {
        return notifications.stream()
                .map(e -> "- " + textOrType(e.getMessage(), e))
                .collect(Collectors.joining("\n"));
    }

    private static String textOrType(String text, NotificationEvent event) {
        return text != null ? text : displayName(event.getType());
    }
}
