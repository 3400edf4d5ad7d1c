package com.example.servicedesk.filter;

import java.util.Map;

/**
 * Groups event types into the categories users can opt out of.
 */
public final class NotificationCategories {

    public static final String GENERAL = "general";

    private static final Map<String, String> BY_TYPE = Map.ofEntries(
            Map.entry("ticket_assigned", "ticket_updates"),
            Map.entry("ticket_updated", "ticket_updates"),
            Map.entry("ticket_resolved", "ticket_updates"),
            Map.entry("ticket_closed", "ticket_updates"),
            Map.entry("status_changed", "ticket_updates"),
            Map.entry("priority_changed", "ticket_updates"),
            Map.entry("comment_added", "comments"),
            Map.entry("comment_internal", "comments"),
            Map.entry("sla_warning", "sla_warnings"),
            Map.entry("sla_breach", "sla_warnings"),
            Map.entry("system_alert", "system_alerts"),
            Map.entry("escalation_alert", "escalations"));

    private NotificationCategories() {
    }

    public static String of(String eventType) {
        return eventType != null ? BY_TYPE.getOrDefault(eventType, GENERAL) : GENERAL;
    }
}
