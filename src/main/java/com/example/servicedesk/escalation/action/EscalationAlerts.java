package com.example.servicedesk.escalation.action;

import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.escalation.EscalationAlertPublisher;
import com.example.servicedesk.escalation.EscalationContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the escalation_alert events emitted by notify steps.
 */
final class EscalationAlerts {

    private EscalationAlerts() {
    }

    static NotificationEvent alert(EscalationContext context, List<String> targets, NotificationPriority priority,
                                   String title, String message, Object channels) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("message", message);
        payload.put("escalationInstanceId", context.getInstanceId());
        payload.put("escalationLevel", context.getEscalationLevel());
        payload.put("ruleId", context.getRule().getId());
        if (context.getNotificationId() != null) {
            payload.put("originalNotificationId", context.getNotificationId());
        }
        if (channels != null) {
            payload.put("channels", channels);
        }
        // Stable per instance and level, so a retried step reuses the same alert id
        String id = context.getInstanceId() + "_escalated_" + context.getEscalationLevel() + "_" + Math.abs(title.hashCode());
        return NotificationEvent.builder()
                .id(id)
                .type(EscalationAlertPublisher.ESCALATION_ALERT_TYPE)
                .targetUserIds(new ArrayList<>(targets))
                .ticketId(context.getSubjectId())
                .authorId("escalation-engine")
                .priority(priority)
                .payload(payload)
                .occurredAt(context.getNow())
                .build();
    }
}
