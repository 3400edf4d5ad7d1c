package com.example.servicedesk.filter;

import com.example.servicedesk.domain.FilterAction;
import com.example.servicedesk.domain.NotificationEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of running an event through the filter rules.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterDecision {

    private FilterAction action;

    /** Earliest time the event may enter a batch; set for DELAY only */
    private Instant delayUntil;

    /** Rewritten event for MODIFY and PRIORITY_CHANGE */
    private NotificationEvent modifiedEvent;

    /** Event to hand to batching; null when blocked */
    private NotificationEvent event;

    /** Matching rule, null for the default allow */
    private String ruleId;
    private String ruleName;

    /** Why the event was blocked when no rule decided it */
    private String reason;

    public static FilterDecision allowByDefault(NotificationEvent event) {
        return FilterDecision.builder()
                .action(FilterAction.ALLOW)
                .event(event)
                .build();
    }

    public static FilterDecision blockedForAllRecipients(NotificationEvent event) {
        return FilterDecision.builder()
                .action(FilterAction.BLOCK)
                .reason("No target user accepts " + event.getType() + " now")
                .build();
    }

    public boolean isBlocked() {
        return action == FilterAction.BLOCK;
    }

    public boolean isDefault() {
        return ruleId == null && reason == null;
    }
}
