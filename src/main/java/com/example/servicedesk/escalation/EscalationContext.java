package com.example.servicedesk.escalation;

import com.example.servicedesk.domain.EscalationInstance;
import com.example.servicedesk.domain.EscalationRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * What an action step knows about the cycle it runs in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationContext {
    private String instanceId;
    private String subjectId;
    private String notificationId;
    private EscalationRule rule;
    private int escalationLevel;
    private Instant now;

    public static EscalationContext of(EscalationInstance instance, EscalationRule rule, Instant now) {
        return EscalationContext.builder()
                .instanceId(instance.getId())
                .subjectId(instance.getSubjectId())
                .notificationId(instance.getNotificationId())
                .rule(rule)
                .escalationLevel(instance.getEscalationLevel())
                .now(now)
                .build();
    }
}
