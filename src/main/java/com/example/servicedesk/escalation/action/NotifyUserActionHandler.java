package com.example.servicedesk.escalation.action;

import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.escalation.ActionOutcome;
import com.example.servicedesk.escalation.EscalationActionHandler;
import com.example.servicedesk.escalation.EscalationActionType;
import com.example.servicedesk.escalation.EscalationAlertPublisher;
import com.example.servicedesk.escalation.EscalationContext;
import com.example.servicedesk.subject.SubjectGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * parameters: userId (a user id, or "ticket_assignee"), optional message and channels.
 */
@Component
@RequiredArgsConstructor
public class NotifyUserActionHandler implements EscalationActionHandler {

    static final String TICKET_ASSIGNEE = "ticket_assignee";

    private final EscalationAlertPublisher alertPublisher;
    private final SubjectGateway subjectGateway;

    @Override
    public EscalationActionType getType() {
        return EscalationActionType.NOTIFY_USER;
    }

    @Override
    public ActionOutcome execute(EscalationAction action, EscalationContext context) {
        Map<String, Object> params = action.getParameters() != null ? action.getParameters() : Map.of();
        Object requested = params.get("userId");
        if (requested == null) {
            return ActionOutcome.failure("notify_user requires userId");
        }
        String userId = TICKET_ASSIGNEE.equals(requested)
                ? subjectGateway.getAssignee(context.getSubjectId()).orElse(null)
                : requested.toString();
        if (userId == null) {
            return ActionOutcome.failure("Ticket " + context.getSubjectId() + " has no assignee to notify");
        }

        String message = params.get("message") != null
                ? params.get("message").toString()
                : "Escalation alert for ticket " + context.getSubjectId();
        NotificationEvent alert = EscalationAlerts.alert(context, List.of(userId), NotificationPriority.HIGH,
                "Ticket Escalation", message, params.get("channels"));
        alertPublisher.publish(alert);
        return ActionOutcome.success(Map.of("notifiedUser", userId, "alertId", alert.getId()));
    }
}
