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

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Re-sends the escalation alert to the ticket assignee over different channels, outside batching.
 * parameters: channels (list), optional userId.
 */
@Component
@RequiredArgsConstructor
public class ChangeChannelsActionHandler implements EscalationActionHandler {

    private final EscalationAlertPublisher alertPublisher;
    private final SubjectGateway subjectGateway;

    @Override
    public EscalationActionType getType() {
        return EscalationActionType.CHANGE_CHANNELS;
    }

    @Override
    public ActionOutcome execute(EscalationAction action, EscalationContext context) {
        Map<String, Object> params = action.getParameters() != null ? action.getParameters() : Map.of();
        if (!(params.get("channels") instanceof Collection<?> channels) || channels.isEmpty()) {
            return ActionOutcome.failure("change_channels requires a non-empty channels list");
        }
        String target = params.get("userId") != null
                ? params.get("userId").toString()
                : subjectGateway.getAssignee(context.getSubjectId()).orElse(null);
        if (target == null) {
            return ActionOutcome.failure("Ticket " + context.getSubjectId() + " has no assignee to re-notify");
        }

        NotificationEvent alert = EscalationAlerts.alert(context, List.of(target), NotificationPriority.HIGH,
                "Escalated notification", "Ticket " + context.getSubjectId() + " still needs attention",
                List.copyOf(channels));
        alert.setBatchable(false);
        alertPublisher.publish(alert);
        return ActionOutcome.success(Map.of("newChannels", List.copyOf(channels), "alertId", alert.getId()));
    }
}
