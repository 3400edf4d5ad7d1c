package com.example.servicedesk.escalation.action;

import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.escalation.ActionOutcome;
import com.example.servicedesk.escalation.EscalationActionHandler;
import com.example.servicedesk.escalation.EscalationActionType;
import com.example.servicedesk.escalation.EscalationContext;
import com.example.servicedesk.subject.SubjectGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * parameters: optional newPriority. Without it the ticket moves up one level.
 */
@Component
@RequiredArgsConstructor
public class RaisePriorityActionHandler implements EscalationActionHandler {

    private final SubjectGateway subjectGateway;

    @Override
    public EscalationActionType getType() {
        return EscalationActionType.RAISE_PRIORITY;
    }

    @Override
    public ActionOutcome execute(EscalationAction action, EscalationContext context) {
        Object requested = action.getParameters() != null ? action.getParameters().get("newPriority") : null;
        NotificationPriority current = subjectGateway.getPriority(context.getSubjectId()).orElse(NotificationPriority.MEDIUM);
        NotificationPriority target;
        if (requested != null) {
            target = NotificationPriority.parse(requested).orElse(null);
            if (target == null) {
                return ActionOutcome.failure("Unknown priority: " + requested);
            }
        } else {
            target = current.raised();
        }

        subjectGateway.changePriority(context.getSubjectId(), target);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("oldPriority", current.wireName());
        result.put("newPriority", target.wireName());
        return ActionOutcome.success(result);
    }
}
