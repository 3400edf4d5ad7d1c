package com.example.servicedesk.escalation.action;

import com.example.servicedesk.domain.EscalationAction;
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
 * parameters: assignee.
 */
@Component
@RequiredArgsConstructor
public class ReassignActionHandler implements EscalationActionHandler {

    private final SubjectGateway subjectGateway;

    @Override
    public EscalationActionType getType() {
        return EscalationActionType.REASSIGN;
    }

    @Override
    public ActionOutcome execute(EscalationAction action, EscalationContext context) {
        Object assignee = action.getParameters() != null ? action.getParameters().get("assignee") : null;
        if (assignee == null || assignee.toString().isBlank()) {
            return ActionOutcome.failure("reassign requires assignee");
        }
        String previous = subjectGateway.reassign(context.getSubjectId(), assignee.toString()).orElse(null);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("assignee", assignee.toString());
        result.put("previousAssignee", previous);
        return ActionOutcome.success(result);
    }
}
